package changefeed.jdbc;

import changefeed.jdbc.store.AbstractJdbcChangeStore;
import changefeed.jdbc.store.PostgresChangeStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@Testcontainers(disabledWithoutDocker = true)
class PostgresChangeStoreIntegrationTest extends AbstractChangeStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("changefeed_test");

    private static final PostgresChangeStore STORE = new PostgresChangeStore();
    private static PGSimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new PGSimpleDataSource();
        dataSource.setURL(postgres.getJdbcUrl());
        dataSource.setUser(postgres.getUsername());
        dataSource.setPassword(postgres.getPassword());
        Schemas.apply(dataSource, "/schema/postgresql.sql");
    }

    @BeforeEach
    void truncate() throws Exception {
        Schemas.execute(dataSource, "TRUNCATE TABLE changelists, changelists_apps, changelists_packages, "
                + "apps, packages, package_apps");
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcChangeStore store() {
        return STORE;
    }
}
