package changefeed.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Loads the reference DDL from {@code /schema} test resources.
 */
final class Schemas {

    private Schemas() {
    }

    static JdbcDataSource h2() throws IOException, SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:changefeed_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        apply(dataSource, "/schema/h2.sql");
        return dataSource;
    }

    static void apply(DataSource dataSource, String resource) throws IOException, SQLException {
        String schema = load(resource);
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : schema.split(";")) {
                String trimmed = sql.trim();
                if (!trimmed.isEmpty()) {
                    stmt.execute(trimmed);
                }
            }
        }
    }

    static void execute(DataSource dataSource, String... statements) throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    private static String load(String path) throws IOException {
        try (InputStream is = Schemas.class.getResourceAsStream(path)) {
            if (is == null) throw new IOException("Resource not found: " + path);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
