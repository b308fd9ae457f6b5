package changefeed.jdbc.store;

import changefeed.jdbc.ChangeStoreException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcChangeStoresTest {

  @Test
  void detectsH2FromDataSource() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:detect;DB_CLOSE_DELAY=-1");

    assertInstanceOf(H2ChangeStore.class, JdbcChangeStores.detect(dataSource));
  }

  @Test
  void urlPrefixesPickTheDialect() {
    assertInstanceOf(MySqlChangeStore.class, JdbcChangeStores.forUrl("jdbc:mysql://localhost/steamdb"));
    assertInstanceOf(MySqlChangeStore.class, JdbcChangeStores.forUrl("JDBC:MARIADB://localhost/steamdb"));
    assertInstanceOf(PostgresChangeStore.class, JdbcChangeStores.forUrl("jdbc:postgresql://localhost/steamdb"));
  }

  @Test
  void unsupportedDatabaseIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> JdbcChangeStores.forUrl("jdbc:oracle:thin:@x"));
    assertThrows(IllegalArgumentException.class, () -> JdbcChangeStores.forUrl(""));
  }

  @Test
  void unreachableDatabaseIsWrapped() {
    DataSource down = (DataSource) Proxy.newProxyInstance(getClass().getClassLoader(),
        new Class<?>[]{DataSource.class}, (proxy, method, args) -> {
          throw new SQLException("connection refused");
        });

    assertThrows(ChangeStoreException.class, () -> JdbcChangeStores.detect(down));
  }
}
