package changefeed.jdbc.store;

import changefeed.jdbc.ChangeStoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks the change store dialect for a database.
 *
 * <p>Candidates are the stores listed in
 * {@code META-INF/services/changefeed.jdbc.store.AbstractJdbcChangeStore}; the first one with a
 * prefix of the database's JDBC URL wins.
 */
public final class JdbcChangeStores {
  private static final Logger logger = Logger.getLogger(JdbcChangeStores.class.getName());

  private static final List<AbstractJdbcChangeStore> STORES = ServiceLoader.load(AbstractJdbcChangeStore.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private JdbcChangeStores() {
  }

  /**
   * Detects the store from the URL of a connection borrowed from {@code dataSource}.
   *
   * @throws ChangeStoreException if no connection can be opened
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcChangeStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new ChangeStoreException("Cannot read the JDBC URL of the change database", e);
    }
    AbstractJdbcChangeStore store = forUrl(url);
    logger.log(Level.INFO, "Using {0} change store", store.name());
    return store;
  }

  static AbstractJdbcChangeStore forUrl(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcChangeStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix)) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No change store handles JDBC URL " + jdbcUrl);
  }
}
