package changefeed.jdbc.store;

import changefeed.jdbc.JdbcTemplate;

import java.util.List;

/**
 * MySQL change store.
 *
 * <p>Uses {@code INSERT ... ON DUPLICATE KEY UPDATE c=c}, a no-op assignment that keeps the
 * existing row. Also handles MariaDB and TiDB URLs.
 */
public final class MySqlChangeStore extends AbstractJdbcChangeStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  protected String insertIgnoreSql(String table, String... columns) {
    String last = columns[columns.length - 1];
    return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
        + JdbcTemplate.placeholders(columns.length) + ") ON DUPLICATE KEY UPDATE "
        + last + "=" + last;
  }
}
