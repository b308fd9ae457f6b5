package changefeed.jdbc.store;

import changefeed.jdbc.JdbcTemplate;

import java.util.List;

/**
 * PostgreSQL change store.
 *
 * <p>Uses {@code INSERT ... ON CONFLICT DO NOTHING}.
 */
public final class PostgresChangeStore extends AbstractJdbcChangeStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String insertIgnoreSql(String table, String... columns) {
    return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
        + JdbcTemplate.placeholders(columns.length) + ") ON CONFLICT DO NOTHING";
  }
}
