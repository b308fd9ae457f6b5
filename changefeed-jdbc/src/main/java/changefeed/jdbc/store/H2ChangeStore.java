package changefeed.jdbc.store;

import changefeed.jdbc.JdbcTemplate;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * H2 change store. Primarily for testing.
 *
 * <p>Inserts with {@code INSERT ... SELECT ... WHERE NOT EXISTS}, binding every value twice.
 * H2's {@code MERGE ... KEY} rejects rows without a non-key column, which is every row here.
 */
public final class H2ChangeStore extends AbstractJdbcChangeStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String insertIgnoreSql(String table, String... columns) {
    String match = Stream.of(columns).map(c -> c + "=?").collect(Collectors.joining(" AND "));
    return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") SELECT "
        + JdbcTemplate.placeholders(columns.length)
        + " WHERE NOT EXISTS (SELECT 1 FROM " + table + " WHERE " + match + ")";
  }

  @Override
  protected Object[] insertIgnoreParams(Object... values) {
    Object[] params = new Object[values.length * 2];
    System.arraycopy(values, 0, params, 0, values.length);
    System.arraycopy(values, 0, params, values.length, values.length);
    return params;
  }
}
