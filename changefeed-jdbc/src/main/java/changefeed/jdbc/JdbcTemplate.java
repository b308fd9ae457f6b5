package changefeed.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in change store implementations.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new ChangeStoreException("Failed to execute update", e);
    }
  }

  /**
   * Execute one statement per parameter row as a JDBC batch.
   *
   * @return rows affected; drivers reporting {@link Statement#SUCCESS_NO_INFO} count as one
   */
  public static int batchUpdate(Connection conn, String sql, List<Object[]> rows) {
    if (rows.isEmpty()) {
      return 0;
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] row : rows) {
        bindParams(ps, row);
        ps.addBatch();
      }
      int total = 0;
      for (int count : ps.executeBatch()) {
        if (count == Statement.SUCCESS_NO_INFO) {
          total++;
        } else if (count > 0) {
          total += count;
        }
      }
      return total;
    } catch (SQLException e) {
      throw new ChangeStoreException("Failed to execute batch update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new ChangeStoreException("Failed to execute query", e);
    }
  }

  /** Execute a single-value SELECT; {@code 0} when there is no row or the value is NULL. */
  public static long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> values = query(conn, sql, rs -> {
      long value = rs.getLong(1);
      return rs.wasNull() ? 0L : value;
    }, params);
    return values.isEmpty() ? 0L : values.get(0);
  }

  /** Returns {@code ?,?,?} with {@code count} placeholders for an IN list. */
  public static String placeholders(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be > 0");
    }
    return String.join(",", Collections.nCopies(count, "?"));
  }

  /** Copies {@code values} into a parameter array. */
  public static Object[] params(Collection<?> values) {
    return values.toArray();
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
