package changefeed.jdbc.store;

import changefeed.jdbc.JdbcTemplate;
import changefeed.model.BillingType;
import changefeed.model.FeedChange;
import changefeed.model.KnownName;
import changefeed.spi.ChangeStore;
import changefeed.util.Partitions;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Base JDBC change store with standard SQL implementations.
 *
 * <p>Subclasses supply the dialect's insert-or-ignore statement through
 * {@link #insertIgnoreSql(String, String...)}. Register custom implementations via
 * {@code META-INF/services/changefeed.jdbc.store.AbstractJdbcChangeStore}.
 *
 * <p>Id lists are sent as IN lists of at most {@value #MAX_IN_LIST} placeholders; an empty
 * list never reaches the database.
 *
 * @see JdbcChangeStores
 */
public abstract class AbstractJdbcChangeStore implements ChangeStore {
  protected static final int MAX_IN_LIST = 1000;

  /** Link type of package contents that are apps (as opposed to depots). */
  protected static final String APP_LINK_TYPE = "app";

  /**
   * Unique identifier for this change store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this change store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Builds an insert of one row into {@code table} that does nothing when a row with the same
   * values already exists. All {@code columns} together form the table's key.
   */
  protected abstract String insertIgnoreSql(String table, String... columns);

  /**
   * Maps the column values of one row to the parameters of {@link #insertIgnoreSql}. The
   * default binds each value once, in column order.
   */
  protected Object[] insertIgnoreParams(Object... values) {
    return values;
  }

  @Override
  public long maxChangeNumber(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT MAX(change_id) FROM changelists");
  }

  @Override
  public int upsertChangeNumbers(Connection conn, Collection<Long> changeNumbers) {
    List<Object[]> rows = new ArrayList<>(changeNumbers.size());
    for (Long changeNumber : changeNumbers) {
      rows.add(insertIgnoreParams(changeNumber));
    }
    return JdbcTemplate.batchUpdate(conn, insertIgnoreSql("changelists", "change_id"), rows);
  }

  @Override
  public int recordAppChanges(Connection conn, Collection<FeedChange> changes) {
    return recordChanges(conn, "changelists_apps", "app_id", changes);
  }

  @Override
  public int recordPackageChanges(Connection conn, Collection<FeedChange> changes) {
    return recordChanges(conn, "changelists_packages", "package_id", changes);
  }

  private int recordChanges(Connection conn, String table, String idColumn, Collection<FeedChange> changes) {
    List<Object[]> rows = new ArrayList<>(changes.size());
    for (FeedChange change : changes) {
      rows.add(insertIgnoreParams(change.changeNumber(), change.id()));
    }
    return JdbcTemplate.batchUpdate(conn, insertIgnoreSql(table, "change_id", idColumn), rows);
  }

  @Override
  public int touchApps(Connection conn, Collection<Integer> appIds) {
    return touch(conn, "apps", "app_id", appIds);
  }

  @Override
  public int touchPackages(Connection conn, Collection<Integer> packageIds) {
    return touch(conn, "packages", "package_id", packageIds);
  }

  private int touch(Connection conn, String table, String idColumn, Collection<Integer> ids) {
    int updated = 0;
    for (List<Integer> chunk : Partitions.partition(ids, MAX_IN_LIST)) {
      String sql = "UPDATE " + table + " SET last_updated=CURRENT_TIMESTAMP WHERE " + idColumn
          + " IN (" + JdbcTemplate.placeholders(chunk.size()) + ")";
      updated += JdbcTemplate.update(conn, sql, JdbcTemplate.params(chunk));
    }
    return updated;
  }

  @Override
  public Map<Integer, BillingType> billingTypes(Connection conn, Collection<Integer> packageIds) {
    Map<Integer, BillingType> result = new HashMap<>();
    for (List<Integer> chunk : Partitions.partition(packageIds, MAX_IN_LIST)) {
      String sql = "SELECT package_id, billing_type FROM packages WHERE billing_type IS NOT NULL"
          + " AND package_id IN (" + JdbcTemplate.placeholders(chunk.size()) + ")";
      JdbcTemplate.query(conn, sql, rs -> {
        BillingType type = BillingType.fromCode(rs.getInt("billing_type"));
        if (type != null) {
          result.put(rs.getInt("package_id"), type);
        }
        return null;
      }, JdbcTemplate.params(chunk));
    }
    return result;
  }

  @Override
  public List<Integer> appsInPackages(Connection conn, Collection<Integer> packageIds) {
    if (packageIds.isEmpty()) {
      return List.of();
    }
    Set<Integer> apps = new TreeSet<>();
    for (List<Integer> chunk : Partitions.partition(packageIds, MAX_IN_LIST)) {
      List<Object> params = new ArrayList<>(chunk);
      params.add(APP_LINK_TYPE);
      String sql = "SELECT DISTINCT app_id FROM package_apps WHERE package_id IN ("
          + JdbcTemplate.placeholders(chunk.size()) + ") AND link_type=?";
      apps.addAll(JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), params.toArray()));
    }
    return new ArrayList<>(apps);
  }

  @Override
  public Map<Integer, KnownName> appNames(Connection conn, Collection<Integer> appIds) {
    Map<Integer, KnownName> result = new HashMap<>();
    for (List<Integer> chunk : Partitions.partition(appIds, MAX_IN_LIST)) {
      String sql = "SELECT app_id, name, last_known_name, app_type FROM apps WHERE app_id IN ("
          + JdbcTemplate.placeholders(chunk.size()) + ")";
      JdbcTemplate.query(conn, sql, rs -> result.put(rs.getInt("app_id"),
          new KnownName(rs.getString("name"), rs.getString("last_known_name"), rs.getString("app_type"))),
          JdbcTemplate.params(chunk));
    }
    return result;
  }

  @Override
  public Map<Integer, KnownName> packageNames(Connection conn, Collection<Integer> packageIds) {
    Map<Integer, KnownName> result = new HashMap<>();
    for (List<Integer> chunk : Partitions.partition(packageIds, MAX_IN_LIST)) {
      String sql = "SELECT package_id, name, last_known_name FROM packages WHERE package_id IN ("
          + JdbcTemplate.placeholders(chunk.size()) + ")";
      JdbcTemplate.query(conn, sql, rs -> result.put(rs.getInt("package_id"),
          new KnownName(rs.getString("name"), rs.getString("last_known_name"), null)),
          JdbcTemplate.params(chunk));
    }
    return result;
  }

  @Override
  public int highestAppId(Connection conn, int below) {
    return (int) JdbcTemplate.queryForLong(conn, "SELECT MAX(app_id) FROM apps WHERE app_id < ?", below);
  }

  @Override
  public int highestPackageId(Connection conn) {
    return (int) JdbcTemplate.queryForLong(conn, "SELECT MAX(package_id) FROM packages");
  }

  @Override
  public List<Integer> allAppIds(Connection conn) {
    String sql = "SELECT app_id FROM apps UNION SELECT app_id FROM package_apps WHERE link_type=?"
        + " ORDER BY app_id DESC";
    return JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), APP_LINK_TYPE);
  }

  @Override
  public List<Integer> allPackageIds(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT package_id FROM packages ORDER BY package_id DESC",
        rs -> rs.getInt(1));
  }
}
