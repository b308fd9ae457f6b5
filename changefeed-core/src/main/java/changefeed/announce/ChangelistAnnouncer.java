package changefeed.announce;

import changefeed.model.FeedResponse;
import changefeed.model.KnownName;
import changefeed.spi.AnnouncementSink;
import changefeed.spi.ChangeStore;
import changefeed.spi.ConnectionProvider;
import changefeed.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * Turns a feed response into announcement lines, one group per change number.
 *
 * <p>Groups are announced in ascending change number order. A group with at least
 * {@value #BIG_CHANGELIST} changes is additionally posted to the main channel. Once the
 * {@link BurstWindow} is saturated, or when a group exceeds {@value #COMPACT_CHANGELIST}
 * changes, the group collapses into a single line listing bare ids. Otherwise a summary
 * line is followed by one line per app and package, with names fetched in one query per kind.
 */
public final class ChangelistAnnouncer {
  public static final int BIG_CHANGELIST = 50;
  public static final int COMPACT_CHANGELIST = 300;

  private final ConnectionProvider connectionProvider;
  private final ChangeStore changeStore;
  private final AnnouncementSink sink;
  private final Links links;
  private final BurstWindow burstWindow;
  private final MetricsExporter metrics;

  public ChangelistAnnouncer(ConnectionProvider connectionProvider, ChangeStore changeStore,
      AnnouncementSink sink, Links links, BurstWindow burstWindow, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.changeStore = Objects.requireNonNull(changeStore, "changeStore");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.links = Objects.requireNonNull(links, "links");
    this.burstWindow = Objects.requireNonNull(burstWindow, "burstWindow");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Announces a response that carried no app or package changes.
   */
  public void announceEmpty(long changeNumber) {
    sink.announce(Colors.RED + "»" + Colors.NORMAL + " Changelist " + Colors.BLUE + changeNumber
        + Colors.DARKGRAY + " (empty)");
  }

  /**
   * Announces every change number group in {@code response}.
   *
   * @throws SQLException if names cannot be looked up
   */
  public void announce(FeedResponse response) throws SQLException {
    burstWindow.roll();

    SortedMap<Long, ChangelistGroup> groups = ChangelistGroup.groupBy(response);
    for (ChangelistGroup group : groups.values()) {
      announceGroup(group);
    }
  }

  private void announceGroup(ChangelistGroup group) throws SQLException {
    int appCount = group.apps().size();
    int packageCount = group.packages().size();
    int changes = group.size();

    String message = String.format(Locale.US, "Changelist %s%d%s %s(%,d apps and %,d packages)",
        Colors.BLUE, group.changeNumber(), Colors.NORMAL, Colors.DARKGRAY, appCount, packageCount);

    if (changes >= BIG_CHANGELIST) {
      sink.main("Big " + message + Colors.DARKBLUE + " " + links.changelist(group.changeNumber()));
    }

    // register() must run for every group, so it goes first
    if (burstWindow.register() || changes > COMPACT_CHANGELIST) {
      if (appCount > 0) {
        message += " (Apps: " + join(group.apps()) + ")";
      }
      if (packageCount > 0) {
        message += " (Packages: " + join(group.packages()) + ")";
      }
      sink.announce(Colors.RED + "»" + Colors.NORMAL + " " + message);
      metrics.incrementAnnouncements(true);
      return;
    }

    sink.announce(Colors.RED + "»" + Colors.NORMAL + " " + message);
    metrics.incrementAnnouncements(false);

    if (appCount > 0) {
      Map<Integer, KnownName> names;
      try (Connection conn = connectionProvider.getConnection()) {
        names = changeStore.appNames(conn, group.apps());
      }
      for (int appId : group.apps()) {
        sink.announce("  App: " + Colors.BLUE + appId + Colors.NORMAL + " - "
            + NameFormatter.app(appId, names.get(appId)));
      }
    }

    if (packageCount > 0) {
      Map<Integer, KnownName> names;
      try (Connection conn = connectionProvider.getConnection()) {
        names = changeStore.packageNames(conn, group.packages());
      }
      for (int packageId : group.packages()) {
        sink.announce("  Package: " + Colors.BLUE + packageId + Colors.NORMAL + " - "
            + NameFormatter.pkg(packageId, names.get(packageId)));
      }
    }
  }

  private static String join(List<Integer> ids) {
    return ids.stream().map(String::valueOf).collect(Collectors.joining(", "));
  }
}
