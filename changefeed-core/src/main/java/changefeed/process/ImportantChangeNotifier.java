package changefeed.process;

import changefeed.announce.Colors;
import changefeed.announce.Links;
import changefeed.announce.NameFormatter;
import changefeed.model.FeedResponse;
import changefeed.model.KnownName;
import changefeed.spi.AnnouncementSink;
import changefeed.spi.ChangeStore;
import changefeed.spi.ChatNotifier;
import changefeed.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Announces changes to allow-listed apps and packages on their dedicated channels, and posts
 * important app updates to the external chat when store querying is enabled.
 */
public final class ImportantChangeNotifier {
  private final ConnectionProvider connectionProvider;
  private final ChangeStore changeStore;
  private final AnnouncementSink sink;
  private final ChatNotifier chat;
  private final ImportantItems important;
  private final Links links;
  private final boolean storeQueryEnabled;

  public ImportantChangeNotifier(ConnectionProvider connectionProvider, ChangeStore changeStore,
      AnnouncementSink sink, ChatNotifier chat, ImportantItems important, Links links,
      boolean storeQueryEnabled) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.changeStore = Objects.requireNonNull(changeStore, "changeStore");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.chat = chat != null ? chat : ChatNotifier.NONE;
    this.important = important != null ? important : ImportantItems.NONE;
    this.links = Objects.requireNonNull(links, "links");
    this.storeQueryEnabled = storeQueryEnabled;
  }

  public void notify(FeedResponse response) throws SQLException {
    List<Integer> apps = important.importantApps(response.appIds());
    List<Integer> packages = important.importantPackages(response.packageIds());
    if (apps.isEmpty() && packages.isEmpty()) {
      return;
    }

    try (Connection conn = connectionProvider.getConnection()) {
      if (!apps.isEmpty()) {
        Map<Integer, KnownName> names = changeStore.appNames(conn, apps);
        for (int appId : apps) {
          KnownName data = names.get(appId);
          String type = NameFormatter.appType(data);
          String name = NameFormatter.app(appId, data);
          String history = links.appHistory(appId);

          sink.importantApp(appId, type + " update: " + Colors.BLUE + name + Colors.NORMAL
              + " -" + Colors.DARKBLUE + " " + history);

          if (storeQueryEnabled) {
            chat.send(type + " update: " + name + "\n<" + history + "?changeid="
                + response.currentChangeNumber() + ">");
          }
        }
      }

      if (!packages.isEmpty()) {
        Map<Integer, KnownName> names = changeStore.packageNames(conn, packages);
        for (int packageId : packages) {
          sink.importantPackage(packageId, "Package update: " + Colors.BLUE
              + NameFormatter.pkg(packageId, names.get(packageId)) + Colors.NORMAL
              + " -" + Colors.DARKBLUE + " " + links.packageHistory(packageId));
        }
      }
    }
  }
}
