package changefeed.resync;

import changefeed.dispatch.BatchDispatcher;
import changefeed.model.ItemKind;
import changefeed.spi.ChangeStore;
import changefeed.spi.ConnectionProvider;
import changefeed.spi.TokenCache;
import changefeed.util.DaemonThreadFactory;
import changefeed.util.Partitions;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces the identifier lists of a full resync and feeds them to the
 * {@link BatchDispatcher}: apps in chunks of {@value #APP_CHUNK_SIZE}, then packages in
 * chunks of {@value #PACKAGE_CHUNK_SIZE} unless the mode is
 * {@link FullRunMode#WITH_FORCED_DEPOTS}.
 *
 * <p>Lists are descending so the newest items are refreshed first.
 */
public final class FullResyncEnumerator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FullResyncEnumerator.class.getName());

  public static final int APP_CHUNK_SIZE = 200;
  public static final int PACKAGE_CHUNK_SIZE = 1000;
  public static final int APP_ID_PADDING = 50_000;
  public static final int PACKAGE_ID_PADDING = 10_000;

  /** App ids at or above this bound are ignored when locating the last known app. */
  static final int APP_ID_CEILING = 2_000_000;

  private final FullRunMode mode;
  private final ConnectionProvider connectionProvider;
  private final ChangeStore changeStore;
  private final TokenCache tokenCache;
  private final BatchDispatcher dispatcher;

  private ExecutorService executor;
  private volatile boolean closed;

  public FullResyncEnumerator(FullRunMode mode, ConnectionProvider connectionProvider,
      ChangeStore changeStore, TokenCache tokenCache, BatchDispatcher dispatcher) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.changeStore = Objects.requireNonNull(changeStore, "changeStore");
    this.tokenCache = Objects.requireNonNull(tokenCache, "tokenCache");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  public FullRunMode mode() {
    return mode;
  }

  /**
   * Computes the identifier lists for the configured mode.
   *
   * @throws IllegalStateException if the mode is {@link FullRunMode#NONE} or the store is unreachable
   */
  public ResyncPlan plan() {
    switch (mode) {
      case NONE:
        throw new IllegalStateException("Full run mode is NONE");
      case TOKENS_ONLY: {
        List<Integer> apps = tokenCache.ids(ItemKind.APP);
        List<Integer> packages = tokenCache.ids(ItemKind.PACKAGE);
        logger.log(Level.INFO, "Enumerating {0} apps and {1} packages that have a token",
            new Object[]{apps.size(), packages.size()});
        return new ResyncPlan(apps, packages);
      }
      default:
        break;
    }

    try (Connection conn = connectionProvider.getConnection()) {
      if (mode == FullRunMode.ENUMERATE) {
        int lastAppId = APP_ID_PADDING + changeStore.highestAppId(conn, APP_ID_CEILING);
        int lastPackageId = PACKAGE_ID_PADDING + changeStore.highestPackageId(conn);
        logger.log(Level.INFO, "Will enumerate {0} apps and {1} packages",
            new Object[]{lastAppId, lastPackageId});
        return new ResyncPlan(Partitions.descendingRange(lastAppId), Partitions.descendingRange(lastPackageId));
      }

      logger.info("Doing a full run on all apps and packages in the database");
      List<Integer> apps = mode == FullRunMode.PACKAGES_NORMAL
          ? List.of()
          : changeStore.allAppIds(conn);
      List<Integer> packages = changeStore.allPackageIds(conn);
      return new ResyncPlan(apps, packages);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to enumerate ids for full run", e);
    }
  }

  /**
   * Plans and dispatches synchronously. Blocks for as long as the dispatcher throttles.
   *
   * @throws InterruptedException if interrupted while the dispatcher waits
   */
  public void run() throws InterruptedException {
    ResyncPlan plan = plan();
    logger.log(Level.INFO, "Requesting info for {0} apps and {1} packages",
        new Object[]{plan.apps().size(), plan.packages().size()});

    dispatcher.dispatch(plan.apps(), ItemKind.APP, APP_CHUNK_SIZE);

    if (mode == FullRunMode.WITH_FORCED_DEPOTS) {
      return;
    }

    dispatcher.dispatch(plan.packages(), ItemKind.PACKAGE, PACKAGE_CHUNK_SIZE);
    logger.info("Full run dispatched");
  }

  /**
   * Runs {@link #run()} on a dedicated daemon thread. The resync does not use the shared
   * task pool, whose outstanding count the backpressure gate waits on.
   * Subsequent calls are no-ops while a run is in progress.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("FullResyncEnumerator has been closed");
    }
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("changefeed-resync-"));
    executor.execute(() -> {
      try {
        run();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.warning("Full run interrupted");
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Full run failed", e);
      }
    });
  }

  /**
   * Interrupts a run in progress and shuts down its thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
