package changefeed;

import changefeed.announce.BurstWindow;
import changefeed.announce.ChangelistAnnouncer;
import changefeed.announce.Links;
import changefeed.dispatch.BatchDispatcher;
import changefeed.dispatch.InMemoryTokenCache;
import changefeed.dispatch.TokenJobQueue;
import changefeed.model.ItemKind;
import changefeed.model.ProductLookup;
import changefeed.poller.ChangeFeedPoller;
import changefeed.process.ChangeProcessor;
import changefeed.process.ImportantChangeNotifier;
import changefeed.process.ImportantItems;
import changefeed.resync.FullResyncEnumerator;
import changefeed.resync.FullRunMode;
import changefeed.spi.AnnouncementSink;
import changefeed.spi.ChangeStore;
import changefeed.spi.ChatNotifier;
import changefeed.spi.ConnectionProvider;
import changefeed.spi.FeedClient;
import changefeed.spi.LocalStateStore;
import changefeed.spi.MetricsExporter;
import changefeed.spi.ProductInfoListener;
import changefeed.spi.RefreshQueue;
import changefeed.spi.TokenCache;
import changefeed.spi.WorkloadProbe;
import changefeed.task.TaskRunner;
import changefeed.throttle.BackpressureGate;
import changefeed.tracker.ChangeNumberTracker;
import changefeed.util.DaemonThreadFactory;
import changefeed.util.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the poller, response processing, token dispatch and
 * announcements into a single {@link AutoCloseable} unit.
 *
 * <p>In the default mode ({@link FullRunMode#NONE}) {@link #start()} restores the last change
 * number and begins polling. Any other mode runs a full resync instead of polling, logging
 * the workload every {@link Builder#statusIntervalMs(long) status interval}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (ChangeFeed feed = ChangeFeed.builder()
 *     .connectionProvider(connProvider)
 *     .changeStore(store)
 *     .feedClient(client)
 *     .announcementSink(sink)
 *     .refreshQueue(queue)
 *     .localStateStore(new FileLocalStateStore(Path.of("changefeed.properties")))
 *     .build()) {
 *   feed.start();
 *   // ...
 * }
 * }</pre>
 *
 * @see ChangeFeedPoller
 * @see ChangeProcessor
 * @see FullResyncEnumerator
 */
public final class ChangeFeed implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChangeFeed.class.getName());
  private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(10);

  private final FullRunMode fullRunMode;
  private final ConnectionProvider connectionProvider;
  private final ChangeStore changeStore;
  private final ChangeNumberTracker tracker;
  private final TaskRunner taskRunner;
  private final TokenJobQueue jobQueue;
  private final BackpressureGate gate;
  private final ChangeFeedPoller poller;
  private final ChangeProcessor processor;
  private final FullResyncEnumerator enumerator;
  private final long statusIntervalMs;
  private final MetricsExporter metrics;

  private ScheduledExecutorService statusScheduler;
  private boolean started;
  private boolean closed;

  private ChangeFeed(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.changeStore, "changeStore");
    Objects.requireNonNull(builder.feedClient, "feedClient");
    Objects.requireNonNull(builder.announcementSink, "announcementSink");
    Objects.requireNonNull(builder.refreshQueue, "refreshQueue");
    Objects.requireNonNull(builder.localStateStore, "localStateStore");
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.statusIntervalMs <= 0L) {
      throw new IllegalArgumentException("statusIntervalMs must be > 0");
    }

    this.fullRunMode = builder.fullRunMode;
    this.connectionProvider = builder.connectionProvider;
    this.changeStore = builder.changeStore;
    this.statusIntervalMs = builder.statusIntervalMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    TokenCache tokenCache = builder.tokenCache != null ? builder.tokenCache : new InMemoryTokenCache();
    Links links = builder.links != null ? builder.links : new Links();
    Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;

    this.tracker = new ChangeNumberTracker(builder.localStateStore);
    this.taskRunner = new TaskRunner(builder.workerCount, builder.drainTimeoutMs);
    this.jobQueue = new TokenJobQueue(builder.feedClient, tokenCache, builder.productInfoListener);
    this.gate = new BackpressureGate(WorkloadProbe.of(
        taskRunner::outstandingTasks,
        jobQueue::outstandingJobs,
        jobQueue::processingProductInfo,
        builder.heldLocks), metrics);
    BatchDispatcher dispatcher = new BatchDispatcher(jobQueue, gate, sleeper, metrics);

    ChangelistAnnouncer announcer = new ChangelistAnnouncer(connectionProvider, changeStore,
        builder.announcementSink, links,
        builder.burstWindow != null ? builder.burstWindow : new BurstWindow(), metrics);
    ImportantChangeNotifier notifier = new ImportantChangeNotifier(connectionProvider, changeStore,
        builder.announcementSink, builder.chatNotifier, builder.importantItems, links,
        builder.storeQueryEnabled);

    this.processor = ChangeProcessor.builder()
        .tracker(tracker)
        .taskRunner(taskRunner)
        .connectionProvider(connectionProvider)
        .changeStore(changeStore)
        .dispatcher(dispatcher)
        .refreshQueue(builder.refreshQueue)
        .announcer(announcer)
        .importantNotifier(notifier)
        .metrics(metrics)
        .build();

    this.poller = ChangeFeedPoller.builder()
        .feedClient(builder.feedClient)
        .tracker(tracker)
        .handler(processor)
        .intervalMs(builder.intervalMs)
        .requestTimeoutMs(builder.requestTimeoutMs)
        .tightPolling(!builder.storeQueryEnabled)
        .sleeper(sleeper)
        .metrics(metrics)
        .build();

    this.enumerator = fullRunMode == FullRunMode.NONE
        ? null
        : new FullResyncEnumerator(fullRunMode, connectionProvider, changeStore, tokenCache, dispatcher);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts polling, or the full resync when a full run mode is configured.
   *
   * @throws IllegalStateException if already started or closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ChangeFeed has been closed");
    }
    if (started) {
      throw new IllegalStateException("ChangeFeed already started");
    }
    started = true;

    if (enumerator != null) {
      logger.log(Level.INFO, "Starting full run: {0}", fullRunMode);
      statusScheduler = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("changefeed-status-"));
      statusScheduler.scheduleWithFixedDelay(gate::logStatus, statusIntervalMs, statusIntervalMs,
          TimeUnit.MILLISECONDS);
      enumerator.start();
      return;
    }

    tracker.initialize(connectionProvider, changeStore);
    poller.start();
  }

  /**
   * Looks up one app or package directly, waiting up to ten seconds for each remote request.
   */
  public ProductLookup lookup(ItemKind kind, int id) throws InterruptedException {
    return jobQueue.lookup(kind, id, LOOKUP_TIMEOUT);
  }

  public FullRunMode fullRunMode() {
    return fullRunMode;
  }

  public ChangeNumberTracker tracker() {
    return tracker;
  }

  public ChangeFeedPoller poller() {
    return poller;
  }

  public ChangeProcessor processor() {
    return processor;
  }

  public BackpressureGate gate() {
    return gate;
  }

  /**
   * Shuts down components in order: status logger, resync, poller, task runner.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;

    RuntimeException first = null;
    if (statusScheduler != null) {
      statusScheduler.shutdownNow();
    }
    if (enumerator != null) {
      try {
        enumerator.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      poller.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      taskRunner.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link ChangeFeed}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ChangeStore changeStore;
    private FeedClient feedClient;
    private AnnouncementSink announcementSink;
    private RefreshQueue refreshQueue;
    private LocalStateStore localStateStore;
    private TokenCache tokenCache;
    private ProductInfoListener productInfoListener = ProductInfoListener.NONE;
    private ChatNotifier chatNotifier = ChatNotifier.NONE;
    private ImportantItems importantItems = ImportantItems.NONE;
    private Links links;
    private BurstWindow burstWindow;
    private FullRunMode fullRunMode = FullRunMode.NONE;
    private boolean storeQueryEnabled = true;
    private long intervalMs = 10_000;
    private long requestTimeoutMs = 30_000;
    private int workerCount = 4;
    private long drainTimeoutMs = 5000;
    private long statusIntervalMs = 10_000;
    private IntSupplier heldLocks = () -> 0;
    private Sleeper sleeper;
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the connection provider for the change store.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the persistent change store.
     *
     * <p><b>Required.</b>
     *
     * @param changeStore the store
     * @return this builder
     */
    public Builder changeStore(ChangeStore changeStore) {
      this.changeStore = changeStore;
      return this;
    }

    /**
     * <b>Required.</b> Remote catalog client.
     */
    public Builder feedClient(FeedClient feedClient) {
      this.feedClient = feedClient;
      return this;
    }

    /**
     * <b>Required.</b> Destination of announcement lines.
     */
    public Builder announcementSink(AnnouncementSink announcementSink) {
      this.announcementSink = announcementSink;
      return this;
    }

    /**
     * <b>Required.</b> Queue receiving the app and package ids to refresh.
     */
    public Builder refreshQueue(RefreshQueue refreshQueue) {
      this.refreshQueue = refreshQueue;
      return this;
    }

    /**
     * <b>Required.</b> Durable home of the last processed change number.
     */
    public Builder localStateStore(LocalStateStore localStateStore) {
      this.localStateStore = localStateStore;
      return this;
    }

    /** Optional. Defaults to an {@link InMemoryTokenCache}. */
    public Builder tokenCache(TokenCache tokenCache) {
      this.tokenCache = tokenCache;
      return this;
    }

    /** Optional. Receives product info fetched by token jobs. */
    public Builder productInfoListener(ProductInfoListener productInfoListener) {
      this.productInfoListener = Objects.requireNonNull(productInfoListener, "productInfoListener");
      return this;
    }

    /** Optional. External chat used for important app updates. */
    public Builder chatNotifier(ChatNotifier chatNotifier) {
      this.chatNotifier = Objects.requireNonNull(chatNotifier, "chatNotifier");
      return this;
    }

    /** Optional. Allow-listed apps and packages. */
    public Builder importantItems(ImportantItems importantItems) {
      this.importantItems = Objects.requireNonNull(importantItems, "importantItems");
      return this;
    }

    /** Optional. Defaults to links under {@link Links#DEFAULT_BASE_URL}. */
    public Builder links(Links links) {
      this.links = links;
      return this;
    }

    /** Optional. Defaults to 50 detailed changelists per 5 minutes. */
    public Builder burstWindow(BurstWindow burstWindow) {
      this.burstWindow = burstWindow;
      return this;
    }

    /**
     * Selects a full resync instead of polling.
     *
     * <p>Optional. Defaults to {@link FullRunMode#NONE}.
     */
    public Builder fullRunMode(FullRunMode fullRunMode) {
      this.fullRunMode = Objects.requireNonNull(fullRunMode, "fullRunMode");
      return this;
    }

    /**
     * Whether the external store may be queried. When disabled, polling does not pause
     * between requests and no chat notifications are sent.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder storeQueryEnabled(boolean storeQueryEnabled) {
      this.storeQueryEnabled = storeQueryEnabled;
      return this;
    }

    /** Optional. Pause between polls. Defaults to {@code 10000} ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /** Optional. Defaults to {@code 30000} ms. */
    public Builder requestTimeoutMs(long requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    /** Optional. Threads of the processing pool. Defaults to {@code 4}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Optional. Time granted to running flows on close. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /** Optional. Full run workload log interval. Defaults to {@code 10000} ms. */
    public Builder statusIntervalMs(long statusIntervalMs) {
      this.statusIntervalMs = statusIntervalMs;
      return this;
    }

    /** Optional. Source of the held lock count read by the backpressure gate. */
    public Builder heldLocks(IntSupplier heldLocks) {
      this.heldLocks = Objects.requireNonNull(heldLocks, "heldLocks");
      return this;
    }

    /** Optional. Defaults to {@link Sleeper#SYSTEM}. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the feed. Call {@link ChangeFeed#start()} to begin.
     *
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if a numeric setting is out of range
     * @throws IllegalStateException    if build() was already called on this builder
     */
    public ChangeFeed build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new ChangeFeed(this);
    }
  }
}
