package changefeed.process;

import changefeed.announce.ChangelistAnnouncer;
import changefeed.dispatch.BatchDispatcher;
import changefeed.filter.IgnoreFilter;
import changefeed.model.BillingType;
import changefeed.model.FeedResponse;
import changefeed.model.ItemKind;
import changefeed.poller.FeedResponseHandler;
import changefeed.spi.ChangeStore;
import changefeed.spi.ConnectionProvider;
import changefeed.spi.MetricsExporter;
import changefeed.spi.RefreshQueue;
import changefeed.task.TaskRunner;
import changefeed.tracker.ChangeNumberTracker;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Processes feed responses: advances the tracker, records change history, submits token jobs,
 * fans out refresh work and triggers announcements.
 *
 * <p>Only the duplicate check and the tracker update happen on the calling (poller) thread.
 * Everything else runs on the {@link TaskRunner}: one flow per response, which records the
 * change numbers and then launches separate flows for token jobs, apps, packages, package
 * history and the announcer. Flows share no state with each other.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ChangeProcessor implements FeedResponseHandler {
    private static final Logger logger = Logger.getLogger(ChangeProcessor.class.getName());

    /** Token jobs for feed responses hold at most this many ids. */
    public static final int IDS_PER_JOB = 50;

    private final ChangeNumberTracker tracker;
    private final TaskRunner taskRunner;
    private final ConnectionProvider connectionProvider;
    private final ChangeStore changeStore;
    private final BatchDispatcher dispatcher;
    private final RefreshQueue refreshQueue;
    private final IgnoreFilter ignoreFilter;
    private final ChangelistAnnouncer announcer;
    private final ImportantChangeNotifier importantNotifier;
    private final MetricsExporter metrics;

    private ChangeProcessor(Builder builder) {
        this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
        this.taskRunner = Objects.requireNonNull(builder.taskRunner, "taskRunner");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.changeStore = Objects.requireNonNull(builder.changeStore, "changeStore");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        this.refreshQueue = Objects.requireNonNull(builder.refreshQueue, "refreshQueue");
        this.announcer = Objects.requireNonNull(builder.announcer, "announcer");
        this.ignoreFilter = builder.ignoreFilter != null ? builder.ignoreFilter : new IgnoreFilter();
        this.importantNotifier = builder.importantNotifier;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accepts a response from the poller.
     *
     * <p>A response repeating the current change number is ignored. Otherwise the tracker is
     * advanced before any other work is scheduled, so the next poll already asks for newer
     * changes.
     */
    @Override
    public void onResponse(FeedResponse response) {
        long previous = tracker.current();
        long current = response.currentChangeNumber();
        if (previous == current) {
            return;
        }

        logger.log(Level.INFO, "Changelist {0} -> {1} ({2} apps, {3} packages)", new Object[]{
                String.valueOf(previous), String.valueOf(current),
                response.appChanges().size(), response.packageChanges().size()});

        if (!tracker.advance(current)) {
            return;
        }
        metrics.recordChangeNumber(current);

        taskRunner.run("changelist " + current, () -> process(response));
    }

    /**
     * Runs the per-response flow. Exposed for tests that drive processing synchronously.
     */
    void process(FeedResponse response) throws SQLException {
        recordChangeNumbers(response);

        if (response.isEmpty()) {
            announcer.announceEmpty(response.currentChangeNumber());
            return;
        }

        long changeNumber = response.currentChangeNumber();
        taskRunner.run("tokens of changelist " + changeNumber, () -> {
            dispatcher.submitChunks(response.appIds(), ItemKind.APP, IDS_PER_JOB);
            dispatcher.submitChunks(response.packageIds(), ItemKind.PACKAGE, IDS_PER_JOB);
        });
        if (!response.appChanges().isEmpty()) {
            taskRunner.run("apps of changelist " + changeNumber, () -> handleApps(response));
        }
        if (!response.packageChanges().isEmpty()) {
            taskRunner.run("packages of changelist " + changeNumber, () -> handlePackages(response));
            taskRunner.run("package history of changelist " + changeNumber,
                    () -> handlePackageChangelists(response));
        }
        taskRunner.run("announce changelist " + changeNumber, () -> announcer.announce(response));

        if (importantNotifier != null) {
            importantNotifier.notify(response);
        }
    }

    void recordChangeNumbers(FeedResponse response) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            changeStore.upsertChangeNumbers(conn, response.referencedChangeNumbers());
        }
    }

    void handleApps(FeedResponse response) throws SQLException {
        List<Integer> appIds = response.appIds();
        refreshQueue.enqueueApps(appIds);

        try (Connection conn = connectionProvider.getConnection()) {
            changeStore.recordAppChanges(conn, response.appChanges().values());
            changeStore.touchApps(conn, appIds);
        }
    }

    void handlePackageChangelists(FeedResponse response) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            changeStore.recordPackageChanges(conn, response.packageChanges().values());
            changeStore.touchPackages(conn, response.packageIds());
        }
    }

    /**
     * Enqueues the changed packages that survive the {@link IgnoreFilter}, together with the
     * apps they own.
     */
    void handlePackages(FeedResponse response) throws SQLException {
        List<Integer> survivors;
        List<Integer> ownedApps;
        try (Connection conn = connectionProvider.getConnection()) {
            Map<Integer, BillingType> billingTypes = changeStore.billingTypes(conn, response.packageIds());
            survivors = ignoreFilter.survivors(response.packageIds(), billingTypes);
            if (survivors.isEmpty()) {
                return;
            }
            ownedApps = new ArrayList<>(changeStore.appsInPackages(conn, survivors));
        }

        if (!ownedApps.isEmpty()) {
            refreshQueue.enqueueApps(ownedApps);
        }
        refreshQueue.enqueuePackages(survivors);
    }

    /**
     * Builder for {@link ChangeProcessor}.
     */
    public static final class Builder {
        private ChangeNumberTracker tracker;
        private TaskRunner taskRunner;
        private ConnectionProvider connectionProvider;
        private ChangeStore changeStore;
        private BatchDispatcher dispatcher;
        private RefreshQueue refreshQueue;
        private IgnoreFilter ignoreFilter;
        private ChangelistAnnouncer announcer;
        private ImportantChangeNotifier importantNotifier;
        private MetricsExporter metrics;

        private Builder() {
        }

        /** <b>Required.</b> Tracker advanced for every new change number. */
        public Builder tracker(ChangeNumberTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        /** <b>Required.</b> Runner for the processing flows. */
        public Builder taskRunner(TaskRunner taskRunner) {
            this.taskRunner = taskRunner;
            return this;
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder changeStore(ChangeStore changeStore) {
            this.changeStore = changeStore;
            return this;
        }

        /** <b>Required.</b> Dispatcher used to submit token jobs. */
        public Builder dispatcher(BatchDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /** <b>Required.</b> */
        public Builder refreshQueue(RefreshQueue refreshQueue) {
            this.refreshQueue = refreshQueue;
            return this;
        }

        /** Optional. Defaults to a standard {@link IgnoreFilter}. */
        public Builder ignoreFilter(IgnoreFilter ignoreFilter) {
            this.ignoreFilter = ignoreFilter;
            return this;
        }

        /** <b>Required.</b> */
        public Builder announcer(ChangelistAnnouncer announcer) {
            this.announcer = announcer;
            return this;
        }

        /** Optional. Without it no allow-list announcements are made. */
        public Builder importantNotifier(ImportantChangeNotifier importantNotifier) {
            this.importantNotifier = importantNotifier;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @throws NullPointerException if a required component is missing
         */
        public ChangeProcessor build() {
            return new ChangeProcessor(this);
        }
    }
}
