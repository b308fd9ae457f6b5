package changefeed.process;

import changefeed.announce.BurstWindow;
import changefeed.announce.ChangelistAnnouncer;
import changefeed.announce.Links;
import changefeed.dispatch.BatchDispatcher;
import changefeed.dispatch.InMemoryTokenCache;
import changefeed.dispatch.TokenJobQueue;
import changefeed.model.AccessTokens;
import changefeed.model.BillingType;
import changefeed.model.FeedResponse;
import changefeed.model.ItemKind;
import changefeed.model.KnownName;
import changefeed.model.TokenRequest;
import changefeed.spi.ConnectionProvider;
import changefeed.spi.JobQueue;
import changefeed.spi.WorkloadProbe;
import changefeed.task.TaskRunner;
import changefeed.testing.CountingMetrics;
import changefeed.testing.InMemoryChangeStore;
import changefeed.testing.InMemoryLocalStateStore;
import changefeed.testing.RecordingJobQueue;
import changefeed.testing.RecordingRefreshQueue;
import changefeed.testing.RecordingSink;
import changefeed.testing.StubFeedClient;
import changefeed.throttle.BackpressureGate;
import changefeed.tracker.ChangeNumberTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeProcessorTest {

    private static final ConnectionProvider NO_CONNECTION = () -> null;

    private InMemoryLocalStateStore state;
    private ChangeNumberTracker tracker;
    private InMemoryChangeStore store;
    private RecordingJobQueue jobs;
    private JobQueue jobQueue;
    private RecordingRefreshQueue refresh;
    private RecordingSink sink;
    private List<String> chat;
    private CountingMetrics metrics;

    @BeforeEach
    void setUp() {
        state = new InMemoryLocalStateStore();
        tracker = new ChangeNumberTracker(state);
        store = new InMemoryChangeStore();
        jobs = new RecordingJobQueue();
        jobQueue = jobs;
        refresh = new RecordingRefreshQueue();
        sink = new RecordingSink();
        chat = new CopyOnWriteArrayList<>();
        metrics = new CountingMetrics();
    }

    private ChangeProcessor processor(TaskRunner runner, ImportantItems important, boolean storeQueryEnabled) {
        Links links = new Links();
        BatchDispatcher dispatcher = new BatchDispatcher(jobQueue,
                new BackpressureGate(WorkloadProbe.of(() -> 0, () -> 0, () -> 0, () -> 0)), millis -> { }, metrics);
        return ChangeProcessor.builder()
                .tracker(tracker)
                .taskRunner(runner)
                .connectionProvider(NO_CONNECTION)
                .changeStore(store)
                .dispatcher(dispatcher)
                .refreshQueue(refresh)
                .announcer(new ChangelistAnnouncer(NO_CONNECTION, store, sink, links, new BurstWindow(), metrics))
                .importantNotifier(new ImportantChangeNotifier(NO_CONNECTION, store, sink, chat::add,
                        important, links, storeQueryEnabled))
                .metrics(metrics)
                .build();
    }

    private ChangeProcessor inlineProcessor() {
        return processor(new TaskRunner(Runnable::run), ImportantItems.NONE, true);
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingTracker() {
        assertThrows(NullPointerException.class, () -> ChangeProcessor.builder()
                .taskRunner(new TaskRunner(Runnable::run))
                .build());
    }

    // ── Duplicates and ordering ─────────────────────────────────────

    @Test
    void duplicateChangeNumberCausesNoWork() {
        tracker.advance(100);
        int savesBefore = state.saves.get();

        inlineProcessor().onResponse(FeedResponse.builder(100).app(1, 100).build());

        assertEquals(0, store.writes.get());
        assertTrue(jobs.submitted.isEmpty());
        assertTrue(sink.announced.isEmpty());
        assertEquals(savesBefore, state.saves.get());
    }

    @Test
    void trackerAdvancesBeforeAnyFlowRuns() {
        List<Runnable> deferred = new ArrayList<>();
        ChangeProcessor processor = processor(new TaskRunner(deferred::add), ImportantItems.NONE, true);

        processor.onResponse(FeedResponse.builder(7).app(1, 7).build());

        assertEquals(7, tracker.current());
        assertEquals(7, state.value);
        assertEquals(1, deferred.size());
        assertEquals(0, store.writes.get());

        deferred.get(0).run();
        assertTrue(store.changelists.contains(7L));
    }

    // ── Empty responses ─────────────────────────────────────────────

    @Test
    void emptyResponseRecordsNumberAndAnnouncesEmpty() {
        tracker.advance(100);

        inlineProcessor().onResponse(FeedResponse.builder(101).build());

        assertEquals(101, tracker.current());
        assertEquals(Set.of(101L), store.changelists);
        assertEquals(List.of("» Changelist 101 (empty)"), sink.announced);
        assertTrue(jobs.submitted.isEmpty());
        assertTrue(refresh.apps.isEmpty());
    }

    // ── Full processing ─────────────────────────────────────────────

    @Test
    void referencedChangeNumbersAreRecorded() {
        inlineProcessor().onResponse(FeedResponse.builder(205)
                .app(1, 203).app(2, 205).pkg(3, 204)
                .build());

        assertEquals(Set.of(203L, 204L, 205L), store.changelists);
        assertEquals(Set.of("203:1", "205:2"), store.appChanges);
        assertEquals(Set.of("204:3"), store.packageChanges);
        assertEquals(205, metrics.changeNumber.get());
    }

    @Test
    void tokenJobsHoldAtMostFiftyIds() {
        FeedResponse.Builder builder = FeedResponse.builder(10);
        for (int id = 1; id <= 120; id++) {
            builder.app(id, 10);
        }
        builder.pkg(1, 10);

        inlineProcessor().onResponse(builder.build());

        List<Integer> appJobSizes = jobs.submitted.stream()
                .filter(r -> r.kind() == ItemKind.APP).map(TokenRequest::size).collect(Collectors.toList());
        List<Integer> packageJobSizes = jobs.submitted.stream()
                .filter(r -> r.kind() == ItemKind.PACKAGE).map(TokenRequest::size).collect(Collectors.toList());
        assertEquals(List.of(50, 50, 20), appJobSizes);
        assertEquals(List.of(1), packageJobSizes);
        assertEquals(ItemKind.APP, jobs.submitted.get(0).kind());
    }

    @Test
    void appsAreTouchedAndEnqueued() {
        inlineProcessor().onResponse(FeedResponse.builder(10).app(440, 10).app(570, 10).build());

        assertEquals(List.of(440, 570), refresh.apps);
        assertEquals(List.of(440, 570), store.touchedApps);
    }

    @Test
    void ignoredPackagesAreRecordedButNotEnqueued() {
        store.billing.put(50, BillingType.GUEST_PASS);
        store.billing.put(60, BillingType.BILL_ONCE_ONLY);
        store.packageApps.put(60, List.of(600, 601));
        store.packageApps.put(50, List.of(500));

        inlineProcessor().onResponse(FeedResponse.builder(10)
                .pkg(50, 10).pkg(60, 10).pkg(0, 10).pkg(17906, 10)
                .build());

        assertEquals(List.of(60), refresh.packages);
        assertEquals(List.of(600, 601), refresh.apps);
        assertEquals(Set.of("10:50", "10:60", "10:0", "10:17906"), store.packageChanges);
        assertEquals(List.of(50, 60, 0, 17906), store.touchedPackages);
    }

    @Test
    void allPackagesIgnoredEnqueuesNothing() {
        store.billing.put(50, BillingType.GIFT);

        inlineProcessor().onResponse(FeedResponse.builder(10).pkg(50, 10).build());

        assertTrue(refresh.packages.isEmpty());
        assertTrue(refresh.apps.isEmpty());
    }

    // ── Important items ─────────────────────────────────────────────

    @Test
    void importantAppIsAnnouncedAndSentToChat() {
        store.apps.put(730, new KnownName("Counter-Strike 2", null, "Game"));
        ChangeProcessor processor = processor(new TaskRunner(Runnable::run),
                new ImportantItems(List.of(730), List.of(17)), true);

        processor.onResponse(FeedResponse.builder(900).app(730, 900).app(1, 900).pkg(17, 900).build());

        assertEquals(List.of("Game update: Counter-Strike 2 - https://steamdb.info/app/730/history/"),
                sink.importantApps);
        assertEquals(List.of("Package update: Unknown Package 17 - https://steamdb.info/sub/17/history/"),
                sink.importantPackages);
        assertEquals(List.of("Game update: Counter-Strike 2\n<https://steamdb.info/app/730/history/?changeid=900>"),
                chat);
    }

    @Test
    void chatIsSkippedWhenStoreQueryDisabled() {
        ChangeProcessor processor = processor(new TaskRunner(Runnable::run),
                new ImportantItems(List.of(730), List.of()), false);

        processor.onResponse(FeedResponse.builder(900).app(730, 900).build());

        assertEquals(List.of("App update: Unknown App 730 - https://steamdb.info/app/730/history/"),
                sink.importantApps);
        assertTrue(chat.isEmpty());
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    void storeFailureInFlowIsContained() {
        store = new InMemoryChangeStore() {
            @Override
            public int touchApps(Connection conn, Collection<Integer> appIds) {
                throw new IllegalStateException("db down");
            }
        };
        TaskRunner runner = new TaskRunner(Runnable::run);

        inlineProcessorWith(runner).onResponse(FeedResponse.builder(10).app(1, 10).build());

        assertEquals(10, tracker.current());
        assertEquals(0, runner.outstandingTasks());
        assertEquals(List.of(1), refresh.apps);
        assertEquals(2, sink.announced.size());
    }

    @Test
    void tokenClientFailureDoesNotLoseHistory() {
        StubFeedClient client = new StubFeedClient() {
            @Override
            public CompletableFuture<AccessTokens> accessTokens(Collection<Integer> appIds,
                    Collection<Integer> packageIds) {
                throw new IllegalStateException("not connected");
            }
        };
        TokenJobQueue tokenJobs = new TokenJobQueue(client, new InMemoryTokenCache(), null);
        jobQueue = tokenJobs;

        inlineProcessor().onResponse(FeedResponse.builder(10).app(1, 10).pkg(2, 10).build());

        assertEquals(10, tracker.current());
        assertEquals(Set.of("10:1"), store.appChanges);
        assertEquals(Set.of("10:2"), store.packageChanges);
        assertTrue(refresh.apps.contains(1));
        assertFalse(sink.announced.isEmpty());
        assertEquals(0, tokenJobs.outstandingJobs());
    }

    @Test
    void failingJobQueueOnlyStopsTokenFlow() {
        jobQueue = new JobQueue() {
            @Override
            public void submit(TokenRequest request) {
                throw new IllegalStateException("queue closed");
            }

            @Override
            public int outstandingJobs() {
                return 0;
            }
        };
        TaskRunner runner = new TaskRunner(Runnable::run);

        inlineProcessorWith(runner).onResponse(FeedResponse.builder(10).app(1, 10).build());

        assertEquals(Set.of("10:1"), store.appChanges);
        assertEquals(List.of(1), refresh.apps);
        assertEquals(2, sink.announced.size());
        assertEquals(0, runner.outstandingTasks());
    }

    private ChangeProcessor inlineProcessorWith(TaskRunner runner) {
        return processor(runner, ImportantItems.NONE, true);
    }
}
