package changefeed;

import changefeed.model.FeedResponse;
import changefeed.model.ItemKind;
import changefeed.model.KnownName;
import changefeed.model.ProductLookup;
import changefeed.resync.FullRunMode;
import changefeed.testing.InMemoryChangeStore;
import changefeed.testing.InMemoryLocalStateStore;
import changefeed.testing.RecordingRefreshQueue;
import changefeed.testing.RecordingSink;
import changefeed.testing.StubFeedClient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeFeedTest {

  private static ChangeFeed.Builder builder(InMemoryChangeStore store, StubFeedClient client,
      InMemoryLocalStateStore state, RecordingSink sink, RecordingRefreshQueue refresh) {
    return ChangeFeed.builder()
        .connectionProvider(() -> null)
        .changeStore(store)
        .feedClient(client)
        .announcementSink(sink)
        .refreshQueue(refresh)
        .localStateStore(state)
        .requestTimeoutMs(50)
        .sleeper(millis -> Thread.sleep(5));
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingFeedClient() {
    assertThrows(NullPointerException.class, () -> ChangeFeed.builder()
        .connectionProvider(() -> null)
        .changeStore(new InMemoryChangeStore())
        .announcementSink(new RecordingSink())
        .refreshQueue(new RecordingRefreshQueue())
        .localStateStore(new InMemoryLocalStateStore())
        .build());
  }

  @Test
  void builderRejectsZeroWorkers() {
    assertThrows(IllegalArgumentException.class, () -> builder(new InMemoryChangeStore(), new StubFeedClient(),
        new InMemoryLocalStateStore(), new RecordingSink(), new RecordingRefreshQueue())
        .workerCount(0)
        .build());
  }

  @Test
  void builderCannotBeReused() {
    ChangeFeed.Builder builder = builder(new InMemoryChangeStore(), new StubFeedClient(),
        new InMemoryLocalStateStore(), new RecordingSink(), new RecordingRefreshQueue());
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  @Test
  void normalModeResumesFromLocalStateAndProcessesResponses() throws Exception {
    InMemoryChangeStore store = new InMemoryChangeStore();
    StubFeedClient client = new StubFeedClient()
        .respond(FeedResponse.builder(501).app(10, 501).build());
    InMemoryLocalStateStore state = new InMemoryLocalStateStore(500);
    RecordingSink sink = new RecordingSink();
    RecordingRefreshQueue refresh = new RecordingRefreshQueue();

    try (ChangeFeed feed = builder(store, client, state, sink, refresh).build()) {
      feed.start();

      long deadline = System.currentTimeMillis() + 5000;
      while (refresh.apps.isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(500L, client.sinceRequests.get(0));
      assertEquals(501, feed.tracker().current());
      assertEquals(List.of(10), refresh.apps);
      assertThrows(IllegalStateException.class, feed::start);
    }
    assertEquals(501, state.value);
  }

  @Test
  void fullRunDispatchesInsteadOfPolling() throws Exception {
    InMemoryChangeStore store = new InMemoryChangeStore();
    store.apps.put(3, new KnownName("a", null, null));
    StubFeedClient client = new StubFeedClient();

    try (ChangeFeed feed = builder(store, client, new InMemoryLocalStateStore(), new RecordingSink(),
        new RecordingRefreshQueue())
        .fullRunMode(FullRunMode.NORMAL)
        .build()) {
      feed.start();

      long deadline = System.currentTimeMillis() + 5000;
      while (client.productRequests.isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(3, client.productRequests.get(0).id());
      assertTrue(client.sinceRequests.isEmpty());
      assertEquals(FullRunMode.NORMAL, feed.fullRunMode());
    }
  }

  @Test
  void startAfterCloseThrows() {
    ChangeFeed feed = builder(new InMemoryChangeStore(), new StubFeedClient(),
        new InMemoryLocalStateStore(), new RecordingSink(), new RecordingRefreshQueue()).build();
    feed.close();
    assertThrows(IllegalStateException.class, feed::start);
  }

  @Test
  void lookupAsksTheFeedClientDirectly() throws Exception {
    StubFeedClient client = new StubFeedClient();

    try (ChangeFeed feed = builder(new InMemoryChangeStore(), client, new InMemoryLocalStateStore(),
        new RecordingSink(), new RecordingRefreshQueue()).build()) {
      ProductLookup lookup = feed.lookup(ItemKind.PACKAGE, 17906);

      assertEquals(ProductLookup.Status.NO_INFO, lookup.status());
      assertEquals(17906, client.productRequests.get(0).id());
    }
  }
}
