package changefeed.tracker;

import changefeed.spi.ConnectionProvider;
import changefeed.testing.InMemoryChangeStore;
import changefeed.testing.InMemoryLocalStateStore;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeNumberTrackerTest {

    private static final ConnectionProvider NO_CONNECTION = () -> null;

    // ── Advance ─────────────────────────────────────────────────────

    @Test
    void advanceThroughSequencePersistsEachValue() {
        InMemoryLocalStateStore state = new InMemoryLocalStateStore();
        ChangeNumberTracker tracker = new ChangeNumberTracker(state);

        assertTrue(tracker.advance(100));
        assertTrue(tracker.advance(101));
        assertFalse(tracker.advance(101));
        assertTrue(tracker.advance(105));

        assertEquals(105, tracker.current());
        assertEquals(105, state.value);
        assertEquals(3, state.saves.get());
    }

    @Test
    void advanceToSameValueDoesNotWrite() {
        InMemoryLocalStateStore state = new InMemoryLocalStateStore(42);
        ChangeNumberTracker tracker = new ChangeNumberTracker(state);
        tracker.initialize(NO_CONNECTION, new InMemoryChangeStore());

        assertFalse(tracker.advance(42));
        assertEquals(0, state.saves.get());
    }

    @Test
    void advanceRefusesLowerValue() {
        InMemoryLocalStateStore state = new InMemoryLocalStateStore();
        ChangeNumberTracker tracker = new ChangeNumberTracker(state);
        tracker.advance(200);

        assertFalse(tracker.advance(150));
        assertEquals(200, tracker.current());
        assertEquals(200, state.value);
    }

    @Test
    void resetMovesBackwards() {
        InMemoryLocalStateStore state = new InMemoryLocalStateStore();
        ChangeNumberTracker tracker = new ChangeNumberTracker(state);
        tracker.advance(200);

        tracker.reset(10);

        assertEquals(10, tracker.current());
        assertEquals(10, state.value);
    }

    @Test
    void resetRejectsNegative() {
        ChangeNumberTracker tracker = new ChangeNumberTracker(new InMemoryLocalStateStore());
        assertThrows(IllegalArgumentException.class, () -> tracker.reset(-1));
    }

    @Test
    void saveFailureLeavesValueUnchanged() {
        ChangeNumberTracker tracker = new ChangeNumberTracker(new InMemoryLocalStateStore() {
            @Override
            public void save(long changeNumber) {
                throw new LocalStateException("disk full", null);
            }
        });

        assertThrows(LocalStateException.class, () -> tracker.advance(7));
        assertEquals(0, tracker.current());
    }

    // ── Initialize ──────────────────────────────────────────────────

    @Test
    void initializePrefersLocalState() {
        InMemoryChangeStore store = new InMemoryChangeStore();
        store.changelists.add(900L);
        ChangeNumberTracker tracker = new ChangeNumberTracker(new InMemoryLocalStateStore(500));

        assertEquals(500, tracker.initialize(NO_CONNECTION, store));
        assertEquals(500, tracker.current());
    }

    @Test
    void initializeSeedsFromStoreAndPersistsSeed() {
        InMemoryChangeStore store = new InMemoryChangeStore();
        store.changelists.add(10L);
        store.changelists.add(900L);
        InMemoryLocalStateStore state = new InMemoryLocalStateStore();
        ChangeNumberTracker tracker = new ChangeNumberTracker(state);

        assertEquals(900, tracker.initialize(NO_CONNECTION, store));
        assertEquals(900, state.value);
    }

    @Test
    void initializeWithNothingStoredStaysAtZero() {
        InMemoryLocalStateStore state = new InMemoryLocalStateStore();
        ChangeNumberTracker tracker = new ChangeNumberTracker(state);

        assertEquals(0, tracker.initialize(NO_CONNECTION, new InMemoryChangeStore()));
        assertEquals(0, state.saves.get());
    }

    @Test
    void initializeWrapsConnectionFailure() {
        ChangeNumberTracker tracker = new ChangeNumberTracker(new InMemoryLocalStateStore());
        ConnectionProvider broken = () -> {
            throw new SQLException("down");
        };

        assertThrows(IllegalStateException.class, () -> tracker.initialize(broken, new InMemoryChangeStore()));
    }
}
