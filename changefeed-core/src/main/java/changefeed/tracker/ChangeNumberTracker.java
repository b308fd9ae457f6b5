package changefeed.tracker;

import changefeed.spi.ChangeStore;
import changefeed.spi.ConnectionProvider;
import changefeed.spi.LocalStateStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the last processed change number, the single source of truth for the feed position.
 *
 * <p>Writers are serialized and persist the new value through the {@link LocalStateStore}
 * before publishing it; readers never block and always see either the old or the new value.
 * The value only moves forward, except through {@link #reset(long)}.
 *
 * <p>This class is thread-safe.
 */
public final class ChangeNumberTracker {
    private static final Logger logger = Logger.getLogger(ChangeNumberTracker.class.getName());

    private final LocalStateStore stateStore;
    private final AtomicLong current = new AtomicLong();

    public ChangeNumberTracker(LocalStateStore stateStore) {
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
    }

    /**
     * Loads the change number from local state, falling back to the highest change number
     * recorded in the change store. A value recovered from the store is persisted locally.
     *
     * <p>When neither source has a value the tracker starts at zero and a warning asks the
     * operator to run a full resync; none is started automatically.
     *
     * @return the loaded change number
     * @throws IllegalStateException if the change store cannot be reached
     */
    public synchronized long initialize(ConnectionProvider connectionProvider, ChangeStore changeStore) {
        long value = stateStore.load();
        if (value == 0L) {
            try (Connection conn = connectionProvider.getConnection()) {
                value = changeStore.maxChangeNumber(conn);
            } catch (SQLException e) {
                throw new IllegalStateException("Failed to read latest change number from store", e);
            }
            if (value > 0L) {
                stateStore.save(value);
            }
        }
        current.set(value);

        logger.log(Level.INFO, "Previous changelist was {0}", String.valueOf(value));
        if (value == 0L) {
            logger.warning("Looks like there are no changelists in the database.");
            logger.warning("If you want to fill up your database first, restart with full run mode ENUMERATE.");
        }
        return value;
    }

    /**
     * Returns the last processed change number.
     */
    public long current() {
        return current.get();
    }

    /**
     * Moves the tracker to {@code changeNumber}.
     *
     * @return {@code true} if the value changed; {@code false} if it equals the current value
     *     or would move the tracker backwards
     */
    public synchronized boolean advance(long changeNumber) {
        long previous = current.get();
        if (changeNumber == previous) {
            return false;
        }
        if (changeNumber < previous) {
            logger.log(Level.WARNING, "Refusing to move change number back from {0} to {1}",
                    new Object[]{String.valueOf(previous), String.valueOf(changeNumber)});
            return false;
        }
        stateStore.save(changeNumber);
        current.set(changeNumber);
        return true;
    }

    /**
     * Administrative override: persists and publishes {@code changeNumber} even if it is lower
     * than the current value.
     */
    public synchronized void reset(long changeNumber) {
        if (changeNumber < 0) {
            throw new IllegalArgumentException("changeNumber must be >= 0");
        }
        long previous = current.get();
        stateStore.save(changeNumber);
        current.set(changeNumber);
        logger.log(Level.WARNING, "Change number reset from {0} to {1}",
                new Object[]{String.valueOf(previous), String.valueOf(changeNumber)});
    }
}
