package changefeed.announce;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Counts detailed changelist announcements within a rolling window.
 *
 * <p>The window is only rolled explicitly, once per response, so all groups of one response
 * fall into the same window.
 */
public final class BurstWindow {
  public static final int DEFAULT_THRESHOLD = 50;
  public static final Duration DEFAULT_LENGTH = Duration.ofMinutes(5);

  private final Clock clock;
  private final int threshold;
  private final Duration length;

  private Instant windowEnd;
  private int count;

  public BurstWindow() {
    this(Clock.systemUTC(), DEFAULT_THRESHOLD, DEFAULT_LENGTH);
  }

  public BurstWindow(Clock clock, int threshold, Duration length) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.length = Objects.requireNonNull(length, "length");
    if (threshold < 0) {
      throw new IllegalArgumentException("threshold must be >= 0");
    }
    if (length.isNegative() || length.isZero()) {
      throw new IllegalArgumentException("length must be > 0");
    }
    this.threshold = threshold;
  }

  /**
   * Starts a new window with a zero count if the current one has expired.
   *
   * @return {@code true} if a new window was started
   */
  public synchronized boolean roll() {
    Instant now = clock.instant();
    if (windowEnd == null || now.isAfter(windowEnd)) {
      windowEnd = now.plus(length);
      count = 0;
      return true;
    }
    return false;
  }

  /**
   * Counts one group and reports whether the window was already saturated before it.
   */
  public synchronized boolean register() {
    return count++ >= threshold;
  }

  public synchronized int count() {
    return count;
  }
}
