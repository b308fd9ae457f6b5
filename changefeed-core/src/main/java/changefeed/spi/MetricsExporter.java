package changefeed.spi;

import changefeed.model.ItemKind;

/**
 * Observability hook for exporting change-feed counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of successful feed polls.
   */
  void incrementPolls();

  /**
   * Increments the count of polls that failed, were cancelled or timed out.
   */
  void incrementPollFailures();

  /**
   * Records the change number the tracker advanced to.
   */
  void recordChangeNumber(long changeNumber);

  /**
   * Increments the count of token-acquisition jobs submitted for the given kind.
   */
  void incrementTokenJobs(ItemKind kind);

  /**
   * Increments the count of 100 ms pauses taken while the backpressure gate was busy.
   */
  void incrementThrottlePauses();

  /**
   * Increments the count of changelists announced in detail or in compact form.
   */
  void incrementAnnouncements(boolean compact);

  /**
   * Records the counters sampled by the backpressure gate.
   */
  default void recordWorkload(int tasks, int jobs, int processing, int locks) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementPolls() {
    }

    @Override
    public void incrementPollFailures() {
    }

    @Override
    public void recordChangeNumber(long changeNumber) {
    }

    @Override
    public void incrementTokenJobs(ItemKind kind) {
    }

    @Override
    public void incrementThrottlePauses() {
    }

    @Override
    public void incrementAnnouncements(boolean compact) {
    }
  }
}
