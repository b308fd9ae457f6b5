package changefeed.throttle;

import changefeed.spi.MetricsExporter;
import changefeed.spi.WorkloadProbe;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Answers whether the system is too loaded to accept more batch work.
 *
 * <p>Busy when any task or job is outstanding, when more than {@link #MAX_PROCESSING} items
 * are having their product info processed, or when more than {@link #MAX_LOCKS} resource
 * locks are held. Sampling never blocks; callers poll.
 */
public final class BackpressureGate {
  private static final Logger logger = Logger.getLogger(BackpressureGate.class.getName());

  public static final int MAX_PROCESSING = 50;
  public static final int MAX_LOCKS = 4;

  private final WorkloadProbe probe;
  private final MetricsExporter metrics;

  public BackpressureGate(WorkloadProbe probe) {
    this(probe, MetricsExporter.NOOP);
  }

  public BackpressureGate(WorkloadProbe probe, MetricsExporter metrics) {
    this.probe = Objects.requireNonNull(probe, "probe");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public boolean isBusy() {
    int tasks = probe.outstandingTasks();
    int jobs = probe.outstandingJobs();
    int processing = probe.processingProductInfo();
    int locks = probe.heldLocks();
    metrics.recordWorkload(tasks, jobs, processing, locks);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(status(tasks, jobs, processing, locks));
    }
    return tasks > 0
        || jobs > 0
        || processing > MAX_PROCESSING
        || locks > MAX_LOCKS;
  }

  /**
   * Logs the current counters at INFO. Used as a progress report during a full run.
   */
  public void logStatus() {
    logger.info(status(probe.outstandingTasks(), probe.outstandingJobs(),
        probe.processingProductInfo(), probe.heldLocks()));
  }

  private static String status(int tasks, int jobs, int processing, int locks) {
    return "Jobs: " + jobs + " - Tasks: " + tasks + " - Processing: " + processing + " - Locks: " + locks;
  }
}
