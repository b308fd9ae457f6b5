package changefeed.spi;

import java.util.Objects;
import java.util.function.IntSupplier;

/**
 * Read-only view over the load counters owned by other components.
 *
 * @see changefeed.throttle.BackpressureGate
 */
public interface WorkloadProbe {

  int outstandingTasks();

  int outstandingJobs();

  /** Items whose product info is currently requested or being processed. */
  int processingProductInfo();

  /** Resource locks currently held by downstream processors. */
  int heldLocks();

  static WorkloadProbe of(IntSupplier tasks, IntSupplier jobs, IntSupplier processing, IntSupplier locks) {
    Objects.requireNonNull(tasks, "tasks");
    Objects.requireNonNull(jobs, "jobs");
    Objects.requireNonNull(processing, "processing");
    Objects.requireNonNull(locks, "locks");
    return new WorkloadProbe() {
      @Override
      public int outstandingTasks() {
        return tasks.getAsInt();
      }

      @Override
      public int outstandingJobs() {
        return jobs.getAsInt();
      }

      @Override
      public int processingProductInfo() {
        return processing.getAsInt();
      }

      @Override
      public int heldLocks() {
        return locks.getAsInt();
      }
    };
  }
}
