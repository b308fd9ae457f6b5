package changefeed.dispatch;

import changefeed.model.ItemKind;
import changefeed.model.TokenRequest;
import changefeed.spi.JobQueue;
import changefeed.spi.MetricsExporter;
import changefeed.throttle.BackpressureGate;
import changefeed.util.Partitions;
import changefeed.util.Sleeper;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits identifier lists into bounded chunks and submits one token-acquisition job per chunk.
 *
 * <p>{@link #dispatch} is the throttled path used by full resyncs: after each submission it
 * pauses {@value #THROTTLE_PAUSE_MS} ms and keeps pausing while the
 * {@link BackpressureGate} reports busy, so a resync of hundreds of thousands of ids never
 * floods the job queue. {@link #submitChunks} is the unthrottled path used per feed response.
 */
public final class BatchDispatcher {
  private static final Logger logger = Logger.getLogger(BatchDispatcher.class.getName());

  public static final long THROTTLE_PAUSE_MS = 100;

  private final JobQueue jobQueue;
  private final BackpressureGate gate;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;

  public BatchDispatcher(JobQueue jobQueue, BackpressureGate gate) {
    this(jobQueue, gate, Sleeper.SYSTEM, MetricsExporter.NOOP);
  }

  public BatchDispatcher(JobQueue jobQueue, BackpressureGate gate, Sleeper sleeper, MetricsExporter metrics) {
    this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Submits {@code ids} in input order as chunks of at most {@code chunkSize}, waiting for the
   * gate to clear after every submission.
   *
   * @return the number of jobs submitted
   * @throws InterruptedException if interrupted while waiting; remaining chunks are not submitted
   */
  public int dispatch(Collection<Integer> ids, ItemKind kind, int chunkSize) throws InterruptedException {
    List<List<Integer>> chunks = Partitions.partition(ids, chunkSize);
    int submitted = 0;
    for (List<Integer> chunk : chunks) {
      submit(kind, chunk);
      submitted++;
      do {
        sleeper.sleep(THROTTLE_PAUSE_MS);
        metrics.incrementThrottlePauses();
      } while (gate.isBusy());
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Dispatched " + submitted + "/" + chunks.size() + " " + kind + " chunks");
      }
    }
    return submitted;
  }

  /**
   * Submits {@code ids} without throttling: one job per chunk of {@code chunkSize} when there
   * are more ids than that, otherwise a single job holding all of them. No job for an empty list.
   *
   * @return the number of jobs submitted
   */
  public int submitChunks(Collection<Integer> ids, ItemKind kind, int chunkSize) {
    if (ids.isEmpty()) {
      return 0;
    }
    if (ids.size() <= chunkSize) {
      submit(kind, List.copyOf(ids));
      return 1;
    }
    List<List<Integer>> chunks = Partitions.partition(ids, chunkSize);
    for (List<Integer> chunk : chunks) {
      submit(kind, chunk);
    }
    return chunks.size();
  }

  private void submit(ItemKind kind, List<Integer> chunk) {
    jobQueue.submit(TokenRequest.of(kind, chunk));
    metrics.incrementTokenJobs(kind);
  }
}
