package changefeed.task;

import changefeed.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared worker pool for fire-and-forget flows (persistence, fan-out, announcements).
 *
 * <p>Tracks how many submitted tasks have not finished yet, which the
 * {@link changefeed.throttle.BackpressureGate} reads. A task that throws is logged and
 * counted as finished; nobody awaits its result.
 *
 * <p>This class is thread-safe.
 */
public final class TaskRunner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TaskRunner.class.getName());

  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final long drainTimeoutMs;
  private final AtomicInteger outstanding = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates a runner with its own pool of {@code workerCount} daemon threads.
   */
  public TaskRunner(int workerCount, long drainTimeoutMs) {
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.ownedExecutor = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("changefeed-task-"));
    this.executor = ownedExecutor;
    this.drainTimeoutMs = drainTimeoutMs;
  }

  /**
   * Creates a runner on a caller-owned executor, which {@link #close()} leaves running.
   */
  public TaskRunner(Executor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownedExecutor = null;
    this.drainTimeoutMs = 0L;
  }

  /**
   * Runs {@code task} asynchronously.
   *
   * @param name short description used when logging a failure
   * @param task the work
   * @return {@code false} if the runner is closed or its executor refused the task
   */
  public boolean run(String name, Task task) {
    Objects.requireNonNull(task, "task");
    if (closed) {
      logger.log(Level.WARNING, "Task runner closed, dropping task: {0}", name);
      return false;
    }
    outstanding.incrementAndGet();
    try {
      executor.execute(() -> execute(name, task));
      return true;
    } catch (RejectedExecutionException e) {
      outstanding.decrementAndGet();
      logger.log(Level.WARNING, "Task rejected: " + name, e);
      return false;
    }
  }

  private void execute(String name, Task task) {
    try {
      task.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Task interrupted: {0}", name);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Task failed: " + name, t);
    } finally {
      outstanding.decrementAndGet();
    }
  }

  /**
   * Returns the number of tasks submitted but not yet finished.
   */
  public int outstandingTasks() {
    return outstanding.get();
  }

  /**
   * Stops accepting tasks and, for an owned pool, waits up to the drain timeout for
   * running tasks before forcing shutdown.
   */
  @Override
  public void close() {
    closed = true;
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown with {0} tasks outstanding",
            outstanding.get());
        ownedExecutor.shutdownNow();
        ownedExecutor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * A unit of work that may fail.
   */
  @FunctionalInterface
  public interface Task {
    void run() throws Exception;
  }
}
