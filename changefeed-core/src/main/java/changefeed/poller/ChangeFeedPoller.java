package changefeed.poller;

import changefeed.model.FeedResponse;
import changefeed.spi.FeedClient;
import changefeed.spi.MetricsExporter;
import changefeed.spi.RemoteJobFailedException;
import changefeed.tracker.ChangeNumberTracker;
import changefeed.util.DaemonThreadFactory;
import changefeed.util.Sleeper;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-running loop that asks the remote catalog for changes since the tracker's change number
 * and hands each response to a {@link FeedResponseHandler}.
 *
 * <p>Every {@link #start()} bumps a generation counter and launches a new loop; a loop exits as
 * soon as it notices its generation is no longer current. {@link #stop()} only bumps the
 * counter. In-flight requests are never interrupted, the old loop simply exits after them.
 *
 * <p>Failed, cancelled and timed-out requests are logged and the loop continues at its normal
 * cadence. Between iterations the loop sleeps for the configured interval unless tight
 * polling is enabled.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see ChangeFeedPoller.Builder
 * @see FeedResponseHandler
 */
public final class ChangeFeedPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ChangeFeedPoller.class.getName());

    private final FeedClient feedClient;
    private final ChangeNumberTracker tracker;
    private final FeedResponseHandler handler;
    private final long intervalMs;
    private final long requestTimeoutMs;
    private final boolean tightPolling;
    private final Sleeper sleeper;
    private final MetricsExporter metrics;

    private final AtomicInteger generation = new AtomicInteger();
    private ExecutorService loopExecutor;
    private volatile boolean closed;

    private ChangeFeedPoller(Builder builder) {
        this.feedClient = Objects.requireNonNull(builder.feedClient, "feedClient");
        this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
        this.handler = Objects.requireNonNull(builder.handler, "handler");

        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.requestTimeoutMs <= 0L) {
            throw new IllegalArgumentException("requestTimeoutMs must be > 0");
        }

        this.intervalMs = builder.intervalMs;
        this.requestTimeoutMs = builder.requestTimeoutMs;
        this.tightPolling = builder.tightPolling;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a new polling loop, superseding any loop started before.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ChangeFeedPoller has been closed");
        }
        if (loopExecutor == null) {
            loopExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("changefeed-poller-"));
        }
        int loopGeneration = generation.incrementAndGet();
        loopExecutor.execute(() -> loop(loopGeneration));
    }

    /**
     * Signals the current loop to exit after its in-flight request.
     */
    public void stop() {
        generation.incrementAndGet();
    }

    /**
     * Returns the generation of the most recently started loop.
     */
    public int generation() {
        return generation.get();
    }

    private void loop(int loopGeneration) {
        logger.log(Level.FINE, "Poll loop started #{0}", loopGeneration);

        while (!closed && loopGeneration == generation.get()) {
            boolean received = pollOnce();

            if (tightPolling && received) {
                continue;
            }
            if (closed || loopGeneration != generation.get()) {
                break;
            }
            try {
                sleeper.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        logger.log(Level.FINE, "Poll loop stopped #{0}", loopGeneration);
    }

    /**
     * Executes a single poll. Called by the loop, but may also be invoked directly for testing.
     *
     * @return {@code true} if a response was received and handed to the handler
     */
    public boolean pollOnce() {
        if (closed) {
            return false;
        }
        FeedResponse response = fetch(tracker.current());
        if (response == null) {
            metrics.incrementPollFailures();
            return false;
        }
        metrics.incrementPolls();
        try {
            handler.onResponse(response);
            return true;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to handle changelist " + response.currentChangeNumber(), e);
            return false;
        }
    }

    /**
     * Requests changes and waits a bounded time for them. Returns {@code null} on failure.
     */
    private FeedResponse fetch(long since) {
        CompletableFuture<FeedResponse> request;
        try {
            request = feedClient.changesSince(since, true, true);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "changesSince request could not be sent", e);
            return null;
        }
        try {
            return request.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (CancellationException e) {
            logger.severe("changesSince task was cancelled");
        } catch (TimeoutException e) {
            request.cancel(false);
            logger.log(Level.SEVERE, "changesSince got no response within {0} ms", requestTimeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RemoteJobFailedException || cause instanceof CancellationException) {
                logger.log(Level.SEVERE, "changesSince async job failed: {0}", cause.getMessage());
            } else {
                logger.log(Level.SEVERE, "changesSince failed", cause);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return null;
    }

    /**
     * Stops the loop and shuts down its thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        generation.incrementAndGet();
        if (loopExecutor != null) {
            loopExecutor.shutdownNow();
            try {
                loopExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link ChangeFeedPoller}.
     */
    public static final class Builder {
        private FeedClient feedClient;
        private ChangeNumberTracker tracker;
        private FeedResponseHandler handler;
        private long intervalMs = 10_000;
        private long requestTimeoutMs = 30_000;
        private boolean tightPolling;
        private Sleeper sleeper;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the remote catalog client.
         *
         * <p><b>Required.</b>
         *
         * @param feedClient the client issuing "changes since" requests
         * @return this builder
         */
        public Builder feedClient(FeedClient feedClient) {
            this.feedClient = feedClient;
            return this;
        }

        /**
         * Sets the tracker whose value is sent as the "since" change number.
         *
         * <p><b>Required.</b>
         *
         * @param tracker the change number tracker
         * @return this builder
         */
        public Builder tracker(ChangeNumberTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        /**
         * Sets the handler that receives each response (typically a
         * {@link changefeed.process.ChangeProcessor}).
         *
         * <p><b>Required.</b>
         *
         * @param handler the response callback
         * @return this builder
         */
        public Builder handler(FeedResponseHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets the pause between two polls in milliseconds.
         *
         * <p>Optional. Defaults to {@code 10000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets how long a "changes since" request may take before it counts as failed.
         *
         * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
         *
         * @param requestTimeoutMs request timeout in milliseconds
         * @return this builder
         */
        public Builder requestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        /**
         * Skips the pause between polls, issuing the next request as soon as the previous one
         * finished. A poll that fails still pauses for the interval.
         *
         * <p>Optional. Defaults to {@code false}.
         *
         * @param tightPolling whether to poll without pausing
         * @return this builder
         */
        public Builder tightPolling(boolean tightPolling) {
            this.tightPolling = tightPolling;
            return this;
        }

        /**
         * Sets the sleeper used between polls.
         *
         * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Sets the metrics exporter for poll counters.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the poller. Call {@link ChangeFeedPoller#start()} to begin polling.
         *
         * @return a new {@link ChangeFeedPoller} instance
         * @throws NullPointerException     if {@code feedClient}, {@code tracker} or {@code handler} is null
         * @throws IllegalArgumentException if {@code intervalMs <= 0} or {@code requestTimeoutMs <= 0}
         */
        public ChangeFeedPoller build() {
            return new ChangeFeedPoller(this);
        }
    }
}
