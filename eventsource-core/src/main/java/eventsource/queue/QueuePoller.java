package eventsource.queue;

import eventsource.Result;
import eventsource.spi.MessageQueue;
import eventsource.spi.MetricsExporter;
import eventsource.spi.QueuedMessage;
import eventsource.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled sweep that hands unprocessed queue rows to a {@link QueueHandler}.
 *
 * <p>For the event queue this is the recovery path: the unit of work publishes on the
 * hot path and the poller redelivers whatever was committed but never fully delivered.
 * Set {@link Builder#skipRecent} so the sweep does not race the hot path. For the
 * command queue it is the transport itself; enable {@link Builder#wakeOnEnqueue} so
 * new commands are picked up without waiting for the next interval.
 *
 * <p>A row is marked processed only when its handler returns ok; otherwise its attempt
 * count is incremented. Rows that reach {@code maxAttempts} are parked: they stay in the
 * queue, are no longer polled, and are logged at {@code SEVERE}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see QueuePoller.Builder
 */
public final class QueuePoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(QueuePoller.class.getName());

    private final MessageQueue queue;
    private final QueueHandler handler;
    private final Duration skipRecent;
    private final int batchSize;
    private final long intervalMs;
    private final int maxAttempts;
    private final boolean wakeOnEnqueue;
    private final MetricsExporter metrics;
    private final Clock clock;

    private final ReentrantLock pollLock = new ReentrantLock();
    private final AtomicBoolean wakePending = new AtomicBoolean();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private QueuePoller(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.handler = Objects.requireNonNull(builder.handler, "handler");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (builder.skipRecent != null && builder.skipRecent.isNegative()) {
            throw new IllegalArgumentException("skipRecent must be >= 0");
        }

        this.skipRecent = builder.skipRecent == null ? Duration.ZERO : builder.skipRecent;
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.maxAttempts = builder.maxAttempts;
        this.wakeOnEnqueue = builder.wakeOnEnqueue;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("QueuePoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("eventsource-" + queue.name() + "-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        if (wakeOnEnqueue) {
            queue.onEnqueued(this::wakeUp);
        }
        logger.log(Level.INFO, "Started {0} queue poller (interval {1} ms, batch {2})",
                new Object[]{queue.name(), intervalMs, batchSize});
    }

    /**
     * Requests an immediate poll cycle on the poller thread. Requests arriving while one
     * is pending are coalesced. No-op until {@link #start()} has been called.
     */
    public void wakeUp() {
        ScheduledExecutorService current = scheduler;
        if (closed || current == null || !wakePending.compareAndSet(false, true)) {
            return;
        }
        try {
            current.execute(() -> {
                wakePending.set(false);
                poll();
            });
        } catch (RejectedExecutionException e) {
            wakePending.set(false);
            logger.log(Level.FINE, "Wake-up rejected; poller is shutting down");
        }
    }

    /**
     * Executes a single poll cycle. Called automatically by the scheduler, but may also
     * be invoked directly for testing. Overlapping calls return immediately.
     *
     * @return the number of rows delivered and marked processed
     */
    public int poll() {
        if (closed || !pollLock.tryLock()) {
            return 0;
        }
        try {
            Instant now = clock.instant();
            List<QueuedMessage> rows = queue.pollUnprocessed(now.minus(skipRecent), maxAttempts, batchSize);
            metrics.recordUnprocessedDepth(queue.name(), queue.countUnprocessed());
            if (rows.isEmpty()) {
                metrics.recordOldestLagMs(queue.name(), 0L);
                return 0;
            }
            // oldest first, by the queue's ordering
            long lagMs = Duration.between(rows.get(0).createdAt(), now).toMillis();
            metrics.recordOldestLagMs(queue.name(), Math.max(0L, lagMs));

            int delivered = 0;
            for (QueuedMessage row : rows) {
                if (closed) {
                    break;
                }
                if (deliver(row)) {
                    delivered++;
                }
            }
            return delivered;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed on " + queue.name() + " queue", t);
            return 0;
        } finally {
            pollLock.unlock();
        }
    }

    private boolean deliver(QueuedMessage row) {
        String failure;
        try {
            Result<?> result = handler.handle(row);
            if (result.isOk()) {
                queue.markProcessed(row.messageId());
                metrics.incrementRedelivered(queue.name());
                return true;
            }
            failure = result.failure().orElseThrow().message();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Handler threw on " + queue.name() + " row " + row.messageId(), e);
            failure = e.toString();
        }

        queue.markFailed(row.messageId(), failure);
        int attempts = row.attempts() + 1;
        if (attempts >= maxAttempts) {
            metrics.incrementParked(queue.name());
            logger.log(Level.SEVERE, "Parked {0} row {1} ({2}) after {3} attempt(s): {4}",
                    new Object[]{queue.name(), row.messageId(), row.messageType(), attempts, failure});
        } else {
            logger.log(Level.WARNING, "Delivery of {0} row {1} failed (attempt {2}/{3}): {4}",
                    new Object[]{queue.name(), row.messageId(), attempts, maxAttempts, failure});
        }
        return false;
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link QueuePoller}.
     */
    public static final class Builder {
        private MessageQueue queue;
        private QueueHandler handler;
        private Duration skipRecent;
        private int batchSize = 50;
        private long intervalMs = 5000;
        private int maxAttempts = 10;
        private boolean wakeOnEnqueue;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the queue to sweep.
         *
         * <p><b>Required.</b>
         *
         * @param queue the durable queue
         * @return this builder
         */
        public Builder queue(MessageQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the handler that delivers each row.
         *
         * <p><b>Required.</b>
         *
         * @param handler the delivery callback
         * @return this builder
         */
        public Builder handler(QueueHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets a grace period during which newly enqueued rows are left to the hot path.
         *
         * <p>Optional. Defaults to {@link Duration#ZERO}. Must be &ge; 0.
         *
         * @param skipRecent duration to skip recent rows
         * @return this builder
         */
        public Builder skipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
            return this;
        }

        /**
         * Sets the maximum number of rows fetched per poll cycle.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize max rows per poll
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the polling interval in milliseconds.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the number of failed attempts after which a row is parked.
         *
         * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
         *
         * @param maxAttempts attempts per row
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Polls as soon as the queue reports new rows instead of waiting for the interval.
         *
         * <p>Optional. Defaults to {@code false}.
         *
         * @param wakeOnEnqueue whether enqueue notifications trigger a poll
         * @return this builder
         */
        public Builder wakeOnEnqueue(boolean wakeOnEnqueue) {
            this.wakeOnEnqueue = wakeOnEnqueue;
            return this;
        }

        /**
         * Sets the metrics exporter for queue depth, lag, redelivery and parking.
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
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the poller. Call {@link QueuePoller#start()} to begin the polling schedule.
         *
         * @return a new {@link QueuePoller} instance
         * @throws NullPointerException     if {@code queue} or {@code handler} is null
         * @throws IllegalArgumentException if {@code batchSize <= 0}, {@code intervalMs <= 0},
         *                                  {@code maxAttempts < 1} or {@code skipRecent} is negative
         */
        public QueuePoller build() {
            return new QueuePoller(this);
        }
    }
}
