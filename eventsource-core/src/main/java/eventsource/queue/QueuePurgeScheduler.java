package eventsource.queue;

import eventsource.bus.ProcessedKeyStore;
import eventsource.spi.MessageQueue;
import eventsource.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes processed queue rows, and optionally recorded dedup
 * keys, older than a retention period.
 *
 * <p>Each cycle deletes in batches (default 500) until fewer than {@code batchSize}
 * rows are deleted from a queue, then sleeps until the next interval. Unprocessed and
 * parked rows are never deleted.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see QueuePurgeScheduler.Builder
 */
public final class QueuePurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueuePurgeScheduler.class.getName());

  private final List<MessageQueue> queues;
  private final ProcessedKeyStore processedKeys;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private QueuePurgeScheduler(Builder builder) {
    if (builder.queues.isEmpty() && builder.processedKeys == null) {
      throw new IllegalArgumentException("at least one queue or a processed-key store is required");
    }
    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.queues = List.copyOf(builder.queues);
    this.processedKeys = builder.processedKeys;
    this.retention = builder.retention != null ? builder.retention : Duration.ofDays(7);
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueuePurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("eventsource-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single purge cycle over every configured queue and the processed-key store.
   *
   * <p>May be invoked directly for testing or one-off purges.
   *
   * @return total rows and keys deleted
   */
  public long runOnce() {
    if (closed) {
      return 0L;
    }
    Instant cutoff = clock.instant().minus(retention);
    long total = 0;
    for (MessageQueue queue : queues) {
      try {
        long deletedFromQueue = 0;
        int deleted;
        do {
          deleted = queue.purgeProcessed(cutoff, batchSize);
          deletedFromQueue += deleted;
        } while (deleted >= batchSize);
        if (deletedFromQueue > 0) {
          logger.log(Level.INFO, "Purged {0} processed {1} row(s) older than {2}",
              new Object[]{deletedFromQueue, queue.name(), cutoff});
        }
        total += deletedFromQueue;
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Purge cycle failed on " + queue.name() + " queue", e);
      }
    }
    if (processedKeys != null) {
      try {
        int deleted = processedKeys.purge(cutoff);
        if (deleted > 0) {
          logger.log(Level.INFO, "Purged {0} processed key(s) older than {1}", new Object[]{deleted, cutoff});
        }
        total += deleted;
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Processed-key purge failed", e);
      }
    }
    return total;
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
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

  /** Builder for {@link QueuePurgeScheduler}. */
  public static final class Builder {
    private final List<MessageQueue> queues = new ArrayList<>();
    private ProcessedKeyStore processedKeys;
    private Duration retention;
    private int batchSize = 500;
    private long intervalSeconds = 3600;
    private Clock clock;

    private Builder() {}

    /**
     * Adds a queue whose processed rows are purged.
     *
     * @param queue the queue
     * @return this builder
     */
    public Builder queue(MessageQueue queue) {
      this.queues.add(Objects.requireNonNull(queue, "queue"));
      return this;
    }

    /**
     * Sets a processed-key store whose old keys are purged with the same retention.
     *
     * <p>Optional.
     *
     * @param processedKeys the key store
     * @return this builder
     */
    public Builder processedKeys(ProcessedKeyStore processedKeys) {
      this.processedKeys = processedKeys;
      return this;
    }

    /**
     * Sets the retention period. Processed rows older than this are eligible for purging.
     *
     * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
     *
     * @param retention the retention duration
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the maximum number of rows deleted per batch within a purge cycle.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize max rows per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the interval in seconds between purge cycles.
     *
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     *
     * @param intervalSeconds purge interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the purge scheduler. Call {@link QueuePurgeScheduler#start()} to begin.
     *
     * @return a new {@link QueuePurgeScheduler} instance
     * @throws IllegalArgumentException if nothing is configured to purge, {@code retention}
     *     is negative, {@code batchSize <= 0}, or {@code intervalSeconds <= 0}
     */
    public QueuePurgeScheduler build() {
      return new QueuePurgeScheduler(this);
    }
  }
}
