package nudge.delivery;

import nudge.model.QueueEntry;
import nudge.util.DaemonThreadFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-delay batch loop that delivers due queue entries.
 *
 * <p>Each cycle selects up to {@code batchSize} {@code QUEUED} entries whose scheduled time
 * has passed, ordered by priority then scheduled time, and delivers them concurrently on a
 * pool of {@code batchSize} workers, waiting for the whole batch before the cycle ends. A
 * cycle that starts while another is still running returns immediately.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see NotificationService#deliver
 */
public final class DeliveryPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DeliveryPoller.class.getName());

    private final NotificationService notificationService;
    private final int batchSize;
    private final long intervalMs;
    private final AtomicBoolean running = new AtomicBoolean();
    private final ExecutorService workers;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private DeliveryPoller(Builder builder) {
        this.notificationService = Objects.requireNonNull(builder.notificationService, "notificationService");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.workers = Executors.newFixedThreadPool(batchSize, new DaemonThreadFactory("nudge-delivery-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled delivery loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DeliveryPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("nudge-delivery-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single batch. Called automatically by the scheduler, but may also be invoked directly for testing.
     *
     * @return the number of entries picked up, or {@code 0} if another batch was running
     */
    public int poll() {
        if (closed || !running.compareAndSet(false, true)) {
            return 0;
        }
        try {
            List<QueueEntry> due;
            try {
                due = notificationService.selectDue(batchSize);
            } catch (SQLException | RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to select due notifications", e);
                return 0;
            }
            notificationService.metrics().recordBatchSize(due.size());
            if (due.isEmpty()) {
                return 0;
            }
            deliverAll(due);
            return due.size();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Delivery cycle failed", t);
            return 0;
        } finally {
            running.set(false);
        }
    }

    private void deliverAll(List<QueueEntry> due) throws InterruptedException {
        List<Future<?>> futures = new ArrayList<>(due.size());
        for (QueueEntry entry : due) {
            futures.add(workers.submit(() -> notificationService.deliver(entry.id())));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Delivery task failed", e.getCause());
            }
        }
    }

    /**
     * Returns {@code true} while a batch is in progress.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Cancels the delivery schedule and shuts down the scheduler and worker threads.
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
        }
        workers.shutdown();
        try {
            if (scheduler != null) {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            }
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Builder for {@link DeliveryPoller}.
     */
    public static final class Builder {
        private NotificationService notificationService;
        private int batchSize = 50;
        private long intervalMs = 10_000L;

        private Builder() {
        }

        /**
         * Sets the service that selects and delivers entries.
         *
         * <p><b>Required.</b>
         *
         * @param notificationService the delivery pipeline
         * @return this builder
         */
        public Builder notificationService(NotificationService notificationService) {
            this.notificationService = notificationService;
            return this;
        }

        /**
         * Sets the maximum number of entries delivered per cycle, which is also the number
         * of concurrent deliveries.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize max entries per cycle
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the delay between the end of one cycle and the start of the next.
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
         * Builds the poller. Call {@link DeliveryPoller#start()} to begin the schedule.
         *
         * @return a new {@link DeliveryPoller} instance
         * @throws NullPointerException     if {@code notificationService} is null
         * @throws IllegalArgumentException if {@code batchSize <= 0} or {@code intervalMs <= 0}
         */
        public DeliveryPoller build() {
            return new DeliveryPoller(this);
        }
    }
}
