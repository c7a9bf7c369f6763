package com.alertgate.core.quiet;

import com.alertgate.core.DeliveryException;
import com.alertgate.core.QueueFullException;
import com.alertgate.core.config.QuietHoursConfig;
import com.alertgate.core.model.QueuedNotification;
import com.alertgate.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds notifications per channel while quiet hours are active and releases
 * them in one batch per channel once the window ends.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * A single background thread starts at construction and re-evaluates the
 * queues every check interval: expired notifications (older than
 * {@link QueueManagerSettings#NOTIFICATION_TTL}) are dropped, and when quiet
 * hours are no longer active each non-empty channel is detached and handed
 * to the {@link DeliveryCallback} on a separate delivery thread, which is
 * interrupted once the delivery timeout elapses. {@link #close()} stops the
 * background thread and waits for it.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Channel entries are created, detached and removed through atomic
 * {@link ConcurrentHashMap} operations, so a batch is handed to exactly one
 * delivery. No lock is held while a callback runs.
 * </p>
 *
 * @since 1.0.0
 */
public class QuietHoursQueueManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(QuietHoursQueueManager.class);

    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final Clock clock;
    private final QuietHoursFilter filter = new QuietHoursFilter();
    private final DeliveryCallback callback;
    private final int maxQueueSize;
    private final Duration deliveryTimeout;

    private final ConcurrentMap<String, ChannelQueue> queues = new ConcurrentHashMap<>();
    private final ScheduledThreadPoolExecutor scheduler;
    private final ExecutorService deliveryExecutor;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile QuietHoursConfig config;

    public QuietHoursQueueManager() {
        this(QueueManagerSettings.defaults());
    }

    /**
     * Create the manager and start its background task.
     *
     * @param settings construction settings, not null
     */
    public QuietHoursQueueManager(QueueManagerSettings settings) {
        Objects.requireNonNull(settings, "QueueManagerSettings must not be null");
        this.clock = settings.getClock();
        this.config = settings.getQuietHours();
        this.callback = settings.getDeliveryCallback();
        this.maxQueueSize = settings.getMaxQueueSize();
        this.deliveryTimeout = settings.getDeliveryTimeout();

        this.scheduler = new ScheduledThreadPoolExecutor(1, daemonThreads("quiet-hours-queue"));
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.deliveryExecutor = Executors.newCachedThreadPool(daemonThreads("quiet-hours-delivery"));

        long intervalMillis = settings.getCheckInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runCheck, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOG.info("Quiet hours queue manager started: {}", settings);
    }

    // -------------------------------------------------------------------------
    // Queueing
    // -------------------------------------------------------------------------

    /**
     * Whether a notification of {@code severity} should be queued right now.
     */
    public QuietHoursDecision shouldQueue(String severity) {
        return filter.shouldSuppress(config, severity, clock.instant());
    }

    /**
     * Queue a notification on its channel, stamping {@code queuedAt} and
     * {@code ttlExpiresAt}.
     *
     * @throws QueueFullException if the channel already holds the maximum
     */
    public void enqueue(QueuedNotification notification) {
        Objects.requireNonNull(notification, "notification must not be null");
        Instant now = clock.instant();
        QueuedNotification stamped = notification.toBuilder()
                .queuedAt(now)
                .ttlExpiresAt(now.plus(QueueManagerSettings.NOTIFICATION_TTL))
                .build();

        queues.compute(stamped.getChannelId(), (channelId, queue) -> {
            ChannelQueue target = queue != null ? queue : new ChannelQueue();
            if (!target.offer(stamped, maxQueueSize)) {
                throw new QueueFullException(channelId, maxQueueSize);
            }
            return target;
        });
        LOG.debug("Queued notification {} for channel {}", stamped.getAlertId(), stamped.getChannelId());
    }

    public int getQueuedCount(String channelId) {
        ChannelQueue queue = queues.get(channelId);
        return queue != null ? queue.size() : 0;
    }

    /**
     * @return queued count per non-empty channel
     */
    public Map<String, Integer> getAllQueuedCounts() {
        Map<String, Integer> counts = new HashMap<>();
        queues.forEach((channelId, queue) -> {
            int size = queue.size();
            if (size > 0) {
                counts.put(channelId, size);
            }
        });
        return counts;
    }

    /** Discard everything queued for {@code channelId}. */
    public void clearQueue(String channelId) {
        ChannelQueue removed = queues.remove(channelId);
        if (removed != null) {
            LOG.info("Cleared quiet hours queue for channel {}", channelId);
        }
    }

    public void clearAllQueues() {
        queues.clear();
        LOG.info("Cleared all quiet hours queues");
    }

    // -------------------------------------------------------------------------
    // Delivery
    // -------------------------------------------------------------------------

    /**
     * Deliver every queued notification in a single batch, ignoring quiet
     * hours. Expired notifications are dropped. Does nothing when all queues
     * are empty.
     *
     * @throws DeliveryException if no callback is configured or delivery fails
     */
    public void flushAll() {
        if (callback == null) {
            throw new DeliveryException("no delivery callback configured");
        }
        Instant now = clock.instant();
        List<QueuedNotification> batch = new ArrayList<>();
        for (String channelId : new ArrayList<>(queues.keySet())) {
            ChannelQueue queue = queues.remove(channelId);
            if (queue != null) {
                for (QueuedNotification n : queue.drain()) {
                    if (!n.isExpired(now)) {
                        batch.add(n);
                    }
                }
            }
        }
        if (batch.isEmpty()) {
            return;
        }

        LOG.info("Flushing {} queued notification(s)", batch.size());
        try {
            callback.deliver(batch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("flush interrupted", e);
        } catch (Exception e) {
            throw new DeliveryException("failed to deliver " + batch.size() + " notification(s): "
                    + e.getMessage(), e);
        }
    }

    /**
     * One pass of the background task: drop expired notifications and, when
     * quiet hours are not active, dispatch each channel's batch.
     */
    void processQueues() {
        Instant now = clock.instant();
        boolean quiet = filter.shouldSuppress(config, Severity.INFO.name(), now).isSuppress();

        AtomicInteger expired = new AtomicInteger();
        for (String channelId : new ArrayList<>(queues.keySet())) {
            queues.computeIfPresent(channelId, (id, queue) -> {
                expired.addAndGet(queue.removeExpired(now));
                return queue.isEmpty() ? null : queue;
            });
        }
        if (expired.get() > 0) {
            LOG.warn("Dropped {} expired quiet hours notification(s)", expired.get());
        }

        if (quiet || callback == null) {
            return;
        }
        for (String channelId : new ArrayList<>(queues.keySet())) {
            ChannelQueue queue = queues.remove(channelId);
            if (queue == null) {
                continue;
            }
            List<QueuedNotification> batch = queue.drain();
            if (!batch.isEmpty()) {
                dispatch(channelId, batch);
            }
        }
    }

    private void runCheck() {
        try {
            processQueues();
        } catch (RuntimeException e) {
            LOG.error("Quiet hours queue check failed", e);
        }
    }

    private void dispatch(String channelId, List<QueuedNotification> batch) {
        Future<?> delivery;
        try {
            delivery = deliveryExecutor.submit(() -> deliver(channelId, batch));
        } catch (RejectedExecutionException e) {
            LOG.warn("Delivery executor stopped, dropping {} notification(s) for channel {}",
                    batch.size(), channelId);
            return;
        }
        try {
            scheduler.schedule(() -> {
                if (!delivery.isDone()) {
                    LOG.warn("Delivery to channel {} exceeded {}, cancelling", channelId, deliveryTimeout);
                    delivery.cancel(true);
                }
            }, deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler stopped, delivery to channel {} runs without a deadline", channelId);
        }
    }

    private void deliver(String channelId, List<QueuedNotification> batch) {
        try {
            callback.deliver(batch);
            LOG.info("Delivered {} queued notification(s) to channel {}", batch.size(), channelId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Delivery to channel {} interrupted, {} notification(s) dropped", channelId, batch.size());
        } catch (Exception e) {
            LOG.error("Delivery of {} notification(s) to channel {} failed", batch.size(), channelId, e);
        }
    }

    // -------------------------------------------------------------------------
    // Configuration and lifecycle
    // -------------------------------------------------------------------------

    public QuietHoursConfig getConfig() {
        return config;
    }

    /** Replace the quiet-hours window used from the next evaluation on. */
    public void updateConfig(QuietHoursConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        LOG.info("Quiet hours config updated: {}", config);
    }

    /**
     * Stop the background task and wait for it. Safe to call repeatedly.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
                if (!scheduler.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Queue check task did not exit within {}s of interruption",
                            SHUTDOWN_WAIT.toSeconds());
                }
            }
            deliveryExecutor.shutdown();
            if (!deliveryExecutor.awaitTermination(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                deliveryExecutor.shutdownNow();
                if (!deliveryExecutor.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Delivery did not exit within {}s of interruption", SHUTDOWN_WAIT.toSeconds());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
            deliveryExecutor.shutdownNow();
        }
        LOG.info("Quiet hours queue manager stopped");
    }

    /**
     * @return {@code true} once {@link #close()} has returned and the
     *         background task has exited
     */
    boolean isTerminated() {
        return closed.get() && scheduler.isTerminated();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // -------------------------------------------------------------------------
    // Channel queue
    // -------------------------------------------------------------------------

    /** Bounded FIFO for one channel. */
    private static final class ChannelQueue {
        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<QueuedNotification> notifications = new ArrayDeque<>();

        boolean offer(QueuedNotification notification, int max) {
            lock.lock();
            try {
                if (notifications.size() >= max) {
                    return false;
                }
                notifications.addLast(notification);
                return true;
            } finally {
                lock.unlock();
            }
        }

        int removeExpired(Instant now) {
            lock.lock();
            try {
                int before = notifications.size();
                notifications.removeIf(n -> n.isExpired(now));
                return before - notifications.size();
            } finally {
                lock.unlock();
            }
        }

        List<QueuedNotification> drain() {
            lock.lock();
            try {
                List<QueuedNotification> all = new ArrayList<>(notifications);
                notifications.clear();
                return all;
            } finally {
                lock.unlock();
            }
        }

        int size() {
            lock.lock();
            try {
                return notifications.size();
            } finally {
                lock.unlock();
            }
        }

        boolean isEmpty() {
            return size() == 0;
        }
    }
}
