package com.alertgate.core.storm;

import com.alertgate.core.config.StormConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Global alert circuit breaker.
 *
 * <p>
 * Counts every alert that reaches the gate in a sliding window. When the
 * count exceeds the threshold the detector enters storm mode and denies all
 * alerts until the cooldown has elapsed since the storm began.
 * </p>
 *
 * <h3>Implementation</h3>
 * <p>
 * Keeps a deque of alert timestamps (epoch millis), pruned on each call.
 * Alerts denied during a storm are not recorded, so the window reflects the
 * load that was let through before the storm.
 * </p>
 *
 * @since 1.0.0
 */
public class StormDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StormDetector.class);

    private final StormConfig config;
    private final Clock clock;
    private final long windowMillis;
    private final long cooldownMillis;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Deque<Long> timestamps = new ArrayDeque<>();
    private boolean inStorm;
    private long stormStart;
    private long suppressedCount;

    public StormDetector() {
        this(StormConfig.defaults(), Clock.systemUTC());
    }

    /**
     * @param config thresholds, not null
     * @param clock  time source, not null
     */
    public StormDetector(StormConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "StormConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windowMillis = config.getWindowSeconds() * 1000L;
        this.cooldownMillis = config.getCooldownSeconds() * 1000L;
    }

    /**
     * Record an alert and decide whether it may proceed.
     *
     * @return {@code false} if the alert is suppressed by an ongoing or
     *         newly detected storm
     */
    public boolean recordAlert() {
        long now = clock.millis();
        lock.writeLock().lock();
        try {
            long cutoff = now - windowMillis;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }

            if (inStorm) {
                if (now < stormStart + cooldownMillis) {
                    suppressedCount++;
                    return false;
                }
                LOG.info("Alert storm ended after {}s, {} alert(s) suppressed",
                        (now - stormStart) / 1000, suppressedCount);
                inStorm = false;
                stormStart = 0;
                suppressedCount = 0;
            }

            timestamps.addLast(now);

            if (timestamps.size() > config.getThreshold()) {
                inStorm = true;
                stormStart = now;
                suppressedCount = 0;
                LOG.warn("Alert storm detected: {} alerts in {}s (threshold {})",
                        timestamps.size(), config.getWindowSeconds(), config.getThreshold());
                return false;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return current status; does not modify the window
     */
    public StormStatus getStatus() {
        long now = clock.millis();
        lock.readLock().lock();
        try {
            long cutoff = now - windowMillis;
            long count = timestamps.stream().filter(ts -> ts > cutoff).count();
            double windowMinutes = config.getWindowSeconds() / 60.0;

            Duration remaining = Duration.ZERO;
            if (inStorm) {
                long left = stormStart + cooldownMillis - now;
                remaining = Duration.ofMillis(Math.max(0, left));
            }
            return new StormStatus(
                    inStorm,
                    inStorm ? Instant.ofEpochMilli(stormStart) : null,
                    suppressedCount,
                    count / windowMinutes,
                    config.getThreshold() / windowMinutes,
                    remaining);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Clear the window and leave storm mode. */
    public void reset() {
        lock.writeLock().lock();
        try {
            timestamps.clear();
            inStorm = false;
            stormStart = 0;
            suppressedCount = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StormConfig getConfig() {
        return config;
    }
}
