package com.alertgate.core.storm;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of the storm detector.
 *
 * @since 1.0.0
 */
public final class StormStatus {

    private final boolean inStorm;
    private final Instant stormStartTime;
    private final long suppressedCount;
    private final double currentRate;
    private final double thresholdRate;
    private final Duration cooldownRemaining;

    StormStatus(boolean inStorm, Instant stormStartTime, long suppressedCount,
                double currentRate, double thresholdRate, Duration cooldownRemaining) {
        this.inStorm = inStorm;
        this.stormStartTime = stormStartTime;
        this.suppressedCount = suppressedCount;
        this.currentRate = currentRate;
        this.thresholdRate = thresholdRate;
        this.cooldownRemaining = cooldownRemaining;
    }

    public boolean isInStorm() {
        return inStorm;
    }

    /**
     * @return when the current storm began, or {@code null} outside a storm
     */
    public Instant getStormStartTime() {
        return stormStartTime;
    }

    public long getSuppressedCount() {
        return suppressedCount;
    }

    /** Alerts per minute over the current window. */
    public double getCurrentRate() {
        return currentRate;
    }

    /** Configured threshold expressed in alerts per minute. */
    public double getThresholdRate() {
        return thresholdRate;
    }

    /**
     * @return time left before the storm may end; zero outside a storm
     */
    public Duration getCooldownRemaining() {
        return cooldownRemaining;
    }

    @Override
    public String toString() {
        return "StormStatus{inStorm=" + inStorm
                + ", stormStartTime=" + stormStartTime
                + ", suppressedCount=" + suppressedCount
                + ", currentRate=" + currentRate
                + ", thresholdRate=" + thresholdRate
                + ", cooldownRemaining=" + cooldownRemaining + '}';
    }
}
