package com.alertgate.core.config;

import com.alertgate.core.ConfigurationException;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * Global burst-detection settings: more than {@code threshold} alerts within
 * {@code windowSeconds} enters storm mode, which lasts
 * {@code cooldownSeconds} from the moment it started.
 *
 * @since 1.0.0
 */
public final class StormConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_THRESHOLD = 100;
    public static final int DEFAULT_WINDOW_SECONDS = 60;
    public static final int DEFAULT_COOLDOWN_SECONDS = 300;

    private final int threshold;
    private final int windowSeconds;
    private final int cooldownSeconds;

    /**
     * @throws IllegalArgumentException if any value is not positive
     */
    public StormConfig(int threshold, int windowSeconds, int cooldownSeconds) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
        }
        if (cooldownSeconds <= 0) {
            throw new IllegalArgumentException("cooldownSeconds must be > 0, got: " + cooldownSeconds);
        }
        this.threshold = threshold;
        this.windowSeconds = windowSeconds;
        this.cooldownSeconds = cooldownSeconds;
    }

    /**
     * @return 100 alerts per 60 seconds, 300 second cooldown
     */
    public static StormConfig defaults() {
        return new StormConfig(DEFAULT_THRESHOLD, DEFAULT_WINDOW_SECONDS, DEFAULT_COOLDOWN_SECONDS);
    }

    /**
     * Convert a decoded map with keys {@code threshold}, {@code windowSeconds}
     * and {@code cooldownSeconds}; missing keys take the defaults.
     *
     * @throws ConfigurationException on a type mismatch or non-positive value
     */
    public static StormConfig fromMap(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "storm config map must not be null");
        int threshold = ConfigValues.optionalInt(raw, "threshold", DEFAULT_THRESHOLD);
        int window = ConfigValues.optionalInt(raw, "windowSeconds", DEFAULT_WINDOW_SECONDS);
        int cooldown = ConfigValues.optionalInt(raw, "cooldownSeconds", DEFAULT_COOLDOWN_SECONDS);
        try {
            return new StormConfig(threshold, window, cooldown);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid storm config: " + e.getMessage(), e);
        }
    }

    public int getThreshold() {
        return threshold;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StormConfig that))
            return false;
        return threshold == that.threshold
                && windowSeconds == that.windowSeconds
                && cooldownSeconds == that.cooldownSeconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(threshold, windowSeconds, cooldownSeconds);
    }

    @Override
    public String toString() {
        return "StormConfig{threshold=" + threshold
                + ", windowSeconds=" + windowSeconds
                + ", cooldownSeconds=" + cooldownSeconds + '}';
    }
}
