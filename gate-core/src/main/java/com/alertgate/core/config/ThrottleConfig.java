package com.alertgate.core.config;

import com.alertgate.core.ConfigurationException;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * Per-rule rate limit: at most {@code maxAlerts} alerts in any trailing
 * window of {@code periodSeconds}, tracked separately for every value of the
 * optional {@code groupByField}.
 *
 * <p>
 * A config with a non-positive limit or period is "unconfigured" and never
 * throttles. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThrottleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Throttling disabled. */
    public static final ThrottleConfig NONE = new ThrottleConfig(0, 0, null);

    private final int maxAlerts;
    private final int periodSeconds;
    private final String groupByField;

    public ThrottleConfig(int maxAlerts, int periodSeconds) {
        this(maxAlerts, periodSeconds, null);
    }

    /**
     * @param maxAlerts     alerts allowed per window
     * @param periodSeconds window length in seconds
     * @param groupByField  dotted path into the event payload, or {@code null}
     */
    public ThrottleConfig(int maxAlerts, int periodSeconds, String groupByField) {
        this.maxAlerts = maxAlerts;
        this.periodSeconds = periodSeconds;
        this.groupByField = groupByField != null && !groupByField.isBlank() ? groupByField : null;
    }

    /**
     * Convert a decoded configuration map with keys {@code maxAlerts},
     * {@code periodSeconds} and {@code groupByField}.
     *
     * <p>
     * Missing numeric keys leave throttling unconfigured. Present ones must be
     * positive whole numbers, integer or floating-point encoded.
     * </p>
     *
     * @param raw decoded map; must not be {@code null}
     * @return the parsed configuration
     * @throws ConfigurationException on a type mismatch or non-positive value
     */
    public static ThrottleConfig fromMap(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "throttle config map must not be null");
        int maxAlerts = ConfigValues.optionalInt(raw, "maxAlerts", 0);
        int periodSeconds = ConfigValues.optionalInt(raw, "periodSeconds", 0);
        if (raw.containsKey("maxAlerts") && maxAlerts <= 0) {
            throw new ConfigurationException("maxAlerts must be > 0, got " + maxAlerts);
        }
        if (raw.containsKey("periodSeconds") && periodSeconds <= 0) {
            throw new ConfigurationException("periodSeconds must be > 0, got " + periodSeconds);
        }
        String groupByField = ConfigValues.optionalString(raw, "groupByField", null);
        return new ThrottleConfig(maxAlerts, periodSeconds, groupByField);
    }

    /**
     * @return {@code true} when both limit and period are positive
     */
    public boolean isConfigured() {
        return maxAlerts > 0 && periodSeconds > 0;
    }

    public int getMaxAlerts() {
        return maxAlerts;
    }

    public int getPeriodSeconds() {
        return periodSeconds;
    }

    /**
     * @return dotted field path, or {@code null} when alerts are not grouped
     */
    public String getGroupByField() {
        return groupByField;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThrottleConfig that))
            return false;
        return maxAlerts == that.maxAlerts
                && periodSeconds == that.periodSeconds
                && Objects.equals(groupByField, that.groupByField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAlerts, periodSeconds, groupByField);
    }

    @Override
    public String toString() {
        return "ThrottleConfig{maxAlerts=" + maxAlerts
                + ", periodSeconds=" + periodSeconds
                + ", groupByField='" + groupByField + "'}";
    }
}
