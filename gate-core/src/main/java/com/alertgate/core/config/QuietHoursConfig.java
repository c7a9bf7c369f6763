package com.alertgate.core.config;

import com.alertgate.core.ConfigurationException;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Daily quiet-hours window.
 *
 * <p>
 * Times are {@code HH:MM} wall-clock values in {@link #getTimezone()}. A
 * window whose start is later than its end (e.g. {@code 22:00-07:00}) spans
 * midnight. {@code daysOfWeek} uses {@code 0 = Sunday .. 6 = Saturday}; an
 * empty list means every day.
 * </p>
 *
 * <p>
 * Instances are immutable. Use {@link #fromMap(Map)} to convert decoded
 * configuration; the constructor does not validate so that an unconfigured
 * value ({@link #NONE}) can be represented.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuietHoursConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Quiet hours disabled. */
    public static final QuietHoursConfig NONE = new QuietHoursConfig("", "", "UTC", true, List.of());

    public static final String DEFAULT_TIMEZONE = "UTC";

    private static final Pattern HH_MM = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");

    private final String startTime;
    private final String endTime;
    private final String timezone;
    private final boolean bypassCritical;
    private final List<Integer> daysOfWeek;

    public QuietHoursConfig(String startTime, String endTime, String timezone,
            boolean bypassCritical, List<Integer> daysOfWeek) {
        this.startTime = startTime != null ? startTime : "";
        this.endTime = endTime != null ? endTime : "";
        this.timezone = timezone != null && !timezone.isBlank() ? timezone : DEFAULT_TIMEZONE;
        this.bypassCritical = bypassCritical;
        this.daysOfWeek = daysOfWeek != null
                ? Collections.unmodifiableList(new ArrayList<>(daysOfWeek))
                : List.of();
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    /**
     * Convert a decoded configuration map.
     *
     * <p>
     * Keys: {@code startTime} and {@code endTime} (required, {@code HH:MM}),
     * {@code timezone} (IANA id, default {@code UTC}), {@code bypassCritical}
     * (default {@code true}), {@code daysOfWeek} (list of whole numbers in
     * {@code [0, 6]}, integer or floating-point encoded).
     * </p>
     *
     * @param raw decoded map; must not be {@code null}
     * @return validated configuration
     * @throws ConfigurationException if any value is missing or invalid
     */
    public static QuietHoursConfig fromMap(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "quiet hours config map must not be null");

        String start = ConfigValues.requiredString(raw, "startTime");
        String end = ConfigValues.requiredString(raw, "endTime");
        requireTime("startTime", start);
        requireTime("endTime", end);

        String timezone = ConfigValues.optionalString(raw, "timezone", DEFAULT_TIMEZONE);
        if (timezone.isBlank()) {
            timezone = DEFAULT_TIMEZONE;
        }
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("invalid timezone '" + timezone + "': " + e.getMessage(), e);
        }

        boolean bypassCritical = ConfigValues.optionalBoolean(raw, "bypassCritical", true);

        List<Integer> days = ConfigValues.optionalIntList(raw, "daysOfWeek");
        for (int day : days) {
            if (day < 0 || day > 6) {
                throw new ConfigurationException(
                        "daysOfWeek values must be between 0 (Sunday) and 6 (Saturday), got " + day);
            }
        }

        return new QuietHoursConfig(start, end, timezone, bypassCritical, days);
    }

    /**
     * Inverse of {@link #fromMap(Map)}.
     *
     * @return a mutable map that parses back to an equal configuration
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("startTime", startTime);
        map.put("endTime", endTime);
        map.put("timezone", timezone);
        map.put("bypassCritical", bypassCritical);
        map.put("daysOfWeek", new ArrayList<>(daysOfWeek));
        return map;
    }

    /**
     * Parse a strict {@code HH:MM} string into minutes since midnight.
     *
     * @param value time string, may be {@code null}
     * @return minute of day in {@code [0, 1439]}, or {@code -1} if malformed
     */
    public static int minuteOfDay(String value) {
        if (value == null) {
            return -1;
        }
        Matcher m = HH_MM.matcher(value);
        if (!m.matches()) {
            return -1;
        }
        return Integer.parseInt(m.group(1)) * 60 + Integer.parseInt(m.group(2));
    }

    private static void requireTime(String key, String value) {
        if (minuteOfDay(value) < 0) {
            throw new ConfigurationException(
                    "invalid " + key + " format '" + value + "', expected HH:MM");
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return {@code true} when both start and end times are set
     */
    public boolean isConfigured() {
        return !startTime.isBlank() && !endTime.isBlank();
    }

    public String getStartTime() {
        return startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    public String getTimezone() {
        return timezone;
    }

    public boolean isBypassCritical() {
        return bypassCritical;
    }

    /**
     * @return unmodifiable list of active weekdays, empty for every day
     */
    public List<Integer> getDaysOfWeek() {
        return daysOfWeek;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QuietHoursConfig that))
            return false;
        return bypassCritical == that.bypassCritical
                && startTime.equals(that.startTime)
                && endTime.equals(that.endTime)
                && timezone.equals(that.timezone)
                && daysOfWeek.equals(that.daysOfWeek);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, endTime, timezone, bypassCritical, daysOfWeek);
    }

    @Override
    public String toString() {
        return "QuietHoursConfig{" +
                "startTime='" + startTime + '\'' +
                ", endTime='" + endTime + '\'' +
                ", timezone='" + timezone + '\'' +
                ", bypassCritical=" + bypassCritical +
                ", daysOfWeek=" + daysOfWeek +
                '}';
    }
}
