package com.alertgate.core.digest;

import com.alertgate.core.model.QueuedAlert;
import com.alertgate.core.model.Severity;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders queued alerts as a plain-text digest.
 *
 * <pre>
 * Quiet Hours Digest for router-1
 * Total Alerts: 3
 * Period: 2024-01-01 22:05:00 UTC - 2024-01-02 06:40:00 UTC
 *
 * CRITICAL (1):
 *   - disk.full: 1
 *
 * WARNING (2):
 *   - cpu.high: 2
 * </pre>
 *
 * @since 1.0.0
 */
public final class DigestFormatter {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private DigestFormatter() {
        // utility class
    }

    /**
     * @param alerts   alerts for one device
     * @param deviceId device named in the header
     * @return the digest text, or {@code ""} when there are no alerts
     */
    public static String format(List<QueuedAlert> alerts, String deviceId) {
        if (alerts == null || alerts.isEmpty()) {
            return "";
        }

        Map<Severity, Map<String, Integer>> buckets = new EnumMap<>(Severity.class);
        Map<Severity, Integer> totals = new EnumMap<>(Severity.class);
        Instant oldest = null;
        Instant newest = null;
        for (QueuedAlert alert : alerts) {
            Severity severity = alert.severityLevel();
            buckets.computeIfAbsent(severity, s -> new LinkedHashMap<>())
                    .merge(String.valueOf(alert.getEventType()), 1, Integer::sum);
            totals.merge(severity, 1, Integer::sum);

            Instant ts = alert.getTimestamp();
            if (oldest == null || ts.isBefore(oldest)) {
                oldest = ts;
            }
            if (newest == null || ts.isAfter(newest)) {
                newest = ts;
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Quiet Hours Digest for ").append(deviceId).append('\n');
        sb.append("Total Alerts: ").append(alerts.size()).append('\n');
        sb.append("Period: ").append(TIMESTAMP.format(oldest))
                .append(" - ").append(TIMESTAMP.format(newest)).append('\n');

        // EnumMap iterates in declaration order: CRITICAL, ERROR, WARNING, INFO
        buckets.forEach((severity, eventTypes) -> {
            sb.append('\n').append(severity.name()).append(" (").append(totals.get(severity)).append("):\n");
            eventTypes.forEach((eventType, count) ->
                    sb.append("  - ").append(eventType).append(": ").append(count).append('\n'));
        });
        return sb.toString();
    }

    /**
     * @return the most urgent severity among {@code alerts}; {@link Severity#INFO} when empty
     */
    public static Severity highestSeverity(List<QueuedAlert> alerts) {
        Severity highest = Severity.INFO;
        if (alerts != null) {
            for (QueuedAlert alert : alerts) {
                highest = highest.max(alert.severityLevel());
            }
        }
        return highest;
    }
}
