package com.alertgate.core.quiet;

import com.alertgate.core.config.QuietHoursConfig;
import com.alertgate.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides whether an alert falls inside a configured quiet-hours window.
 *
 * <p>
 * Stateless and thread-safe. The evaluation instant is always supplied by
 * the caller so that decisions are reproducible under a test clock.
 * </p>
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>An unconfigured window never suppresses.</li>
 *   <li>Critical alerts pass when {@code bypassCritical} is set.</li>
 *   <li>An unknown timezone falls back to UTC.</li>
 *   <li>When {@code daysOfWeek} is non-empty, other weekdays pass.</li>
 *   <li>The window end is exclusive; a start later than the end spans midnight.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class QuietHoursFilter {

    private static final Logger LOG = LoggerFactory.getLogger(QuietHoursFilter.class);

    /**
     * @param config   quiet-hours window; {@code null} means unconfigured
     * @param severity the alert's severity string
     * @param now      evaluation instant, not null
     * @return whether to suppress, with a reason
     */
    public QuietHoursDecision shouldSuppress(QuietHoursConfig config, String severity, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (config == null || !config.isConfigured()) {
            return QuietHoursDecision.PASS;
        }

        if (config.isBypassCritical() && Severity.isCritical(severity)) {
            return new QuietHoursDecision(false, "critical bypasses quiet hours");
        }

        ZonedDateTime local = now.atZone(resolveZone(config.getTimezone()));

        if (!config.getDaysOfWeek().isEmpty()) {
            int day = local.getDayOfWeek().getValue() % 7;
            if (!config.getDaysOfWeek().contains(day)) {
                return new QuietHoursDecision(false, "quiet hours not active on "
                        + local.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
            }
        }

        int start = QuietHoursConfig.minuteOfDay(config.getStartTime());
        int end = QuietHoursConfig.minuteOfDay(config.getEndTime());
        if (start < 0 || end < 0) {
            LOG.debug("Ignoring quiet hours with malformed times {} - {}",
                    config.getStartTime(), config.getEndTime());
            return QuietHoursDecision.PASS;
        }

        int minute = local.getHour() * 60 + local.getMinute();
        if (inWindow(minute, start, end)) {
            return new QuietHoursDecision(true, String.format("quiet hours active (%s - %s %s)",
                    config.getStartTime(), config.getEndTime(), config.getTimezone()));
        }
        return QuietHoursDecision.PASS;
    }

    /**
     * When the current (or next) quiet-hours window ends.
     *
     * @return today's end time in the configured zone, or that instant plus
     *         24 hours if it has already passed (an hour off the wall-clock end
     *         across a DST change); {@code now} itself when unconfigured
     */
    public ZonedDateTime getNextDeliveryTime(QuietHoursConfig config, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        ZoneId zone = config != null ? resolveZone(config.getTimezone()) : ZoneOffset.UTC;
        ZonedDateTime local = now.atZone(zone);
        int end = config != null ? QuietHoursConfig.minuteOfDay(config.getEndTime()) : -1;
        if (end < 0) {
            return local;
        }
        LocalDate date = local.toLocalDate();
        ZonedDateTime candidate = ZonedDateTime.of(date, LocalTime.of(end / 60, end % 60), zone);
        if (candidate.isBefore(local)) {
            candidate = candidate.plusHours(24);
        }
        return candidate;
    }

    static boolean inWindow(int minute, int start, int end) {
        if (start > end) {
            return minute >= start || minute < end;
        }
        return minute >= start && minute < end;
    }

    private static ZoneId resolveZone(String timezone) {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            LOG.debug("Unknown timezone '{}', using UTC: {}", timezone, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
