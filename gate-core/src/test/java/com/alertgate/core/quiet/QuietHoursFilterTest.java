package com.alertgate.core.quiet;

import com.alertgate.core.config.QuietHoursConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link QuietHoursFilter}.
 */
class QuietHoursFilterTest {

    private static final QuietHoursConfig OVERNIGHT =
            new QuietHoursConfig("22:00", "07:00", "UTC", true, List.of());

    private final QuietHoursFilter filter = new QuietHoursFilter();

    @Test
    @DisplayName("Overnight window should suppress late evening and early morning only")
    void overnightWindow() {
        assertThat(suppressed(OVERNIGHT, "WARNING", "2024-01-15T23:30:00Z")).isTrue();
        assertThat(suppressed(OVERNIGHT, "WARNING", "2024-01-16T03:00:00Z")).isTrue();
        assertThat(suppressed(OVERNIGHT, "WARNING", "2024-01-15T12:00:00Z")).isFalse();
    }

    @Test
    @DisplayName("Window start should be inclusive and end exclusive")
    void boundaries() {
        assertThat(suppressed(OVERNIGHT, "WARNING", "2024-01-15T22:00:00Z")).isTrue();
        assertThat(suppressed(OVERNIGHT, "WARNING", "2024-01-16T06:59:00Z")).isTrue();
        assertThat(suppressed(OVERNIGHT, "WARNING", "2024-01-16T07:00:00Z")).isFalse();
        assertThat(suppressed(OVERNIGHT, "WARNING", "2024-01-15T21:59:00Z")).isFalse();
    }

    @Test
    @DisplayName("Daytime window should use a conjunctive range")
    void daytimeWindow() {
        QuietHoursConfig lunch = new QuietHoursConfig("12:00", "13:30", "UTC", true, List.of());

        assertThat(suppressed(lunch, "INFO", "2024-01-15T12:45:00Z")).isTrue();
        assertThat(suppressed(lunch, "INFO", "2024-01-15T13:30:00Z")).isFalse();
        assertThat(suppressed(lunch, "INFO", "2024-01-15T23:00:00Z")).isFalse();
    }

    @Test
    @DisplayName("Reason should name the window and timezone")
    void reasonShouldNameWindow() {
        QuietHoursDecision decision = filter.shouldSuppress(OVERNIGHT, "WARNING",
                Instant.parse("2024-01-15T23:30:00Z"));

        assertThat(decision.isSuppress()).isTrue();
        assertThat(decision.getReason()).isEqualTo("quiet hours active (22:00 - 07:00 UTC)");
    }

    @Test
    @DisplayName("Critical alerts should bypass quiet hours only when configured")
    void criticalBypass() {
        QuietHoursDecision bypass = filter.shouldSuppress(OVERNIGHT, "CRITICAL",
                Instant.parse("2024-01-15T23:30:00Z"));
        assertThat(bypass.isSuppress()).isFalse();
        assertThat(bypass.getReason()).contains("critical bypasses");

        QuietHoursConfig strict = new QuietHoursConfig("22:00", "07:00", "UTC", false, List.of());
        assertThat(suppressed(strict, "CRITICAL", "2024-01-15T23:30:00Z")).isTrue();
    }

    @Test
    @DisplayName("Window should be evaluated in the configured timezone")
    void timezoneShouldApply() {
        QuietHoursConfig tokyo = new QuietHoursConfig("22:00", "07:00", "Asia/Tokyo", true, List.of());

        // 14:00 UTC is 23:00 in Tokyo
        assertThat(suppressed(tokyo, "WARNING", "2024-01-15T14:00:00Z")).isTrue();
        // 03:00 UTC is 12:00 in Tokyo
        assertThat(suppressed(tokyo, "WARNING", "2024-01-15T03:00:00Z")).isFalse();
    }

    @Test
    @DisplayName("Unknown timezone should fall back to UTC")
    void unknownTimezoneFallsBackToUtc() {
        QuietHoursConfig broken = new QuietHoursConfig("22:00", "07:00", "Mars/Olympus", true, List.of());

        assertThat(suppressed(broken, "WARNING", "2024-01-15T23:30:00Z")).isTrue();
        assertThat(suppressed(broken, "WARNING", "2024-01-15T12:00:00Z")).isFalse();
    }

    @Test
    @DisplayName("Weekday restriction should suppress only on listed days")
    void weekdayRestriction() {
        QuietHoursConfig weekdays = new QuietHoursConfig("22:00", "07:00", "UTC", true, List.of(1, 2, 3, 4, 5));

        // Tuesday 23:30
        assertThat(suppressed(weekdays, "WARNING", "2024-01-16T23:30:00Z")).isTrue();
        assertThat(suppressed(weekdays, "CRITICAL", "2024-01-16T23:30:00Z")).isFalse();

        // Saturday 23:00
        QuietHoursDecision saturday = filter.shouldSuppress(weekdays, "WARNING",
                Instant.parse("2024-01-20T23:00:00Z"));
        assertThat(saturday.isSuppress()).isFalse();
        assertThat(saturday.getReason()).isEqualTo("quiet hours not active on Saturday");
    }

    @Test
    @DisplayName("Sunday should map to day zero")
    void sundayIsDayZero() {
        QuietHoursConfig sundays = new QuietHoursConfig("00:00", "23:59", "UTC", true, List.of(0));

        assertThat(suppressed(sundays, "INFO", "2024-01-21T10:00:00Z")).isTrue();
        assertThat(suppressed(sundays, "INFO", "2024-01-22T10:00:00Z")).isFalse();
    }

    @Test
    @DisplayName("Unconfigured or malformed windows should never suppress")
    void unconfiguredNeverSuppresses() {
        QuietHoursConfig malformed = new QuietHoursConfig("25:00", "07:00", "UTC", true, List.of());

        assertThat(suppressed(QuietHoursConfig.NONE, "INFO", "2024-01-15T23:30:00Z")).isFalse();
        assertThat(suppressed(null, "INFO", "2024-01-15T23:30:00Z")).isFalse();
        assertThat(suppressed(malformed, "INFO", "2024-01-15T23:30:00Z")).isFalse();
        assertThat(filter.shouldSuppress(QuietHoursConfig.NONE, "INFO", Instant.now()).getReason()).isEmpty();
    }

    @Test
    @DisplayName("Next delivery should be the upcoming end of the window")
    void nextDeliveryTime() {
        ZonedDateTime during = filter.getNextDeliveryTime(OVERNIGHT, Instant.parse("2024-01-01T23:00:00Z"));
        assertThat(during.toInstant()).isEqualTo(Instant.parse("2024-01-02T07:00:00Z"));
        assertThat(during.getHour()).isEqualTo(7);

        ZonedDateTime early = filter.getNextDeliveryTime(OVERNIGHT, Instant.parse("2024-01-02T03:00:00Z"));
        assertThat(early.toInstant()).isEqualTo(Instant.parse("2024-01-02T07:00:00Z"));
    }

    @Test
    @DisplayName("A passed end time should roll forward by exactly 24 hours across a DST change")
    void nextDeliveryTimeAcrossDst() {
        QuietHoursConfig berlin = new QuietHoursConfig("22:00", "07:00", "Europe/Berlin", true, List.of());

        // 08:00 CET on the day before clocks go forward; 07:00 CET was 06:00Z
        ZonedDateTime next = filter.getNextDeliveryTime(berlin, Instant.parse("2024-03-30T07:00:00Z"));

        assertThat(next.toInstant()).isEqualTo(Instant.parse("2024-03-31T06:00:00Z"));
        assertThat(next.getHour()).isEqualTo(8);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean suppressed(QuietHoursConfig config, String severity, String instant) {
        return filter.shouldSuppress(config, severity, Instant.parse(instant)).isSuppress();
    }
}
