package com.alertgate.service;

import com.alertgate.core.clock.MutableClock;
import com.alertgate.core.config.ThrottleConfig;
import com.alertgate.core.throttle.ThrottleManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ThrottleSummaryReporter}.
 */
class ThrottleSummaryReporterTest {

    private static final ThrottleConfig TWO_PER_MINUTE = new ThrottleConfig(2, 60, "device_id");

    private ThrottleManager throttle;
    private RecordingPublisher publisher;
    private ThrottleSummaryReporter reporter;

    @BeforeEach
    void setUp() {
        throttle = new ThrottleManager(new MutableClock(Instant.parse("2024-01-15T12:00:00Z")));
        publisher = new RecordingPublisher();
        reporter = new ThrottleSummaryReporter(throttle, publisher);
    }

    @Test
    @DisplayName("Rules that suppressed nothing should not be reported")
    void skipsQuietRules() {
        throttle.shouldAllow("cpu-high", Map.of("device_id", "r1"), TWO_PER_MINUTE);

        assertThat(reporter.reportOnce()).isZero();
        assertThat(publisher.all()).isEmpty();
    }

    @Test
    @DisplayName("A report should carry totals and per-group detail, then clear the counters")
    @SuppressWarnings("unchecked")
    void reportsAndClears() {
        for (int i = 0; i < 5; i++) {
            throttle.shouldAllow("cpu-high", Map.of("device_id", "r1"), TWO_PER_MINUTE);
        }
        throttle.shouldAllow("cpu-high", Map.of("device_id", "r2"), TWO_PER_MINUTE);

        assertThat(reporter.reportOnce()).isEqualTo(1);

        Map<String, Object> payload = publisher.ofType(ThrottleSummaryReporter.EVENT_TYPE).get(0);
        assertThat(payload)
                .containsEntry("rule_id", "cpu-high")
                .containsEntry("total_allowed", 3L)
                .containsEntry("total_suppressed", 3L)
                .containsEntry("period_seconds", 60);
        List<Map<String, Object>> groups = (List<Map<String, Object>>) payload.get("groups");
        assertThat(groups).extracting(g -> g.get("group_key")).containsExactly("r1", "r2");
        assertThat(groups.get(0)).containsEntry("suppressed", 3L);

        assertThat(throttle.getSummary("cpu-high").orElseThrow().getTotalSuppressed()).isZero();
        assertThat(reporter.reportOnce()).isZero();
    }

    @Test
    @DisplayName("Suppressions recorded while a report is being published should be kept for the next report")
    void keepsSuppressionsRecordedDuringPublish() {
        ThrottleConfig onePerMinute = new ThrottleConfig(1, 60);
        throttle.shouldAllow("r", Map.of(), onePerMinute);
        throttle.shouldAllow("r", Map.of(), onePerMinute);
        ThrottleSummaryReporter racing = new ThrottleSummaryReporter(throttle, (type, payload) -> {
            publisher.publish(type, payload);
            throttle.shouldAllow("r", Map.of(), onePerMinute);
        });

        assertThat(racing.reportOnce()).isEqualTo(1);

        assertThat(publisher.ofType(ThrottleSummaryReporter.EVENT_TYPE).get(0))
                .containsEntry("total_suppressed", 1L);
        assertThat(throttle.getSummary("r").orElseThrow().getTotalSuppressed()).isEqualTo(1);
    }

    @Test
    @DisplayName("run() should not propagate publisher failures")
    void runSwallowsPublisherFailure() {
        for (int i = 0; i < 3; i++) {
            throttle.shouldAllow("cpu-high", Map.of("device_id", "r1"), TWO_PER_MINUTE);
        }
        ThrottleSummaryReporter failing = new ThrottleSummaryReporter(throttle, (type, payload) -> {
            throw new IllegalStateException("sink down");
        });

        failing.run();

        assertThat(throttle.getSummary("cpu-high").orElseThrow().getTotalAllowed()).isEqualTo(2);
    }
}
