package com.alertgate.core.pipeline;

import com.alertgate.core.clock.MutableClock;
import com.alertgate.core.config.GateConfig;
import com.alertgate.core.config.QuietHoursConfig;
import com.alertgate.core.config.StormConfig;
import com.alertgate.core.config.ThrottleConfig;
import com.alertgate.core.model.AlertEvent;
import com.alertgate.core.model.AlertRule;
import com.alertgate.core.model.Severity;
import com.alertgate.core.pipeline.AdmissionResult.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AdmissionPipeline}.
 */
class AdmissionPipelineTest {

    private static final QuietHoursConfig OVERNIGHT =
            new QuietHoursConfig("22:00", "07:00", "UTC", true, List.of());

    private MutableClock clock;
    private AdmissionPipeline pipeline;
    private List<Map<String, Object>> published;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T12:00:00Z"));
        pipeline = new AdmissionPipeline(
                new GateConfig(new StormConfig(10, 60, 120), QuietHoursConfig.NONE, List.of()), clock);
        published = new ArrayList<>();
        pipeline.setEventPublisher((type, payload) -> {
            assertThat(type).isEqualTo(AdmissionPipeline.ALERT_TRIGGERED);
            published.add(payload);
        });
    }

    @Test
    @DisplayName("Disabled rules should be skipped without touching the gates")
    void disabledRuleIsSkipped() {
        AlertRule rule = rule("cpu-high", Severity.WARNING);
        rule.setEnabled(false);

        AdmissionResult result = pipeline.admit(rule, event("router-1"));

        assertThat(result.getOutcome()).isEqualTo(Outcome.SKIPPED);
        assertThat(pipeline.getStormDetector().getStatus().getCurrentRate()).isZero();
    }

    @Test
    @DisplayName("Throttled alerts should be counted and reported on the next delivery")
    void throttledAlertsAreReportedOnDelivery() {
        AlertRule rule = rule("cpu-high", Severity.WARNING);
        rule.setThrottle(new ThrottleConfig(1, 60));

        assertThat(pipeline.admit(rule, event("router-1")).getOutcome()).isEqualTo(Outcome.DELIVER);
        AdmissionResult throttled = pipeline.admit(rule, event("router-1"));
        pipeline.admit(rule, event("router-1"));

        assertThat(throttled.getOutcome()).isEqualTo(Outcome.THROTTLED);
        assertThat(throttled.getReason()).startsWith("throttled:");

        clock.advance(Duration.ofSeconds(61));
        AdmissionResult delivered = pipeline.admit(rule, event("router-1"));
        assertThat(delivered.getOutcome()).isEqualTo(Outcome.DELIVER);
        assertThat(delivered.getSuppressedCount()).isEqualTo(2);
        assertThat(delivered.getReason()).startsWith("throttled:");

        clock.advance(Duration.ofSeconds(61));
        assertThat(pipeline.admit(rule, event("router-1")).getSuppressedCount()).isZero();
    }

    @Test
    @DisplayName("Storm suppression should precede throttling")
    void stormSuppressesFirst() {
        AlertRule rule = rule("cpu-high", Severity.WARNING);
        for (int i = 0; i < 10; i++) {
            assertThat(pipeline.admit(rule, event("router-1")).isDeliver()).isTrue();
        }

        AdmissionResult storm = pipeline.admit(rule, event("router-1"));

        assertThat(storm.getOutcome()).isEqualTo(Outcome.STORM_SUPPRESSED);
        assertThat(storm.getReason()).startsWith("storm: 11/min (threshold: 10/min)");
    }

    @Test
    @DisplayName("Quiet hours should defer alerts into the per-device queue")
    void quietHoursDefer() {
        clock.set(Instant.parse("2024-01-15T23:30:00Z"));
        AlertRule rule = rule("cpu-high", Severity.WARNING);
        rule.setQuietHours(OVERNIGHT);
        AlertRule critical = rule("disk-full", Severity.CRITICAL);
        critical.setQuietHours(OVERNIGHT);

        AdmissionResult deferred = pipeline.admit(rule, event("router-1"));

        assertThat(deferred.getOutcome()).isEqualTo(Outcome.DEFERRED);
        assertThat(deferred.getReason()).contains("quiet hours active");
        assertThat(pipeline.getAlertQueue().getByDevice("router-1")).hasSize(1);
        assertThat(pipeline.admit(critical, event("router-1")).getOutcome()).isEqualTo(Outcome.DELIVER);
    }

    @Test
    @DisplayName("Digests should wait for quiet hours to end, then cover each device")
    void flushDigestsAfterQuietHours() {
        clock.set(Instant.parse("2024-01-15T23:30:00Z"));
        AlertRule rule = rule("cpu-high", Severity.WARNING);
        rule.setQuietHours(OVERNIGHT);
        pipeline.registerRule(rule);
        pipeline.admit(rule, event("router-1"));
        pipeline.admit(rule, event("router-1"));
        pipeline.admit(rule, event("router-2"));

        assertThat(pipeline.flushDigests()).isEmpty();
        assertThat(pipeline.getAlertQueue().count()).isEqualTo(3);

        clock.set(Instant.parse("2024-01-16T07:30:00Z"));
        List<DigestMessage> digests = pipeline.flushDigests();

        assertThat(digests).extracting(DigestMessage::getDeviceId)
                .containsExactlyInAnyOrder("router-1", "router-2");
        DigestMessage first = digests.stream()
                .filter(d -> d.getDeviceId().equals("router-1")).findFirst().orElseThrow();
        assertThat(first.getTitle()).isEqualTo("WARNING: Quiet Hours Digest (2 alerts)");
        assertThat(first.getBody()).contains("Quiet Hours Digest for router-1", "router.cpu.high: 2");
        assertThat(first.toPayload()).containsEntry("digest", true).containsEntry("alert_count", 2);
        assertThat(pipeline.getAlertQueue().count()).isZero();
    }

    @Test
    @DisplayName("process should evaluate every matching rule and publish deliveries")
    void processMatchingRules() {
        AlertRule cpu = rule("cpu-high", Severity.WARNING);
        AlertRule cpuCritical = rule("cpu-critical", Severity.CRITICAL);
        AlertRule other = rule("disk-full", Severity.ERROR);
        other.setEventType("router.disk.full");
        pipeline.registerRule(cpu);
        pipeline.registerRule(cpuCritical);
        pipeline.registerRule(other);

        List<AdmissionResult> results = pipeline.process(event("router-1"));

        assertThat(results).extracting(AdmissionResult::getRuleId)
                .containsExactlyInAnyOrder("cpu-high", "cpu-critical");
        assertThat(results).allMatch(AdmissionResult::isDeliver);
        assertThat(published).hasSize(2);
        assertThat(published.get(0)).containsEntry("device_id", "router-1");
        assertThat(pipeline.process(new AlertEvent("unknown.type", Map.of()))).isEmpty();
    }

    @Test
    @DisplayName("Removing a rule should release its throttle state")
    void removeRuleCleansThrottleState() {
        AlertRule rule = rule("cpu-high", Severity.WARNING);
        rule.setThrottle(new ThrottleConfig(5, 60));
        pipeline.registerRule(rule);
        pipeline.process(event("router-1"));
        assertThat(pipeline.getThrottleManager().ruleIds()).containsExactly("cpu-high");

        pipeline.removeRule("cpu-high");

        assertThat(pipeline.getRule("cpu-high")).isEmpty();
        assertThat(pipeline.getThrottleManager().ruleIds()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AlertRule rule(String id, Severity severity) {
        AlertRule rule = new AlertRule(id, id, severity);
        rule.setEventType("router.cpu.high");
        rule.setChannels(List.of("ops-email"));
        return rule;
    }

    private static AlertEvent event(String deviceId) {
        return new AlertEvent("router.cpu.high", Map.of("device_id", deviceId, "cpu", 97));
    }
}
