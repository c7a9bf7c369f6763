package com.alertgate.core.pipeline;

import com.alertgate.core.config.GateConfig;
import com.alertgate.core.config.QuietHoursConfig;
import com.alertgate.core.digest.AlertQueue;
import com.alertgate.core.digest.DigestFormatter;
import com.alertgate.core.model.AlertEvent;
import com.alertgate.core.model.AlertRule;
import com.alertgate.core.model.QueuedAlert;
import com.alertgate.core.model.Severity;
import com.alertgate.core.pipeline.AdmissionResult.Outcome;
import com.alertgate.core.quiet.QuietHoursDecision;
import com.alertgate.core.quiet.QuietHoursFilter;
import com.alertgate.core.storm.StormDetector;
import com.alertgate.core.storm.StormStatus;
import com.alertgate.core.throttle.ThrottleDecision;
import com.alertgate.core.throttle.ThrottleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Applies the gates to triggered alerts, in order: storm detection,
 * per-rule throttling, quiet hours.
 *
 * <p>
 * Alerts held by quiet hours go to an {@link AlertQueue} and come back out
 * as per-device digests from {@link #flushDigests()}. Suppressions are
 * counted per rule and reported on the rule's next delivered alert.
 * </p>
 *
 * <h3>Publishing</h3>
 * <p>
 * When an {@link EventPublisher} is set, {@link #process(AlertEvent)}
 * publishes an {@value #ALERT_TRIGGERED} event for every delivered alert.
 * </p>
 *
 * @since 1.0.0
 */
public class AdmissionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AdmissionPipeline.class);

    public static final String ALERT_TRIGGERED = "alert.triggered";

    private final StormDetector stormDetector;
    private final ThrottleManager throttleManager;
    private final QuietHoursFilter quietHoursFilter;
    private final AlertQueue alertQueue;
    private final QuietHoursConfig defaultQuietHours;
    private final Clock clock;

    private final ConcurrentMap<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Suppression> suppressions = new ConcurrentHashMap<>();

    private volatile EventPublisher publisher;

    /**
     * Build a pipeline with fresh gates from {@code config} and register its rules.
     */
    public AdmissionPipeline(GateConfig config, Clock clock) {
        this(new StormDetector(config.getStorm(), clock),
                new ThrottleManager(clock),
                new QuietHoursFilter(),
                new AlertQueue(),
                config.getQuietHours(),
                clock);
        config.getRules().forEach(this::registerRule);
    }

    /**
     * @param defaultQuietHours applied to rules without their own quiet hours
     */
    public AdmissionPipeline(StormDetector stormDetector, ThrottleManager throttleManager,
            QuietHoursFilter quietHoursFilter, AlertQueue alertQueue,
            QuietHoursConfig defaultQuietHours, Clock clock) {
        this.stormDetector = Objects.requireNonNull(stormDetector, "stormDetector must not be null");
        this.throttleManager = Objects.requireNonNull(throttleManager, "throttleManager must not be null");
        this.quietHoursFilter = Objects.requireNonNull(quietHoursFilter, "quietHoursFilter must not be null");
        this.alertQueue = Objects.requireNonNull(alertQueue, "alertQueue must not be null");
        this.defaultQuietHours = defaultQuietHours != null ? defaultQuietHours : QuietHoursConfig.NONE;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // -------------------------------------------------------------------------
    // Rules
    // -------------------------------------------------------------------------

    public void registerRule(AlertRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        rule.validate();
        rules.put(rule.getId(), rule);
    }

    /**
     * Unregister a rule and release throttle state of rules no longer registered.
     */
    public void removeRule(String ruleId) {
        rules.remove(ruleId);
        suppressions.remove(ruleId);
        throttleManager.cleanup(rules.keySet());
    }

    public Optional<AlertRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public Collection<AlertRule> getRules() {
        return new ArrayList<>(rules.values());
    }

    // -------------------------------------------------------------------------
    // Admission
    // -------------------------------------------------------------------------

    /**
     * Evaluate {@code event} against every registered rule for its event
     * type. The storm detector sees the event once.
     *
     * @return one result per matching rule; empty if none match
     */
    public List<AdmissionResult> process(AlertEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        List<AlertRule> matching = matchingRules(event.getEventType());
        if (matching.isEmpty()) {
            return List.of();
        }

        List<AdmissionResult> results = new ArrayList<>(matching.size());
        if (!stormDetector.recordAlert()) {
            String reason = stormReason();
            for (AlertRule rule : matching) {
                trackSuppression(rule.getId(), reason);
                results.add(new AdmissionResult(rule.getId(), Outcome.STORM_SUPPRESSED, reason, 0));
            }
            return results;
        }

        for (AlertRule rule : matching) {
            AdmissionResult result = rule.isEnabled()
                    ? evaluateRule(rule, event)
                    : new AdmissionResult(rule.getId(), Outcome.SKIPPED, "rule disabled", 0);
            if (result.isDeliver()) {
                publishTriggered(rule, event, result);
            }
            results.add(result);
        }
        return results;
    }

    /**
     * Evaluate one alert for one rule through every gate.
     */
    public AdmissionResult admit(AlertRule rule, AlertEvent event) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(event, "event must not be null");
        if (!rule.isEnabled()) {
            return new AdmissionResult(rule.getId(), Outcome.SKIPPED, "rule disabled", 0);
        }
        if (!stormDetector.recordAlert()) {
            String reason = stormReason();
            trackSuppression(rule.getId(), reason);
            return new AdmissionResult(rule.getId(), Outcome.STORM_SUPPRESSED, reason, 0);
        }
        return evaluateRule(rule, event);
    }

    private AdmissionResult evaluateRule(AlertRule rule, AlertEvent event) {
        ThrottleDecision throttle = throttleManager.shouldAllow(rule.getId(), event.getFields(), rule.getThrottle());
        if (!throttle.isAllowed()) {
            trackSuppression(rule.getId(), throttle.getReason());
            return new AdmissionResult(rule.getId(), Outcome.THROTTLED, throttle.getReason(), 0);
        }

        Instant now = clock.instant();
        QuietHoursDecision quiet = quietHoursFilter.shouldSuppress(
                quietHoursFor(rule), rule.getSeverity().name(), now);
        if (quiet.isSuppress()) {
            alertQueue.enqueue(QueuedAlert.builder()
                    .ruleId(rule.getId())
                    .eventType(event.getEventType() != null ? event.getEventType() : rule.getEventType())
                    .severity(rule.getSeverity())
                    .timestamp(now)
                    .deviceId(event.getDeviceId())
                    .eventData(event.getFields())
                    .build());
            LOG.debug("Rule {} deferred: {}", rule.getId(), quiet.getReason());
            return new AdmissionResult(rule.getId(), Outcome.DEFERRED, quiet.getReason(), 0);
        }

        Suppression pending = suppressions.remove(rule.getId());
        return pending != null
                ? new AdmissionResult(rule.getId(), Outcome.DELIVER, pending.lastReason, pending.count)
                : new AdmissionResult(rule.getId(), Outcome.DELIVER, "", 0);
    }

    // -------------------------------------------------------------------------
    // Digests
    // -------------------------------------------------------------------------

    /**
     * Drain the alert queue and build one digest per device whose quiet hours
     * have ended. Devices still inside quiet hours (judged by the rule of
     * their first queued alert) are queued again.
     *
     * @return digests ready for delivery
     */
    public List<DigestMessage> flushDigests() {
        Map<String, List<QueuedAlert>> byDevice = alertQueue.dequeueAll();
        if (byDevice.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        List<DigestMessage> digests = new ArrayList<>();
        for (Map.Entry<String, List<QueuedAlert>> entry : byDevice.entrySet()) {
            String deviceId = entry.getKey();
            List<QueuedAlert> alerts = entry.getValue();
            if (alerts.isEmpty()) {
                continue;
            }

            QueuedAlert first = alerts.get(0);
            QuietHoursConfig quietHours = Optional.ofNullable(rules.get(first.getRuleId()))
                    .map(this::quietHoursFor)
                    .orElse(defaultQuietHours);
            if (quietHoursFilter.shouldSuppress(quietHours, Severity.INFO.name(), now).isSuppress()) {
                alerts.forEach(alertQueue::enqueue);
                LOG.debug("Quiet hours still active for device '{}', re-queued {} alert(s)", deviceId, alerts.size());
                continue;
            }

            Severity severity = DigestFormatter.highestSeverity(alerts);
            String title = String.format("%s: Quiet Hours Digest (%d alerts)", severity.name(), alerts.size());
            digests.add(new DigestMessage(deviceId, first.getRuleId(), severity, title,
                    DigestFormatter.format(alerts, deviceId), alerts));
            LOG.info("Digest ready for device '{}' with {} alert(s)", deviceId, alerts.size());
        }
        return digests;
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public void setEventPublisher(EventPublisher publisher) {
        this.publisher = publisher;
    }

    public StormDetector getStormDetector() {
        return stormDetector;
    }

    public ThrottleManager getThrottleManager() {
        return throttleManager;
    }

    public AlertQueue getAlertQueue() {
        return alertQueue;
    }

    // -------------------------------------------------------------------------
    // Internal
    // -------------------------------------------------------------------------

    private List<AlertRule> matchingRules(String eventType) {
        List<AlertRule> matching = new ArrayList<>();
        if (eventType == null || eventType.isEmpty()) {
            return matching;
        }
        for (AlertRule rule : rules.values()) {
            if (eventType.equals(rule.getEventType())) {
                matching.add(rule);
            }
        }
        return matching;
    }

    private QuietHoursConfig quietHoursFor(AlertRule rule) {
        QuietHoursConfig own = rule.getQuietHours();
        return own != null && own.isConfigured() ? own : defaultQuietHours;
    }

    private String stormReason() {
        StormStatus status = stormDetector.getStatus();
        return String.format("storm: %.0f/min (threshold: %.0f/min)",
                status.getCurrentRate(), status.getThresholdRate());
    }

    private void trackSuppression(String ruleId, String reason) {
        suppressions.compute(ruleId, (id, s) -> {
            Suppression next = s != null ? s : new Suppression();
            next.count++;
            next.lastReason = reason;
            return next;
        });
    }

    private void publishTriggered(AlertRule rule, AlertEvent event, AdmissionResult result) {
        EventPublisher target = publisher;
        if (target == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rule_id", rule.getId());
        payload.put("device_id", event.getDeviceId());
        payload.put("event_type", event.getEventType());
        payload.put("severity", rule.getSeverity().name());
        payload.put("title", "Alert: " + (rule.getName() != null ? rule.getName() : rule.getId()));
        payload.put("channels", rule.getChannels());
        payload.put("suppressed_count", result.getSuppressedCount());
        payload.put("suppress_reason", result.getReason());
        payload.put("data", event.getFields());
        try {
            target.publish(ALERT_TRIGGERED, payload);
        } catch (RuntimeException e) {
            LOG.error("Failed to publish {} for rule {}", ALERT_TRIGGERED, rule.getId(), e);
        }
    }

    /** Guarded by the suppressions map's per-key compute. */
    private static final class Suppression {
        long count;
        String lastReason;
    }
}
