package com.alertgate.service;

import com.alertgate.core.pipeline.EventPublisher;
import com.alertgate.core.throttle.ThrottleManager;
import com.alertgate.core.throttle.ThrottleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Periodically publishes a {@value #EVENT_TYPE} event for every rule whose
 * throttle suppressed alerts since the last report. Counters are read and
 * zeroed atomically before publishing, so a failed publish drops that
 * report. Rules with nothing suppressed are skipped.
 *
 * @since 1.0.0
 */
public class ThrottleSummaryReporter implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ThrottleSummaryReporter.class);

    static final String EVENT_TYPE = "throttle.summary";

    private final ThrottleManager throttleManager;
    private final EventPublisher publisher;

    public ThrottleSummaryReporter(ThrottleManager throttleManager, EventPublisher publisher) {
        this.throttleManager = Objects.requireNonNull(throttleManager, "throttleManager must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * @return number of summaries published
     */
    public int reportOnce() {
        int published = 0;
        for (String ruleId : throttleManager.ruleIds()) {
            Optional<ThrottleSummary> summary = throttleManager.drainSummary(ruleId);
            if (summary.isEmpty() || summary.get().getTotalSuppressed() == 0) {
                continue;
            }
            publisher.publish(EVENT_TYPE, toPayload(summary.get()));
            published++;
        }
        if (published > 0) {
            LOG.info("Published {} throttle summary event(s)", published);
        }
        return published;
    }

    @Override
    public void run() {
        try {
            reportOnce();
        } catch (RuntimeException e) {
            LOG.error("Throttle summary report failed: {}", e.getMessage(), e);
        }
    }

    static Map<String, Object> toPayload(ThrottleSummary summary) {
        List<Map<String, Object>> groups = new ArrayList<>();
        for (ThrottleSummary.GroupSummary group : summary.getGroups().values()) {
            Map<String, Object> g = new LinkedHashMap<>();
            g.put("group_key", group.getGroupKey());
            g.put("allowed", group.getAllowed());
            g.put("suppressed", group.getSuppressed());
            g.put("first_alert", group.getFirstAlert());
            g.put("last_alert", group.getLastAlert());
            groups.add(g);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rule_id", summary.getRuleId());
        payload.put("total_allowed", summary.getTotalAllowed());
        payload.put("total_suppressed", summary.getTotalSuppressed());
        payload.put("period_seconds", summary.getPeriodSeconds());
        payload.put("groups", groups);
        return payload;
    }
}
