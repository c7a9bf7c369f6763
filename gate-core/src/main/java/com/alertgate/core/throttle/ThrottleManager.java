package com.alertgate.core.throttle;

import com.alertgate.core.config.ThrottleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-rule sliding-window rate limiter.
 *
 * <p>
 * Each rule owns a set of groups, keyed by the value of the configured
 * {@code groupByField} in the event payload (or {@value #DEFAULT_GROUP}).
 * Each group records the timestamps of its allowed alerts in a
 * {@link TimestampRing} sized to {@code maxAlerts}; an alert is allowed while
 * fewer than {@code maxAlerts} recorded timestamps are newer than
 * {@code now - period}.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Rule entries live in a {@link ConcurrentHashMap}. Each rule carries its own
 * {@link ReentrantReadWriteLock}: decisions take the write lock, summaries the
 * read lock. Decisions on different rules never contend.
 * </p>
 *
 * @since 1.0.0
 */
public class ThrottleManager {

    private static final Logger LOG = LoggerFactory.getLogger(ThrottleManager.class);

    /** Group key used when no {@code groupByField} is configured or resolvable. */
    public static final String DEFAULT_GROUP = "default";

    private final Clock clock;
    private final ConcurrentMap<String, RuleState> rules = new ConcurrentHashMap<>();

    public ThrottleManager() {
        this(Clock.systemUTC());
    }

    public ThrottleManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // -------------------------------------------------------------------------
    // Decisions
    // -------------------------------------------------------------------------

    /**
     * Decide whether an alert for {@code ruleId} may pass. Allowed alerts are
     * recorded; denied alerts increment the group's suppressed count.
     *
     * @param ruleId      rule identifier, not null
     * @param eventFields event payload used to resolve the group key, may be null
     * @param config      throttle settings; {@code null} or unconfigured allows everything
     * @return the decision, with a reason when denied
     */
    public ThrottleDecision shouldAllow(String ruleId, Map<String, ?> eventFields, ThrottleConfig config) {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        if (config == null || !config.isConfigured()) {
            return ThrottleDecision.allow();
        }

        String groupKey = groupKey(eventFields, config.getGroupByField());
        long now = clock.millis();
        long periodMillis = config.getPeriodSeconds() * 1000L;
        int maxAlerts = config.getMaxAlerts();

        RuleState rule = rules.computeIfAbsent(ruleId, id -> new RuleState());
        rule.lock.writeLock().lock();
        try {
            rule.periodSeconds = config.getPeriodSeconds();
            GroupState group = rule.groups.get(groupKey);
            if (group == null) {
                group = new GroupState(maxAlerts, now);
                rule.groups.put(groupKey, group);
            } else if (group.ring.capacity() != maxAlerts) {
                LOG.debug("Resizing throttle group {}/{} from {} to {}",
                        ruleId, groupKey, group.ring.capacity(), maxAlerts);
                group.ring.resize(maxAlerts);
            }

            long cutoff = now - periodMillis;
            if (now - group.lastCompaction >= periodMillis / 2) {
                group.ring.compact(cutoff);
                group.lastCompaction = now;
            }

            int count = group.ring.countAfter(cutoff);
            if (count < maxAlerts) {
                group.ring.add(now);
                return ThrottleDecision.allow();
            }

            group.suppressed++;
            String reason = String.format("throttled: %d alerts per %ds limit reached (%d in current window)",
                    maxAlerts, config.getPeriodSeconds(), count);
            LOG.debug("Rule {} group {} {}", ruleId, groupKey, reason);
            return ThrottleDecision.deny(reason);
        } finally {
            rule.lock.writeLock().unlock();
        }
    }

    static String groupKey(Map<String, ?> eventFields, String groupByField) {
        if (groupByField == null || groupByField.isEmpty()) {
            return DEFAULT_GROUP;
        }
        return FieldPaths.resolve(eventFields, groupByField).orElse(DEFAULT_GROUP);
    }

    // -------------------------------------------------------------------------
    // Monitoring
    // -------------------------------------------------------------------------

    /**
     * @return summary of the rule's groups, or empty if the rule has no state
     */
    public Optional<ThrottleSummary> getSummary(String ruleId) {
        RuleState rule = rules.get(ruleId);
        if (rule == null) {
            return Optional.empty();
        }
        long now = clock.millis();
        rule.lock.readLock().lock();
        try {
            return Optional.of(snapshot(ruleId, rule, now));
        } finally {
            rule.lock.readLock().unlock();
        }
    }

    /**
     * Take the rule's summary and zero its suppressed counters in one step,
     * so that no suppression recorded concurrently is lost between the two.
     *
     * @return summary as it stood before the reset, or empty if the rule has no state
     */
    public Optional<ThrottleSummary> drainSummary(String ruleId) {
        RuleState rule = rules.get(ruleId);
        if (rule == null) {
            return Optional.empty();
        }
        long now = clock.millis();
        rule.lock.writeLock().lock();
        try {
            ThrottleSummary summary = snapshot(ruleId, rule, now);
            rule.groups.values().forEach(g -> g.suppressed = 0);
            return Optional.of(summary);
        } finally {
            rule.lock.writeLock().unlock();
        }
    }

    /** Caller holds the rule's read or write lock. */
    private static ThrottleSummary snapshot(String ruleId, RuleState rule, long now) {
        long cutoff = now - rule.periodSeconds * 1000L;
        Map<String, ThrottleSummary.GroupSummary> groups = new TreeMap<>();
        rule.groups.forEach((key, group) -> groups.put(key, new ThrottleSummary.GroupSummary(
                key,
                group.ring.countAfter(cutoff),
                group.suppressed,
                toInstant(group.ring.oldestAfter(cutoff)),
                toInstant(group.ring.newestAfter(cutoff)))));
        return new ThrottleSummary(ruleId, rule.periodSeconds, groups);
    }

    /**
     * @return snapshot of the rule ids that currently hold throttle state
     */
    public Set<String> ruleIds() {
        return new HashSet<>(rules.keySet());
    }

    /**
     * Zero the suppressed counters of every group of {@code ruleId}, keeping
     * the recorded window.
     */
    public void clearSuppressedCounts(String ruleId) {
        RuleState rule = rules.get(ruleId);
        if (rule == null) {
            return;
        }
        rule.lock.writeLock().lock();
        try {
            rule.groups.values().forEach(g -> g.suppressed = 0);
        } finally {
            rule.lock.writeLock().unlock();
        }
    }

    /** Drop all state for {@code ruleId}. */
    public void reset(String ruleId) {
        if (rules.remove(ruleId) != null) {
            LOG.debug("Throttle state reset for rule {}", ruleId);
        }
    }

    /**
     * Drop state for every rule not in {@code activeRuleIds}.
     *
     * @return number of rules removed
     */
    public int cleanup(Collection<String> activeRuleIds) {
        Objects.requireNonNull(activeRuleIds, "activeRuleIds must not be null");
        Set<String> active = new HashSet<>(activeRuleIds);
        int removed = 0;
        for (String ruleId : rules.keySet()) {
            if (!active.contains(ruleId) && rules.remove(ruleId) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("Removed throttle state for {} inactive rule(s)", removed);
        }
        return removed;
    }

    private static Instant toInstant(long millis) {
        return millis < 0 ? null : Instant.ofEpochMilli(millis);
    }

    // -------------------------------------------------------------------------
    // State
    // -------------------------------------------------------------------------

    private static final class RuleState {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        final Map<String, GroupState> groups = new HashMap<>();
        int periodSeconds;
    }

    private static final class GroupState {
        final TimestampRing ring;
        long suppressed;
        long lastCompaction;

        GroupState(int capacity, long now) {
            this.ring = new TimestampRing(capacity);
            this.lastCompaction = now;
        }
    }
}
