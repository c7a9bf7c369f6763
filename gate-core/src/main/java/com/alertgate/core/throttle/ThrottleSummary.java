package com.alertgate.core.throttle;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time view of one rule's throttle state, broken down by group.
 *
 * <p>
 * Used by monitoring consumers and by the periodic summary events. Immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThrottleSummary {

    private final String ruleId;
    private final int periodSeconds;
    private final Map<String, GroupSummary> groups;

    ThrottleSummary(String ruleId, int periodSeconds, Map<String, GroupSummary> groups) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.periodSeconds = periodSeconds;
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public String getRuleId() {
        return ruleId;
    }

    public int getPeriodSeconds() {
        return periodSeconds;
    }

    /**
     * @return per-group breakdown keyed by group key, in key order
     */
    public Map<String, GroupSummary> getGroups() {
        return groups;
    }

    public long getTotalAllowed() {
        return groups.values().stream().mapToLong(GroupSummary::getAllowed).sum();
    }

    public long getTotalSuppressed() {
        return groups.values().stream().mapToLong(GroupSummary::getSuppressed).sum();
    }

    @Override
    public String toString() {
        return "ThrottleSummary{ruleId='" + ruleId + '\''
                + ", periodSeconds=" + periodSeconds
                + ", allowed=" + getTotalAllowed()
                + ", suppressed=" + getTotalSuppressed()
                + ", groups=" + groups.keySet() + '}';
    }

    /**
     * Counts for one group key. {@code allowed} is the number of alerts that
     * passed within the current window; {@code suppressed} accumulates until
     * cleared.
     */
    public static final class GroupSummary {

        private final String groupKey;
        private final long allowed;
        private final long suppressed;
        private final Instant firstAlert;
        private final Instant lastAlert;

        GroupSummary(String groupKey, long allowed, long suppressed, Instant firstAlert, Instant lastAlert) {
            this.groupKey = groupKey;
            this.allowed = allowed;
            this.suppressed = suppressed;
            this.firstAlert = firstAlert;
            this.lastAlert = lastAlert;
        }

        public String getGroupKey() {
            return groupKey;
        }

        public long getAllowed() {
            return allowed;
        }

        public long getSuppressed() {
            return suppressed;
        }

        /**
         * @return oldest allowed alert still in the window, or {@code null}
         */
        public Instant getFirstAlert() {
            return firstAlert;
        }

        /**
         * @return newest allowed alert still in the window, or {@code null}
         */
        public Instant getLastAlert() {
            return lastAlert;
        }

        @Override
        public String toString() {
            return groupKey + "{allowed=" + allowed + ", suppressed=" + suppressed + '}';
        }
    }
}
