package com.alertgate.core.pipeline;

import java.util.Objects;

/**
 * What the admission pipeline decided for one rule and one event.
 *
 * @since 1.0.0
 */
public final class AdmissionResult {

    /** Possible outcomes, in the order the gates are applied. */
    public enum Outcome {
        /** The rule is disabled. */
        SKIPPED,
        /** Denied by the storm detector. */
        STORM_SUPPRESSED,
        /** Denied by the rule's throttle. */
        THROTTLED,
        /** Held for the quiet-hours digest. */
        DEFERRED,
        /** Passed every gate. */
        DELIVER
    }

    private final String ruleId;
    private final Outcome outcome;
    private final String reason;
    private final long suppressedCount;

    AdmissionResult(String ruleId, Outcome outcome, String reason, long suppressedCount) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.reason = reason != null ? reason : "";
        this.suppressedCount = suppressedCount;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * For suppressions, why the alert was held back. For {@link Outcome#DELIVER},
     * the most recent suppression reason since the rule last delivered, if any.
     */
    public String getReason() {
        return reason;
    }

    /**
     * Alerts of this rule suppressed since its previous delivery. Only set on
     * {@link Outcome#DELIVER}.
     */
    public long getSuppressedCount() {
        return suppressedCount;
    }

    public boolean isDeliver() {
        return outcome == Outcome.DELIVER;
    }

    @Override
    public String toString() {
        return "AdmissionResult{ruleId='" + ruleId + "', outcome=" + outcome
                + ", reason='" + reason + "', suppressedCount=" + suppressedCount + '}';
    }
}
