package com.alertgate.core.quiet;

import java.util.Objects;

/**
 * Result of a quiet-hours evaluation.
 *
 * <p>
 * {@code reason} explains both suppressions and notable pass-throughs
 * (critical bypass, excluded weekday); it is empty when the window simply
 * does not apply.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuietHoursDecision {

    static final QuietHoursDecision PASS = new QuietHoursDecision(false, "");

    private final boolean suppress;
    private final String reason;

    QuietHoursDecision(boolean suppress, String reason) {
        this.suppress = suppress;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public boolean isSuppress() {
        return suppress;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "QuietHoursDecision{suppress=" + suppress + ", reason='" + reason + "'}";
    }
}
