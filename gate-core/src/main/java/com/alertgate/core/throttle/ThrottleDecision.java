package com.alertgate.core.throttle;

import java.util.Objects;

/**
 * Outcome of {@link ThrottleManager#shouldAllow}.
 *
 * @since 1.0.0
 */
public final class ThrottleDecision {

    private static final ThrottleDecision ALLOWED = new ThrottleDecision(true, "");

    private final boolean allowed;
    private final String reason;

    private ThrottleDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    static ThrottleDecision allow() {
        return ALLOWED;
    }

    static ThrottleDecision deny(String reason) {
        return new ThrottleDecision(false, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean isAllowed() {
        return allowed;
    }

    /**
     * @return why the alert was throttled; empty when allowed
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return allowed ? "ThrottleDecision{allowed}" : "ThrottleDecision{denied: " + reason + '}';
    }
}
