package com.alertgate.core.model;

import java.util.Locale;

/**
 * Alert severity, declared from most to least urgent.
 *
 * <p>
 * The declaration order is the order used by digests.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL,
    ERROR,
    WARNING,
    INFO;

    /**
     * Lenient parse used for severities that arrive as free-form strings.
     * Blank or unknown values map to {@link #INFO}; matching ignores case.
     *
     * @param value raw severity, may be {@code null}
     * @return the parsed severity, never {@code null}
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }

    /**
     * @param value raw severity, may be {@code null}
     * @return {@code true} if {@code value} names {@link #CRITICAL}
     */
    public static boolean isCritical(String value) {
        return value != null && CRITICAL.name().equalsIgnoreCase(value.trim());
    }

    /**
     * @return whichever of the two is more urgent
     */
    public Severity max(Severity other) {
        return other != null && other.ordinal() < ordinal() ? other : this;
    }
}
