package com.alertgate.core;

/**
 * Raised when a loosely-typed configuration map cannot be converted into a
 * typed configuration: missing fields, malformed times, unknown time zones,
 * out-of-range day values or type mismatches.
 *
 * <p>
 * An invalid configuration is never applied.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends AlertGateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
