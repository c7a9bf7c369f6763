package com.alertgate.core;

/**
 * Base type for every failure raised by the alert gate.
 *
 * <p>
 * All gate failures are unchecked. Hot-path decisions never throw; only
 * configuration parsing, queue capacity checks and explicit flushes do.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertGateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AlertGateException(String message) {
        super(message);
    }

    public AlertGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
