package com.alertgate.core;

/**
 * Raised by a synchronous flush when queued notifications could not be
 * handed to the delivery callback.
 *
 * @since 1.0.0
 */
public class DeliveryException extends AlertGateException {

    private static final long serialVersionUID = 1L;

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
