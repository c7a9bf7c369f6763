package com.alertgate.core.quiet;

import com.alertgate.core.model.QueuedNotification;

import java.util.List;

/**
 * Receives a batch of notifications released from the quiet-hours queues.
 *
 * <p>
 * Implementations may block; the queue manager runs them on a dedicated
 * executor and interrupts them once the delivery timeout elapses. Failures
 * are logged and not retried.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeliveryCallback {

    /**
     * @param notifications batch to deliver, never empty
     * @throws Exception if delivery fails
     */
    void deliver(List<QueuedNotification> notifications) throws Exception;
}
