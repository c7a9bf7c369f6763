package com.alertgate.core.pipeline;

import java.util.Map;

/**
 * Outbound event sink for alerts, digests and throttle summaries.
 *
 * <p>
 * Implementations must be thread-safe; the pipeline and the service
 * schedulers publish from different threads.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * @param eventType event type, e.g. {@code alert.triggered}
     * @param payload   event body; not retained after the call returns
     */
    void publish(String eventType, Map<String, Object> payload);
}
