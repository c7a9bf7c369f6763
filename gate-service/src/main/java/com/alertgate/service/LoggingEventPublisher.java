package com.alertgate.service;

import com.alertgate.core.pipeline.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * {@link EventPublisher} that writes each event as one JSON log line.
 *
 * <p>
 * Logged under its own logger name so Logback can route published events to
 * a dedicated appender.
 * </p>
 */
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger LOG = LoggerFactory.getLogger("com.alertgate.events");

    @Override
    public void publish(String eventType, Map<String, Object> payload) {
        try {
            LOG.info("{} {}", eventType, EventJson.encode(payload));
        } catch (IllegalArgumentException e) {
            LOG.error("Failed to serialise {} event: {}", eventType, e.getMessage(), e);
        }
    }
}
