package com.alertgate.service;

import com.alertgate.core.model.AlertEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON conversion for inbound events and outbound payloads.
 *
 * <p>
 * Malformed inbound messages are logged and dropped (decoded as
 * {@code null}), so a single bad line does not stop the service.
 * </p>
 */
final class EventJson {

    private static final Logger LOG = LoggerFactory.getLogger(EventJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EventJson() {
        // utility class
    }

    /**
     * @return the decoded event stamped with the current time if it carried
     *         none, or {@code null} if the input is blank or malformed
     */
    static AlertEvent decode(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            AlertEvent event = MAPPER.readValue(json, AlertEvent.class);
            if (event.getTimestamp() == null) {
                event.setTimestamp(Instant.now());
            }
            return event;
        } catch (Exception e) {
            LOG.warn("Failed to decode event, skipping: {}", e.getMessage());
            return null;
        }
    }

    /**
     * @throws IllegalArgumentException if {@code value} cannot be serialised
     */
    static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialise " + value.getClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    static byte[] encodeBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialise " + value.getClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
