package com.alertgate.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A triggered event as seen by the admission pipeline.
 *
 * <p>
 * The payload is kept as a free-form map so throttle grouping can reach any
 * field, including nested ones, without a fixed schema. The well-known
 * properties {@code event_type} and {@code timestamp} are lifted out of the
 * payload when Jackson binds JSON into this class.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe while being populated; treat as read-only once handed to
 * the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    static final String EVENT_TYPE = "event_type";
    static final String TIMESTAMP = "timestamp";

    private String eventType;
    private Instant timestamp;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public AlertEvent() {
    }

    public AlertEvent(String eventType, Map<String, Object> fields) {
        this.eventType = eventType;
        if (fields != null) {
            this.fields.putAll(fields);
        }
    }

    /**
     * Set a payload field. Called by Jackson for every JSON property.
     *
     * @param key   field name; must not be {@code null}
     * @param value field value
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        if (EVENT_TYPE.equals(key)) {
            eventType = value != null ? value.toString() : null;
            return;
        }
        if (TIMESTAMP.equals(key) && value instanceof String s) {
            timestamp = Instant.parse(s);
            return;
        }
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of the payload
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Object> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * Device the event concerns: {@code device_id}, else {@code router_id},
     * else the empty string.
     */
    public String getDeviceId() {
        Object id = fields.get("device_id");
        if (id instanceof String s) {
            return s;
        }
        id = fields.get("router_id");
        return id instanceof String s ? s : "";
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    /**
     * @return the time the event was raised, or {@code null} if unknown
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertEvent that))
            return false;
        return Objects.equals(eventType, that.eventType)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, timestamp, fields);
    }

    @Override
    public String toString() {
        return "AlertEvent{" + eventType + ", " + fields + '}';
    }
}
