package com.alertgate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An alert held back by quiet hours, waiting in the
 * {@link com.alertgate.core.digest.AlertQueue} for digest delivery.
 *
 * <p>
 * Instances are immutable. {@code ruleId} and {@code timestamp} are required;
 * a missing severity is reported as {@link Severity#INFO}.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueuedAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ruleId;
    private final String eventType;
    private final String severity;
    private final Instant timestamp;
    private final String deviceId;
    private final Map<String, Object> eventData;

    private QueuedAlert(Builder builder) {
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.eventType = builder.eventType;
        this.severity = builder.severity;
        this.deviceId = builder.deviceId != null ? builder.deviceId : "";
        this.eventData = builder.eventData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.eventData))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String eventType;
        private String severity;
        private Instant timestamp;
        private String deviceId;
        private Map<String, Object> eventData;

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity != null ? severity.name() : null;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder eventData(Map<String, Object> eventData) {
            this.eventData = eventData;
            return this;
        }

        /**
         * @throws NullPointerException if {@code ruleId} or {@code timestamp}
         *                              is missing
         */
        public QueuedAlert build() {
            return new QueuedAlert(this);
        }
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * @return the raw severity as supplied, possibly {@code null} or blank
     */
    public String getSeverity() {
        return severity;
    }

    /**
     * @return the severity bucket this alert belongs to in a digest
     */
    public Severity severityLevel() {
        return Severity.parse(severity);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public Map<String, Object> getEventData() {
        return eventData;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueuedAlert that))
            return false;
        return Objects.equals(ruleId, that.ruleId)
                && Objects.equals(eventType, that.eventType)
                && Objects.equals(severity, that.severity)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(deviceId, that.deviceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, eventType, severity, timestamp, deviceId);
    }

    @Override
    public String toString() {
        return "QueuedAlert{" +
                "ruleId='" + ruleId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", severity='" + severity + '\'' +
                ", timestamp=" + timestamp +
                ", deviceId='" + deviceId + '\'' +
                '}';
    }
}
