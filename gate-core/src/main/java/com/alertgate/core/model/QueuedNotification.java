package com.alertgate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A notification parked in a per-channel quiet-hours queue.
 *
 * <p>
 * Callers build the notification content; the
 * {@link com.alertgate.core.quiet.QuietHoursQueueManager} stamps
 * {@code queuedAt} and {@code ttlExpiresAt} on enqueue via
 * {@link #toBuilder()}. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueuedNotification implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String channelId;
    private final String alertId;
    private final String title;
    private final String message;
    private final String severity;
    private final String eventType;
    private final Map<String, Object> data;
    private final Instant queuedAt;
    private final Instant ttlExpiresAt;

    private QueuedNotification(Builder builder) {
        this.channelId = Objects.requireNonNull(builder.channelId, "channelId must not be null");
        this.alertId = builder.alertId;
        this.title = builder.title;
        this.message = builder.message;
        this.severity = builder.severity;
        this.eventType = builder.eventType;
        this.data = builder.data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.data))
                : Collections.emptyMap();
        this.queuedAt = builder.queuedAt;
        this.ttlExpiresAt = builder.ttlExpiresAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this notification's values
     */
    public Builder toBuilder() {
        return new Builder()
                .channelId(channelId)
                .alertId(alertId)
                .title(title)
                .message(message)
                .severity(severity)
                .eventType(eventType)
                .data(data)
                .queuedAt(queuedAt)
                .ttlExpiresAt(ttlExpiresAt);
    }

    public static class Builder {
        private String channelId;
        private String alertId;
        private String title;
        private String message;
        private String severity;
        private String eventType;
        private Map<String, Object> data;
        private Instant queuedAt;
        private Instant ttlExpiresAt;

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder queuedAt(Instant queuedAt) {
            this.queuedAt = queuedAt;
            return this;
        }

        public Builder ttlExpiresAt(Instant ttlExpiresAt) {
            this.ttlExpiresAt = ttlExpiresAt;
            return this;
        }

        /**
         * @throws NullPointerException if {@code channelId} is missing
         */
        public QueuedNotification build() {
            return new QueuedNotification(this);
        }
    }

    /**
     * @return {@code true} once {@code now} has reached the TTL deadline
     */
    public boolean isExpired(Instant now) {
        return ttlExpiresAt != null && !now.isBefore(ttlExpiresAt);
    }

    public String getChannelId() {
        return channelId;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public String getSeverity() {
        return severity;
    }

    public String getEventType() {
        return eventType;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Instant getQueuedAt() {
        return queuedAt;
    }

    public Instant getTtlExpiresAt() {
        return ttlExpiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueuedNotification that))
            return false;
        return Objects.equals(channelId, that.channelId)
                && Objects.equals(alertId, that.alertId)
                && Objects.equals(queuedAt, that.queuedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelId, alertId, queuedAt);
    }

    @Override
    public String toString() {
        return "QueuedNotification{" +
                "channelId='" + channelId + '\'' +
                ", alertId='" + alertId + '\'' +
                ", severity='" + severity + '\'' +
                ", eventType='" + eventType + '\'' +
                ", queuedAt=" + queuedAt +
                '}';
    }
}
