package com.alertgate.core.quiet;

import com.alertgate.core.config.QuietHoursConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Construction settings for {@link QuietHoursQueueManager}.
 *
 * <p>
 * Use the {@link Builder}; unset values take the defaults below and
 * {@link Builder#build()} rejects non-positive sizes and durations.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueueManagerSettings {

    public static final int DEFAULT_MAX_QUEUE_SIZE = 100;
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_DELIVERY_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration NOTIFICATION_TTL = Duration.ofHours(24);

    private final Clock clock;
    private final QuietHoursConfig quietHours;
    private final DeliveryCallback deliveryCallback;
    private final int maxQueueSize;
    private final Duration checkInterval;
    private final Duration deliveryTimeout;

    private QueueManagerSettings(Builder b) {
        this.clock = b.clock;
        this.quietHours = b.quietHours;
        this.deliveryCallback = b.deliveryCallback;
        this.maxQueueSize = b.maxQueueSize;
        this.checkInterval = b.checkInterval;
        this.deliveryTimeout = b.deliveryTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return settings with every default and no delivery callback */
    public static QueueManagerSettings defaults() {
        return builder().build();
    }

    public Clock getClock() {
        return clock;
    }

    public QuietHoursConfig getQuietHours() {
        return quietHours;
    }

    /**
     * @return the callback, or {@code null} if none was configured
     */
    public DeliveryCallback getDeliveryCallback() {
        return deliveryCallback;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public Duration getDeliveryTimeout() {
        return deliveryTimeout;
    }

    @Override
    public String toString() {
        return "QueueManagerSettings{quietHours=" + quietHours
                + ", maxQueueSize=" + maxQueueSize
                + ", checkInterval=" + checkInterval
                + ", deliveryTimeout=" + deliveryTimeout
                + ", callback=" + (deliveryCallback != null) + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Clock clock = Clock.systemUTC();
        private QuietHoursConfig quietHours = QuietHoursConfig.NONE;
        private DeliveryCallback deliveryCallback;
        private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
        private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
        private Duration deliveryTimeout = DEFAULT_DELIVERY_TIMEOUT;

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        public Builder quietHours(QuietHoursConfig v) {
            this.quietHours = v;
            return this;
        }

        public Builder deliveryCallback(DeliveryCallback v) {
            this.deliveryCallback = v;
            return this;
        }

        public Builder maxQueueSize(int v) {
            this.maxQueueSize = v;
            return this;
        }

        public Builder checkInterval(Duration v) {
            this.checkInterval = v;
            return this;
        }

        public Builder deliveryTimeout(Duration v) {
            this.deliveryTimeout = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a size or duration is not positive
         */
        public QueueManagerSettings build() {
            Objects.requireNonNull(clock, "clock required");
            Objects.requireNonNull(quietHours, "quietHours required");
            requirePositive(checkInterval, "checkInterval");
            requirePositive(deliveryTimeout, "deliveryTimeout");
            if (maxQueueSize < 1) {
                throw new IllegalArgumentException("maxQueueSize must be >= 1, got: " + maxQueueSize);
            }
            return new QueueManagerSettings(this);
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }
}
