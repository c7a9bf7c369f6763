package com.alertgate.core.clock;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deterministic {@link Clock} whose current instant only moves when told to.
 *
 * <p>
 * Every time-dependent component of the gate takes a {@link Clock}. Production
 * code passes {@link Clock#systemUTC()}; tests and replays pass a
 * {@code MutableClock} and drive it with {@link #set(Instant)} and
 * {@link #advance(Duration)}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Reads and writes are guarded by a single lock, so concurrent
 * {@link #advance(Duration)} calls never lose an update.
 * </p>
 *
 * @since 1.0.0
 */
public final class MutableClock extends Clock implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Lock lock = new ReentrantLock();
    private final ZoneId zone;
    private Instant current;

    /**
     * @param start initial instant; {@code null} starts at the Unix epoch
     */
    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        this.current = start != null ? start : Instant.EPOCH;
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Move the clock to an absolute instant.
     *
     * @param instant the new current instant; must not be {@code null}
     */
    public void set(Instant instant) {
        Objects.requireNonNull(instant, "instant must not be null");
        lock.lock();
        try {
            current = instant;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move the clock forward (or backward, for a negative duration).
     *
     * @param duration amount to add; must not be {@code null}
     */
    public void advance(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        lock.lock();
        try {
            current = current.plus(duration);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Instant instant() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns a view in another zone. The view has its own lock and a
     * snapshot of the current instant; it does not follow later updates.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        if (this.zone.equals(zone)) {
            return this;
        }
        return new MutableClock(instant(), zone);
    }

    @Override
    public String toString() {
        return "MutableClock[" + instant() + "," + zone + "]";
    }
}
