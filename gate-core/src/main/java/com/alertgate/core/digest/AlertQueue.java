package com.alertgate.core.digest;

import com.alertgate.core.model.QueuedAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-device holding queue for alerts deferred by quiet hours.
 *
 * <p>
 * All operations take one lock. {@link #dequeueAll()} swaps the whole map
 * out in a single step, so among concurrent callers exactly one receives a
 * given batch.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertQueue {

    private static final Logger LOG = LoggerFactory.getLogger(AlertQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private Map<String, List<QueuedAlert>> byDevice = new HashMap<>();

    public void enqueue(QueuedAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        lock.lock();
        try {
            byDevice.computeIfAbsent(alert.getDeviceId(), d -> new ArrayList<>()).add(alert);
        } finally {
            lock.unlock();
        }
        LOG.debug("Queued alert for rule {} on device '{}'", alert.getRuleId(), alert.getDeviceId());
    }

    /**
     * Remove and return everything queued.
     *
     * @return alerts keyed by device id, in enqueue order; empty if nothing
     *         was queued
     */
    public Map<String, List<QueuedAlert>> dequeueAll() {
        Map<String, List<QueuedAlert>> drained;
        lock.lock();
        try {
            drained = byDevice;
            byDevice = new HashMap<>();
        } finally {
            lock.unlock();
        }
        return drained;
    }

    /**
     * @return a copy of the alerts queued for {@code deviceId}
     */
    public List<QueuedAlert> getByDevice(String deviceId) {
        lock.lock();
        try {
            List<QueuedAlert> alerts = byDevice.get(deviceId);
            return alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return total number of queued alerts across devices
     */
    public int count() {
        lock.lock();
        try {
            int total = 0;
            for (List<QueuedAlert> alerts : byDevice.values()) {
                total += alerts.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            byDevice = new HashMap<>();
        } finally {
            lock.unlock();
        }
    }
}
