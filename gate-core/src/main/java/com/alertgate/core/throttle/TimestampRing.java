package com.alertgate.core.throttle;

/**
 * Fixed-capacity circular buffer of epoch-millisecond timestamps.
 *
 * <p>
 * One array is allocated per throttle group, sized to the group's alert
 * limit, so recording an alert never allocates. {@code head} is the next
 * write slot and {@code size} the number of valid slots; the valid entries
 * are the {@code size} slots immediately before {@code head}, oldest first.
 * Entries are appended in clock order, so the oldest entry is always the
 * one overwritten once the ring is full.
 * </p>
 *
 * <p>
 * Not thread-safe. Callers hold the owning rule's lock.
 * </p>
 */
final class TimestampRing {

    private long[] slots;
    private int head;
    private int size;

    TimestampRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.slots = new long[capacity];
    }

    int capacity() {
        return slots.length;
    }

    int size() {
        return size;
    }

    void add(long timestamp) {
        slots[head] = timestamp;
        head = (head + 1) % slots.length;
        if (size < slots.length) {
            size++;
        }
    }

    /**
     * @return number of valid entries strictly newer than {@code cutoff}
     */
    int countAfter(long cutoff) {
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (get(i) > cutoff) {
                count++;
            }
        }
        return count;
    }

    /**
     * Repack the ring so it holds only entries strictly newer than
     * {@code cutoff}, oldest first starting at slot zero.
     *
     * @return number of entries discarded
     */
    int compact(long cutoff) {
        long[] kept = new long[slots.length];
        int n = 0;
        for (int i = 0; i < size; i++) {
            long ts = get(i);
            if (ts > cutoff) {
                kept[n++] = ts;
            }
        }
        int dropped = size - n;
        slots = kept;
        size = n;
        head = n % slots.length;
        return dropped;
    }

    /**
     * Change capacity, keeping the most recent entries that still fit.
     */
    void resize(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        if (capacity == slots.length) {
            return;
        }
        int keep = Math.min(size, capacity);
        long[] resized = new long[capacity];
        for (int i = 0; i < keep; i++) {
            resized[i] = get(size - keep + i);
        }
        slots = resized;
        size = keep;
        head = keep % capacity;
    }

    /**
     * @return oldest entry newer than {@code cutoff}, or {@code -1}
     */
    long oldestAfter(long cutoff) {
        for (int i = 0; i < size; i++) {
            long ts = get(i);
            if (ts > cutoff) {
                return ts;
            }
        }
        return -1;
    }

    /**
     * @return newest entry newer than {@code cutoff}, or {@code -1}
     */
    long newestAfter(long cutoff) {
        if (size == 0) {
            return -1;
        }
        long newest = get(size - 1);
        return newest > cutoff ? newest : -1;
    }

    /** Logical index 0 is the oldest valid entry. */
    private long get(int logicalIndex) {
        int physical = (head - size + logicalIndex) % slots.length;
        if (physical < 0) {
            physical += slots.length;
        }
        return slots[physical];
    }
}
