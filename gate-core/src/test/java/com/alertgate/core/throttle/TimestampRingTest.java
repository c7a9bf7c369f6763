package com.alertgate.core.throttle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimestampRing}.
 */
class TimestampRingTest {

    @Test
    @DisplayName("Should overwrite the oldest entry once full")
    void shouldOverwriteOldestWhenFull() {
        TimestampRing ring = new TimestampRing(3);
        ring.add(10);
        ring.add(20);
        ring.add(30);
        ring.add(40);

        assertThat(ring.size()).isEqualTo(3);
        assertThat(ring.oldestAfter(0)).isEqualTo(20);
        assertThat(ring.newestAfter(0)).isEqualTo(40);
    }

    @Test
    @DisplayName("Should count only entries strictly newer than the cutoff")
    void shouldCountStrictlyAfterCutoff() {
        TimestampRing ring = new TimestampRing(4);
        ring.add(100);
        ring.add(200);
        ring.add(300);

        assertThat(ring.countAfter(200)).isEqualTo(1);
        assertThat(ring.countAfter(199)).isEqualTo(2);
        assertThat(ring.countAfter(300)).isZero();
        assertThat(ring.newestAfter(300)).isEqualTo(-1);
    }

    @Test
    @DisplayName("Compaction should drop old entries and keep insertion order")
    void compactionShouldKeepOrder() {
        TimestampRing ring = new TimestampRing(3);
        for (long ts = 1; ts <= 5; ts++) {
            ring.add(ts * 10);
        }

        int dropped = ring.compact(35);

        assertThat(dropped).isEqualTo(1);
        assertThat(ring.size()).isEqualTo(2);
        assertThat(ring.oldestAfter(0)).isEqualTo(40);
        ring.add(60);
        ring.add(70);
        assertThat(ring.size()).isEqualTo(3);
        assertThat(ring.oldestAfter(0)).isEqualTo(50);
        assertThat(ring.newestAfter(0)).isEqualTo(70);
    }

    @Test
    @DisplayName("Shrinking should keep the most recent entries")
    void shrinkingShouldKeepMostRecent() {
        TimestampRing ring = new TimestampRing(4);
        ring.add(1);
        ring.add(2);
        ring.add(3);
        ring.add(4);

        ring.resize(2);

        assertThat(ring.capacity()).isEqualTo(2);
        assertThat(ring.size()).isEqualTo(2);
        assertThat(ring.oldestAfter(0)).isEqualTo(3);
        assertThat(ring.newestAfter(0)).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject non-positive capacity")
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new TimestampRing(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }
}
