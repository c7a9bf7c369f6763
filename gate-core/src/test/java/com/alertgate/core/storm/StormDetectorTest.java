package com.alertgate.core.storm;

import com.alertgate.core.clock.MutableClock;
import com.alertgate.core.config.StormConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StormDetector}.
 */
class StormDetectorTest {

    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    private MutableClock clock;
    private StormDetector detector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        detector = new StormDetector(new StormConfig(10, 60, 120), clock);
    }

    @Test
    @DisplayName("Should trip on the alert that crosses the threshold and recover after cooldown")
    void shouldTripAndRecover() {
        for (int i = 0; i < 10; i++) {
            assertThat(recordAt(i)).as("alert %d", i).isTrue();
        }
        assertThat(recordAt(10)).isFalse();
        assertThat(detector.getStatus().isInStorm()).isTrue();
        assertThat(detector.getStatus().getStormStartTime()).isEqualTo(START.plusSeconds(10));

        assertThat(recordAt(60)).isFalse();
        assertThat(recordAt(120)).isFalse();

        assertThat(recordAt(132)).isTrue();
        assertThat(detector.getStatus().isInStorm()).isFalse();
        assertThat(detector.getStatus().getSuppressedCount()).isZero();
    }

    @Test
    @DisplayName("Suppressed count should start at zero and grow with each denial")
    void suppressedCountShouldGrow() {
        for (int i = 0; i < 11; i++) {
            detector.recordAlert();
        }
        assertThat(detector.getStatus().getSuppressedCount()).isZero();

        for (int i = 0; i < 10; i++) {
            assertThat(detector.recordAlert()).isFalse();
        }
        assertThat(detector.getStatus().getSuppressedCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Alerts spread beyond the window should never trip the detector")
    void spreadAlertsShouldNotTrip() {
        for (int i = 0; i < 100; i++) {
            assertThat(recordAt(i * 7L)).isTrue();
        }
        assertThat(detector.getStatus().isInStorm()).isFalse();
    }

    @Test
    @DisplayName("Status should report rates and remaining cooldown")
    void statusShouldReportRates() {
        detector = new StormDetector(new StormConfig(10, 120, 300), clock);
        for (int i = 0; i < 6; i++) {
            detector.recordAlert();
        }

        StormStatus calm = detector.getStatus();
        assertThat(calm.getCurrentRate()).isEqualTo(3.0);
        assertThat(calm.getThresholdRate()).isEqualTo(5.0);
        assertThat(calm.getCooldownRemaining()).isEqualTo(Duration.ZERO);
        assertThat(calm.getStormStartTime()).isNull();

        for (int i = 0; i < 5; i++) {
            detector.recordAlert();
        }
        clock.advance(Duration.ofSeconds(100));
        assertThat(detector.getStatus().getCooldownRemaining()).isEqualTo(Duration.ofSeconds(200));
    }

    @Test
    @DisplayName("Reset should leave storm mode and clear the window")
    void resetShouldClearState() {
        for (int i = 0; i < 11; i++) {
            detector.recordAlert();
        }
        assertThat(detector.getStatus().isInStorm()).isTrue();

        detector.reset();

        assertThat(detector.getStatus().isInStorm()).isFalse();
        assertThat(detector.getStatus().getCurrentRate()).isZero();
        assertThat(detector.recordAlert()).isTrue();
    }

    @Test
    @DisplayName("Default configuration should be 100 alerts per minute with a 5 minute cooldown")
    void defaultsShouldMatch() {
        StormConfig defaults = new StormDetector().getConfig();

        assertThat(defaults.getThreshold()).isEqualTo(100);
        assertThat(defaults.getWindowSeconds()).isEqualTo(60);
        assertThat(defaults.getCooldownSeconds()).isEqualTo(300);
    }

    @Test
    @DisplayName("Concurrent callers should let exactly the threshold through before the storm")
    void concurrentCallersShouldTripOnce() throws Exception {
        int threads = 16;
        int perThread = 25;
        AtomicInteger allowed = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        if (detector.recordAlert()) {
                            allowed.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        StormStatus status = detector.getStatus();
        assertThat(allowed.get()).isEqualTo(10);
        assertThat(status.isInStorm()).isTrue();
        assertThat(status.getSuppressedCount()).isEqualTo(threads * perThread - 10 - 1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean recordAt(long seconds) {
        clock.set(START.plusSeconds(seconds));
        return detector.recordAlert();
    }
}
