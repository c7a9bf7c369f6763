package com.alertgate.core.digest;

import com.alertgate.core.model.QueuedAlert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertQueue}.
 */
class AlertQueueTest {

    private AlertQueue queue;

    @BeforeEach
    void setUp() {
        queue = new AlertQueue();
    }

    @Test
    @DisplayName("Should group alerts by device in enqueue order")
    void shouldGroupByDevice() {
        queue.enqueue(alert("router-1", "cpu.high"));
        queue.enqueue(alert("router-2", "disk.full"));
        queue.enqueue(alert("router-1", "memory.high"));

        assertThat(queue.count()).isEqualTo(3);
        assertThat(queue.getByDevice("router-1"))
                .extracting(QueuedAlert::getEventType)
                .containsExactly("cpu.high", "memory.high");
        assertThat(queue.getByDevice("unknown")).isEmpty();
    }

    @Test
    @DisplayName("getByDevice should return a copy")
    void getByDeviceShouldCopy() {
        queue.enqueue(alert("router-1", "cpu.high"));

        List<QueuedAlert> copy = queue.getByDevice("router-1");
        copy.clear();

        assertThat(queue.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("dequeueAll should drain everything")
    void dequeueAllShouldDrain() {
        queue.enqueue(alert("router-1", "cpu.high"));
        queue.enqueue(alert("", "link.down"));

        Map<String, List<QueuedAlert>> drained = queue.dequeueAll();

        assertThat(drained).containsOnlyKeys("router-1", "");
        assertThat(queue.count()).isZero();
        assertThat(queue.dequeueAll()).isEmpty();
    }

    @Test
    @DisplayName("Exactly one of several concurrent dequeueAll calls should receive the batch")
    void concurrentDequeueShouldHandOffOnce() throws Exception {
        for (int i = 0; i < 100; i++) {
            queue.enqueue(alert("router-1", "cpu.high"));
        }

        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Map<String, List<QueuedAlert>>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 3; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return queue.dequeueAll();
                }));
            }
            go.countDown();

            int nonEmpty = 0;
            int total = 0;
            for (Future<Map<String, List<QueuedAlert>>> f : futures) {
                Map<String, List<QueuedAlert>> result = f.get(10, TimeUnit.SECONDS);
                if (!result.isEmpty()) {
                    nonEmpty++;
                    total += result.get("router-1").size();
                }
            }
            assertThat(nonEmpty).isEqualTo(1);
            assertThat(total).isEqualTo(100);
        } finally {
            pool.shutdownNow();
        }
        assertThat(queue.count()).isZero();
    }

    @Test
    @DisplayName("clear should empty the queue")
    void clearShouldEmpty() {
        queue.enqueue(alert("router-1", "cpu.high"));
        queue.clear();

        assertThat(queue.count()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static QueuedAlert alert(String deviceId, String eventType) {
        return QueuedAlert.builder()
                .ruleId("rule-1")
                .deviceId(deviceId)
                .eventType(eventType)
                .severity("WARNING")
                .timestamp(Instant.parse("2024-01-01T10:00:00Z"))
                .build();
    }
}
