package com.alertgate.service;

import com.alertgate.core.clock.MutableClock;
import com.alertgate.core.config.GateConfig;
import com.alertgate.core.config.GateConfigLoader;
import com.alertgate.core.pipeline.AdmissionPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertGateService}.
 */
class AlertGateServiceTest {

    private RecordingPublisher sink;
    private AlertGateService service;

    @BeforeEach
    void setUp() {
        GateConfig gateConfig = GateConfigLoader.fromClasspath(GateConfigLoader.DEFAULT_RESOURCE);
        sink = new RecordingPublisher();
        service = new AlertGateService(new ServiceConfig.Builder().build(), gateConfig, sink,
                new MutableClock(Instant.parse("2024-01-15T12:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    @DisplayName("The bundled configuration should load with its three rules")
    void bundledConfigLoads() {
        assertThat(service.pipeline().getRules()).hasSize(3);
    }

    @Test
    @DisplayName("Ingested lines should be admitted, throttled and routed to channels")
    void ingestsEvents() throws Exception {
        String input = String.join("\n",
                "{\"event_type\":\"router.offline\",\"device_id\":\"router-1\"}",
                "not json",
                "",
                "{\"event_type\":\"router.offline\",\"device_id\":\"router-1\"}",
                "{\"event_type\":\"router.unknown\",\"device_id\":\"router-1\"}");

        long processed = service.ingest(new BufferedReader(new StringReader(input)));

        assertThat(processed).isEqualTo(3);
        assertThat(sink.ofType(AdmissionPipeline.ALERT_TRIGGERED)).hasSize(1);
        assertThat(sink.ofType(ChannelNotifier.DISPATCH))
                .extracting(p -> p.get("channel_id"))
                .containsExactly("ops-pager", "ops-email");
    }

    @Test
    @DisplayName("Closing should publish a throttle summary for suppressed alerts")
    void closePublishesSummary() throws Exception {
        String line = "{\"event_type\":\"router.offline\",\"device_id\":\"router-1\"}\n";
        service.ingest(new BufferedReader(new StringReader(line + line + line)));

        service.close();

        assertThat(sink.ofType(ThrottleSummaryReporter.EVENT_TYPE)).singleElement()
                .satisfies(p -> assertThat(p).containsEntry("total_suppressed", 2L));
    }
}
