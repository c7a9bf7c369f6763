package com.alertgate.service;

import com.alertgate.core.model.AlertEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventJson}.
 */
class EventJsonTest {

    @Test
    @DisplayName("Decoding should lift event_type and timestamp out of the payload")
    void decodesEvent() {
        AlertEvent event = EventJson.decode(
                "{\"event_type\":\"router.offline\",\"timestamp\":\"2024-01-15T12:00:00Z\","
                        + "\"device_id\":\"router-1\",\"interface\":{\"name\":\"eth0\"}}");

        assertThat(event).isNotNull();
        assertThat(event.getEventType()).isEqualTo("router.offline");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-01-15T12:00:00Z"));
        assertThat(event.getDeviceId()).isEqualTo("router-1");
        assertThat(event.getFields()).containsKey("interface").doesNotContainKey("event_type");
    }

    @Test
    @DisplayName("Events without a timestamp should be stamped on decode")
    void stampsMissingTimestamp() {
        Instant before = Instant.now();

        AlertEvent event = EventJson.decode("{\"event_type\":\"router.offline\"}");

        assertThat(event.getTimestamp()).isAfterOrEqualTo(before);
    }

    @Test
    @DisplayName("Blank or malformed input should decode to null")
    void rejectsBadInput() {
        assertThat(EventJson.decode(null)).isNull();
        assertThat(EventJson.decode("   ")).isNull();
        assertThat(EventJson.decode("{not json")).isNull();
    }

    @Test
    @DisplayName("Instants should be written as ISO-8601 strings")
    void encodesInstantsAsText() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rule_id", "cpu-high");
        payload.put("at", Instant.parse("2024-01-15T12:00:00Z"));

        assertThat(EventJson.encode(payload))
                .isEqualTo("{\"rule_id\":\"cpu-high\",\"at\":\"2024-01-15T12:00:00Z\"}");
    }

    @Test
    @DisplayName("Values Jackson cannot serialise should raise IllegalArgumentException")
    void encodeFailure() {
        Map<String, Object> payload = Map.of("self", new Object());

        assertThatThrownBy(() -> EventJson.encode(payload))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to serialise");
    }
}
