package com.alertwarden.service;

import com.alertwarden.core.model.AlertEventType;
import com.alertwarden.core.model.AlertState;
import com.alertwarden.core.model.NotificationPayload;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PayloadSerializer}.
 */
class PayloadSerializerTest {

    private final PayloadSerializer serializer = new PayloadSerializer();

    private static NotificationPayload payload() {
        return NotificationPayload.builder()
                .correlationId("corr-1")
                .ruleId("checkout-latency")
                .ruleName("Checkout latency")
                .severity(1)
                .severityLabel("Error")
                .state(AlertState.FIRING)
                .eventType(AlertEventType.FIRED)
                .timestamp(Instant.parse("2026-03-01T10:15:30Z"))
                .observedValue(2_450.0)
                .threshold(2_000)
                .build();
    }

    @Test
    @DisplayName("Should write timestamps as ISO-8601 strings")
    void writesIsoTimestamps() throws Exception {
        byte[] json = serializer.serialize(payload());

        JsonNode node = serializer.getMapper().readTree(json);
        assertThat(node.get("timestamp").asText()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(node.get("eventType").asText()).isEqualTo("FIRED");
        assertThat(node.get("severityLabel").asText()).isEqualTo("Error");
        assertThat(node.get("observedValue").asDouble()).isEqualTo(2_450.0);
    }

    @Test
    @DisplayName("Should carry the idempotency key so receivers can drop duplicates")
    void includesIdempotencyKey() throws Exception {
        NotificationPayload payload = payload();

        JsonNode node = serializer.getMapper().readTree(serializer.serialize(payload));

        assertThat(node.get("idempotencyKey").asText())
                .isEqualTo("corr-1:FIRED:" + Instant.parse("2026-03-01T10:15:30Z").toEpochMilli());
    }

    @Test
    @DisplayName("Should serialize arbitrary views for the health endpoints")
    void serializesViews() throws Exception {
        byte[] json = serializer.toJson(Map.of("firedAt", Instant.parse("2026-03-01T10:15:30Z")));

        assertThat(new String(json, StandardCharsets.UTF_8))
                .isEqualTo("{\"firedAt\":\"2026-03-01T10:15:30Z\"}");
    }
}
