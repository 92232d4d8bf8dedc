package com.hostsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.FindingType;
import com.hostsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertEventSerializationSchema}.
 */
class AlertEventSerializationSchemaTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private final AlertEventSerializationSchema schema = new AlertEventSerializationSchema();
    private final ObjectMapper reader = new ObjectMapper();

    private static final Finding FINDING = Finding.builder()
            .type(FindingType.NETWORK_LATENCY_HIGH)
            .severity(Severity.MEDIUM)
            .value(250)
            .threshold(200)
            .description("Network latency 250.0ms exceeds threshold")
            .build();

    @Test
    @DisplayName("Finding events carry the finding and the alert state")
    void shouldSerializeFindingEvent() throws Exception {
        Alert alert = Alert.open("edge-7", FINDING, T0);

        JsonNode json = reader.readTree(schema.serialize(AlertEvent.finding(FINDING, alert)));

        assertThat(json.get("event").asText()).isEqualTo("finding");
        assertThat(json.get("source_id").asText()).isEqualTo("edge-7");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-15T10:00:00Z");
        assertThat(json.at("/finding/type").asText()).isEqualTo("network_latency_high");
        assertThat(json.at("/finding/score_or_value").asDouble()).isEqualTo(250.0);
        assertThat(json.at("/finding/threshold").asDouble()).isEqualTo(200.0);
        assertThat(json.at("/finding/suggested_action").asText()).isEqualTo("check_network_connectivity");
        assertThat(json.at("/alert/key").asText()).isEqualTo("network_latency_high:edge-7");
        assertThat(json.at("/alert/count").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Resolved events omit the finding and stamp the resolution time")
    void shouldSerializeResolvedEvent() throws Exception {
        Alert resolved = Alert.open("edge-7", FINDING, T0).resolve(T0.plusSeconds(90));

        JsonNode json = reader.readTree(schema.serialize(AlertEvent.resolved(resolved)));

        assertThat(json.get("event").asText()).isEqualTo("resolved");
        assertThat(json.has("finding")).isFalse();
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-15T10:01:30Z");
        assertThat(json.at("/alert/status").asText()).isEqualTo("resolved");
        assertThat(json.at("/alert/resolved_at").asText()).isEqualTo("2024-01-15T10:01:30Z");
    }

    @Test
    @DisplayName("A resolved event needs a resolved alert")
    void resolvedEventNeedsResolvedAlert() {
        Alert active = Alert.open("edge-7", FINDING, T0);

        assertThatThrownBy(() -> AlertEvent.resolved(active)).isInstanceOf(IllegalArgumentException.class);
    }
}
