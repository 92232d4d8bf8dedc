package com.hostsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Alert} transitions and its JSON shape.
 */
class AlertTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private static Finding cpuFinding(Severity severity, double usage) {
        return Finding.builder()
                .type(FindingType.CPU_THRESHOLD_BREACH)
                .severity(severity)
                .value(usage)
                .threshold(80)
                .description("CPU usage " + usage + "% exceeds threshold")
                .build();
    }

    @Test
    @DisplayName("Repeat occurrences keep the first severity and description")
    void shouldKeepFirstFindingDetails() {
        Alert opened = Alert.open("web-01", cpuFinding(Severity.HIGH, 85), T0);
        Alert repeated = opened.recordOccurrence(T0.plusSeconds(30));

        assertThat(repeated.getCount()).isEqualTo(2);
        assertThat(repeated.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(repeated.getFirstSeen()).isEqualTo(T0);
        assertThat(repeated.getLastSeen()).isEqualTo(T0.plusSeconds(30));
        assertThat(repeated.getSuggestedAction()).isEqualTo("identify_cpu_intensive_processes");
    }

    @Test
    @DisplayName("A resolved alert accepts no further transitions")
    void resolvedAlertIsTerminal() {
        Alert resolved = Alert.open("web-01", cpuFinding(Severity.HIGH, 85), T0).resolve(T0.plusSeconds(60));

        assertThat(resolved.isActive()).isFalse();
        assertThat(resolved.getResolvedAt()).contains(T0.plusSeconds(60));
        assertThatThrownBy(() -> resolved.recordOccurrence(T0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> resolved.resolve(T0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Serializes with snake_case wire names")
    void shouldSerializeWireNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        Alert alert = Alert.open("web-01", cpuFinding(Severity.CRITICAL, 97), T0);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(alert));

        assertThat(json.get("key").asText()).isEqualTo("cpu_threshold_breach:web-01");
        assertThat(json.get("type").asText()).isEqualTo("cpu_threshold_breach");
        assertThat(json.get("severity").asText()).isEqualTo("critical");
        assertThat(json.get("status").asText()).isEqualTo("active");
        assertThat(json.get("first_seen").asText()).isEqualTo("2024-01-15T10:00:00Z");
        assertThat(json.has("resolved_at")).isFalse();
        assertThat(json.has("active")).isFalse();
    }
}
