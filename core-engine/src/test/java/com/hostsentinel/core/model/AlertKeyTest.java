package com.hostsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertKey}.
 */
class AlertKeyTest {

    @Test
    @DisplayName("String form is type:source and parses back")
    void shouldRoundTripStringForm() {
        AlertKey key = AlertKey.of(FindingType.CPU_THRESHOLD_BREACH, "web-01");

        assertThat(key.toString()).isEqualTo("cpu_threshold_breach:web-01");
        assertThat(AlertKey.parse(key.toString())).contains(key);
    }

    @Test
    @DisplayName("Source ids may themselves contain colons")
    void shouldSplitOnFirstColon() {
        assertThat(AlertKey.parse("disk_threshold_breach:host:8080"))
                .hasValueSatisfying(k -> {
                    assertThat(k.getType()).isEqualTo(FindingType.DISK_THRESHOLD_BREACH);
                    assertThat(k.getSourceId()).isEqualTo("host:8080");
                });
    }

    @Test
    @DisplayName("Malformed keys and unknown types do not parse")
    void shouldRejectMalformedKeys() {
        assertThat(AlertKey.parse(null)).isEmpty();
        assertThat(AlertKey.parse("no-separator")).isEmpty();
        assertThat(AlertKey.parse(":web-01")).isEmpty();
        assertThat(AlertKey.parse("cpu_threshold_breach:")).isEmpty();
        assertThat(AlertKey.parse("made_up_type:web-01")).isEmpty();
    }
}
