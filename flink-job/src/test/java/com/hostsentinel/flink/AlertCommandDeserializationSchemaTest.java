package com.hostsentinel.flink;

import com.hostsentinel.core.model.AlertKey;
import com.hostsentinel.core.model.FindingType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertCommandDeserializationSchema}.
 */
class AlertCommandDeserializationSchemaTest {

    private final AlertCommandDeserializationSchema schema = new AlertCommandDeserializationSchema();

    private AlertCommand decode(String json) throws Exception {
        return schema.deserialize(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should decode a resolve command routed by source")
    void shouldDecodeResolve() throws Exception {
        AlertCommand command = decode("{\"action\":\"resolve\",\"key\":\"disk_threshold_breach:db-01\"}");

        assertThat(command).isEqualTo(
                AlertCommand.resolve(AlertKey.of(FindingType.DISK_THRESHOLD_BREACH, "db-01")));
        assertThat(command.getSourceId()).isEqualTo("db-01");
    }

    @Test
    @DisplayName("Unknown actions and malformed keys are dropped")
    void shouldDropInvalidCommands() throws Exception {
        assertThat(decode("{\"action\":\"snooze\",\"key\":\"disk_threshold_breach:db-01\"}")).isNull();
        assertThat(decode("{\"action\":\"resolve\",\"key\":\"db-01\"}")).isNull();
        assertThat(decode("{\"action\":\"resolve\"}")).isNull();
        assertThat(decode("[]")).isNull();
    }
}
