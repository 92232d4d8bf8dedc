package com.hostsentinel.flink;

import com.hostsentinel.core.model.MetricGroup;
import com.hostsentinel.core.model.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SnapshotDeserializationSchema}.
 */
class SnapshotDeserializationSchemaTest {

    private final SnapshotDeserializationSchema schema = new SnapshotDeserializationSchema();

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should decode a snapshot and ignore unknown fields")
    void shouldDecode() throws Exception {
        Snapshot snapshot = schema.deserialize(bytes(
                "{\"agent_id\":\"web-01\",\"hostname\":\"web-01.local\",\"cpu\":{\"usage_percent\":12}}"));

        assertThat(snapshot).isNotNull();
        assertThat(snapshot.getSourceId()).isEqualTo("web-01");
        assertThat(snapshot.getValue(MetricGroup.CPU, "usage_percent")).hasValue(12.0);
    }

    @Test
    @DisplayName("Malformed, empty and source-less messages are dropped")
    void shouldDropBadMessages() throws Exception {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
        assertThat(schema.deserialize(bytes("{\"cpu\":{\"usage_percent\":12}}"))).isNull();
        assertThat(schema.deserialize(bytes("{\"source_id\":\"  \"}"))).isNull();
    }

    @Test
    @DisplayName("The stream never ends")
    void neverEndOfStream() {
        assertThat(schema.isEndOfStream(null)).isFalse();
    }
}
