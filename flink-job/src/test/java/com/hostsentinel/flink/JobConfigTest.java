package com.hostsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults match the documented environment defaults")
    void builderDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getSnapshotTopic()).isEqualTo("telemetry");
        assertThat(config.getCommandTopic()).isEqualTo("alert-commands");
        assertThat(config.getAlertTopic()).isEqualTo("alerts");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getDetectionConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("The alert topic must not feed back into an input")
    void shouldRejectFeedbackLoop() {
        assertThatThrownBy(() -> new JobConfig.Builder().alertTopic("telemetry").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alertTopic must differ");
        assertThatThrownBy(() -> new JobConfig.Builder().alertTopic("alert-commands").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject blank topics and out-of-range numbers")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new JobConfig.Builder().snapshotTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Kafka client properties carry the reset and transaction settings")
    void kafkaProperties() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.kafkaConsumerProperties()).containsEntry("auto.offset.reset", "earliest");
        assertThat(config.kafkaProducerProperties()).containsEntry("transaction.timeout.ms", "900000");
    }
}
