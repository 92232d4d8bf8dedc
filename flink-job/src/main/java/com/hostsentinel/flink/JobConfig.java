package com.hostsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable deployment configuration of the Host Sentinel job.
 *
 * <p>
 * Values are resolved from environment variables with defaults suitable for
 * a local Kafka. Detection parameters are not part of this object; they live
 * in the YAML document named by {@link #getDetectionConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String snapshotTopic;
    private final String commandTopic;
    private final String alertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final String detectionConfigPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.snapshotTopic = b.snapshotTopic;
        this.commandTopic = b.commandTopic;
        this.alertTopic = b.alertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.detectionConfigPath = b.detectionConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .snapshotTopic(env("KAFKA_SNAPSHOT_TOPIC", "telemetry"))
                    .commandTopic(env("KAFKA_COMMAND_TOPIC", "alert-commands"))
                    .alertTopic(env("KAFKA_ALERT_TOPIC", "alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "host-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .detectionConfigPath(env("DETECTION_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties
    // ---------------------------------------------------------------

    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getSnapshotTopic() {
        return snapshotTopic;
    }

    public String getCommandTopic() {
        return commandTopic;
    }

    public String getAlertTopic() {
        return alertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the detection YAML, blank to use the classpath default
     */
    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} rejects blank topic names, a parallelism below 1, a
     * non-positive checkpoint interval and identical input and output topics.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String snapshotTopic = "telemetry";
        private String commandTopic = "alert-commands";
        private String alertTopic = "alerts";
        private String kafkaGroupId = "host-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String detectionConfigPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder snapshotTopic(String v) {
            this.snapshotTopic = v;
            return this;
        }

        public Builder commandTopic(String v) {
            this.commandTopic = v;
            return this;
        }

        public Builder alertTopic(String v) {
            this.alertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(snapshotTopic, "snapshotTopic");
            requireNonBlank(commandTopic, "commandTopic");
            requireNonBlank(alertTopic, "alertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (alertTopic.equals(snapshotTopic) || alertTopic.equals(commandTopic)) {
                throw new IllegalArgumentException(
                        "alertTopic must differ from the input topics, got: " + alertTopic);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (detectionConfigPath == null) {
                detectionConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", snapshotTopic='" + snapshotTopic + '\'' +
                ", commandTopic='" + commandTopic + '\'' +
                ", alertTopic='" + alertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                '}';
    }
}
