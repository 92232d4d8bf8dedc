package com.hostsentinel.flink;

import com.hostsentinel.core.config.DetectionConfig;
import com.hostsentinel.core.config.DetectionConfigLoader;
import com.hostsentinel.core.model.Snapshot;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Main entry point for the Host Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry topic)        Kafka (alert-commands topic)
 *     → Snapshot                     → AlertCommand
 *     → key by source id             → key by source id
 *              \                     /
 *               TelemetryProcessFunction
 *                 → AlertEvent → JSON
 *                 → Kafka (alerts topic, keyed by source id)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring comes from environment variables via {@link JobConfig};
 * detection tuning from the YAML file named by
 * {@code DETECTION_CONFIG_PATH}, or the bundled {@code detection.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class HostSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(HostSentinelJob.class);

    private HostSentinelJob() {
        // entry-point class
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Host Sentinel with config: {}", config);

        // 2. Load detection settings
        DetectionConfig detectionConfig = loadDetectionConfig(config);
        LOG.info("Loaded detection config: {}", detectionConfig);

        // 3. Set up Flink execution environment
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        registerSerializers(env);
        configureCheckpointing(env, config);

        // 4. Build pipeline
        buildPipeline(env, config, detectionConfig);

        // 5. Execute
        env.execute("Host Sentinel - Telemetry Anomaly Detection");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    static void buildPipeline(StreamExecutionEnvironment env,
            JobConfig config,
            DetectionConfig detectionConfig) {
        KafkaSource<Snapshot> snapshotSource = KafkaSource.<Snapshot>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getSnapshotTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setProperties(config.kafkaConsumerProperties())
                .setValueOnlyDeserializer(new SnapshotDeserializationSchema())
                .build();

        KafkaSource<AlertCommand> commandSource = KafkaSource.<AlertCommand>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getCommandTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setProperties(config.kafkaConsumerProperties())
                .setValueOnlyDeserializer(new AlertCommandDeserializationSchema())
                .build();

        // Detection is arrival-ordered; event time is not used.
        DataStream<Snapshot> snapshots = env
                .fromSource(snapshotSource, WatermarkStrategy.noWatermarks(), "kafka-telemetry-source")
                .filter(Objects::nonNull)
                .name("drop-malformed-snapshots");

        DataStream<AlertCommand> commands = env
                .fromSource(commandSource, WatermarkStrategy.noWatermarks(), "kafka-command-source")
                .filter(Objects::nonNull)
                .name("drop-malformed-commands");

        DataStream<AlertEvent> alerts = snapshots
                .keyBy(Snapshot::getSourceId)
                .connect(commands.keyBy(AlertCommand::getSourceId))
                .process(new TelemetryProcessFunction(detectionConfig))
                .name("anomaly-detection");

        SerializationSchema<AlertEvent> keySerializer =
                event -> event.getSourceId().getBytes(StandardCharsets.UTF_8);
        KafkaSink<AlertEvent> kafkaSink = KafkaSink.<AlertEvent>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setKafkaProducerConfig(config.kafkaProducerProperties())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.<AlertEvent>builder()
                                .setTopic(config.getAlertTopic())
                                .setKeySerializationSchema(keySerializer)
                                .setValueSerializationSchema(new AlertEventSerializationSchema())
                                .build())
                .build();

        alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static DetectionConfig loadDetectionConfig(JobConfig config) {
        String path = config.getDetectionConfigPath();
        if (path != null && !path.isBlank()) {
            return DetectionConfigLoader.fromFile(path);
        }
        return DetectionConfigLoader.load();
    }

    /**
     * Stream records are immutable and hold unmodifiable collections, which
     * Kryo cannot rebuild field by field.
     */
    static void registerSerializers(StreamExecutionEnvironment env) {
        env.getConfig().addDefaultKryoSerializer(Snapshot.class, JavaRecordSerializer.class);
        env.getConfig().addDefaultKryoSerializer(AlertCommand.class, JavaRecordSerializer.class);
        env.getConfig().addDefaultKryoSerializer(AlertEvent.class, JavaRecordSerializer.class);
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
