package com.rigwatch.flink;

import com.rigwatch.core.config.ConfigLoader;
import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.detection.LogisticScoringModel;
import com.rigwatch.core.detection.ScoringModelLoader;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.TelemetryEvent;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
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

import java.time.Duration;

/**
 * Main entry point for the RigWatch Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry topic)
 *     → Deserialize JSON → TelemetryEvent
 *     → Key by device_id
 *     → TelemetryProcessFunction (detectors, ensemble, dedup)
 *     → Serialize Alert → JSON
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig}; the
 * pipeline itself from YAML via {@link ConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing protects Kafka offsets and the alert sink's
 * transactions.
 * </p>
 *
 * @since 1.0.0
 */
public final class RigWatchJob {

        private static final Logger LOG = LoggerFactory.getLogger(RigWatchJob.class);

        private RigWatchJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting RigWatch with config: {}", config);

                // 2. Load pipeline settings and the optional model
                PipelineConfig pipelineConfig = loadPipelineConfig(config);
                LogisticScoringModel model = config.hasModel()
                                ? ScoringModelLoader.fromFile(config.getModelPath())
                                : null;

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, pipelineConfig, model);

                // 5. Execute
                env.execute("RigWatch – Telemetry Anomaly Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        PipelineConfig pipelineConfig,
                        LogisticScoringModel model) {
                KafkaSource<TelemetryEvent> kafkaSource = KafkaSource.<TelemetryEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new TelemetryEventDeserializationSchema())
                                .build();

                DataStream<TelemetryEvent> events = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<TelemetryEvent>forBoundedOutOfOrderness(
                                                Duration.ofMillis(config.getMaxOutOfOrdernessMs()))
                                                .withTimestampAssigner((event, ts) -> toEpochMillis(event))
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-telemetry-source");

                DataStream<Alert> alerts = events
                                .filter(RigWatchJob::hasDeviceId) // drops deserialization failures too
                                .name("drop-unkeyed")
                                .keyBy(TelemetryEvent::getDeviceId)
                                .process(new TelemetryProcessFunction(pipelineConfig, model))
                                .name("telemetry-anomaly-detection");

                KafkaSink<Alert> kafkaSink = KafkaSink.<Alert>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAlertTopic())
                                                                .setValueSerializationSchema(
                                                                                new AlertSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        static boolean hasDeviceId(TelemetryEvent event) {
                return event != null && event.getDeviceId() != null && !event.getDeviceId().isBlank();
        }

        static long toEpochMillis(TelemetryEvent event) {
                double ts = event.getTimestamp();
                return Double.isFinite(ts) ? (long) (ts * 1000) : Long.MIN_VALUE;
        }

        private static PipelineConfig loadPipelineConfig(JobConfig config) {
                String path = config.getPipelineConfigPath();
                if (path != null && !path.isBlank()) {
                        return ConfigLoader.fromFile(path);
                }
                return ConfigLoader.load();
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
