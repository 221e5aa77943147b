package com.rigwatch.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the RigWatch Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configured entirely through the deployment environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
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
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long maxOutOfOrdernessMs;

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final String pipelineConfigPath;
    private final String modelPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.maxOutOfOrdernessMs = b.maxOutOfOrdernessMs;
        this.pipelineConfigPath = b.pipelineConfigPath;
        this.modelPath = b.modelPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "telemetry"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "rigwatch"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .maxOutOfOrdernessMs(parseLongEnv("MAX_OUT_OF_ORDERNESS_MS", "5000"))
                    .pipelineConfigPath(env("RIGWATCH_CONFIG_PATH", ""))
                    .modelPath(env("RIGWATCH_MODEL_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
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

    public long getMaxOutOfOrdernessMs() {
        return maxOutOfOrdernessMs;
    }

    /** @return YAML pipeline configuration path, blank for the classpath default */
    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    /** @return JSON scoring model path, blank to run without a model */
    public String getModelPath() {
        return modelPath;
    }

    public boolean hasModel() {
        return modelPath != null && !modelPath.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, out-of-orderness
     * &gt;= 0, non-blank Kafka settings).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "telemetry";
        private String kafkaAlertTopic = "alerts";
        private String kafkaGroupId = "rigwatch";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long maxOutOfOrdernessMs = 5_000;
        private String pipelineConfigPath = "";
        private String modelPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
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

        public Builder maxOutOfOrdernessMs(long v) {
            this.maxOutOfOrdernessMs = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder modelPath(String v) {
            this.modelPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (maxOutOfOrdernessMs < 0) {
                throw new IllegalArgumentException(
                        "maxOutOfOrdernessMs must be >= 0, got: " + maxOutOfOrdernessMs);
            }
            pipelineConfigPath = Objects.requireNonNullElse(pipelineConfigPath, "");
            modelPath = Objects.requireNonNullElse(modelPath, "");

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
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", maxOutOfOrdernessMs=" + maxOutOfOrdernessMs +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", modelPath='" + modelPath + '\'' +
                '}';
    }
}
