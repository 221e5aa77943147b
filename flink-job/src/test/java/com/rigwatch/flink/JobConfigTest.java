package com.rigwatch.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults describe a local single-slot job without a model")
    void defaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("telemetry");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("rigwatch");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.hasModel()).isFalse();
        assertThat(config.getPipelineConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("A model path enables the external model")
    void modelPath() {
        JobConfig config = new JobConfig.Builder().modelPath("/models/rig.json").build();

        assertThat(config.hasModel()).isTrue();
        assertThat(config.getModelPath()).isEqualTo("/models/rig.json");
    }

    @Test
    @DisplayName("Null paths are normalised to empty")
    void nullPaths() {
        JobConfig config = new JobConfig.Builder().pipelineConfigPath(null).modelPath(null).build();

        assertThat(config.getPipelineConfigPath()).isEmpty();
        assertThat(config.hasModel()).isFalse();
    }

    @Test
    @DisplayName("Should reject blank Kafka settings")
    void blankKafka() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaInputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic");
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaBootstrapServers(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range numbers")
    void outOfRange() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().maxOutOfOrdernessMs(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
