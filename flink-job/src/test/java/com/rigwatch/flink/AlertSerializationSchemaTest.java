package com.rigwatch.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.DedupKey;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertSerializationSchema} and the job's helpers.
 */
class AlertSerializationSchemaTest {

    @Test
    @DisplayName("Should write alerts as snake_case JSON")
    void writesSnakeCase() throws Exception {
        Alert alert = Alert.builder()
                .deviceId("well-17")
                .alertType("TEMPERATURE_HIGH")
                .severity(Severity.CRITICAL)
                .timestamp(1_700_000_000.0)
                .payload(Map.of("detector", "rule_based"))
                .dedupKey(DedupKey.of("well-17", "TEMPERATURE_HIGH", 1_700_000_000.0, 60))
                .build();

        JsonNode json = new ObjectMapper().readTree(new AlertSerializationSchema().serialize(alert));

        assertThat(json.get("id").asText()).isEqualTo(alert.getId());
        assertThat(json.get("device_id").asText()).isEqualTo("well-17");
        assertThat(json.get("alert_type").asText()).isEqualTo("TEMPERATURE_HIGH");
        assertThat(json.get("severity").asText()).isEqualTo("CRITICAL");
        assertThat(json.get("payload").get("detector").asText()).isEqualTo("rule_based");
    }

    @Test
    @DisplayName("Events without a device id are filtered and timestamps become epoch millis")
    void jobHelpers() {
        assertThat(RigWatchJob.hasDeviceId(TelemetryEvent.of("well-1", 1, 80, 200))).isTrue();
        assertThat(RigWatchJob.hasDeviceId(TelemetryEvent.of(" ", 1, 80, 200))).isFalse();
        assertThat(RigWatchJob.hasDeviceId(null)).isFalse();
        assertThat(RigWatchJob.toEpochMillis(TelemetryEvent.of("d", 1.25, 80, 200)))
                .isEqualTo(1_250L);
    }
}
