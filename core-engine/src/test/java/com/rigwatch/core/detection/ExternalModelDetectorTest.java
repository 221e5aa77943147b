package com.rigwatch.core.detection;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.rigwatch.core.TestEvents.DEVICE;
import static com.rigwatch.core.TestEvents.after;
import static com.rigwatch.core.TestEvents.appendTo;
import static com.rigwatch.core.TestEvents.event;
import static com.rigwatch.core.TestEvents.historyOf;
import static com.rigwatch.core.TestEvents.steady;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExternalModelDetector}.
 */
class ExternalModelDetectorTest {

    @Test
    @DisplayName("Probability above 0.5 is a MEDIUM model anomaly")
    void mediumAnomaly() {
        AnomalyVerdict verdict = evaluateWith(new FixedScoringModel(0.8));

        assertThat(verdict.isAnomaly()).isTrue();
        assertThat(verdict.getMethod()).isEqualTo(DetectionMethod.EXTERNAL_MODEL);
        assertThat(verdict.getAlertType()).isEqualTo(ExternalModelDetector.ALERT_TYPE);
        assertThat(verdict.getScore()).isEqualTo(0.8);
        assertThat(verdict.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Probability of 0.9 or more is HIGH severity")
    void highAnomaly() {
        assertThat(evaluateWith(new FixedScoringModel(0.95)).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Exactly 0.5 counts as an anomaly, below does not")
    void threshold() {
        assertThat(evaluateWith(new FixedScoringModel(0.5)).isAnomaly()).isTrue();
        assertThat(evaluateWith(new FixedScoringModel(0.3)).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should fail when the model returns an invalid probability")
    void invalidProbability() {
        assertThatThrownBy(() -> evaluateWith(new FixedScoringModel(1.5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("outside [0, 1]");
        assertThatThrownBy(() -> evaluateWith(new FixedScoringModel(Double.NaN)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should not call the model before the baseline is full enough")
    void insufficientHistory() {
        FixedScoringModel model = new FixedScoringModel(0.9);
        ExternalModelDetector detector = new ExternalModelDetector(new PipelineConfig(), model);
        DeviceHistory history = historyOf(steady(DEVICE, 4), 50);
        TelemetryEvent event = appendTo(history, event(DEVICE, after(4), 80.0, 200.0));

        assertThatThrownBy(() -> detector.evaluate(event, history))
                .isInstanceOf(InsufficientDataException.class);
        assertThat(model.getCalls()).isZero();
    }

    @Test
    @DisplayName("The model receives the derived feature vector")
    void passesFeatures() {
        FixedScoringModel model = new FixedScoringModel(0.1);
        evaluateWith(model);

        assertThat(model.getLastFeatures())
                .containsKeys("temperature", "temperature_z_score", "temperature_rate_of_change",
                        "pressure_rolling_mean", "pressure_rolling_std", FeatureExtractor.TEMP_PRESSURE_RATIO);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyVerdict evaluateWith(ScoringModel model) {
        ExternalModelDetector detector = new ExternalModelDetector(new PipelineConfig(), model);
        DeviceHistory history = historyOf(steady(DEVICE, 20), 50);
        TelemetryEvent event = appendTo(history, event(DEVICE, after(20), 90.0, 210.0));
        return detector.evaluate(event, history).orElseThrow();
    }
}
