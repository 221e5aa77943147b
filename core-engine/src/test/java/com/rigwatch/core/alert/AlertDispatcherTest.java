package com.rigwatch.core.alert;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import com.rigwatch.core.processor.StatsRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.rigwatch.core.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertDispatcher}.
 */
class AlertDispatcherTest {

    private PipelineConfig config;
    private StatsRecorder stats;
    private InMemoryAlertSink memory;
    private AlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        stats = new StatsRecorder();
        memory = new InMemoryAlertSink();
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown(1_000);
        }
    }

    @Test
    @DisplayName("Should build the alert from the event and verdict and deliver it")
    void deliversAlert() {
        dispatcher = new AlertDispatcher(config, List.of(memory), stats);
        TelemetryEvent event = event("well-1", 1_000, 125.0, 200.0);

        Alert alert = dispatcher.dispatch(event, fired("TEMPERATURE_HIGH", Severity.CRITICAL)).orElseThrow();
        assertThat(dispatcher.flush(5_000)).isTrue();

        assertThat(alert.getDeviceId()).isEqualTo("well-1");
        assertThat(alert.getAlertType()).isEqualTo("TEMPERATURE_HIGH");
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getTimestamp()).isEqualTo(1_000.0);
        assertThat(alert.getPayload())
                .containsEntry("detector", "rule_based")
                .containsEntry("method", "RULE_BASED")
                .containsEntry("temperature", 125.0)
                .containsEntry("pressure", 200.0)
                .containsKeys("score", "reasons", "status");
        assertThat(memory.getDelivered()).containsExactly(alert);
        assertThat(stats.snapshot().alertsGenerated()).isEqualTo(1);
    }

    @Test
    @DisplayName("Two alerts of one type 10 s apart yield one dispatch and one suppression")
    void deduplicatesWithinWindow() {
        dispatcher = new AlertDispatcher(config, List.of(memory), stats);

        Optional<Alert> first = dispatcher.dispatch(event("well-1", 1_000, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL));
        Optional<Alert> second = dispatcher.dispatch(event("well-1", 1_010, 126, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL));
        Optional<Alert> other = dispatcher.dispatch(event("well-1", 1_010, 126, 200), fired("ANOMALY_DETECTED", Severity.HIGH));
        dispatcher.flush(5_000);

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(other).isPresent();
        assertThat(stats.snapshot().alertsGenerated()).isEqualTo(2);
        assertThat(stats.snapshot().duplicatesSuppressed()).isEqualTo(1);
        assertThat(memory.getDelivered()).hasSize(2);
    }

    @Test
    @DisplayName("Devices with out-of-step event times keep their own suppression")
    void deduplicatesAcrossLaggingDevices() {
        dispatcher = new AlertDispatcher(config, List.of(memory), stats);

        Optional<Alert> first = dispatcher.dispatch(event("well-A", 1_000, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL));
        Optional<Alert> ahead = dispatcher.dispatch(event("well-B", 2_000, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL));
        Optional<Alert> repeat = dispatcher.dispatch(event("well-A", 1_010, 126, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL));
        dispatcher.flush(5_000);

        assertThat(first).isPresent();
        assertThat(ahead).isPresent();
        assertThat(repeat).isEmpty();
        assertThat(stats.snapshot().duplicatesSuppressed()).isEqualTo(1);
        assertThat(memory.getDelivered()).extracting(Alert::getDedupKey).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("A failing sink is counted as an error and does not block the others")
    void isolatesSinkFailures() {
        FailingAlertSink throwing = new FailingAlertSink(true);
        FailingAlertSink refusing = new FailingAlertSink(false);
        dispatcher = new AlertDispatcher(config, List.of(throwing, memory, refusing), stats);

        dispatcher.dispatch(event("well-1", 1_000, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL));
        assertThat(dispatcher.flush(5_000)).isTrue();

        assertThat(memory.getDelivered()).hasSize(1);
        assertThat(throwing.getAttempts()).isEqualTo(1);
        assertThat(refusing.getAttempts()).isEqualTo(1);
        assertThat(stats.snapshot().processingErrors()).isEqualTo(2);
        assertThat(stats.snapshot().alertsGenerated()).isEqualTo(1);
    }

    @Test
    @DisplayName("A sink that exceeds the timeout is reported as failed")
    void slowSinkTimesOut() throws Exception {
        config.setSinkTimeoutMillis(100);
        CountDownLatch release = new CountDownLatch(1);
        AlertSink stuck = alert -> {
            try {
                return release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        };
        dispatcher = new AlertDispatcher(config, List.of(stuck, memory), stats);
        try {
            dispatcher.dispatch(event("well-1", 1_000, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL));

            assertThat(dispatcher.flush(5_000)).isTrue();
            assertThat(stats.snapshot().processingErrors()).isEqualTo(1);
            assertThat(memory.getDelivered()).hasSize(1);
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Should refuse non-anomalous verdicts")
    void refusesNonAnomaly() {
        dispatcher = new AlertDispatcher(config, List.of(memory), stats);
        AnomalyVerdict quiet = AnomalyVerdict.builder("rule_based", DetectionMethod.RULE_BASED).build();

        assertThatThrownBy(() -> dispatcher.dispatch(event("well-1", 1, 80, 200), quiet))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should refuse alerts after shutdown")
    void refusesAfterShutdown() {
        dispatcher = new AlertDispatcher(config, List.of(memory), stats);

        assertThat(dispatcher.shutdown(1_000)).isTrue();

        assertThat(dispatcher.isShutdown()).isTrue();
        assertThatThrownBy(() -> dispatcher.dispatch(event("well-1", 1, 125, 200),
                fired("TEMPERATURE_HIGH", Severity.CRITICAL)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Recent alerts are bounded and measured from stream time")
    void retentionAndWindow() {
        config.setAlertHistoryCapacity(3);
        dispatcher = new AlertDispatcher(config, List.of(memory), stats);
        assertThat(dispatcher.streamTime()).isNaN();
        assertThat(dispatcher.recentAlerts(60)).isEmpty();

        Alert evicted = dispatcher.dispatch(event("well-1", 0, 125, 200), fired("A", Severity.LOW)).orElseThrow();
        dispatcher.dispatch(event("well-1", 10, 125, 200), fired("B", Severity.LOW));
        dispatcher.dispatch(event("well-2", 900, 125, 200), fired("C", Severity.LOW));
        dispatcher.dispatch(event("well-1", 1_000, 125, 200), fired("D", Severity.LOW));

        assertThat(dispatcher.streamTime()).isEqualTo(1_000.0);
        assertThat(dispatcher.recentAlerts(10_000)).extracting(Alert::getAlertType).containsExactly("B", "C", "D");
        assertThat(dispatcher.recentAlerts(200)).extracting(Alert::getAlertType).containsExactly("C", "D");
        assertThat(dispatcher.recentAlerts("well-1", 200, 1_000)).extracting(Alert::getAlertType).containsExactly("D");
        assertThat(dispatcher.cancel(evicted.getId())).isFalse();
    }

    @Test
    @DisplayName("Cancelling an alert suppresses its type for another window")
    void cancelExtendsSuppression() {
        dispatcher = new AlertDispatcher(config, List.of(memory), stats);
        Alert alert = dispatcher.dispatch(event("well-1", 0, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL))
                .orElseThrow();
        dispatcher.observe(30);

        assertThat(dispatcher.cancel(alert.getId())).isTrue();
        assertThat(dispatcher.dispatch(event("well-1", 70, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL)))
                .isEmpty();
        assertThat(dispatcher.dispatch(event("well-1", 95, 125, 200), fired("TEMPERATURE_HIGH", Severity.CRITICAL)))
                .isPresent();
        assertThat(dispatcher.cancel("no-such-alert")).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyVerdict fired(String alertType, Severity severity) {
        return AnomalyVerdict.builder("rule_based", DetectionMethod.RULE_BASED)
                .anomaly(true)
                .score(1.0)
                .alertType(alertType)
                .severity(severity)
                .reason("temperature above critical limit")
                .build();
    }
}
