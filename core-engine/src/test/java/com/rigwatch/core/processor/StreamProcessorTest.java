package com.rigwatch.core.processor;

import com.rigwatch.core.alert.FailingAlertSink;
import com.rigwatch.core.alert.InMemoryAlertSink;
import com.rigwatch.core.analytics.DeviceAnalytics;
import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.detection.ScoringModel;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.HealthStatus;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.ProcessorStats;
import com.rigwatch.core.model.TelemetryEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.rigwatch.core.TestEvents.DEVICE;
import static com.rigwatch.core.TestEvents.START;
import static com.rigwatch.core.TestEvents.STEP;
import static com.rigwatch.core.TestEvents.after;
import static com.rigwatch.core.TestEvents.constant;
import static com.rigwatch.core.TestEvents.event;
import static com.rigwatch.core.TestEvents.steady;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StreamProcessor}.
 */
class StreamProcessorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private PipelineConfig config;
    private InMemoryAlertSink sink;
    private StreamProcessor processor;

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        config.setWorkerStripes(0);
        sink = new InMemoryAlertSink();
    }

    @AfterEach
    void tearDown() {
        if (processor != null) {
            processor.shutdown(5_000);
        }
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Warm-up readings produce an insufficient-data ensemble verdict")
    void warmUpIsInsufficient() {
        processor = newProcessor();

        List<AnomalyVerdict> verdicts = List.of();
        for (TelemetryEvent e : steady(DEVICE, 5)) {
            verdicts = processor.process(e);
        }

        AnomalyVerdict ensemble = verdicts.get(verdicts.size() - 1);
        assertThat(ensemble.getDetector()).isEqualTo("ensemble");
        assertThat(ensemble.getMethod()).isEqualTo(DetectionMethod.INSUFFICIENT_DATA);
        assertThat(ensemble.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("A critical reading during warm-up alerts from rules but not from the ensemble")
    void warmUpRuleAlert() {
        processor = newProcessor();
        steady(DEVICE, 3).forEach(processor::process);

        ProcessingResult result = processor.processEvent(event(DEVICE, after(3), 125.0, 200.0));

        assertThat(result.alerts()).extracting(Alert::getAlertType).containsExactly("TEMPERATURE_HIGH");
        assertThat(result.verdicts().get(result.verdicts().size() - 1).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("A spike after warm-up raises statistical, rule and ensemble alerts")
    void spikeRaisesAlerts() {
        processor = newProcessor();
        for (TelemetryEvent e : steady(DEVICE, 20)) {
            assertThat(processor.processEvent(e).alerts()).isEmpty();
        }

        ProcessingResult result = processor.processEvent(event(DEVICE, after(20), 95.0, 200.0));
        processor.flush(5_000);

        assertThat(result.hasAnomaly()).isTrue();
        assertThat(result.verdicts()).extracting(AnomalyVerdict::getDetector)
                .containsExactly("statistical", "rule_based", "trend", "ensemble");
        assertThat(result.alerts()).extracting(Alert::getAlertType)
                .containsExactly("ANOMALY_DETECTED", "TEMPERATURE_OUT_OF_RANGE", "ENSEMBLE_ANOMALY");
        assertThat(sink.getDelivered()).hasSize(3);
        assertThat(processor.getProcessorStats().alertsGenerated()).isEqualTo(3);
    }

    @Test
    @DisplayName("A repeat spike inside the dedup window is suppressed")
    void repeatSpikeSuppressed() {
        processor = newProcessor();
        steady(DEVICE, 20).forEach(processor::process);

        processor.processEvent(event(DEVICE, after(20), 95.0, 200.0));
        ProcessingResult repeat = processor.processEvent(event(DEVICE, after(21), 95.0, 200.0));

        assertThat(repeat.hasAnomaly()).isTrue();
        assertThat(repeat.alerts()).isEmpty();
        assertThat(processor.getRecentAlerts(3_600))
                .filteredOn(a -> a.getAlertType().equals("ANOMALY_DETECTED"))
                .hasSize(1);
        assertThat(processor.getProcessorStats().duplicatesSuppressed()).isGreaterThanOrEqualTo(1);
    }

    @Test
    @DisplayName("Replaying the same stream gives identical verdicts and alert ids")
    void deterministicReplay() {
        List<TelemetryEvent> stream = new ArrayList<>(steady(DEVICE, 20));
        stream.add(event(DEVICE, after(20), 125.0, 90.0));
        stream.addAll(steady("well-002", 12));

        List<List<AnomalyVerdict>> first = new ArrayList<>();
        List<List<AnomalyVerdict>> second = new ArrayList<>();
        List<String> firstIds;
        List<String> secondIds;
        try (StreamProcessor a = newProcessor(); StreamProcessor b = newProcessor()) {
            stream.forEach(e -> first.add(a.process(e)));
            stream.forEach(e -> second.add(b.process(e)));
            firstIds = a.getRecentAlerts(86_400).stream().map(Alert::getId).toList();
            secondIds = b.getRecentAlerts(86_400).stream().map(Alert::getId).toList();
        }

        assertThat(first).isEqualTo(second);
        assertThat(firstIds).isNotEmpty().isEqualTo(secondIds);
    }

    // ---------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Invalid events are rejected and counted without touching state")
    void invalidEvents() {
        processor = newProcessor();

        assertThatThrownBy(() -> processor.process(event(DEVICE, 1, Double.NaN, 200)))
                .isInstanceOf(InvalidEventException.class).hasMessageContaining("temperature");
        assertThatThrownBy(() -> processor.process(event(DEVICE, 1, 80, Double.POSITIVE_INFINITY)))
                .isInstanceOf(InvalidEventException.class).hasMessageContaining("pressure");
        assertThatThrownBy(() -> processor.process(event(" ", 1, 80, 200)))
                .isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> processor.process(event(DEVICE, -5, 80, 200)))
                .isInstanceOf(InvalidEventException.class).hasMessageContaining("timestamp");
        assertThatThrownBy(() -> processor.process(null))
                .isInstanceOf(InvalidEventException.class);

        ProcessorStats stats = processor.getProcessorStats();
        assertThat(stats.invalidEvents()).isEqualTo(5);
        assertThat(stats.eventsProcessed()).isZero();
        assertThat(stats.lastProcessed()).isNull();
        assertThat(processor.getDeviceHealth(DEVICE).status()).isEqualTo(HealthStatus.NO_DATA);
    }

    @Test
    @DisplayName("A failing detector degrades its verdict and counts an error")
    void detectorFailure() {
        ScoringModel broken = features -> {
            throw new IllegalStateException("model offline");
        };
        processor = StreamProcessor.builder(config).sink(sink).scoringModel(broken).build();

        List<AnomalyVerdict> last = List.of();
        for (TelemetryEvent e : steady(DEVICE, 12)) {
            last = processor.process(e);
        }

        assertThat(processor.getProcessorStats().processingErrors()).isEqualTo(2);
        assertThat(processor.getProcessorStats().eventsProcessed()).isEqualTo(12);
        assertThat(last).filteredOn(AnomalyVerdict::isDegraded)
                .singleElement()
                .satisfies(v -> assertThat(v.getMethod()).isEqualTo(DetectionMethod.EXTERNAL_MODEL));
        assertThat(last.get(last.size() - 1).isInsufficientData()).isFalse();
    }

    @Test
    @DisplayName("A failing sink counts an error while the other sinks still deliver")
    void sinkFailure() {
        processor = StreamProcessor.builder(config).sink(new FailingAlertSink(true)).sink(sink).build();

        processor.process(event(DEVICE, START, 125.0, 200.0));
        processor.flush(5_000);

        assertThat(sink.getDelivered()).hasSize(1);
        assertThat(processor.getProcessorStats().processingErrors()).isEqualTo(1);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Stats record the processing time from the injected clock")
    void statsUseClock() {
        processor = StreamProcessor.builder(config).sink(sink).clock(Clock.fixed(NOW, ZoneOffset.UTC)).build();

        constant(DEVICE, 3, 80.0, 200.0).forEach(processor::process);

        assertThat(processor.getProcessorStats().eventsProcessed()).isEqualTo(3);
        assertThat(processor.getProcessorStats().lastProcessed()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Health and trend queries reflect the device history")
    void healthAndTrends() {
        processor = newProcessor();
        constant(DEVICE, 10, 80.0, 200.0).forEach(processor::process);

        assertThat(processor.getDeviceHealth(DEVICE).status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(processor.getDeviceHealth(DEVICE).score()).isEqualTo(1.0);
        assertThat(processor.getDeviceHealth("unknown").status()).isEqualTo(HealthStatus.NO_DATA);
        assertThat(processor.analyzeTrends(DEVICE, Metric.TEMPERATURE))
                .hasValueSatisfying(r -> assertThat(r.linear().points()).isEqualTo(10));
        assertThat(processor.analyzeTrends("unknown", Metric.TEMPERATURE)).isEmpty();
    }

    @Test
    @DisplayName("Cancelling an alert goes through to the dispatcher")
    void cancelAlert() {
        processor = newProcessor();
        Alert alert = processor.processEvent(event(DEVICE, START, 125.0, 200.0)).alerts().get(0);

        assertThat(processor.cancelAlert(alert.getId())).isTrue();
        assertThat(processor.cancelAlert("missing")).isFalse();
    }

    // ---------------------------------------------------------------
    // Concurrency and lifecycle
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Concurrent callers on different devices are all processed")
    void concurrentDevices() throws Exception {
        processor = newProcessor();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                String device = "well-" + t;
                futures.add(pool.submit(() -> steady(device, 200).forEach(processor::process)));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(processor.getProcessorStats().eventsProcessed()).isEqualTo(800);
        assertThat(processor.getSystemOverview().totalDevices()).isEqualTo(4);
        assertThat(processor.getDeviceAnalytics("well-2"))
                .hasValueSatisfying(a -> assertThat(a.dataPoints()).isEqualTo(200));
    }

    @Test
    @DisplayName("Submitted events keep their per-device order")
    void submitKeepsOrder() {
        config.setWorkerStripes(2);
        processor = newProcessor();

        List<CompletableFuture<List<AnomalyVerdict>>> futures = new ArrayList<>();
        List<TelemetryEvent> a = steady("well-a", 50);
        List<TelemetryEvent> b = steady("well-b", 50);
        for (int i = 0; i < 50; i++) {
            futures.add(processor.submit(a.get(i)));
            futures.add(processor.submit(b.get(i)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        assertThat(processor.getProcessorStats().eventsProcessed()).isEqualTo(100);
        assertThat(processor.getDeviceAnalytics("well-a")).hasValueSatisfying(analytics -> {
            assertThat(analytics.dataPoints()).isEqualTo(50);
            assertThat(analytics.firstTimestamp()).isEqualTo(START);
            assertThat(analytics.lastTimestamp()).isEqualTo(START + 49 * STEP);
        });
    }

    @Test
    @DisplayName("Invalid submissions fail their future")
    void submitInvalid() {
        config.setWorkerStripes(1);
        processor = newProcessor();

        CompletableFuture<List<AnomalyVerdict>> future = processor.submit(event(DEVICE, 1, Double.NaN, 200));

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(InvalidEventException.class);
        assertThat(processor.getProcessorStats().invalidEvents()).isEqualTo(1);
    }

    @Test
    @DisplayName("submit needs a worker pool")
    void submitWithoutStripes() {
        processor = newProcessor();

        assertThatThrownBy(() -> processor.submit(event(DEVICE, 1, 80, 200)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A full stripe queue rejects further submissions")
    void fullStripeRejects() throws Exception {
        config.setWorkerStripes(1);
        config.setWorkerQueueCapacity(1);
        BlockingScoringModel model = new BlockingScoringModel();
        processor = StreamProcessor.builder(config).sink(sink).scoringModel(model).build();
        List<TelemetryEvent> events = steady(DEVICE, 13);
        events.subList(0, 10).forEach(processor::process);

        try {
            CompletableFuture<List<AnomalyVerdict>> running = processor.submit(events.get(10));
            model.awaitEntered();
            CompletableFuture<List<AnomalyVerdict>> queued = processor.submit(events.get(11));
            CompletableFuture<List<AnomalyVerdict>> rejected = processor.submit(events.get(12));

            assertThat(rejected).isCompletedExceptionally();
            model.release();
            assertThat(running.join()).isNotEmpty();
            assertThat(queued.join()).isNotEmpty();
        } finally {
            model.release();
        }
    }

    @Test
    @DisplayName("A shut-down processor refuses events but still answers queries")
    void shutdownRefusesEvents() {
        config.setWorkerStripes(1);
        processor = newProcessor();
        processor.process(event(DEVICE, START, 80.0, 200.0));

        assertThat(processor.shutdown(5_000)).isTrue();

        assertThat(processor.isShutdown()).isTrue();
        assertThatThrownBy(() -> processor.process(event(DEVICE, after(1), 80.0, 200.0)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> processor.submit(event(DEVICE, after(1), 80.0, 200.0)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(processor.getProcessorStats().eventsProcessed()).isEqualTo(1);
        assertThat(processor.shutdown(5_000)).isTrue();
    }

    @Test
    @DisplayName("Events racing a shutdown are either fully processed or refused before being stored")
    void shutdownDuringProcessing() throws Exception {
        processor = newProcessor();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<RuntimeException>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                String device = "well-" + t;
                futures.add(pool.submit(() -> {
                    for (TelemetryEvent e : constant(device, 2_000, 125.0, 200.0)) {
                        try {
                            processor.process(e);
                        } catch (RuntimeException refused) {
                            return refused;
                        }
                    }
                    return null;
                }));
            }
            while (processor.getProcessorStats().eventsProcessed() < 50) {
                Thread.onSpinWait();
            }
            assertThat(processor.shutdown(5_000)).isTrue();

            for (Future<RuntimeException> f : futures) {
                RuntimeException refused = f.get();
                if (refused != null) {
                    assertThat(refused)
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessage("StreamProcessor is shut down");
                }
            }
        } finally {
            pool.shutdownNow();
        }

        long stored = 0;
        for (int t = 0; t < 4; t++) {
            stored += processor.getDeviceAnalytics("well-" + t).map(DeviceAnalytics::dataPoints).orElse(0);
        }
        assertThat(stored).isEqualTo(processor.getProcessorStats().eventsProcessed());
    }

    @Test
    @DisplayName("Should refuse an invalid configuration at build time")
    void invalidConfig() {
        config.setMinWindow(100);

        assertThatThrownBy(this::newProcessor).isInstanceOf(IllegalStateException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private StreamProcessor newProcessor() {
        return StreamProcessor.builder(config).sink(sink).build();
    }
}
