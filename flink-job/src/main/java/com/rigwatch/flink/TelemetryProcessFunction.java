package com.rigwatch.flink;

import com.rigwatch.core.alert.LoggingAlertSink;
import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.detection.ScoringModel;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.TelemetryEvent;
import com.rigwatch.core.processor.InvalidEventException;
import com.rigwatch.core.processor.ProcessingResult;
import com.rigwatch.core.processor.StreamProcessor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs the RigWatch pipeline for
 * events keyed by device id.
 *
 * <p>
 * Each parallel instance owns one {@link StreamProcessor}, built in
 * {@link #open(Configuration)}. Flink routes all events of a device to the
 * same instance, so the processor's per-device history sees the device's
 * complete stream. Dispatched alerts are emitted downstream; they are also
 * logged through a {@link LoggingAlertSink}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Device histories live in the processor's memory and are not part of
 * Flink checkpoints. After a restore each device goes through the detector
 * warm-up window again.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetryProcessFunction
        extends KeyedProcessFunction<String, TelemetryEvent, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryProcessFunction.class);

    private static final long SHUTDOWN_TIMEOUT_MILLIS = 10_000L;

    /** Pipeline settings (serializable config, not runtime state). */
    private final PipelineConfig pipelineConfig;

    /** Optional offline-trained model; {@code null} disables the model detector. */
    private final ScoringModel scoringModel;

    private transient StreamProcessor processor;
    private transient PipelineMetrics metrics;

    /**
     * @param pipelineConfig validated pipeline configuration
     * @param scoringModel   serializable scoring model, or {@code null}
     */
    public TelemetryProcessFunction(PipelineConfig pipelineConfig, ScoringModel scoringModel) {
        this.pipelineConfig = Objects.requireNonNull(pipelineConfig, "PipelineConfig must not be null");
        if (scoringModel != null && !(scoringModel instanceof Serializable)) {
            throw new IllegalArgumentException("ScoringModel must be Serializable to ship with the job");
        }
        this.scoringModel = scoringModel;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        // Flink already runs one thread per subtask
        pipelineConfig.setWorkerStripes(0);
        processor = StreamProcessor.builder(pipelineConfig)
                .sink(new LoggingAlertSink())
                .scoringModel(scoringModel)
                .build();
        metrics = new PipelineMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("TelemetryProcessFunction opened (subtask {}, model {})",
                getRuntimeContext().getIndexOfThisSubtask(), scoringModel != null ? "enabled" : "disabled");
    }

    @Override
    public void close() {
        if (processor != null) {
            boolean drained = processor.shutdown(SHUTDOWN_TIMEOUT_MILLIS);
            LOG.info("TelemetryProcessFunction closed (drained={}, stats={})",
                    drained, processor.getProcessorStats());
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(TelemetryEvent event,
            KeyedProcessFunction<String, TelemetryEvent, Alert>.Context ctx,
            Collector<Alert> out) {
        long startNanos = System.nanoTime();

        ProcessingResult result;
        try {
            result = processor.processEvent(event);
        } catch (InvalidEventException e) {
            metrics.incrementInvalidEvents();
            LOG.warn("Dropping invalid event for key [{}]: {}", ctx.getCurrentKey(), e.getMessage());
            return;
        }

        long anomalies = result.verdicts().stream().filter(AnomalyVerdict::isAnomaly).count();
        metrics.incrementAnomaliesDetected(anomalies);
        for (Alert alert : result.alerts()) {
            out.collect(alert);
        }
        metrics.incrementAlertsDispatched(result.alerts().size());

        metrics.incrementEventsProcessed();
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }
}
