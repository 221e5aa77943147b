package com.rigwatch.core.detection;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.history.WindowStats;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Z-score outlier detector.
 *
 * <p>
 * For every {@link Metric}, the new value is compared with the population
 * mean and standard deviation of the {@code windowSize} readings that precede
 * it: {@code z = |value - mean| / (std + 1e-8)}. The detector fires when any
 * metric's z-score exceeds {@code zscoreThreshold}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * With fewer than {@code minWindow} preceding readings the detector throws
 * {@link InsufficientDataException}.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetector.class);

    public static final String NAME = "statistical";
    public static final String ALERT_TYPE = "ANOMALY_DETECTED";

    static final double EPSILON = 1e-8;

    private final int windowSize;
    private final int minWindow;
    private final double threshold;

    /**
     * @param config pipeline configuration
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public StatisticalDetector(PipelineConfig config) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.windowSize = config.getWindowSize();
        this.minWindow = config.getMinWindow();
        this.threshold = config.getZscoreThreshold();
        if (minWindow < 2 || windowSize < minWindow) {
            throw new IllegalArgumentException("Statistical detector requires 2 <= minWindow <= windowSize, got "
                    + minWindow + " and " + windowSize);
        }
    }

    @Override
    public Optional<AnomalyVerdict> evaluate(TelemetryEvent event, DeviceHistory history) {
        Objects.requireNonNull(event, "Event must not be null");
        Objects.requireNonNull(history, "History must not be null");

        List<TelemetryEvent> baseline = Baselines.preceding(event, history, windowSize);
        if (baseline.size() < minWindow) {
            throw new InsufficientDataException(NAME, minWindow, baseline.size());
        }

        AnomalyVerdict.Builder verdict = AnomalyVerdict.builder(NAME, DetectionMethod.STATISTICAL)
                .alertType(ALERT_TYPE);
        double maxZ = 0;
        boolean fired = false;

        for (Metric metric : Metric.values()) {
            double[] values = WindowStats.values(baseline, metric);
            double mean = WindowStats.mean(values);
            double std = WindowStats.populationStdDev(values);
            double value = event.valueOf(metric);
            double z = Math.abs(value - mean) / (std + EPSILON);

            verdict.detail(metric.key() + "_z_score", z);
            maxZ = Math.max(maxZ, z);

            if (z > threshold) {
                fired = true;
                verdict.reason(String.format(Locale.ROOT,
                        "%s z-score %.2f exceeds %.1f (value=%.2f, mean=%.2f, std=%.2f)",
                        metric.key(), z, threshold, value, mean, std));
            }
        }

        if (fired) {
            LOG.debug("Detector [{}] fired for device [{}]: maxZ={}", NAME, event.getDeviceId(), maxZ);
        }

        return Optional.of(verdict
                .anomaly(fired)
                .score(Math.min(1.0, maxZ / (2 * threshold)))
                .severity(maxZ > threshold + 1 ? Severity.HIGH : Severity.MEDIUM)
                .build());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.STATISTICAL;
    }
}
