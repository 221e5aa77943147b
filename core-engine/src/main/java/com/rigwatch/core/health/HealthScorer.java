package com.rigwatch.core.health;

import com.rigwatch.core.config.HealthThresholds;
import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.history.WindowStats;
import com.rigwatch.core.model.DeviceHealth;
import com.rigwatch.core.model.HealthStatus;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.MetricRule;
import com.rigwatch.core.model.TelemetryEvent;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores device health from reading stability and recent alert volume.
 *
 * <p>
 * Over the last {@code healthWindow} readings, each metric's stability is
 * {@code clamp(1 - sampleStd / stabilityStdLimit)}. The score is the mean
 * stability minus an alert penalty of {@value #PENALTY_PER_ALERT} per recent
 * alert, capped at {@value #MAX_ALERT_PENALTY}, clamped to {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthScorer {

    static final double PENALTY_PER_ALERT = 0.1;
    static final double MAX_ALERT_PENALTY = 0.5;

    private final int window;
    private final HealthThresholds thresholds;
    private final Map<Metric, Double> stdLimits = new EnumMap<>(Metric.class);

    public HealthScorer(PipelineConfig config) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.window = config.getHealthWindow();
        this.thresholds = config.getHealthThresholds();
        Map<Metric, MetricRule> rules = config.metricRulesByMetric();
        for (Metric metric : Metric.values()) {
            MetricRule rule = rules.get(metric);
            stdLimits.put(metric, rule != null ? rule.getStabilityStdLimit() : new MetricRule().getStabilityStdLimit());
        }
    }

    /**
     * @param deviceId     the device
     * @param history      its history, or {@code null} if it never reported
     * @param recentAlerts alerts raised for the device within the lookback
     * @return the device's health
     */
    public DeviceHealth score(String deviceId, DeviceHistory history, int recentAlerts) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        if (history == null || history.size() == 0) {
            return DeviceHealth.noData(deviceId);
        }
        List<TelemetryEvent> events = history.recent(window);

        double temperatureStd = WindowStats.sampleStdDev(WindowStats.values(events, Metric.TEMPERATURE));
        double pressureStd = WindowStats.sampleStdDev(WindowStats.values(events, Metric.PRESSURE));
        double stability = (stability(temperatureStd, Metric.TEMPERATURE)
                + stability(pressureStd, Metric.PRESSURE)) / 2.0;

        double penalty = Math.min(MAX_ALERT_PENALTY, recentAlerts * PENALTY_PER_ALERT);
        double score = clamp(stability - penalty);

        return new DeviceHealth(deviceId, status(score), score, temperatureStd, pressureStd,
                recentAlerts, events.get(events.size() - 1).getTimestamp());
    }

    HealthStatus status(double score) {
        if (score > thresholds.getHealthy()) {
            return HealthStatus.HEALTHY;
        }
        if (score > thresholds.getDegraded()) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.CRITICAL;
    }

    private double stability(double std, Metric metric) {
        return clamp(1.0 - std / stdLimits.get(metric));
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
