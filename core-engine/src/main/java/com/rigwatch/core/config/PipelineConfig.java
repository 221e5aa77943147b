package com.rigwatch.core.config;

import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.MetricRule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * windowSize: 24
 * minWindow: 10
 * zscoreThreshold: 3.0
 * voteThreshold: 0.5
 * voteWeights: { statistical: 1.0, ruleBased: 1.0, externalModel: 1.0 }
 * dedupWindowSeconds: 60
 * bufferCapacityPerDevice: 10000
 * healthThresholds: { healthy: 0.7, degraded: 0.4 }
 * metricRules:
 *   - metric: temperature
 *     criticalHigh: 120
 *     criticalLow: 40
 * </pre>
 *
 * <p>
 * One instance is loaded once at start-up and passed to the
 * {@link com.rigwatch.core.processor.StreamProcessor}, whose components copy
 * the values they need. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private int windowSize = 24;
    private int minWindow = 10;
    private double zscoreThreshold = 3.0;
    private double voteThreshold = 0.5;
    private VoteWeights voteWeights = new VoteWeights();
    private int trendWindow = 30;
    private int trendMinPoints = 20;
    private int seasonalMaxLag = 24;
    private int movingAverageWindow = 6;

    // ---------------------------------------------------------------
    // History
    // ---------------------------------------------------------------
    private int bufferCapacityPerDevice = 10_000;

    // ---------------------------------------------------------------
    // Alerting
    // ---------------------------------------------------------------
    private long dedupWindowSeconds = 60;
    private int alertHistoryCapacity = 10_000;
    private long sinkTimeoutMillis = 5_000;
    private int sinkThreads = 4;
    private int sinkQueueCapacity = 1_000;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private HealthThresholds healthThresholds = new HealthThresholds();
    private int healthWindow = 100;
    private long alertLookbackSeconds = 3_600;

    // ---------------------------------------------------------------
    // Worker pool
    // ---------------------------------------------------------------
    private int workerStripes = 4;
    private int workerQueueCapacity = 1_024;

    private List<MetricRule> metricRules = MetricRule.defaults();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every option and metric rule. Collects all errors and throws a
     * single exception if any value is illegal.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowSize < 2) {
            errors.add("'windowSize' must be >= 2, got: " + windowSize);
        }
        if (minWindow < 2) {
            errors.add("'minWindow' must be >= 2, got: " + minWindow);
        }
        if (minWindow > windowSize) {
            errors.add("'minWindow' (" + minWindow + ") must not exceed 'windowSize' (" + windowSize + ")");
        }
        if (zscoreThreshold <= 0) {
            errors.add("'zscoreThreshold' must be > 0, got: " + zscoreThreshold);
        }
        if (voteThreshold <= 0 || voteThreshold > 1) {
            errors.add("'voteThreshold' must be in (0, 1], got: " + voteThreshold);
        }
        if (voteWeights == null) {
            errors.add("'voteWeights' must not be null");
        } else if (voteWeights.getStatistical() < 0 || voteWeights.getRuleBased() < 0
                || voteWeights.getExternalModel() < 0) {
            errors.add("'voteWeights' must be >= 0, got: " + voteWeights);
        }
        if (trendMinPoints < 2 || trendMinPoints > trendWindow) {
            errors.add("'trendMinPoints' must be in [2, trendWindow], got: " + trendMinPoints);
        }
        if (seasonalMaxLag < 2) {
            errors.add("'seasonalMaxLag' must be >= 2, got: " + seasonalMaxLag);
        }
        if (movingAverageWindow < 1) {
            errors.add("'movingAverageWindow' must be >= 1, got: " + movingAverageWindow);
        }
        if (bufferCapacityPerDevice < windowSize + 1) {
            errors.add("'bufferCapacityPerDevice' must be > 'windowSize', got: " + bufferCapacityPerDevice);
        }
        if (dedupWindowSeconds <= 0) {
            errors.add("'dedupWindowSeconds' must be > 0, got: " + dedupWindowSeconds);
        }
        if (alertHistoryCapacity < 1) {
            errors.add("'alertHistoryCapacity' must be >= 1, got: " + alertHistoryCapacity);
        }
        if (sinkTimeoutMillis <= 0) {
            errors.add("'sinkTimeoutMillis' must be > 0, got: " + sinkTimeoutMillis);
        }
        if (sinkThreads < 1 || sinkQueueCapacity < 1) {
            errors.add("'sinkThreads' and 'sinkQueueCapacity' must be >= 1");
        }
        if (healthThresholds == null) {
            errors.add("'healthThresholds' must not be null");
        } else if (healthThresholds.getDegraded() < 0
                || healthThresholds.getDegraded() >= healthThresholds.getHealthy()
                || healthThresholds.getHealthy() > 1) {
            errors.add("'healthThresholds' must satisfy 0 <= degraded < healthy <= 1, got: "
                    + healthThresholds);
        }
        if (healthWindow < 2) {
            errors.add("'healthWindow' must be >= 2, got: " + healthWindow);
        }
        if (alertLookbackSeconds <= 0) {
            errors.add("'alertLookbackSeconds' must be > 0, got: " + alertLookbackSeconds);
        }
        if (workerStripes < 0) {
            errors.add("'workerStripes' must be >= 0 (0 disables the worker pool), got: " + workerStripes);
        }
        if (workerQueueCapacity < 1) {
            errors.add("'workerQueueCapacity' must be >= 1, got: " + workerQueueCapacity);
        }

        for (int i = 0; i < metricRules.size(); i++) {
            MetricRule rule = Objects.requireNonNull(metricRules.get(i),
                    "Metric rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Index the metric rules by metric. When a metric is listed twice the
     * last entry wins.
     *
     * @return unmodifiable map of metric to its rule
     */
    public Map<Metric, MetricRule> metricRulesByMetric() {
        Map<Metric, MetricRule> byMetric = new EnumMap<>(Metric.class);
        for (MetricRule rule : metricRules) {
            byMetric.put(rule.resolveMetric(), rule);
        }
        return Collections.unmodifiableMap(byMetric);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinWindow() {
        return minWindow;
    }

    public void setMinWindow(int minWindow) {
        this.minWindow = minWindow;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getVoteThreshold() {
        return voteThreshold;
    }

    public void setVoteThreshold(double voteThreshold) {
        this.voteThreshold = voteThreshold;
    }

    public VoteWeights getVoteWeights() {
        return voteWeights;
    }

    public void setVoteWeights(VoteWeights voteWeights) {
        this.voteWeights = voteWeights;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public int getTrendMinPoints() {
        return trendMinPoints;
    }

    public void setTrendMinPoints(int trendMinPoints) {
        this.trendMinPoints = trendMinPoints;
    }

    public int getSeasonalMaxLag() {
        return seasonalMaxLag;
    }

    public void setSeasonalMaxLag(int seasonalMaxLag) {
        this.seasonalMaxLag = seasonalMaxLag;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }

    public void setMovingAverageWindow(int movingAverageWindow) {
        this.movingAverageWindow = movingAverageWindow;
    }

    public int getBufferCapacityPerDevice() {
        return bufferCapacityPerDevice;
    }

    public void setBufferCapacityPerDevice(int bufferCapacityPerDevice) {
        this.bufferCapacityPerDevice = bufferCapacityPerDevice;
    }

    public long getDedupWindowSeconds() {
        return dedupWindowSeconds;
    }

    public void setDedupWindowSeconds(long dedupWindowSeconds) {
        this.dedupWindowSeconds = dedupWindowSeconds;
    }

    public int getAlertHistoryCapacity() {
        return alertHistoryCapacity;
    }

    public void setAlertHistoryCapacity(int alertHistoryCapacity) {
        this.alertHistoryCapacity = alertHistoryCapacity;
    }

    public long getSinkTimeoutMillis() {
        return sinkTimeoutMillis;
    }

    public void setSinkTimeoutMillis(long sinkTimeoutMillis) {
        this.sinkTimeoutMillis = sinkTimeoutMillis;
    }

    public int getSinkThreads() {
        return sinkThreads;
    }

    public void setSinkThreads(int sinkThreads) {
        this.sinkThreads = sinkThreads;
    }

    public int getSinkQueueCapacity() {
        return sinkQueueCapacity;
    }

    public void setSinkQueueCapacity(int sinkQueueCapacity) {
        this.sinkQueueCapacity = sinkQueueCapacity;
    }

    public HealthThresholds getHealthThresholds() {
        return healthThresholds;
    }

    public void setHealthThresholds(HealthThresholds healthThresholds) {
        this.healthThresholds = healthThresholds;
    }

    public int getHealthWindow() {
        return healthWindow;
    }

    public void setHealthWindow(int healthWindow) {
        this.healthWindow = healthWindow;
    }

    public long getAlertLookbackSeconds() {
        return alertLookbackSeconds;
    }

    public void setAlertLookbackSeconds(long alertLookbackSeconds) {
        this.alertLookbackSeconds = alertLookbackSeconds;
    }

    public int getWorkerStripes() {
        return workerStripes;
    }

    public void setWorkerStripes(int workerStripes) {
        this.workerStripes = workerStripes;
    }

    public int getWorkerQueueCapacity() {
        return workerQueueCapacity;
    }

    public void setWorkerQueueCapacity(int workerQueueCapacity) {
        this.workerQueueCapacity = workerQueueCapacity;
    }

    /**
     * @return unmodifiable list of metric rules
     */
    public List<MetricRule> getMetricRules() {
        return Collections.unmodifiableList(metricRules);
    }

    /**
     * Set the metric rules (used by SnakeYAML during deserialization).
     * {@code null} restores the defaults.
     *
     * @param metricRules the metric rules
     */
    public void setMetricRules(List<MetricRule> metricRules) {
        this.metricRules = metricRules != null ? new ArrayList<>(metricRules) : MetricRule.defaults();
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "windowSize=" + windowSize +
                ", minWindow=" + minWindow +
                ", zscoreThreshold=" + zscoreThreshold +
                ", voteThreshold=" + voteThreshold +
                ", voteWeights=" + voteWeights +
                ", dedupWindowSeconds=" + dedupWindowSeconds +
                ", bufferCapacityPerDevice=" + bufferCapacityPerDevice +
                ", healthThresholds=" + healthThresholds +
                ", metricRules=" + metricRules +
                '}';
    }
}
