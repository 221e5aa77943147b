package com.rigwatch.core.detection;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.history.WindowStats;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.MetricRule;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import com.rigwatch.core.trend.LinearTrend;
import com.rigwatch.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flags sustained drift: the per-reading least-squares slope over the last
 * {@code trendWindow} readings (current one included) exceeds the metric's
 * {@code trendSlopeLimit}.
 *
 * <p>
 * Needs at least {@code trendMinPoints} readings. Alert type
 * {@code <METRIC>_TREND}, severity MEDIUM. Not part of the ensemble vote.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(TrendDetector.class);

    public static final String NAME = "trend";

    private final int trendWindow;
    private final int minPoints;
    private final Map<Metric, MetricRule> rules;
    private final TrendAnalyzer analyzer;

    public TrendDetector(PipelineConfig config) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.trendWindow = config.getTrendWindow();
        this.minPoints = config.getTrendMinPoints();
        this.rules = config.metricRulesByMetric();
        this.analyzer = new TrendAnalyzer(config.getSeasonalMaxLag(), config.getMovingAverageWindow());
    }

    @Override
    public Optional<AnomalyVerdict> evaluate(TelemetryEvent event, DeviceHistory history) {
        Objects.requireNonNull(event, "Event must not be null");
        Objects.requireNonNull(history, "History must not be null");

        List<TelemetryEvent> window = history.recent(trendWindow);
        if (window.size() < minPoints) {
            throw new InsufficientDataException(NAME, minPoints, window.size());
        }

        AnomalyVerdict.Builder verdict = AnomalyVerdict.builder(NAME, DetectionMethod.TREND)
                .severity(Severity.MEDIUM);
        String alertType = null;
        double score = 0;

        for (Map.Entry<Metric, MetricRule> entry : rules.entrySet()) {
            Double limit = entry.getValue().getTrendSlopeLimit();
            if (limit == null) {
                continue;
            }
            Metric metric = entry.getKey();
            LinearTrend trend = analyzer.linear(WindowStats.values(window, metric));
            double slope = trend.slope();
            verdict.detail(metric.key() + "_slope", slope);

            if (Math.abs(slope) > limit) {
                if (alertType == null) {
                    alertType = metric.name() + "_TREND";
                }
                score = Math.max(score, Math.min(1.0, Math.abs(slope) / (2 * limit)));
                verdict.reason(String.format(Locale.ROOT, "%s trend %+.3f per reading (%s, limit %.2f)",
                        metric.key(), slope, trend.direction(), limit));
            }
        }

        if (alertType != null) {
            LOG.debug("Detector [{}] fired for device [{}]: {}", NAME, event.getDeviceId(), alertType);
        }
        return Optional.of(verdict
                .anomaly(alertType != null)
                .score(score)
                .alertType(alertType)
                .build());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.TREND;
    }
}
