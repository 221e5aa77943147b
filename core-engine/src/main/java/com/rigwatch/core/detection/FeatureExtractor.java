package com.rigwatch.core.detection;

import com.rigwatch.core.history.WindowStats;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.TelemetryEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the feature map handed to a {@link ScoringModel}.
 *
 * <p>
 * Per metric ({@code m} = {@link Metric#key()}):
 * {@code m}, {@code m_rolling_mean}, {@code m_rolling_std} (sample),
 * {@code m_z_score} and {@code m_rate_of_change} (difference to the previous
 * reading). Plus {@code temp_pressure_ratio}. Keys are emitted in a fixed
 * order.
 * </p>
 */
public final class FeatureExtractor {

    public static final String TEMP_PRESSURE_RATIO = "temp_pressure_ratio";

    private static final double EPSILON = 1e-8;

    /**
     * @param event    the current event
     * @param baseline readings preceding {@code event}, oldest first
     * @return feature map
     */
    public Map<String, Double> extract(TelemetryEvent event, List<TelemetryEvent> baseline) {
        Map<String, Double> features = new LinkedHashMap<>();
        TelemetryEvent previous = baseline.isEmpty() ? null : baseline.get(baseline.size() - 1);

        for (Metric metric : Metric.values()) {
            String key = metric.key();
            double value = event.valueOf(metric);
            double[] values = WindowStats.values(baseline, metric);
            double mean = values.length == 0 ? value : WindowStats.mean(values);
            double std = WindowStats.sampleStdDev(values);

            features.put(key, value);
            features.put(key + "_rolling_mean", mean);
            features.put(key + "_rolling_std", std);
            features.put(key + "_z_score", (value - mean) / (std + EPSILON));
            features.put(key + "_rate_of_change", previous == null ? 0.0 : value - previous.valueOf(metric));
        }
        features.put(TEMP_PRESSURE_RATIO, event.getTemperature() / (event.getPressure() + EPSILON));
        return features;
    }
}
