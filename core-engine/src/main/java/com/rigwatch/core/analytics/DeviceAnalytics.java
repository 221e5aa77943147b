package com.rigwatch.core.analytics;

import com.rigwatch.core.model.Metric;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-device analytics over the retained history.
 *
 * @param deviceId       the device
 * @param dataPoints     readings retained
 * @param firstTimestamp oldest retained reading
 * @param lastTimestamp  newest retained reading
 * @param metrics        summary per metric
 * @param alertCount     alerts raised for the device in the last 24 hours
 * @param alertTypes     those alerts counted by type
 */
public record DeviceAnalytics(
        String deviceId,
        int dataPoints,
        double firstTimestamp,
        double lastTimestamp,
        Map<Metric, MetricSummary> metrics,
        int alertCount,
        Map<String, Integer> alertTypes
) {

    public DeviceAnalytics {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        alertTypes = Collections.unmodifiableMap(new LinkedHashMap<>(alertTypes));
    }

    public double timeSpanSeconds() {
        return lastTimestamp - firstTimestamp;
    }
}
