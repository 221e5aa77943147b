package com.rigwatch.core.trend;

import com.rigwatch.core.model.Metric;

/**
 * Linear, seasonal and moving-average analysis of one metric of a device.
 */
public record TrendReport(
        String deviceId,
        Metric metric,
        LinearTrend linear,
        Seasonality seasonality,
        MovingAverageTrend movingAverage
) {}
