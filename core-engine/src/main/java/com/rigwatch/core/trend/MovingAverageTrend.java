package com.rigwatch.core.trend;

import java.util.List;

/**
 * Windowed moving average with a recent-versus-earlier comparison.
 *
 * @param window        averaging window in points
 * @param averages      sliding-window means, oldest first
 * @param recentMean    mean of the last {@code window} values
 * @param earlierMean   mean of the {@code window} values before those
 * @param changeRatio   {@code (recentMean - earlierMean) / |earlierMean|}
 * @param direction     INCREASING / DECREASING beyond ±5 %, otherwise STABLE
 */
public record MovingAverageTrend(
        int window,
        List<Double> averages,
        double recentMean,
        double earlierMean,
        double changeRatio,
        TrendDirection direction
) {

    static MovingAverageTrend insufficient(int window) {
        return new MovingAverageTrend(window, List.of(), 0.0, 0.0, 0.0,
                TrendDirection.INSUFFICIENT_DATA);
    }

    public boolean isSufficient() {
        return direction != TrendDirection.INSUFFICIENT_DATA;
    }
}
