package com.rigwatch.core.trend;

/**
 * Least-squares line fitted to a series.
 *
 * @param points     number of points fitted
 * @param slope      change of value per unit of x
 * @param intercept  value at x = 0
 * @param rSquared   coefficient of determination
 * @param direction  {@link TrendDirection#STABLE} when {@code |slope| < 0.01}
 * @param confidence bucketed from {@code rSquared}
 */
public record LinearTrend(
        int points,
        double slope,
        double intercept,
        double rSquared,
        TrendDirection direction,
        TrendConfidence confidence
) {

    static LinearTrend insufficient(int points) {
        return new LinearTrend(points, 0.0, 0.0, 0.0,
                TrendDirection.INSUFFICIENT_DATA, TrendConfidence.NONE);
    }

    public boolean isSufficient() {
        return direction != TrendDirection.INSUFFICIENT_DATA;
    }
}
