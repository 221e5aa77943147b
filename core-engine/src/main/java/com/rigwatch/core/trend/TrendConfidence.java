package com.rigwatch.core.trend;

/**
 * Confidence of a linear fit, bucketed from its R².
 */
public enum TrendConfidence {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    static TrendConfidence fromRSquared(double rSquared) {
        if (rSquared > 0.7) {
            return HIGH;
        }
        if (rSquared > 0.3) {
            return MEDIUM;
        }
        return LOW;
    }
}
