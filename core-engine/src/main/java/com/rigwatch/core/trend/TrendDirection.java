package com.rigwatch.core.trend;

/**
 * Direction of a fitted or averaged trend.
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    INSUFFICIENT_DATA
}
