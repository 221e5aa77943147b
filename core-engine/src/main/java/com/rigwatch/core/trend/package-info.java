/**
 * Trend analysis over a device's telemetry window: least-squares fit,
 * autocorrelation seasonality and moving-average direction.
 *
 * @since 1.0.0
 */
package com.rigwatch.core.trend;
