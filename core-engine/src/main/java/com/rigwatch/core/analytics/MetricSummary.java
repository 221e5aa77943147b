package com.rigwatch.core.analytics;

/**
 * Descriptive statistics of one metric over a device's retained history.
 *
 * @param mean  arithmetic mean
 * @param std   sample standard deviation
 * @param min   smallest value
 * @param max   largest value
 * @param slope least-squares change per second of event time
 */
public record MetricSummary(double mean, double std, double min, double max, double slope) {}
