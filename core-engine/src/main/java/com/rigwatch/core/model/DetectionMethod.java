package com.rigwatch.core.model;

/**
 * Signal that produced an {@link AnomalyVerdict}.
 */
public enum DetectionMethod {
    STATISTICAL,
    RULE_BASED,
    EXTERNAL_MODEL,
    TREND,
    ENSEMBLE,
    /** Not enough history to evaluate; never an anomaly. */
    INSUFFICIENT_DATA
}
