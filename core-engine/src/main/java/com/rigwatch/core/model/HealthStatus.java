package com.rigwatch.core.model;

/**
 * Coarse device health classification derived from the health score.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    CRITICAL,
    NO_DATA
}
