package com.rigwatch.core.config;

import java.io.Serializable;

/**
 * Health score cut-offs: a score strictly above {@code healthy} is HEALTHY,
 * strictly above {@code degraded} is DEGRADED, anything else CRITICAL.
 */
public class HealthThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    private double healthy = 0.7;
    private double degraded = 0.4;

    public double getHealthy() {
        return healthy;
    }

    public void setHealthy(double healthy) {
        this.healthy = healthy;
    }

    public double getDegraded() {
        return degraded;
    }

    public void setDegraded(double degraded) {
        this.degraded = degraded;
    }

    @Override
    public String toString() {
        return "HealthThresholds{healthy=" + healthy + ", degraded=" + degraded + '}';
    }
}
