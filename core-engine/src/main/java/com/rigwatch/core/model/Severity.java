package com.rigwatch.core.model;

/**
 * Alert severity, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @param other severity to compare against
     * @return the more severe of {@code this} and {@code other}
     */
    public Severity max(Severity other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
