/**
 * Domain model classes for RigWatch.
 *
 * <p>
 * Data types shared between the history, detection, alerting and health
 * components:
 * </p>
 * <ul>
 * <li>{@link com.rigwatch.core.model.TelemetryEvent}: one device reading</li>
 * <li>{@link com.rigwatch.core.model.AnomalyVerdict}: detector outcome</li>
 * <li>{@link com.rigwatch.core.model.Alert}: dispatched alert</li>
 * <li>{@link com.rigwatch.core.model.MetricRule}: per-metric limits
 * POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rigwatch.core.model;
