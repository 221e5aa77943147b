/**
 * Apache Flink streaming job for RigWatch.
 *
 * <p>
 * This package wires the core pipeline into a Flink job that consumes
 * telemetry from Kafka, runs detection per device, and publishes alerts back
 * to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.rigwatch.flink.RigWatchJob}: main entry point</li>
 * <li>{@link com.rigwatch.flink.TelemetryProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.rigwatch.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rigwatch.flink;
