package com.rigwatch.core.model;

import java.time.Instant;

/**
 * Immutable snapshot of the processor's lifetime counters.
 *
 * <p>
 * Counters never decrease between snapshots taken from the same processor.
 * {@code lastProcessed} is {@code null} until the first event is processed.
 * </p>
 *
 * @param eventsProcessed      events that passed validation and ran the pipeline
 * @param alertsGenerated      alerts dispatched (after deduplication)
 * @param processingErrors     detector failures plus failed sink deliveries
 * @param duplicatesSuppressed alerts dropped by deduplication
 * @param invalidEvents        events rejected at the ingestion boundary
 * @param lastProcessed        wall-clock time of the last processed event
 */
public record ProcessorStats(
        long eventsProcessed,
        long alertsGenerated,
        long processingErrors,
        long duplicatesSuppressed,
        long invalidEvents,
        Instant lastProcessed
) {}
