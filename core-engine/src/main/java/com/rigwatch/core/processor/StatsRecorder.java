package com.rigwatch.core.processor;

import com.rigwatch.core.alert.DispatchMetrics;
import com.rigwatch.core.alert.SinkDeliveryException;
import com.rigwatch.core.model.ProcessorStats;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifetime counters of a {@link StreamProcessor}. Counters only grow.
 */
public class StatsRecorder implements DispatchMetrics {

    private final Clock clock;

    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong alertsGenerated = new AtomicLong();
    private final AtomicLong processingErrors = new AtomicLong();
    private final AtomicLong duplicatesSuppressed = new AtomicLong();
    private final AtomicLong invalidEvents = new AtomicLong();
    private final AtomicReference<Instant> lastProcessed = new AtomicReference<>();

    public StatsRecorder() {
        this(Clock.systemUTC());
    }

    public StatsRecorder(Clock clock) {
        this.clock = clock;
    }

    public void onEventProcessed() {
        eventsProcessed.incrementAndGet();
        lastProcessed.set(clock.instant());
    }

    public void onInvalidEvent() {
        invalidEvents.incrementAndGet();
    }

    public void onProcessingError() {
        processingErrors.incrementAndGet();
    }

    @Override
    public void onAlertDispatched() {
        alertsGenerated.incrementAndGet();
    }

    @Override
    public void onDuplicateSuppressed() {
        duplicatesSuppressed.incrementAndGet();
    }

    @Override
    public void onSinkFailure(SinkDeliveryException failure) {
        processingErrors.incrementAndGet();
    }

    /* ---------- Snapshot ---------- */

    public ProcessorStats snapshot() {
        return new ProcessorStats(
                eventsProcessed.get(),
                alertsGenerated.get(),
                processingErrors.get(),
                duplicatesSuppressed.get(),
                invalidEvents.get(),
                lastProcessed.get()
        );
    }
}
