package com.rigwatch.core.alert;

import com.rigwatch.core.model.Alert;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sink whose every delivery fails, either by throwing or by returning
 * {@code false}.
 */
public class FailingAlertSink implements AlertSink {

    private final boolean throwOnSend;
    private final AtomicInteger attempts = new AtomicInteger();

    public FailingAlertSink(boolean throwOnSend) {
        this.throwOnSend = throwOnSend;
    }

    @Override
    public boolean send(Alert alert) {
        attempts.incrementAndGet();
        if (throwOnSend) {
            throw new IllegalStateException("smtp relay unavailable");
        }
        return false;
    }

    public int getAttempts() {
        return attempts.get();
    }

    @Override
    public String getName() {
        return throwOnSend ? "throwing" : "refusing";
    }
}
