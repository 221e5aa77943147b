package com.rigwatch.core.alert;

import com.rigwatch.core.model.Alert;

/**
 * Outbound alert channel (console, email, SMS, webhook, ...).
 *
 * <p>
 * Called from the dispatcher's sink pool, possibly concurrently.
 * Implementations must be thread-safe. Returning {@code false} or throwing
 * counts as a failed delivery.
 * </p>
 */
@FunctionalInterface
public interface AlertSink {

    /**
     * @param alert the alert to deliver
     * @return {@code true} if the alert was delivered
     */
    boolean send(Alert alert);

    /**
     * @return name used in logs
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
