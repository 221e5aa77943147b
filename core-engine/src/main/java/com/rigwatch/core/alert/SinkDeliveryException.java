package com.rigwatch.core.alert;

/**
 * A sink failed to deliver an alert: it threw, returned {@code false}, timed
 * out or was rejected by the full sink pool.
 */
public class SinkDeliveryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String sink;
    private final String alertId;

    public SinkDeliveryException(String sink, String alertId, String message, Throwable cause) {
        super("Sink [" + sink + "] failed to deliver alert " + alertId + ": " + message, cause);
        this.sink = sink;
        this.alertId = alertId;
    }

    public String getSink() {
        return sink;
    }

    public String getAlertId() {
        return alertId;
    }
}
