package com.rigwatch.core.detection;

/**
 * Thrown by a detector whose device history is below its minimum window.
 *
 * <p>
 * Non-fatal: the processor converts it into a "not an anomaly" verdict with
 * method {@link com.rigwatch.core.model.DetectionMethod#INSUFFICIENT_DATA}
 * and does not count it as a processing error.
 * </p>
 */
public class InsufficientDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String detector;
    private final int required;
    private final int available;

    public InsufficientDataException(String detector, int required, int available) {
        super("Detector [" + detector + "] needs " + required + " points, history has " + available);
        this.detector = detector;
        this.required = required;
        this.available = available;
    }

    public String getDetector() {
        return detector;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
