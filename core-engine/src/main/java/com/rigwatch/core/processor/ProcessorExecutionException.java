package com.rigwatch.core.processor;

/**
 * A detector failed while processing an event. The processor logs it,
 * replaces the detector's verdict with a degraded one and continues.
 */
public class ProcessorExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String detector;
    private final String deviceId;

    public ProcessorExecutionException(String detector, String deviceId, Throwable cause) {
        super("Detector [" + detector + "] failed for device [" + deviceId + "]: " + cause.getMessage(), cause);
        this.detector = detector;
        this.deviceId = deviceId;
    }

    public String getDetector() {
        return detector;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
