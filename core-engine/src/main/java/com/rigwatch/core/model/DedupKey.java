package com.rigwatch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Deduplication identity of an {@link Alert}: device, alert type and the
 * dedup time bucket the alert falls into.
 *
 * @param deviceId   originating device
 * @param alertType  alert type
 * @param timeBucket {@code floor(timestamp / dedupWindowSeconds)}
 */
public record DedupKey(String deviceId, String alertType, long timeBucket) implements Serializable {

    public DedupKey {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(alertType, "alertType must not be null");
    }

    /**
     * Compute the key for an alert raised at {@code timestamp}.
     *
     * @param deviceId      device id
     * @param alertType     alert type
     * @param timestamp     event time in epoch seconds
     * @param windowSeconds dedup window length; must be &gt; 0
     * @return the dedup key
     */
    public static DedupKey of(String deviceId, String alertType, double timestamp, long windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
        }
        return new DedupKey(deviceId, alertType, (long) Math.floor(timestamp / windowSeconds));
    }
}
