package com.rigwatch.core.alert;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Sliding-window suppression per (device, alert type), in event time.
 *
 * <p>
 * An alert is admitted when no alert of the same key was admitted less than
 * {@code windowSeconds} earlier. Admitting an alert suppresses its key until
 * {@code timestamp + windowSeconds}. Each device keeps its own event-time
 * watermark, and an entry is evicted only once its own device's watermark
 * has passed its suppression time, so a device running ahead never expires
 * another device's entries. Cleanup runs at most once per window. All
 * methods are synchronized; one instance is shared across devices.
 * </p>
 */
public class AlertDeduplicator {

    private final double windowSeconds;
    private final Map<Key, Double> suppressedUntil = new HashMap<>();
    private final Map<String, Double> deviceWatermarks = new HashMap<>();
    private double lastCleanup = Double.NEGATIVE_INFINITY;

    public AlertDeduplicator(long windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Dedup window must be > 0 seconds, got: " + windowSeconds);
        }
        this.windowSeconds = windowSeconds;
    }

    /**
     * Admit or suppress an alert, recording it when admitted.
     *
     * @return {@code true} if the alert should be dispatched
     */
    public synchronized boolean tryAcquire(String deviceId, String alertType, double timestamp) {
        deviceWatermarks.merge(deviceId, timestamp, Math::max);
        if (timestamp - lastCleanup >= windowSeconds) {
            cleanup();
            lastCleanup = timestamp;
        }
        Key key = new Key(deviceId, alertType);
        Double until = suppressedUntil.get(key);
        if (until != null && timestamp < until) {
            return false;
        }
        suppressedUntil.put(key, timestamp + windowSeconds);
        return true;
    }

    /**
     * Suppress the key until at least {@code until}.
     */
    public synchronized void suppress(String deviceId, String alertType, double until) {
        suppressedUntil.merge(new Key(deviceId, alertType), until, Math::max);
    }

    /**
     * Drop entries whose suppression ended at or before their device's
     * watermark.
     */
    public synchronized void cleanup() {
        Iterator<Map.Entry<Key, Double>> it = suppressedUntil.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Key, Double> entry = it.next();
            Double watermark = deviceWatermarks.get(entry.getKey().deviceId());
            if (watermark != null && entry.getValue() <= watermark) {
                it.remove();
            }
        }
    }

    public synchronized int size() {
        return suppressedUntil.size();
    }

    public double getWindowSeconds() {
        return windowSeconds;
    }

    private record Key(String deviceId, String alertType) {
        private Key {
            Objects.requireNonNull(deviceId, "deviceId must not be null");
            Objects.requireNonNull(alertType, "alertType must not be null");
        }
    }
}
