package com.rigwatch.core.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of per-device histories. A history is created on a device's
 * first ingested event and lives for the lifetime of the store.
 */
public class DeviceHistoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(DeviceHistoryStore.class);

    private final ConcurrentMap<String, DeviceHistory> histories = new ConcurrentHashMap<>();
    private final int capacityPerDevice;

    /**
     * @param capacityPerDevice ring buffer size for each device; must be &gt; 0
     */
    public DeviceHistoryStore(int capacityPerDevice) {
        if (capacityPerDevice <= 0) {
            throw new IllegalArgumentException(
                    "capacityPerDevice must be > 0, got: " + capacityPerDevice);
        }
        this.capacityPerDevice = capacityPerDevice;
    }

    /**
     * Return the device's history, creating it if this is the first event.
     *
     * @param deviceId device id; must not be {@code null}
     * @return the device history
     */
    public DeviceHistory getOrCreate(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        return histories.computeIfAbsent(deviceId, id -> {
            LOG.debug("Creating history for device [{}] with capacity {}", id, capacityPerDevice);
            return new DeviceHistory(id, capacityPerDevice);
        });
    }

    /**
     * @param deviceId device id
     * @return the device history, or empty if the device never reported
     */
    public Optional<DeviceHistory> find(String deviceId) {
        return Optional.ofNullable(histories.get(deviceId));
    }

    /**
     * @return sorted snapshot of known device ids
     */
    public List<String> deviceIds() {
        return histories.keySet().stream().sorted().toList();
    }

    public int deviceCount() {
        return histories.size();
    }

    public int getCapacityPerDevice() {
        return capacityPerDevice;
    }
}
