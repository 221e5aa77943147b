package com.rigwatch.core.model;

/**
 * Health summary for one device.
 *
 * @param deviceId             device id
 * @param status               status derived from {@code score}
 * @param score                health score in {@code [0, 1]}
 * @param temperatureStability sample standard deviation of temperature over
 *                             the health window
 * @param pressureStability    sample standard deviation of pressure over the
 *                             health window
 * @param recentAlerts         alerts raised for the device within the lookback
 * @param lastSeen             timestamp of the newest reading, {@code null}
 *                             when the device has no history
 */
public record DeviceHealth(
        String deviceId,
        HealthStatus status,
        double score,
        double temperatureStability,
        double pressureStability,
        int recentAlerts,
        Double lastSeen
) {

    /**
     * Health of a device that has never reported.
     */
    public static DeviceHealth noData(String deviceId) {
        return new DeviceHealth(deviceId, HealthStatus.NO_DATA, 0.0, 0.0, 0.0, 0, null);
    }
}
