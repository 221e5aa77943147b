package com.rigwatch.core.analytics;

import com.rigwatch.core.model.DeviceHealth;
import com.rigwatch.core.model.ProcessorStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fleet-wide snapshot.
 *
 * @param totalDevices   devices with retained history
 * @param healthyDevices devices whose status is HEALTHY
 * @param systemHealth   {@code healthyDevices / totalDevices}, 0 without devices
 * @param recentAlerts   alerts raised in the last hour of stream time
 * @param criticalAlerts CRITICAL alerts among {@code recentAlerts}
 * @param stats          processor counters
 * @param devices        health per device, ordered by device id
 */
public record SystemOverview(
        int totalDevices,
        int healthyDevices,
        double systemHealth,
        int recentAlerts,
        int criticalAlerts,
        ProcessorStats stats,
        Map<String, DeviceHealth> devices
) {

    public SystemOverview {
        devices = Collections.unmodifiableMap(new LinkedHashMap<>(devices));
    }
}
