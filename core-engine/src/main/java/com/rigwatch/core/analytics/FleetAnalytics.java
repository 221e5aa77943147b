package com.rigwatch.core.analytics;

import com.rigwatch.core.alert.AlertDispatcher;
import com.rigwatch.core.health.HealthScorer;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.history.DeviceHistoryStore;
import com.rigwatch.core.history.WindowStats;
import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.DeviceHealth;
import com.rigwatch.core.model.HealthStatus;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.ProcessorStats;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import com.rigwatch.core.trend.TrendAnalyzer;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only views over the device histories and the retained alerts.
 *
 * <p>
 * "Now" is the latest event time seen by the dispatcher, so results depend
 * only on the event stream.
 * </p>
 *
 * @since 1.0.0
 */
public class FleetAnalytics {

    static final double OVERVIEW_WINDOW_SECONDS = 3600;
    static final double DEVICE_ALERT_WINDOW_SECONDS = 24 * 3600;

    private final DeviceHistoryStore histories;
    private final AlertDispatcher dispatcher;
    private final HealthScorer healthScorer;
    private final TrendAnalyzer trendAnalyzer;
    private final long alertLookbackSeconds;

    public FleetAnalytics(DeviceHistoryStore histories, AlertDispatcher dispatcher, HealthScorer healthScorer,
            TrendAnalyzer trendAnalyzer, long alertLookbackSeconds) {
        this.histories = Objects.requireNonNull(histories, "DeviceHistoryStore must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "AlertDispatcher must not be null");
        this.healthScorer = Objects.requireNonNull(healthScorer, "HealthScorer must not be null");
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "TrendAnalyzer must not be null");
        this.alertLookbackSeconds = alertLookbackSeconds;
    }

    /**
     * @return the device's health; NO_DATA for unknown devices
     */
    public DeviceHealth deviceHealth(String deviceId) {
        Optional<DeviceHistory> history = histories.find(deviceId);
        if (history.isEmpty()) {
            return DeviceHealth.noData(deviceId);
        }
        int recent = alertsFor(deviceId, alertLookbackSeconds).size();
        return healthScorer.score(deviceId, history.get(), recent);
    }

    public SystemOverview systemOverview(ProcessorStats stats) {
        Map<String, DeviceHealth> devices = new LinkedHashMap<>();
        int healthy = 0;
        for (String deviceId : histories.deviceIds()) {
            DeviceHealth health = deviceHealth(deviceId);
            devices.put(deviceId, health);
            if (health.status() == HealthStatus.HEALTHY) {
                healthy++;
            }
        }

        List<Alert> recent = dispatcher.recentAlerts(OVERVIEW_WINDOW_SECONDS);
        int critical = 0;
        for (Alert alert : recent) {
            if (alert.getSeverity() == Severity.CRITICAL) {
                critical++;
            }
        }

        int total = devices.size();
        return new SystemOverview(total, healthy, total == 0 ? 0.0 : (double) healthy / total,
                recent.size(), critical, stats, devices);
    }

    /**
     * @return analytics for the device, empty if it has no history
     */
    public Optional<DeviceAnalytics> deviceAnalytics(String deviceId) {
        Optional<DeviceHistory> history = histories.find(deviceId);
        if (history.isEmpty()) {
            return Optional.empty();
        }
        List<TelemetryEvent> events = history.get().snapshot();
        if (events.isEmpty()) {
            return Optional.empty();
        }

        Map<Metric, MetricSummary> metrics = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            double[] values = WindowStats.values(events, metric);
            metrics.put(metric, new MetricSummary(
                    WindowStats.mean(values),
                    WindowStats.sampleStdDev(values),
                    WindowStats.min(values),
                    WindowStats.max(values),
                    trendAnalyzer.linear(events, metric).slope()));
        }

        List<Alert> alerts = alertsFor(deviceId, DEVICE_ALERT_WINDOW_SECONDS);
        Map<String, Integer> types = new TreeMap<>();
        for (Alert alert : alerts) {
            types.merge(alert.getAlertType(), 1, Integer::sum);
        }

        return Optional.of(new DeviceAnalytics(deviceId, events.size(),
                events.get(0).getTimestamp(), events.get(events.size() - 1).getTimestamp(),
                metrics, alerts.size(), types));
    }

    private List<Alert> alertsFor(String deviceId, double windowSeconds) {
        double now = dispatcher.streamTime();
        if (Double.isNaN(now)) {
            return List.of();
        }
        return dispatcher.recentAlerts(deviceId, windowSeconds, now);
    }
}
