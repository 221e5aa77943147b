package com.rigwatch.core.model;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Sensor metrics carried by every {@link TelemetryEvent}.
 */
public enum Metric {

    TEMPERATURE(TelemetryEvent::getTemperature),
    PRESSURE(TelemetryEvent::getPressure);

    private final ToDoubleFunction<TelemetryEvent> extractor;

    Metric(ToDoubleFunction<TelemetryEvent> extractor) {
        this.extractor = extractor;
    }

    double extract(TelemetryEvent event) {
        return extractor.applyAsDouble(event);
    }

    /**
     * Lower-case name used in feature keys and configuration.
     *
     * @return e.g. {@code "temperature"}
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a metric from its configuration name, case-insensitively.
     *
     * @param name metric name
     * @return the metric
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Metric fromKey(String name) {
        if (name != null) {
            for (Metric m : values()) {
                if (m.key().equalsIgnoreCase(name.trim())) {
                    return m;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + name
                + "'. Supported: temperature, pressure");
    }
}
