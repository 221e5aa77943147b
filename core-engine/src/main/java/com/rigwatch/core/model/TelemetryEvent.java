package com.rigwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One timestamped sensor reading from a field device.
 *
 * <p>
 * Instances are immutable. Validation of metric values and timestamps is
 * performed at the ingestion boundary by the stream processor, not here, so
 * that malformed readings can still be represented and reported.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TelemetryEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Status reported when the device does not send one. */
    public static final String DEFAULT_STATUS = "OK";

    private final String deviceId;

    /** Event time in epoch seconds. */
    private final double timestamp;

    private final double temperature;
    private final double pressure;
    private final String status;
    private final Map<String, Object> metadata;

    @JsonCreator
    public TelemetryEvent(@JsonProperty("device_id") String deviceId,
            @JsonProperty("timestamp") double timestamp,
            @JsonProperty("temperature") double temperature,
            @JsonProperty("pressure") double pressure,
            @JsonProperty("status") String status,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.deviceId = deviceId;
        this.timestamp = timestamp;
        this.temperature = temperature;
        this.pressure = pressure;
        this.status = (status == null || status.isBlank()) ? DEFAULT_STATUS : status;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    /**
     * Shorthand for a reading with default status and no metadata.
     */
    public static TelemetryEvent of(String deviceId, double timestamp, double temperature, double pressure) {
        return new TelemetryEvent(deviceId, timestamp, temperature, pressure, DEFAULT_STATUS, null);
    }

    @JsonProperty("device_id")
    public String getDeviceId() {
        return deviceId;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getPressure() {
        return pressure;
    }

    public String getStatus() {
        return status;
    }

    /**
     * @return unmodifiable metadata map, empty when none was supplied
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Value of the given metric for this reading.
     *
     * @param metric the metric; must not be {@code null}
     * @return the metric value
     */
    public double valueOf(Metric metric) {
        return Objects.requireNonNull(metric, "metric must not be null").extract(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryEvent that))
            return false;
        return Double.compare(timestamp, that.timestamp) == 0
                && Double.compare(temperature, that.temperature) == 0
                && Double.compare(pressure, that.pressure) == 0
                && Objects.equals(deviceId, that.deviceId)
                && Objects.equals(status, that.status)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, timestamp, temperature, pressure, status, metadata);
    }

    @Override
    public String toString() {
        return "TelemetryEvent{" +
                "deviceId='" + deviceId + '\'' +
                ", timestamp=" + timestamp +
                ", temperature=" + temperature +
                ", pressure=" + pressure +
                ", status='" + status + '\'' +
                '}';
    }
}
