package com.rigwatch.core.model;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Alert raised for a device when a detector fires.
 *
 * <p>
 * Alerts are created by the
 * {@link com.rigwatch.core.alert.AlertDispatcher} and are immutable
 * thereafter. The {@code id} is derived from device, type and timestamp, so
 * replaying the same event stream yields the same ids.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code deviceId}, {@code alertType} and
 * {@code dedupKey} are required; omitting one throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String deviceId;
    private final String alertType;
    private final Severity severity;

    /** Event time of the triggering reading, epoch seconds. */
    private final double timestamp;

    private final Map<String, Object> payload;
    private final DedupKey dedupKey;

    private Alert(Builder builder) {
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId must not be null");
        this.alertType = Objects.requireNonNull(builder.alertType, "alertType must not be null");
        this.dedupKey = Objects.requireNonNull(builder.dedupKey, "dedupKey must not be null");
        this.severity = builder.severity != null ? builder.severity : Severity.MEDIUM;
        this.timestamp = builder.timestamp;
        this.id = builder.id != null ? builder.id : deterministicId(deviceId, alertType, timestamp);
        this.payload = builder.payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload))
                : Collections.emptyMap();
    }

    private static String deterministicId(String deviceId, String alertType, double timestamp) {
        String seed = deviceId + '|' + alertType + '|' + timestamp;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String deviceId;
        private String alertType;
        private Severity severity;
        private double timestamp;
        private Map<String, Object> payload;
        private DedupKey dedupKey;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder alertType(String alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder timestamp(double timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder dedupKey(DedupKey dedupKey) {
            this.dedupKey = dedupKey;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getAlertType() {
        return alertType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getTimestamp() {
        return timestamp;
    }

    /** @return unmodifiable payload map */
    public Map<String, Object> getPayload() {
        return payload;
    }

    public DedupKey getDedupKey() {
        return dedupKey;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id)
                && Objects.equals(deviceId, alert.deviceId)
                && Objects.equals(alertType, alert.alertType)
                && Double.compare(timestamp, alert.timestamp) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, deviceId, alertType, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", deviceId='" + deviceId + '\'' +
                ", alertType='" + alertType + '\'' +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                '}';
    }
}
