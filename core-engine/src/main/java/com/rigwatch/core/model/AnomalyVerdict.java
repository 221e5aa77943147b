package com.rigwatch.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one detector (or of the ensemble vote) for a single event.
 *
 * <p>
 * The {@code score} is always within {@code [0, 1]}; the builder rejects
 * anything else. A verdict produced for a detector that failed carries
 * {@code degraded = true} and is never an anomaly.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} or one of the static factories
 * ({@link #insufficientData(String, String)},
 * {@link #degraded(String, DetectionMethod, String)}).
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String detector;
    private final boolean anomaly;
    private final double score;
    private final DetectionMethod method;
    private final List<String> reasons;
    private final String alertType;
    private final Severity severity;
    private final boolean degraded;
    private final Map<String, Double> details;

    private AnomalyVerdict(Builder b) {
        this.detector = Objects.requireNonNull(b.detector, "detector must not be null");
        this.method = Objects.requireNonNull(b.method, "method must not be null");
        if (Double.isNaN(b.score) || b.score < 0.0 || b.score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1], got: " + b.score);
        }
        if (b.anomaly && (b.degraded || b.method == DetectionMethod.INSUFFICIENT_DATA)) {
            throw new IllegalArgumentException(
                    "degraded or insufficient-data verdicts cannot be anomalies");
        }
        this.anomaly = b.anomaly;
        this.score = b.score;
        this.reasons = Collections.unmodifiableList(new ArrayList<>(b.reasons));
        this.alertType = b.alertType != null ? b.alertType : method.name();
        this.severity = b.severity != null ? b.severity : Severity.MEDIUM;
        this.degraded = b.degraded;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(b.details));
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static Builder builder(String detector, DetectionMethod method) {
        return new Builder(detector, method);
    }

    /**
     * Low-confidence "not an anomaly" verdict for a detector whose history
     * is below its minimum window.
     */
    public static AnomalyVerdict insufficientData(String detector, String reason) {
        return builder(detector, DetectionMethod.INSUFFICIENT_DATA)
                .score(0.0)
                .reason(reason)
                .severity(Severity.LOW)
                .build();
    }

    /**
     * Placeholder verdict for a detector that threw during evaluation.
     */
    public static AnomalyVerdict degraded(String detector, DetectionMethod method, String reason) {
        return builder(detector, method)
                .score(0.0)
                .reason(reason)
                .severity(Severity.LOW)
                .degraded(true)
                .build();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /** @return name of the detector that produced this verdict */
    public String getDetector() {
        return detector;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public double getScore() {
        return score;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    /** @return unmodifiable, ordered list of reasons */
    public List<String> getReasons() {
        return reasons;
    }

    /** @return alert type raised when this verdict is positive */
    public String getAlertType() {
        return alertType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isInsufficientData() {
        return method == DetectionMethod.INSUFFICIENT_DATA;
    }

    /** @return unmodifiable numeric evidence (z-scores, slopes, probabilities) */
    public Map<String, Double> getDetails() {
        return details;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnomalyVerdict}.
     */
    public static final class Builder {
        private final String detector;
        private final DetectionMethod method;
        private boolean anomaly;
        private double score;
        private final List<String> reasons = new ArrayList<>();
        private String alertType;
        private Severity severity;
        private boolean degraded;
        private final Map<String, Double> details = new LinkedHashMap<>();

        private Builder(String detector, DetectionMethod method) {
            this.detector = detector;
            this.method = method;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder reason(String reason) {
            this.reasons.add(Objects.requireNonNull(reason, "reason must not be null"));
            return this;
        }

        public Builder reasons(List<String> reasons) {
            reasons.forEach(this::reason);
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

        public Builder degraded(boolean degraded) {
            this.degraded = degraded;
            return this;
        }

        public Builder detail(String key, double value) {
            this.details.put(key, value);
            return this;
        }

        /**
         * @return a new verdict
         * @throws IllegalArgumentException if the score is outside [0, 1] or a
         *                                  degraded verdict is marked anomalous
         */
        public AnomalyVerdict build() {
            return new AnomalyVerdict(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyVerdict that))
            return false;
        return anomaly == that.anomaly
                && Double.compare(score, that.score) == 0
                && degraded == that.degraded
                && Objects.equals(detector, that.detector)
                && method == that.method
                && Objects.equals(reasons, that.reasons)
                && Objects.equals(alertType, that.alertType)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(detector, anomaly, score, method, reasons, alertType, severity, degraded);
    }

    @Override
    public String toString() {
        return "AnomalyVerdict{" +
                "detector='" + detector + '\'' +
                ", anomaly=" + anomaly +
                ", score=" + score +
                ", method=" + method +
                ", reasons=" + reasons +
                (degraded ? ", degraded" : "") +
                '}';
    }
}
