package com.rigwatch.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-metric limits used by the rule-based, trend and health components.
 *
 * <p>
 * Every limit is optional; a {@code null} limit disables the corresponding
 * check. Limits:
 * </p>
 * <ul>
 * <li>{@code criticalHigh} / {@code criticalLow}: absolute thresholds
 * ({@code <METRIC>_HIGH}, {@code <METRIC>_LOW})</li>
 * <li>{@code normalMin} / {@code normalMax}: normal operating range
 * ({@code <METRIC>_OUT_OF_RANGE})</li>
 * <li>{@code secondaryHigh}: cross-parameter rule: fires only when every
 * metric with a secondary limit is above it simultaneously</li>
 * <li>{@code extremeHigh} / {@code extremeLow}: physically implausible
 * readings ({@code <METRIC>_EXTREME})</li>
 * <li>{@code trendSlopeLimit}: per-reading slope that counts as a
 * significant trend</li>
 * <li>{@code stabilityStdLimit}: standard deviation at which stability is
 * scored 0 by the health scorer</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Metric name: "temperature" or "pressure". */
    private String metric;

    private Double criticalHigh;
    private Double criticalLow;
    private Double normalMin;
    private Double normalMax;
    private Double secondaryHigh;
    private Double extremeHigh;
    private Double extremeLow;
    private Double trendSlopeLimit;
    private double stabilityStdLimit = 10.0;

    /**
     * Default limits for the oil-field temperature and pressure sensors.
     *
     * @return new mutable list with one rule per {@link Metric}
     */
    public static List<MetricRule> defaults() {
        MetricRule temperature = new MetricRule();
        temperature.setMetric("temperature");
        temperature.setCriticalHigh(120.0);
        temperature.setCriticalLow(40.0);
        temperature.setNormalMin(75.0);
        temperature.setNormalMax(85.0);
        temperature.setSecondaryHigh(100.0);
        temperature.setExtremeHigh(150.0);
        temperature.setExtremeLow(-50.0);
        temperature.setTrendSlopeLimit(0.5);
        temperature.setStabilityStdLimit(10.0);

        MetricRule pressure = new MetricRule();
        pressure.setMetric("pressure");
        pressure.setCriticalHigh(300.0);
        pressure.setCriticalLow(100.0);
        pressure.setNormalMin(180.0);
        pressure.setNormalMax(220.0);
        pressure.setSecondaryHigh(250.0);
        pressure.setExtremeHigh(500.0);
        pressure.setExtremeLow(0.0);
        pressure.setTrendSlopeLimit(2.0);
        pressure.setStabilityStdLimit(50.0);

        List<MetricRule> rules = new ArrayList<>();
        rules.add(temperature);
        rules.add(pressure);
        return rules;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the metric is known and that paired limits are ordered.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (metric == null || metric.isBlank()) {
            errors.add("Metric rule 'metric' is required");
        } else {
            try {
                Metric.fromKey(metric);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (criticalLow != null && criticalHigh != null && criticalLow >= criticalHigh) {
            errors.add("Metric rule '" + metric + "' requires 'criticalLow' < 'criticalHigh'");
        }
        if (normalMin != null && normalMax != null && normalMin > normalMax) {
            errors.add("Metric rule '" + metric + "' requires 'normalMin' <= 'normalMax'");
        }
        if (extremeLow != null && extremeHigh != null && extremeLow >= extremeHigh) {
            errors.add("Metric rule '" + metric + "' requires 'extremeLow' < 'extremeHigh'");
        }
        if (trendSlopeLimit != null && trendSlopeLimit <= 0) {
            errors.add("Metric rule '" + metric + "' requires 'trendSlopeLimit' > 0");
        }
        if (stabilityStdLimit <= 0) {
            errors.add("Metric rule '" + metric + "' requires 'stabilityStdLimit' > 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid MetricRule: " + String.join("; ", errors));
        }
    }

    /**
     * @return the resolved {@link Metric}
     * @throws IllegalArgumentException if the metric name is unknown
     */
    public Metric resolveMetric() {
        return Metric.fromKey(metric);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public Double getCriticalHigh() {
        return criticalHigh;
    }

    public void setCriticalHigh(Double criticalHigh) {
        this.criticalHigh = criticalHigh;
    }

    public Double getCriticalLow() {
        return criticalLow;
    }

    public void setCriticalLow(Double criticalLow) {
        this.criticalLow = criticalLow;
    }

    public Double getNormalMin() {
        return normalMin;
    }

    public void setNormalMin(Double normalMin) {
        this.normalMin = normalMin;
    }

    public Double getNormalMax() {
        return normalMax;
    }

    public void setNormalMax(Double normalMax) {
        this.normalMax = normalMax;
    }

    public Double getSecondaryHigh() {
        return secondaryHigh;
    }

    public void setSecondaryHigh(Double secondaryHigh) {
        this.secondaryHigh = secondaryHigh;
    }

    public Double getExtremeHigh() {
        return extremeHigh;
    }

    public void setExtremeHigh(Double extremeHigh) {
        this.extremeHigh = extremeHigh;
    }

    public Double getExtremeLow() {
        return extremeLow;
    }

    public void setExtremeLow(Double extremeLow) {
        this.extremeLow = extremeLow;
    }

    public Double getTrendSlopeLimit() {
        return trendSlopeLimit;
    }

    public void setTrendSlopeLimit(Double trendSlopeLimit) {
        this.trendSlopeLimit = trendSlopeLimit;
    }

    public double getStabilityStdLimit() {
        return stabilityStdLimit;
    }

    public void setStabilityStdLimit(double stabilityStdLimit) {
        this.stabilityStdLimit = stabilityStdLimit;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricRule that))
            return false;
        return Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric);
    }

    @Override
    public String toString() {
        return "MetricRule{" +
                "metric='" + metric + '\'' +
                ", critical=[" + criticalLow + ", " + criticalHigh + ']' +
                ", normal=[" + normalMin + ", " + normalMax + ']' +
                ", secondaryHigh=" + secondaryHigh +
                ", extreme=[" + extremeLow + ", " + extremeHigh + ']' +
                ", trendSlopeLimit=" + trendSlopeLimit +
                ", stabilityStdLimit=" + stabilityStdLimit +
                '}';
    }
}
