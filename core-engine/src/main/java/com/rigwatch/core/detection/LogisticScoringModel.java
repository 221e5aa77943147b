package com.rigwatch.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Logistic regression exported from the offline training job.
 *
 * <p>
 * {@code p = 1 / (1 + exp(-(intercept + sum(coefficient_i * feature_i))))}.
 * Features without a coefficient are ignored; coefficients without a
 * feature contribute zero.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LogisticScoringModel implements ScoringModel, Serializable {

    private static final long serialVersionUID = 1L;

    private final double intercept;
    private final Map<String, Double> coefficients;

    @JsonCreator
    public LogisticScoringModel(@JsonProperty("intercept") double intercept,
            @JsonProperty("coefficients") Map<String, Double> coefficients) {
        this.intercept = intercept;
        this.coefficients = coefficients == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }

    @Override
    public double score(Map<String, Double> features) {
        Objects.requireNonNull(features, "Features must not be null");
        double logit = intercept;
        for (Map.Entry<String, Double> c : coefficients.entrySet()) {
            Double value = features.get(c.getKey());
            if (value != null && c.getValue() != null) {
                logit += c.getValue() * value;
            }
        }
        return 1.0 / (1.0 + Math.exp(-logit));
    }

    public double getIntercept() {
        return intercept;
    }

    public Map<String, Double> getCoefficients() {
        return coefficients;
    }

    @Override
    public String toString() {
        return "LogisticScoringModel{intercept=" + intercept + ", coefficients=" + coefficients.keySet() + '}';
    }
}
