package com.rigwatch.core.detection;

import com.rigwatch.core.config.VoteWeights;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Weighted majority vote over the statistical, rule-based and external
 * model signals.
 *
 * <p>
 * {@code score = sum(w_i * vote_i) / sum(w_i)} over the available signals,
 * where {@code vote_i} is 1 for an anomalous verdict and 0 otherwise.
 * Degraded and insufficient-data verdicts, and verdicts from methods that
 * do not vote, are not available. The result is anomalous when the score is
 * greater than <em>or equal to</em> the threshold.
 * </p>
 */
public class WeightedVote {

    public static final String ALERT_TYPE = "ENSEMBLE_ANOMALY";

    private final VoteWeights weights;
    private final double threshold;

    public WeightedVote(VoteWeights weights, double threshold) {
        this.weights = Objects.requireNonNull(weights, "VoteWeights must not be null");
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Vote threshold must be in [0, 1], got: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @param verdicts chain verdicts in chain order
     * @return the ensemble verdict; insufficient-data when no signal is
     *         available
     */
    public AnomalyVerdict vote(List<AnomalyVerdict> verdicts) {
        Objects.requireNonNull(verdicts, "Verdicts must not be null");

        AnomalyVerdict.Builder result = AnomalyVerdict.builder(EnsembleDetector.NAME, DetectionMethod.ENSEMBLE)
                .alertType(ALERT_TYPE);
        double weighted = 0;
        double total = 0;
        Severity severity = Severity.LOW;

        for (AnomalyVerdict v : verdicts) {
            double w = weightOf(v.getMethod());
            if (w <= 0 || v.isDegraded() || v.isInsufficientData()) {
                continue;
            }
            total += w;
            result.detail(v.getDetector() + "_vote", v.isAnomaly() ? 1.0 : 0.0);
            if (v.isAnomaly()) {
                weighted += w;
                severity = severity.max(v.getSeverity());
                for (String reason : v.getReasons()) {
                    result.reason(v.getDetector() + ": " + reason);
                }
            }
        }

        if (total == 0) {
            return AnomalyVerdict.insufficientData(EnsembleDetector.NAME, "No detector signal available for voting");
        }

        double score = Math.min(1.0, weighted / total);
        boolean anomaly = score >= threshold;
        if (anomaly) {
            result.reason(String.format(Locale.ROOT, "Ensemble score %.2f >= %.2f", score, threshold));
        }
        return result
                .anomaly(anomaly)
                .score(score)
                .severity(anomaly ? severity : Severity.LOW)
                .build();
    }

    /**
     * @return the configured weight, or 0 for methods that do not vote
     */
    double weightOf(DetectionMethod method) {
        switch (method) {
            case STATISTICAL:
                return weights.getStatistical();
            case RULE_BASED:
                return weights.getRuleBased();
            case EXTERNAL_MODEL:
                return weights.getExternalModel();
            default:
                return 0.0;
        }
    }

    public double getThreshold() {
        return threshold;
    }
}
