package com.rigwatch.core.detection;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.MetricRule;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-limit detector driven by the configured {@link MetricRule}s.
 *
 * <p>
 * Checks, per metric:
 * </p>
 * <ul>
 * <li>extreme sensor limits: {@code <METRIC>_EXTREME}, CRITICAL</li>
 * <li>hard limits: {@code <METRIC>_HIGH} (CRITICAL) and {@code <METRIC>_LOW}
 * (HIGH)</li>
 * <li>normal operating range: {@code <METRIC>_OUT_OF_RANGE}, LOW</li>
 * </ul>
 * <p>
 * plus the cross-parameter rule {@code CROSS_PARAMETER_STRESS} (HIGH) when
 * every metric with a {@code secondaryHigh} is above it at once.
 * </p>
 *
 * <p>
 * All comparisons are strict: a value equal to a limit does not fire. The
 * detector is stateless and ignores the history. Every rule that fired is
 * listed in the verdict's reasons; alert type and severity come from the
 * most severe one (first in check order on a tie).
 * </p>
 *
 * @since 1.0.0
 */
public class RuleBasedDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(RuleBasedDetector.class);

    public static final String NAME = "rule_based";
    public static final String CROSS_PARAMETER_STRESS = "CROSS_PARAMETER_STRESS";

    private final Map<Metric, MetricRule> rules;

    /**
     * @param config pipeline configuration supplying the metric rules
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public RuleBasedDetector(PipelineConfig config) {
        this(Objects.requireNonNull(config, "PipelineConfig must not be null").metricRulesByMetric());
    }

    /**
     * @param rules rules keyed by metric; metrics without a rule are not checked
     */
    public RuleBasedDetector(Map<Metric, MetricRule> rules) {
        Objects.requireNonNull(rules, "Rules must not be null");
        Map<Metric, MetricRule> copy = new EnumMap<>(Metric.class);
        copy.putAll(rules);
        this.rules = Collections.unmodifiableMap(copy);
    }

    @Override
    public Optional<AnomalyVerdict> evaluate(TelemetryEvent event, DeviceHistory history) {
        Objects.requireNonNull(event, "Event must not be null");
        if (rules.isEmpty()) {
            return Optional.empty();
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<Metric, MetricRule> entry : rules.entrySet()) {
            checkMetric(entry.getKey(), entry.getValue(), event.valueOf(entry.getKey()), findings);
        }
        checkCrossParameter(event, findings);

        AnomalyVerdict.Builder verdict = AnomalyVerdict.builder(NAME, DetectionMethod.RULE_BASED);
        if (findings.isEmpty()) {
            return Optional.of(verdict.anomaly(false).score(0.0).severity(Severity.LOW).build());
        }

        Finding primary = findings.get(0);
        double score = 0;
        for (Finding f : findings) {
            if (f.severity.ordinal() > primary.severity.ordinal()) {
                primary = f;
            }
            score = Math.max(score, f.score);
            verdict.reason(f.reason);
        }

        LOG.debug("Detector [{}] fired for device [{}]: {}", NAME, event.getDeviceId(), primary.alertType);

        return Optional.of(verdict
                .anomaly(true)
                .score(score)
                .alertType(primary.alertType)
                .severity(primary.severity)
                .detail("rules_fired", findings.size())
                .build());
    }

    private static void checkMetric(Metric metric, MetricRule rule, double value, List<Finding> findings) {
        String prefix = metric.name();

        if (rule.getExtremeHigh() != null && value > rule.getExtremeHigh()) {
            findings.add(new Finding(prefix + "_EXTREME", Severity.CRITICAL, 1.0,
                    describe(metric, value, "above extreme limit", rule.getExtremeHigh())));
        } else if (rule.getExtremeLow() != null && value < rule.getExtremeLow()) {
            findings.add(new Finding(prefix + "_EXTREME", Severity.CRITICAL, 1.0,
                    describe(metric, value, "below extreme limit", rule.getExtremeLow())));
        }

        if (rule.getCriticalHigh() != null && value > rule.getCriticalHigh()) {
            findings.add(new Finding(prefix + "_HIGH", Severity.CRITICAL, 1.0,
                    describe(metric, value, "above critical limit", rule.getCriticalHigh())));
        } else if (rule.getCriticalLow() != null && value < rule.getCriticalLow()) {
            findings.add(new Finding(prefix + "_LOW", Severity.HIGH, 0.9,
                    describe(metric, value, "below critical limit", rule.getCriticalLow())));
        }

        if (rule.getNormalMax() != null && value > rule.getNormalMax()) {
            findings.add(new Finding(prefix + "_OUT_OF_RANGE", Severity.LOW, 0.6,
                    describe(metric, value, "above normal range", rule.getNormalMax())));
        } else if (rule.getNormalMin() != null && value < rule.getNormalMin()) {
            findings.add(new Finding(prefix + "_OUT_OF_RANGE", Severity.LOW, 0.6,
                    describe(metric, value, "below normal range", rule.getNormalMin())));
        }
    }

    private void checkCrossParameter(TelemetryEvent event, List<Finding> findings) {
        int participating = 0;
        List<String> parts = new ArrayList<>();
        for (Map.Entry<Metric, MetricRule> entry : rules.entrySet()) {
            Double limit = entry.getValue().getSecondaryHigh();
            if (limit == null) {
                continue;
            }
            participating++;
            double value = event.valueOf(entry.getKey());
            if (value <= limit) {
                return;
            }
            parts.add(String.format(Locale.ROOT, "%s=%.2f>%.2f", entry.getKey().key(), value, limit));
        }
        if (participating >= 2) {
            findings.add(new Finding(CROSS_PARAMETER_STRESS, Severity.HIGH, 0.8,
                    "Cross-parameter stress: " + String.join(", ", parts)));
        }
    }

    private static String describe(Metric metric, double value, String what, double limit) {
        return String.format(Locale.ROOT, "%s %.2f %s %.2f", metric.key(), value, what, limit);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.RULE_BASED;
    }

    private static final class Finding {
        private final String alertType;
        private final Severity severity;
        private final double score;
        private final String reason;

        private Finding(String alertType, Severity severity, double score, String reason) {
            this.alertType = alertType;
            this.severity = severity;
            this.score = score;
            this.reason = reason;
        }
    }
}
