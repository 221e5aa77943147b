package com.rigwatch.core.detection;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.Severity;
import com.rigwatch.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Delegates scoring to an offline-trained {@link ScoringModel}.
 *
 * <p>
 * Features are built from the current event and the {@code windowSize}
 * readings before it. The detector fires when the model's probability is
 * at least {@value #ANOMALY_PROBABILITY}. A probability outside
 * {@code [0, 1]} (or NaN) is a model failure and is thrown as
 * {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public class ExternalModelDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalModelDetector.class);

    public static final String NAME = "external_model";
    public static final String ALERT_TYPE = "MODEL_ANOMALY";
    public static final double ANOMALY_PROBABILITY = 0.5;

    private static final double HIGH_SEVERITY_PROBABILITY = 0.9;

    private final ScoringModel model;
    private final FeatureExtractor features;
    private final int windowSize;
    private final int minWindow;

    /**
     * @param config pipeline configuration
     * @param model  the scoring model
     * @throws NullPointerException if any argument is {@code null}
     */
    public ExternalModelDetector(PipelineConfig config, ScoringModel model) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.model = Objects.requireNonNull(model, "ScoringModel must not be null");
        this.features = new FeatureExtractor();
        this.windowSize = config.getWindowSize();
        this.minWindow = config.getMinWindow();
    }

    @Override
    public Optional<AnomalyVerdict> evaluate(TelemetryEvent event, DeviceHistory history) {
        Objects.requireNonNull(event, "Event must not be null");
        Objects.requireNonNull(history, "History must not be null");

        List<TelemetryEvent> baseline = Baselines.preceding(event, history, windowSize);
        if (baseline.size() < minWindow) {
            throw new InsufficientDataException(NAME, minWindow, baseline.size());
        }

        Map<String, Double> featureMap = features.extract(event, baseline);
        double probability = model.score(featureMap);
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new IllegalStateException("Scoring model returned probability outside [0, 1]: " + probability);
        }

        boolean anomaly = probability >= ANOMALY_PROBABILITY;
        AnomalyVerdict.Builder verdict = AnomalyVerdict.builder(NAME, DetectionMethod.EXTERNAL_MODEL)
                .anomaly(anomaly)
                .score(probability)
                .alertType(ALERT_TYPE)
                .severity(probability >= HIGH_SEVERITY_PROBABILITY ? Severity.HIGH : Severity.MEDIUM)
                .detail("probability", probability);

        if (anomaly) {
            verdict.reason(String.format(Locale.ROOT, "Model anomaly probability %.3f >= %.2f",
                    probability, ANOMALY_PROBABILITY));
            LOG.debug("Detector [{}] fired for device [{}]: p={}", NAME, event.getDeviceId(), probability);
        }
        return Optional.of(verdict.build());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.EXTERNAL_MODEL;
    }
}
