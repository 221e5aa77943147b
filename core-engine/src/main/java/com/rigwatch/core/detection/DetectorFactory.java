package com.rigwatch.core.detection;

import com.rigwatch.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the fixed detector chain and the ensemble from configuration.
 *
 * <p>
 * Chain order is always: statistical, rule-based, external model (only when
 * a {@link ScoringModel} is supplied), trend.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * @param config pipeline configuration; must not be {@code null}
     * @param model  scoring model, or {@code null} to run without one
     * @return the processing chain
     */
    public static DetectorChain createChain(PipelineConfig config, ScoringModel model) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        List<Detector> detectors = votingDetectors(config, model);
        detectors.add(new TrendDetector(config));
        LOG.info("Created detector chain with {} detector(s), external model {}",
                detectors.size(), model != null ? "enabled" : "disabled");
        return new DetectorChain(detectors);
    }

    /**
     * @param config pipeline configuration; must not be {@code null}
     * @param model  scoring model, or {@code null} to vote without one
     * @return the ensemble over the voting detectors
     */
    public static EnsembleDetector createEnsemble(PipelineConfig config, ScoringModel model) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        return new EnsembleDetector(config, votingDetectors(config, model));
    }

    private static List<Detector> votingDetectors(PipelineConfig config, ScoringModel model) {
        List<Detector> detectors = new ArrayList<>();
        detectors.add(new StatisticalDetector(config));
        detectors.add(new RuleBasedDetector(config));
        if (model != null) {
            detectors.add(new ExternalModelDetector(config, model));
        }
        return detectors;
    }
}
