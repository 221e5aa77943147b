package com.rigwatch.core.detection;

import java.util.Map;

/**
 * Offline-trained model consumed by {@link ExternalModelDetector}.
 *
 * <p>
 * Implementations must be thread-safe and side-effect free.
 * </p>
 */
@FunctionalInterface
public interface ScoringModel {

    /**
     * @param features named features produced by {@link FeatureExtractor}
     * @return anomaly probability, expected within {@code [0, 1]}
     */
    double score(Map<String, Double> features);
}
