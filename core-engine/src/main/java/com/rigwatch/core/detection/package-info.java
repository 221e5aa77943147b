/**
 * Anomaly detection: the {@link com.rigwatch.core.detection.Detector}
 * contract and its implementations.
 *
 * <ul>
 * <li>{@link com.rigwatch.core.detection.StatisticalDetector}: z-score
 * against a rolling baseline</li>
 * <li>{@link com.rigwatch.core.detection.RuleBasedDetector}: fixed limits
 * and the cross-parameter rule</li>
 * <li>{@link com.rigwatch.core.detection.ExternalModelDetector}: offline
 * trained {@link com.rigwatch.core.detection.ScoringModel}</li>
 * <li>{@link com.rigwatch.core.detection.TrendDetector}: sustained
 * drift</li>
 * <li>{@link com.rigwatch.core.detection.EnsembleDetector}: weighted vote
 * over the first three</li>
 * </ul>
 */
package com.rigwatch.core.detection;
