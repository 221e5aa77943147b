package com.rigwatch.core.detection;

import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.TelemetryEvent;

import java.util.Optional;

/**
 * Contract for all detectors in the processing chain.
 *
 * <p>
 * Detectors are stateless: everything they need is in the event and the
 * device history passed to {@link #evaluate}. The history already contains
 * {@code event} as its newest entry when called from the stream processor.
 * Identical inputs always produce identical verdicts.
 * </p>
 */
public interface Detector {

    /**
     * Evaluate a single event against the device's history.
     *
     * @param event   the incoming event
     * @param history the device history
     * @return a verdict, or empty if the detector has nothing to evaluate
     * @throws InsufficientDataException if the history is below the detector's
     *                                   minimum window
     */
    Optional<AnomalyVerdict> evaluate(TelemetryEvent event, DeviceHistory history);

    /**
     * @return unique detector name used in verdicts, logs and metrics
     */
    String getName();

    /**
     * @return the signal this detector contributes
     */
    DetectionMethod getMethod();
}
