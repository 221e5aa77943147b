package com.rigwatch.core.detection;

import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.TelemetryEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable set of detectors evaluated one after another.
 *
 * <p>
 * Each detector runs in isolation. An {@link InsufficientDataException}
 * becomes an insufficient-data verdict; any other runtime failure becomes a
 * degraded verdict and is reported to the {@link FailureHandler}. A failing
 * detector never prevents the following ones from running.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorChain {

    /**
     * Callback for detector failures.
     */
    @FunctionalInterface
    public interface FailureHandler {
        void onFailure(Detector detector, TelemetryEvent event, RuntimeException error);
    }

    private final List<Detector> detectors;

    public DetectorChain(List<Detector> detectors) {
        Objects.requireNonNull(detectors, "Detectors must not be null");
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
    }

    /**
     * @param event   the event
     * @param history the device history, already containing {@code event}
     * @param onFailure receives every detector failure
     * @return one verdict per detector that produced one, in chain order
     */
    public List<AnomalyVerdict> evaluate(TelemetryEvent event, DeviceHistory history, FailureHandler onFailure) {
        Objects.requireNonNull(onFailure, "FailureHandler must not be null");
        List<AnomalyVerdict> verdicts = new ArrayList<>(detectors.size());
        for (Detector detector : detectors) {
            try {
                Optional<AnomalyVerdict> verdict = detector.evaluate(event, history);
                verdict.ifPresent(verdicts::add);
            } catch (InsufficientDataException e) {
                verdicts.add(AnomalyVerdict.insufficientData(detector.getName(), e.getMessage()));
            } catch (RuntimeException e) {
                onFailure.onFailure(detector, event, e);
                verdicts.add(AnomalyVerdict.degraded(detector.getName(), detector.getMethod(),
                        "Detector failed: " + e.getMessage()));
            }
        }
        return verdicts;
    }

    public List<Detector> getDetectors() {
        return detectors;
    }

    public int size() {
        return detectors.size();
    }
}
