package com.rigwatch.core.processor;

import com.rigwatch.core.model.Alert;
import com.rigwatch.core.model.AnomalyVerdict;

import java.util.List;

/**
 * Outcome of processing one event.
 *
 * @param verdicts chain verdicts in chain order, followed by the ensemble verdict
 * @param alerts   alerts dispatched for this event (duplicates excluded)
 */
public record ProcessingResult(List<AnomalyVerdict> verdicts, List<Alert> alerts) {

    public ProcessingResult {
        verdicts = List.copyOf(verdicts);
        alerts = List.copyOf(alerts);
    }

    public boolean hasAnomaly() {
        return verdicts.stream().anyMatch(AnomalyVerdict::isAnomaly);
    }
}
