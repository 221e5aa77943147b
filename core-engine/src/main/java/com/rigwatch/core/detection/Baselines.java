package com.rigwatch.core.detection;

import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.TelemetryEvent;

import java.util.List;

/**
 * Selects the reference window an event is compared against.
 */
final class Baselines {

    private Baselines() {
        // utility class
    }

    /**
     * The up-to-{@code windowSize} events that precede {@code event}. When the
     * history's newest entry is the event itself it is excluded, so a reading
     * never influences its own baseline.
     */
    static List<TelemetryEvent> preceding(TelemetryEvent event, DeviceHistory history, int windowSize) {
        List<TelemetryEvent> recent = history.recent(windowSize + 1);
        if (!recent.isEmpty() && recent.get(recent.size() - 1) == event) {
            return recent.subList(0, recent.size() - 1);
        }
        return recent.size() > windowSize ? recent.subList(1, recent.size()) : recent;
    }
}
