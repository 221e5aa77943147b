package com.rigwatch.core.detection;

import com.rigwatch.core.config.PipelineConfig;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.AnomalyVerdict;
import com.rigwatch.core.model.DetectionMethod;
import com.rigwatch.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Combines the statistical, rule-based and (optional) external model
 * signals into a single verdict with a {@link WeightedVote}.
 *
 * <p>
 * While the device has fewer than {@code minWindow} readings before the
 * current one, the ensemble answers with a not-anomalous
 * {@link DetectionMethod#INSUFFICIENT_DATA} verdict regardless of its
 * members. The stream processor evaluates the members once in its own
 * chain and calls {@link #combine}; {@link #evaluate} runs the members
 * itself for standalone use.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleDetector.class);

    public static final String NAME = "ensemble";

    private final DetectorChain members;
    private final WeightedVote weightedVote;
    private final int windowSize;
    private final int minWindow;

    /**
     * @param config  pipeline configuration
     * @param members voting detectors in chain order
     */
    public EnsembleDetector(PipelineConfig config, List<Detector> members) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.members = new DetectorChain(members);
        this.weightedVote = new WeightedVote(config.getVoteWeights(), config.getVoteThreshold());
        this.windowSize = config.getWindowSize();
        this.minWindow = config.getMinWindow();
    }

    @Override
    public Optional<AnomalyVerdict> evaluate(TelemetryEvent event, DeviceHistory history) {
        Objects.requireNonNull(event, "Event must not be null");
        Objects.requireNonNull(history, "History must not be null");
        if (!hasMinimumWindow(event, history)) {
            return Optional.of(insufficient(history));
        }
        List<AnomalyVerdict> verdicts = members.evaluate(event, history, (detector, e, error) ->
                LOG.error("Ensemble member [{}] failed for device [{}]", detector.getName(), e.getDeviceId(), error));
        return Optional.of(weightedVote.vote(verdicts));
    }

    /**
     * Vote over verdicts that were already produced for {@code event}.
     *
     * @param event    the event
     * @param history  the device history
     * @param verdicts chain verdicts; non-voting ones are ignored
     * @return the ensemble verdict
     */
    public AnomalyVerdict combine(TelemetryEvent event, DeviceHistory history, List<AnomalyVerdict> verdicts) {
        if (!hasMinimumWindow(event, history)) {
            return insufficient(history);
        }
        return vote(verdicts);
    }

    /**
     * @param verdicts chain verdicts; non-voting ones are ignored
     * @return the weighted vote
     */
    public AnomalyVerdict vote(List<AnomalyVerdict> verdicts) {
        return weightedVote.vote(verdicts);
    }

    private boolean hasMinimumWindow(TelemetryEvent event, DeviceHistory history) {
        return Baselines.preceding(event, history, windowSize).size() >= minWindow;
    }

    private AnomalyVerdict insufficient(DeviceHistory history) {
        return AnomalyVerdict.insufficientData(NAME,
                "History of " + history.size() + " reading(s) is below the minimum window of " + minWindow);
    }

    public List<Detector> getMembers() {
        return members.getDetectors();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ENSEMBLE;
    }
}
