package com.rigwatch.core.config;

import java.io.Serializable;

/**
 * Weights of the signals combined by the ensemble vote. A weight of zero
 * removes the signal from the vote.
 */
public class VoteWeights implements Serializable {

    private static final long serialVersionUID = 1L;

    private double statistical = 1.0;
    private double ruleBased = 1.0;
    private double externalModel = 1.0;

    public double getStatistical() {
        return statistical;
    }

    public void setStatistical(double statistical) {
        this.statistical = statistical;
    }

    public double getRuleBased() {
        return ruleBased;
    }

    public void setRuleBased(double ruleBased) {
        this.ruleBased = ruleBased;
    }

    public double getExternalModel() {
        return externalModel;
    }

    public void setExternalModel(double externalModel) {
        this.externalModel = externalModel;
    }

    @Override
    public String toString() {
        return "VoteWeights{statistical=" + statistical
                + ", ruleBased=" + ruleBased
                + ", externalModel=" + externalModel + '}';
    }
}
