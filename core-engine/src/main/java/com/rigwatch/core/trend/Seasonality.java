package com.rigwatch.core.trend;

import java.util.List;

/**
 * Autocorrelation-based seasonality estimate.
 *
 * @param sufficient   {@code false} when the series was shorter than
 *                     {@code 2 × maxLag}
 * @param seasonal     whether any autocorrelation peak was found
 * @param peakLags     lags that are local maxima above the peak threshold,
 *                     ascending
 * @param dominantLag  lag of the strongest peak, or 0 when none
 * @param dominantAcf  autocorrelation at {@code dominantLag}
 */
public record Seasonality(
        boolean sufficient,
        boolean seasonal,
        List<Integer> peakLags,
        int dominantLag,
        double dominantAcf
) {

    static Seasonality insufficient() {
        return new Seasonality(false, false, List.of(), 0, 0.0);
    }
}
