package com.rigwatch.core.trend;

import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.history.WindowStats;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Linear, seasonal and moving-average trend analysis over a device window.
 *
 * <p>
 * Every method tolerates short input and answers with an explicit
 * insufficient-data result instead of throwing:
 * </p>
 * <ul>
 * <li>linear fit: at least 2 points</li>
 * <li>seasonality: at least {@code 2 × maxLag} points</li>
 * <li>moving average: at least {@code 2 × window} points</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    /** |slope| below this is classified as stable. */
    static final double STABLE_SLOPE = 0.01;

    /** Autocorrelation a local maximum must exceed to count as a peak. */
    static final double PEAK_ACF = 0.3;

    /** Relative change of the moving average that counts as a direction. */
    static final double MOVING_AVERAGE_CHANGE = 0.05;

    private final int seasonalMaxLag;
    private final int movingAverageWindow;

    /**
     * @param seasonalMaxLag      largest autocorrelation lag examined; &gt;= 2
     * @param movingAverageWindow moving-average window in points; &gt;= 1
     */
    public TrendAnalyzer(int seasonalMaxLag, int movingAverageWindow) {
        if (seasonalMaxLag < 2) {
            throw new IllegalArgumentException("seasonalMaxLag must be >= 2, got: " + seasonalMaxLag);
        }
        if (movingAverageWindow < 1) {
            throw new IllegalArgumentException(
                    "movingAverageWindow must be >= 1, got: " + movingAverageWindow);
        }
        this.seasonalMaxLag = seasonalMaxLag;
        this.movingAverageWindow = movingAverageWindow;
    }

    // ---------------------------------------------------------------
    // Combined report
    // ---------------------------------------------------------------

    /**
     * Run all three analyses on one metric of a device history.
     *
     * @param history device history; must not be {@code null}
     * @param metric  metric to analyse
     * @return the report
     */
    public TrendReport analyze(DeviceHistory history, Metric metric) {
        Objects.requireNonNull(history, "history must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        List<TelemetryEvent> events = history.snapshot();
        double[] values = WindowStats.values(events, metric);

        TrendReport report = new TrendReport(history.getDeviceId(), metric,
                linear(events, metric),
                seasonality(values, seasonalMaxLag),
                movingAverage(values, movingAverageWindow));
        LOG.debug("Trend report for [{}] {}: {}", history.getDeviceId(), metric, report.linear());
        return report;
    }

    // ---------------------------------------------------------------
    // Linear trend
    // ---------------------------------------------------------------

    /**
     * Fit value against time, with time measured in seconds since the first
     * event.
     */
    public LinearTrend linear(List<TelemetryEvent> events, Metric metric) {
        double[] xs = new double[events.size()];
        double[] ys = new double[events.size()];
        double origin = events.isEmpty() ? 0.0 : events.get(0).getTimestamp();
        for (int i = 0; i < xs.length; i++) {
            TelemetryEvent event = events.get(i);
            xs[i] = event.getTimestamp() - origin;
            ys[i] = event.valueOf(metric);
        }
        return linear(xs, ys);
    }

    /**
     * Fit value against reading index (0, 1, 2, ...).
     */
    public LinearTrend linear(double[] values) {
        double[] xs = new double[values.length];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = i;
        }
        return linear(xs, values);
    }

    /**
     * Ordinary least squares over {@code (xs[i], ys[i])}.
     *
     * <p>
     * When every x is equal the slope is reported as 0. A series with no
     * variance in y is fitted exactly and gets {@code R² = 1}.
     * </p>
     *
     * @param xs x values
     * @param ys y values, same length as {@code xs}
     * @return the fit, or an insufficient result for fewer than 2 points
     */
    public LinearTrend linear(double[] xs, double[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException(
                    "xs and ys must have equal length, got " + xs.length + " and " + ys.length);
        }
        int n = xs.length;
        if (n < 2) {
            return LinearTrend.insufficient(n);
        }

        double meanX = WindowStats.mean(xs);
        double meanY = WindowStats.mean(ys);
        double sxx = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            double dx = xs[i] - meanX;
            sxx += dx * dx;
            sxy += dx * (ys[i] - meanY);
        }
        double slope = sxx == 0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssTot = 0;
        double ssRes = 0;
        for (int i = 0; i < n; i++) {
            double fitted = intercept + slope * xs[i];
            ssRes += (ys[i] - fitted) * (ys[i] - fitted);
            ssTot += (ys[i] - meanY) * (ys[i] - meanY);
        }
        double rSquared = ssTot == 0 ? 1.0 : Math.max(0.0, 1.0 - ssRes / ssTot);

        TrendDirection direction;
        if (Math.abs(slope) < STABLE_SLOPE) {
            direction = TrendDirection.STABLE;
        } else {
            direction = slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }
        return new LinearTrend(n, slope, intercept, rSquared, direction,
                TrendConfidence.fromRSquared(rSquared));
    }

    // ---------------------------------------------------------------
    // Seasonality
    // ---------------------------------------------------------------

    /**
     * Detect periodicity from the normalized autocorrelation function.
     *
     * <p>
     * A lag {@code k} in {@code [2, maxLag]} is a peak when its
     * autocorrelation exceeds both neighbours' (ties on the right allowed)
     * and is above {@value #PEAK_ACF}.
     * </p>
     *
     * @param values series, oldest first
     * @param maxLag largest lag to examine
     * @return the estimate; insufficient when {@code values.length < 2 × maxLag}
     */
    public Seasonality seasonality(double[] values, int maxLag) {
        if (maxLag < 2 || values.length < 2 * maxLag) {
            return Seasonality.insufficient();
        }
        // one lag past maxLag so that maxLag itself has a right neighbour
        double[] acf = autocorrelation(values, maxLag + 1);

        List<Integer> peaks = new ArrayList<>();
        int dominantLag = 0;
        double dominantAcf = 0.0;
        for (int lag = 2; lag <= maxLag; lag++) {
            boolean localMax = acf[lag] > acf[lag - 1] && acf[lag] >= acf[lag + 1];
            if (localMax && acf[lag] > PEAK_ACF) {
                peaks.add(lag);
                if (acf[lag] > dominantAcf) {
                    dominantAcf = acf[lag];
                    dominantLag = lag;
                }
            }
        }
        return new Seasonality(true, !peaks.isEmpty(), List.copyOf(peaks), dominantLag, dominantAcf);
    }

    /**
     * Normalized autocorrelation for lags {@code 0..maxLag}; all zeros (with
     * {@code acf[0] = 1}) for a constant series.
     */
    static double[] autocorrelation(double[] values, int maxLag) {
        double[] acf = new double[maxLag + 1];
        double mean = WindowStats.mean(values);
        double denominator = 0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        acf[0] = 1.0;
        if (denominator == 0) {
            return acf;
        }
        for (int lag = 1; lag <= maxLag; lag++) {
            double sum = 0;
            for (int t = 0; t + lag < values.length; t++) {
                sum += (values[t] - mean) * (values[t + lag] - mean);
            }
            acf[lag] = sum / denominator;
        }
        return acf;
    }

    // ---------------------------------------------------------------
    // Moving average
    // ---------------------------------------------------------------

    /**
     * Sliding-window means plus a comparison of the last window against the
     * window before it.
     *
     * @param values series, oldest first
     * @param window window size in points
     * @return the trend; insufficient when {@code values.length < 2 × window}
     */
    public MovingAverageTrend movingAverage(double[] values, int window) {
        if (window < 1 || values.length < 2 * window) {
            return MovingAverageTrend.insufficient(window);
        }
        List<Double> averages = new ArrayList<>(values.length - window + 1);
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            if (i >= window - 1) {
                averages.add(sum / window);
            }
        }

        double recent = averages.get(averages.size() - 1);
        double earlier = averages.get(averages.size() - 1 - window);
        double change;
        if (earlier == 0) {
            change = recent == 0 ? 0.0 : Math.signum(recent);
        } else {
            change = (recent - earlier) / Math.abs(earlier);
        }

        TrendDirection direction;
        if (change > MOVING_AVERAGE_CHANGE) {
            direction = TrendDirection.INCREASING;
        } else if (change < -MOVING_AVERAGE_CHANGE) {
            direction = TrendDirection.DECREASING;
        } else {
            direction = TrendDirection.STABLE;
        }
        return new MovingAverageTrend(window, List.copyOf(averages), recent, earlier, change, direction);
    }

    public int getSeasonalMaxLag() {
        return seasonalMaxLag;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }
}
