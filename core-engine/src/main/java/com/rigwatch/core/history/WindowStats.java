package com.rigwatch.core.history;

import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.TelemetryEvent;

import java.util.List;

/**
 * Descriptive statistics over metric values of a history window.
 */
public final class WindowStats {

    private WindowStats() {
        // utility class
    }

    /**
     * @return the metric values of {@code events}, in order
     */
    public static double[] values(List<TelemetryEvent> events, Metric metric) {
        double[] out = new double[events.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = events.get(i).valueOf(metric);
        }
        return out;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by {@code n}).
     */
    public static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return Math.sqrt(sumSquaredDiff(values) / values.length);
    }

    /**
     * Sample standard deviation (divides by {@code n - 1}); zero for fewer
     * than two values.
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return Math.sqrt(sumSquaredDiff(values) / (values.length - 1));
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return values.length == 0 ? 0.0 : min;
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return values.length == 0 ? 0.0 : max;
    }

    private static double sumSquaredDiff(double[] values) {
        double mean = mean(values);
        double sum = 0;
        for (double v : values) {
            double diff = v - mean;
            sum += diff * diff;
        }
        return sum;
    }
}
