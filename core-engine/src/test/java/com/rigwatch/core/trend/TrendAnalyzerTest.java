package com.rigwatch.core.trend;

import com.rigwatch.core.TestEvents;
import com.rigwatch.core.history.DeviceHistory;
import com.rigwatch.core.model.Metric;
import com.rigwatch.core.model.TelemetryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendAnalyzer}.
 */
class TrendAnalyzerTest {

    private TrendAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TrendAnalyzer(24, 3);
    }

    // ---------------------------------------------------------------
    // Linear
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should fit a perfect line exactly")
    void perfectLine() {
        LinearTrend trend = analyzer.linear(new double[] {1, 3, 5, 7, 9});

        assertThat(trend.slope()).isCloseTo(2.0, within(1e-9));
        assertThat(trend.intercept()).isCloseTo(1.0, within(1e-9));
        assertThat(trend.rSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(trend.direction()).isEqualTo(TrendDirection.INCREASING);
        assertThat(trend.confidence()).isEqualTo(TrendConfidence.HIGH);
        assertThat(trend.points()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should report insufficient data below two points")
    void insufficientLinear() {
        LinearTrend trend = analyzer.linear(new double[] {42});

        assertThat(trend.isSufficient()).isFalse();
        assertThat(trend.direction()).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("Identical x values give a zero slope")
    void identicalXs() {
        LinearTrend trend = analyzer.linear(new double[] {5, 5, 5}, new double[] {1, 2, 3});

        assertThat(trend.slope()).isZero();
        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    @DisplayName("A tiny slope is classified as stable")
    void tinySlopeIsStable() {
        LinearTrend trend = analyzer.linear(new double[] {100.0, 100.005, 100.01});

        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    @DisplayName("Event-based fit measures slope per second")
    void slopePerSecond() {
        List<TelemetryEvent> events = List.of(
                TestEvents.event("d", 1000, 80, 200),
                TestEvents.event("d", 1010, 81, 199),
                TestEvents.event("d", 1020, 82, 198));

        assertThat(analyzer.linear(events, Metric.TEMPERATURE).slope()).isCloseTo(0.1, within(1e-9));
        assertThat(analyzer.linear(events, Metric.PRESSURE).direction()).isEqualTo(TrendDirection.DECREASING);
    }

    @Test
    @DisplayName("Should reject mismatched arrays")
    void mismatchedArrays() {
        assertThatThrownBy(() -> analyzer.linear(new double[] {1, 2}, new double[] {1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Seasonality
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should find the period of a sine wave")
    void sinePeriod() {
        double[] values = new double[64];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.sin(2 * Math.PI * i / 8.0);
        }

        Seasonality seasonality = analyzer.seasonality(values, 24);

        assertThat(seasonality.sufficient()).isTrue();
        assertThat(seasonality.seasonal()).isTrue();
        assertThat(seasonality.dominantLag()).isEqualTo(8);
        assertThat(seasonality.peakLags()).contains(8, 16);
        assertThat(seasonality.dominantAcf()).isCloseTo(0.875, within(1e-6));
    }

    @Test
    @DisplayName("A cycle whose period equals the maximum lag is detected")
    void seasonalityAtMaxLag() {
        double[] values = new double[96];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.sin(2 * Math.PI * i / 24.0);
        }

        Seasonality seasonality = analyzer.seasonality(values, 24);

        assertThat(seasonality.seasonal()).isTrue();
        assertThat(seasonality.peakLags()).containsExactly(24);
        assertThat(seasonality.dominantLag()).isEqualTo(24);
        assertThat(seasonality.dominantAcf()).isCloseTo(0.75, within(1e-6));
    }

    @Test
    @DisplayName("Short series are insufficient for seasonality")
    void seasonalityInsufficient() {
        Seasonality seasonality = analyzer.seasonality(new double[10], 24);

        assertThat(seasonality.sufficient()).isFalse();
        assertThat(seasonality.seasonal()).isFalse();
    }

    @Test
    @DisplayName("A constant series has no seasonality")
    void constantSeries() {
        double[] values = new double[60];
        Arrays.fill(values, 80.0);

        Seasonality seasonality = analyzer.seasonality(values, 24);

        assertThat(seasonality.sufficient()).isTrue();
        assertThat(seasonality.seasonal()).isFalse();
        assertThat(TrendAnalyzer.autocorrelation(values, 3)).containsExactly(1.0, 0.0, 0.0, 0.0);
    }

    // ---------------------------------------------------------------
    // Moving average
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should compare the latest window with the one before it")
    void movingAverageDirection() {
        MovingAverageTrend up = analyzer.movingAverage(new double[] {100, 100, 100, 110, 110, 110}, 3);
        MovingAverageTrend down = analyzer.movingAverage(new double[] {110, 110, 110, 100, 100, 100}, 3);
        MovingAverageTrend flat = analyzer.movingAverage(new double[] {100, 101, 100, 101, 100, 101}, 3);

        assertThat(up.direction()).isEqualTo(TrendDirection.INCREASING);
        assertThat(up.averages()).hasSize(4);
        assertThat(up.earlierMean()).isEqualTo(100.0);
        assertThat(up.recentMean()).isEqualTo(110.0);
        assertThat(up.changeRatio()).isCloseTo(0.10, within(1e-9));
        assertThat(down.direction()).isEqualTo(TrendDirection.DECREASING);
        assertThat(flat.direction()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    @DisplayName("Moving average needs two full windows")
    void movingAverageInsufficient() {
        MovingAverageTrend trend = analyzer.movingAverage(new double[] {1, 2, 3}, 3);

        assertThat(trend.isSufficient()).isFalse();
    }

    // ---------------------------------------------------------------
    // Report
    // ---------------------------------------------------------------

    @Test
    @DisplayName("analyze combines the three analyses for one device metric")
    void analyzeHistory() {
        DeviceHistory history = TestEvents.historyOf(TestEvents.steady("well-9", 60), 100);

        TrendReport report = analyzer.analyze(history, Metric.TEMPERATURE);

        assertThat(report.deviceId()).isEqualTo("well-9");
        assertThat(report.metric()).isEqualTo(Metric.TEMPERATURE);
        assertThat(report.linear().points()).isEqualTo(60);
        assertThat(report.linear().direction()).isEqualTo(TrendDirection.STABLE);
        assertThat(report.seasonality().sufficient()).isTrue();
        assertThat(report.movingAverage().isSufficient()).isTrue();
    }
}
