package com.z254.verity.forecast;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.DegradationSignal;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.z254.verity.TestSignals.constant;
import static com.z254.verity.TestSignals.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DegradationAnalyzer}.
 */
class DegradationAnalyzerTest {

    private DegradationAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DegradationAnalyzer(new VerityProperties());
    }

    @Test
    void steepRiseIsCriticalAndAccelerating() {
        assertThat(analyzer.analyze(linear(100.0, 2.5))).hasValueSatisfying(signal -> {
            assertThat(signal.getSeriesId()).isEqualTo("latency");
            assertThat(signal.getDegradationRate()).isCloseTo(0.3516, within(1e-3));
            assertThat(signal.getVolatility()).isCloseTo(0.1165, within(1e-3));
            assertThat(signal.getTrend()).isEqualTo(DegradationSignal.Trend.DEGRADING);
            assertThat(signal.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(signal.isAccelerating()).isTrue();
            assertThat(signal.getWindow()).isEqualTo(Duration.ofSeconds(19));
        });
    }

    @Test
    void fallingSeriesIsRecovering() {
        assertThat(analyzer.analyze(linear(150.0, -2.5))).hasValueSatisfying(signal -> {
            assertThat(signal.getTrend()).isEqualTo(DegradationSignal.Trend.RECOVERING);
            assertThat(signal.isAccelerating()).isFalse();
        });
    }

    @Test
    void gentleDriftIsLow() {
        assertThat(analyzer.analyze(linear(100.0, 0.6))).hasValueSatisfying(signal -> {
            assertThat(signal.getDegradationRate()).isCloseTo(0.0988, within(1e-3));
            assertThat(signal.getSeverity()).isEqualTo(Severity.LOW);
        });
    }

    @Test
    void stableSeriesYieldsNothing() {
        double[] wobble = new double[20];
        for (int i = 0; i < wobble.length; i++) {
            wobble[i] = 100.0 + (i % 2 == 0 ? -1.0 : 1.0);
        }
        assertThat(analyzer.analyze(series("latency", "checkout", wobble))).isEmpty();
        assertThat(analyzer.analyze(series("latency", "checkout", constant(20, 42.0)))).isEmpty();
    }

    @Test
    void shortSeriesYieldsNothing() {
        assertThat(analyzer.analyze(series("latency", "checkout", 1, 2, 3, 4, 5))).isEmpty();
    }

    @Test
    void accelerationComparesHalves() {
        assertThat(DegradationAnalyzer.acceleration(new double[]{0, 1, 2, 4, 6, 8})).isCloseTo(1.0, within(1e-9));
        assertThat(DegradationAnalyzer.acceleration(new double[]{1, 2, 3})).isZero();
    }

    private static TimeSeries linear(double start, double perStep) {
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = start + perStep * i;
        }
        return series("latency", "checkout", values);
    }
}
