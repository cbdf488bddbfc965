package com.z254.verity.detection;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.Baseline;
import com.z254.verity.domain.repository.BaselineSeed;
import com.z254.verity.exception.InsufficientHistoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static com.z254.verity.TestSignals.constant;
import static com.z254.verity.TestSignals.samples;
import static com.z254.verity.TestSignals.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineEngine}.
 */
class BaselineEngineTest {

    private VerityProperties properties;
    private BaselineEngine engine;

    @BeforeEach
    void setUp() {
        properties = new VerityProperties();
        engine = new BaselineEngine(properties);
    }

    @Nested
    @DisplayName("Band computation")
    class BandTests {

        @Test
        @DisplayName("should use the population standard deviation")
        void populationStandardDeviation() {
            Baseline baseline = engine.computeBaseline(series("s", "svc", 2, 4, 4, 4, 5, 5, 7, 9), 8, 2.0);

            assertThat(baseline.getMean()).isCloseTo(5.0, within(1e-12));
            assertThat(baseline.getStddev()).isCloseTo(2.0, within(1e-12));
            assertThat(baseline.getBandLow()).isCloseTo(1.0, within(1e-12));
            assertThat(baseline.getBandHigh()).isCloseTo(9.0, within(1e-12));
            assertThat(baseline.getSampleCount()).isEqualTo(8);
        }

        @Test
        @DisplayName("should collapse the band onto the mean for a flat window")
        void flatWindow() {
            Baseline baseline = engine.computeBaseline(series("s", "svc", constant(20, 3.0)), 20);

            assertThat(baseline.getStddev()).isZero();
            assertThat(baseline.isFlat()).isTrue();
            assertThat(baseline.getBandLow()).isEqualTo(3.0);
            assertThat(baseline.getBandHigh()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should only look at the trailing window")
        void trailingWindow() {
            double[] values = new double[30];
            for (int i = 0; i < 30; i++) {
                values[i] = i < 20 ? 100.0 + i : 5.0;
            }

            Baseline baseline = engine.computeBaseline(series("s", "svc", values), 10);

            assertThat(baseline.getMean()).isEqualTo(5.0);
            assertThat(baseline.getStddev()).isZero();
            assertThat(baseline.getWindow()).isEqualTo(10);
        }

        @Test
        @DisplayName("should widen the band with k")
        void bandWidthFollowsK() {
            Baseline narrow = engine.computeBaseline(series("s", "svc", 2, 4, 4, 4, 5, 5, 7, 9), 8, 1.0);
            Baseline wide = engine.computeBaseline(series("s", "svc", 2, 4, 4, 4, 5, 5, 7, 9), 8, 3.0);

            assertThat(wide.getBandHigh() - wide.getBandLow())
                    .isCloseTo(3 * (narrow.getBandHigh() - narrow.getBandLow()), within(1e-9));
        }
    }

    @Nested
    @DisplayName("History requirements")
    class HistoryTests {

        @Test
        @DisplayName("should reject fewer points than the minimum history")
        void rejectsShortHistory() {
            assertThatThrownBy(() -> engine.computeBaseline(series("short", "svc", 1, 2, 3, 4, 5), 60))
                    .isInstanceOf(InsufficientHistoryException.class)
                    .hasMessageContaining("short");
        }

        @Test
        @DisplayName("should reject a non-positive window")
        void rejectsNonPositiveWindow() {
            assertThatThrownBy(() -> engine.computeBaseline(series("s", "svc", constant(20, 1.0)), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should ignore non-finite samples")
        void ignoresNonFinite() {
            double[] values = constant(12, 4.0);
            values[3] = Double.NaN;
            values[7] = Double.POSITIVE_INFINITY;

            Baseline baseline = engine.computeBaseline(series("s", "svc", values), 60);

            assertThat(baseline.getMean()).isEqualTo(4.0);
            assertThat(baseline.getSampleCount()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Historical seeds")
    class SeedTests {

        private AnalysisSettings settings() {
            return AnalysisSettings.defaults(properties).toBuilder()
                    .baselineWindow(8)
                    .minHistory(8)
                    .build();
        }

        @Test
        @DisplayName("should blend a seed with enough samples")
        void blendsSeed() {
            BaselineSeed seed = new BaselineSeed(10.0, 1.0, 50, Instant.now());

            Baseline baseline = engine.computeBaseline("s", samples(2, 4, 4, 4, 5, 5, 7, 9), settings(),
                    Optional.of(seed));

            assertThat(baseline.isSeeded()).isTrue();
            assertThat(baseline.getMean()).isCloseTo(0.3 * 10.0 + 0.7 * 5.0, within(1e-9));
            assertThat(baseline.getStddev()).isCloseTo(0.3 * 1.0 + 0.7 * 2.0, within(1e-9));
        }

        @Test
        @DisplayName("should ignore a seed with too few samples")
        void ignoresThinSeed() {
            BaselineSeed seed = new BaselineSeed(10.0, 1.0, 5, Instant.now());

            Baseline baseline = engine.computeBaseline("s", samples(2, 4, 4, 4, 5, 5, 7, 9), settings(),
                    Optional.of(seed));

            assertThat(baseline.isSeeded()).isFalse();
            assertThat(baseline.getMean()).isCloseTo(5.0, within(1e-12));
        }
    }
}
