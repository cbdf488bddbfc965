package com.z254.verity.forecast;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.domain.model.TrajectoryForecast;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.z254.verity.TestSignals.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrajectoryForecaster}.
 */
class TrajectoryForecasterTest {

    private static final Duration HORIZON = Duration.ofSeconds(300);

    private TrajectoryForecaster forecaster;

    @BeforeEach
    void setUp() {
        forecaster = new TrajectoryForecaster(new VerityProperties());
    }

    @Nested
    @DisplayName("Breach projection")
    class BreachTests {

        @Test
        @DisplayName("should flag a breach inside the window as critical")
        void imminentBreach() {
            Optional<TrajectoryForecast> result = forecaster.forecast(ramp(0.5, 0.001), 0.85, HORIZON);

            assertThat(result).hasValueSatisfying(forecast -> {
                assertThat(forecast.getSeriesId()).isEqualTo("memory");
                assertThat(forecast.getSlopePerSecond()).isCloseTo(0.001, within(1e-9));
                assertThat(forecast.getCurrentValue()).isCloseTo(0.559, within(1e-9));
                assertThat(forecast.getPredictedValueAtHorizon()).isCloseTo(0.859, within(1e-9));
                assertThat(forecast.getTimeToThresholdSeconds()).isCloseTo(291.0, within(1e-6));
                assertThat(forecast.willBreach(HORIZON.toSeconds())).isTrue();
                assertThat(forecast.getConfidence()).isEqualTo(0.99);
                assertThat(forecast.getSeverity()).isEqualTo(Severity.CRITICAL);
            });
        }

        @Test
        @DisplayName("should rate a breach within three windows as high")
        void laterBreach() {
            Optional<TrajectoryForecast> result = forecaster.forecast(ramp(0.5, 0.0005), 0.85, HORIZON);

            assertThat(result).hasValueSatisfying(forecast -> {
                assertThat(forecast.getTimeToThresholdSeconds()).isCloseTo(641.0, within(1e-6));
                assertThat(forecast.willBreach(HORIZON.toSeconds())).isFalse();
                assertThat(forecast.getSeverity()).isEqualTo(Severity.HIGH);
            });
        }

        @Test
        @DisplayName("should drop a trend moving far away from the threshold")
        void movingAway() {
            assertThat(forecaster.forecast(ramp(0.8, -0.002), 0.85, HORIZON)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Rejected fits")
    class RejectionTests {

        @Test
        @DisplayName("should drop fits that explain too little variance")
        void poorFit() {
            double[] values = new double[60];
            for (int i = 0; i < values.length; i++) {
                values[i] = 0.5 + (i % 2 == 0 ? -0.01 : 0.01);
            }
            assertThat(forecaster.forecast(series("memory", "checkout", values), 0.85, HORIZON)).isEmpty();
        }

        @Test
        @DisplayName("should need the minimum number of points")
        void tooShort() {
            assertThat(forecaster.forecast(series("memory", "checkout", 0.5, 0.6, 0.7, 0.8), 0.85, HORIZON))
                    .isEmpty();
        }
    }

    @Test
    @DisplayName("should pick the threshold from the query expression")
    void thresholdFromExpression() {
        assertThat(forecaster.thresholdFor("avg(system_memory_usage_bytes{service=\"checkout\"})")).contains(0.85);
        assertThat(forecaster.thresholdFor("up")).isEmpty();
        assertThat(forecaster.thresholdFor(null)).isEmpty();

        TimeSeries plain = ramp(0.5, 0.001);
        TimeSeries memory = plain.toBuilder()
                .query(plain.getQuery().toBuilder().expression("system_memory_usage_bytes").build())
                .build();
        assertThat(forecaster.forecast(plain)).isEmpty();
        assertThat(forecaster.forecast(memory)).hasValueSatisfying(forecast ->
                assertThat(forecast.getBreachThreshold()).isEqualTo(0.85));
    }

    private static TimeSeries ramp(double start, double perSecond) {
        double[] values = new double[60];
        for (int i = 0; i < values.length; i++) {
            values[i] = start + perSecond * i;
        }
        return series("memory", "checkout", values);
    }
}
