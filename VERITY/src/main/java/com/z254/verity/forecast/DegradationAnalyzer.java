package com.z254.verity.forecast;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.DegradationSignal;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Detects slow drift that never leaves the baseline band.
 * <p>
 * The series is smoothed with an exponential moving average and fitted against a unit time
 * axis, so the slope is the total change over the window. Dividing by the mean magnitude of
 * the raw values makes the rate comparable across series.
 */
@Slf4j
@Component
public class DegradationAnalyzer {

    private static final double EPSILON = 1e-9;

    private final VerityProperties properties;

    public DegradationAnalyzer(VerityProperties properties) {
        this.properties = properties;
    }

    public Optional<DegradationSignal> analyze(TimeSeries series) {
        return analyze(series, properties.getForecast().getMinDegradationRate());
    }

    public Optional<DegradationSignal> analyze(TimeSeries series, double minDegradationRate) {
        VerityProperties.Forecast config = properties.getForecast();
        List<Sample> samples = series.getSamples().stream()
                .filter(s -> Double.isFinite(s.value()))
                .toList();
        if (samples.size() < config.getDegradationMinLength()) {
            return Optional.empty();
        }

        double[] values = samples.stream().mapToDouble(Sample::value).toArray();
        double[] smoothed = ema(values, config.getEmaAlpha());

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < smoothed.length; i++) {
            regression.addData((double) i / (smoothed.length - 1), smoothed[i]);
        }
        double slope = regression.getSlope();

        double meanMagnitude = StatUtils.mean(Arrays.stream(values).map(Math::abs).toArray());
        double volatility = Math.sqrt(StatUtils.populationVariance(values)) / (meanMagnitude + EPSILON);
        double acceleration = acceleration(smoothed);
        double rate = Math.abs(slope) / (meanMagnitude + EPSILON);
        if (!Double.isFinite(rate) || rate < minDegradationRate) {
            return Optional.empty();
        }

        Severity severity;
        if (rate > config.getDegradationCritical()
                || (rate > config.getDegradationHigh() && acceleration > 0)) {
            severity = Severity.CRITICAL;
        } else if (rate > config.getDegradationHigh()) {
            severity = Severity.HIGH;
        } else if (rate > config.getDegradationMedium()) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.LOW;
        }

        DegradationSignal signal = DegradationSignal.builder()
                .seriesId(series.getId())
                .service(series.getService())
                .degradationRate(rate)
                .volatility(volatility)
                .trend(slope > 0 ? DegradationSignal.Trend.DEGRADING : DegradationSignal.Trend.RECOVERING)
                .window(Duration.between(samples.get(0).timestamp(), samples.get(samples.size() - 1).timestamp()))
                .severity(severity)
                .accelerating(acceleration > 0 && slope > 0)
                .build();
        log.debug("Degradation on {}: rate={}, trend={}", series.getId(), rate, signal.getTrend());
        return Optional.of(signal);
    }

    // ========== Private Helper Methods ==========

    static double[] ema(double[] values, double alpha) {
        double[] result = new double[values.length];
        result[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            result[i] = alpha * values[i] + (1 - alpha) * result[i - 1];
        }
        return result;
    }

    /**
     * Mean step of the second half minus mean step of the first half.
     */
    static double acceleration(double[] values) {
        if (values.length < 4) {
            return 0.0;
        }
        int half = values.length / 2;
        return meanStep(values, half, values.length) - meanStep(values, 0, half);
    }

    private static double meanStep(double[] values, int from, int to) {
        if (to - from < 2) {
            return 0.0;
        }
        double[] steps = new double[to - from - 1];
        for (int i = from + 1; i < to; i++) {
            steps[i - from - 1] = values[i] - values[i - 1];
        }
        return StatUtils.mean(steps);
    }
}
