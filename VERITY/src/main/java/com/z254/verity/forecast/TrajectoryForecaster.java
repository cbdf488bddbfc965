package com.z254.verity.forecast;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.domain.model.TrajectoryForecast;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projects a series linearly to estimate when it will cross a breach threshold.
 * <p>
 * A forecast is produced only when:
 * <ul>
 *     <li>The series has at least the configured minimum length</li>
 *     <li>The least-squares fit explains enough variance (R²) and is not flat</li>
 *     <li>The threshold is reached within the horizon, or the projection ends near it</li>
 * </ul>
 * Severity follows the time to breach: under one forecast window is critical, under three
 * is high, any other breach within the horizon is medium.
 */
@Slf4j
@Component
public class TrajectoryForecaster {

    private final VerityProperties properties;

    public TrajectoryForecaster(VerityProperties properties) {
        this.properties = properties;
    }

    /**
     * Breach threshold for a query expression: the first configured fragment it contains.
     */
    public Optional<Double> thresholdFor(String expression) {
        if (expression == null) {
            return Optional.empty();
        }
        return properties.getForecast().getThresholds().entrySet().stream()
                .filter(e -> expression.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * Forecast with the threshold matching the series' query expression, if any.
     */
    public Optional<TrajectoryForecast> forecast(TimeSeries series) {
        String expression = series.getQuery() != null ? series.getQuery().getExpression() : null;
        return thresholdFor(expression)
                .flatMap(threshold -> forecast(series, threshold, properties.getForecast().getHorizon()));
    }

    public Optional<TrajectoryForecast> forecast(TimeSeries series, double threshold, Duration horizon) {
        VerityProperties.Forecast config = properties.getForecast();
        List<Sample> samples = series.getSamples().stream()
                .filter(s -> Double.isFinite(s.value()))
                .toList();
        if (samples.size() < config.getMinLength()) {
            return Optional.empty();
        }

        // Step 1: least squares over seconds since the first sample
        Instant origin = samples.get(0).timestamp();
        SimpleRegression regression = new SimpleRegression();
        for (Sample sample : samples) {
            regression.addData(secondsBetween(origin, sample.timestamp()), sample.value());
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double r2 = regression.getRSquare();
        if (!Double.isFinite(slope) || !(r2 >= config.getR2Threshold()) || slope == 0.0) {
            return Optional.empty();
        }

        // Step 2: project to now and to the horizon
        double horizonSeconds = horizon.toMillis() / 1000.0;
        double now = secondsBetween(origin, samples.get(samples.size() - 1).timestamp());
        double current = slope * now + intercept;
        double predicted = slope * (now + horizonSeconds) + intercept;

        Double timeToThreshold = null;
        if (slope > 0 && current < threshold) {
            timeToThreshold = (threshold - current) / slope;
        } else if (slope < 0 && current > threshold) {
            timeToThreshold = (current - threshold) / Math.abs(slope);
        }

        // Step 3: keep breaches, and projections that end close to the threshold
        boolean willBreach = timeToThreshold != null && timeToThreshold <= horizonSeconds;
        double distance = Math.abs(predicted - threshold) / (Math.abs(threshold) + 1e-9);
        if (!willBreach && distance > config.getRatioThreshold()) {
            return Optional.empty();
        }

        double confidence = Math.min(0.99, r2 * (1.0 - Math.min(1.0, Math.abs(slope) / (Math.abs(current) + 1e-9))));
        TrajectoryForecast forecast = TrajectoryForecast.builder()
                .seriesId(series.getId())
                .service(series.getService())
                .currentValue(current)
                .slopePerSecond(slope)
                .predictedValueAtHorizon(predicted)
                .timeToThresholdSeconds(timeToThreshold)
                .breachThreshold(threshold)
                .confidence(confidence)
                .severity(severity(timeToThreshold, willBreach, config.getWindow()))
                .build();
        log.debug("Trajectory of {}: slope={}/s, breach in {}s", series.getId(), slope, timeToThreshold);
        return Optional.of(forecast);
    }

    // ========== Private Helper Methods ==========

    private static Severity severity(Double timeToThreshold, boolean willBreach, Duration window) {
        double windowSeconds = window.toMillis() / 1000.0;
        if (timeToThreshold != null && timeToThreshold > 0 && timeToThreshold < windowSeconds) {
            return Severity.CRITICAL;
        }
        if (timeToThreshold != null && timeToThreshold > 0 && timeToThreshold < windowSeconds * 3) {
            return Severity.HIGH;
        }
        return willBreach ? Severity.MEDIUM : Severity.LOW;
    }

    private static double secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
