package com.z254.verity.detection;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.Baseline;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.domain.repository.BaselineSeed;
import com.z254.verity.exception.InsufficientHistoryException;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Computes the normal band of a series from its trailing history window.
 * <p>
 * Uses the population standard deviation. A window whose values are all equal yields
 * {@code stddev = 0} exactly and a band collapsed onto the mean.
 */
@Component
public class BaselineEngine {

    /** Relative spread below which a window is treated as flat */
    private static final double FLAT_EPSILON = 1e-12;

    private final VerityProperties properties;

    public BaselineEngine(VerityProperties properties) {
        this.properties = properties;
    }

    /**
     * Baseline over the last {@code window} samples with the configured band width.
     */
    public Baseline computeBaseline(TimeSeries history, int window) {
        return computeBaseline(history, window, properties.getBaseline().getK());
    }

    public Baseline computeBaseline(TimeSeries history, int window, double k) {
        return computeBaseline(history.getId(), history.getSamples(), window, k,
                properties.getBaseline().getMinHistory(), Optional.empty(), 0.0, Integer.MAX_VALUE);
    }

    /**
     * Baseline from request settings, blended with a stored seed when one with enough samples exists.
     */
    public Baseline computeBaseline(String seriesId, List<Sample> history, AnalysisSettings settings,
                                    Optional<BaselineSeed> seed) {
        return computeBaseline(seriesId, history, settings.getBaselineWindow(), settings.getBaselineK(),
                settings.getMinHistory(), seed, settings.getSeedAlpha(), settings.getSeedMinSamples());
    }

    Baseline computeBaseline(String seriesId, List<Sample> history, int window, double k, int minHistory,
                             Optional<BaselineSeed> seed, double seedAlpha, int seedMinSamples) {
        if (window <= 0) {
            throw new IllegalArgumentException("Baseline window must be positive, got " + window);
        }
        double[] values = history.stream()
                .mapToDouble(Sample::value)
                .filter(Double::isFinite)
                .toArray();
        int required = Math.min(minHistory, window);
        if (values.length < Math.max(1, required)) {
            throw new InsufficientHistoryException(seriesId, values.length, Math.max(1, required));
        }

        int from = Math.max(0, values.length - window);
        int n = values.length - from;

        double min = StatUtils.min(values, from, n);
        double max = StatUtils.max(values, from, n);

        double mean;
        double stddev;
        if (min == max) {
            mean = min;
            stddev = 0.0;
        } else {
            mean = StatUtils.mean(values, from, n);
            stddev = Math.sqrt(StatUtils.populationVariance(values, mean, from, n));
            if (stddev <= FLAT_EPSILON * Math.max(1.0, Math.abs(mean))) {
                stddev = 0.0;
            }
        }

        boolean seeded = false;
        if (seed.isPresent() && seed.get().sampleCount() >= seedMinSamples) {
            BaselineSeed s = seed.get();
            mean = seedAlpha * s.mean() + (1 - seedAlpha) * mean;
            stddev = seedAlpha * s.stddev() + (1 - seedAlpha) * stddev;
            seeded = true;
        }

        double halfWidth = k * stddev;
        return Baseline.builder()
                .seriesId(seriesId)
                .window(window)
                .sampleCount(n)
                .mean(mean)
                .stddev(stddev)
                .k(k)
                .bandLow(mean - halfWidth)
                .bandHigh(mean + halfWidth)
                .seeded(seeded)
                .build();
    }
}
