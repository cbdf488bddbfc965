package com.z254.verity.detection;

import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Puts raw series on a regular step grid.
 * <p>
 * Gaps of up to {@code maxGapSteps} missing points are filled by linear interpolation.
 * Longer gaps close the current segment, so detection never spans them. Non-finite values
 * and non-increasing timestamps are dropped.
 */
@Slf4j
@Component
public class SeriesNormalizer {

    public NormalizedSeries normalize(TimeSeries series, Duration defaultStep, int maxGapSteps) {
        Duration step = resolveStep(series, defaultStep);
        long stepMillis = Math.max(1L, step.toMillis());

        NormalizedSeries.NormalizedSeriesBuilder result = NormalizedSeries.builder()
                .seriesId(series.getId())
                .service(series.getService())
                .step(step);

        List<Sample> current = new ArrayList<>();
        Sample previous = null;
        int interpolated = 0;
        int dropped = 0;

        for (Sample sample : series.getSamples()) {
            if (!Double.isFinite(sample.value())
                    || (previous != null && !sample.timestamp().isAfter(previous.timestamp()))) {
                dropped++;
                continue;
            }
            if (previous != null) {
                long elapsed = sample.timestamp().toEpochMilli() - previous.timestamp().toEpochMilli();
                long missing = Math.round((double) elapsed / stepMillis) - 1;
                if (missing > maxGapSteps) {
                    result.segment(List.copyOf(current));
                    current = new ArrayList<>();
                } else if (missing > 0) {
                    for (long i = 1; i <= missing; i++) {
                        double fraction = (double) i / (missing + 1);
                        Instant at = previous.timestamp().plusMillis(i * stepMillis);
                        double value = previous.value() + fraction * (sample.value() - previous.value());
                        current.add(new Sample(at, value));
                        interpolated++;
                    }
                }
            }
            current.add(sample);
            previous = sample;
        }
        if (!current.isEmpty()) {
            result.segment(List.copyOf(current));
        }

        NormalizedSeries normalized = result
                .interpolatedPoints(interpolated)
                .droppedPoints(dropped)
                .build();
        if (normalized.isDiscontinuous() || dropped > 0) {
            log.debug("Normalized {}: segments={}, interpolated={}, dropped={}",
                    series.getId(), normalized.getSegments().size(), interpolated, dropped);
        }
        return normalized;
    }

    /**
     * The query step when known, else the median sample spacing, else {@code defaultStep}.
     */
    Duration resolveStep(TimeSeries series, Duration defaultStep) {
        if (series.getQuery() != null && series.getQuery().getStep() != null
                && !series.getQuery().getStep().isZero()) {
            return series.getQuery().getStep();
        }
        List<Sample> samples = series.getSamples();
        if (samples.size() < 2) {
            return defaultStep;
        }
        long[] diffs = new long[samples.size() - 1];
        for (int i = 1; i < samples.size(); i++) {
            diffs[i - 1] = samples.get(i).timestamp().toEpochMilli() - samples.get(i - 1).timestamp().toEpochMilli();
        }
        Arrays.sort(diffs);
        long median = diffs[diffs.length / 2];
        return median > 0 ? Duration.ofMillis(median) : defaultStep;
    }
}
