package com.z254.verity.detection;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.ChangepointEvent;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-sided CUSUM test for sustained level shifts.
 * <p>
 * Each sample is standardized against the current target mean and scale. The upward sum
 * accumulates {@code x - drift} and the downward sum {@code -x - drift}, each clipped at zero.
 * When either exceeds {@code threshold} a changepoint is emitted, both sums reset and the
 * target is re-anchored to the mean of the following points.
 * <p>
 * {@code drift} and {@code threshold} are in units of {@code scale}; with a non-positive
 * scale they apply to raw values.
 */
@Slf4j
@Component
public class ChangepointDetector {

    private final VerityProperties properties;

    public ChangepointDetector(VerityProperties properties) {
        this.properties = properties;
    }

    /**
     * Detect changepoints using the series' leading points as the reference level.
     * <p>
     * The target is the mean of the first quarter of the series (at least the re-anchor
     * count) and the scale its standard deviation, falling back to the whole series
     * spread and then to raw units when the lead-in is flat.
     */
    public List<ChangepointEvent> detectChangepoints(TimeSeries series, double drift, double threshold) {
        List<Sample> samples = series.getSamples();
        if (samples.isEmpty()) {
            return List.of();
        }
        int reanchor = properties.getChangepoint().getReanchorPoints();
        int warmup = Math.min(samples.size(), Math.max(reanchor, samples.size() / 4));
        double target = mean(samples, 0, warmup);
        double scale = stddev(samples, 0, warmup, target);
        if (scale == 0.0) {
            scale = stddev(samples, 0, samples.size(), mean(samples, 0, samples.size()));
        }
        return detect(series.getId(), series.getService(), samples, target, scale, drift, threshold, reanchor);
    }

    /**
     * Detect changepoints against an explicit reference level and scale.
     */
    public List<ChangepointEvent> detect(String seriesId, String service, List<Sample> samples,
                                         double target, double scale, double drift, double threshold,
                                         int reanchorPoints) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("CUSUM threshold must be positive, got " + threshold);
        }
        if (drift < 0) {
            throw new IllegalArgumentException("CUSUM drift must not be negative, got " + drift);
        }
        double unit = scale > 0 ? scale : 1.0;
        VerityProperties.SeverityBands bands = properties.getSeverity();

        List<ChangepointEvent> events = new ArrayList<>();
        double upper = 0.0;
        double lower = 0.0;
        double reference = target;

        for (int i = 0; i < samples.size(); i++) {
            double x = (samples.get(i).value() - reference) / unit;
            upper = Math.max(0.0, upper + x - drift);
            lower = Math.max(0.0, lower - x - drift);

            if (upper > threshold || lower > threshold) {
                boolean up = upper > threshold;
                int end = Math.min(samples.size(), i + Math.max(1, reanchorPoints));
                double after = mean(samples, i, end);
                double magnitude = Math.abs(after - reference);
                Sample at = samples.get(i);

                events.add(ChangepointEvent.builder()
                        .id(seriesId + "#cp@" + at.timestamp().toEpochMilli())
                        .seriesId(seriesId)
                        .service(service)
                        .timestamp(at.timestamp())
                        .index(i)
                        .direction(up ? ChangepointEvent.Direction.UP : ChangepointEvent.Direction.DOWN)
                        .magnitude(magnitude)
                        .cusumStatistic(up ? upper : lower)
                        .valueBefore(reference)
                        .valueAfter(after)
                        .severity(bands.classify(magnitude / unit))
                        .build());

                upper = 0.0;
                lower = 0.0;
                int next = i + 1;
                if (next < samples.size()) {
                    reference = mean(samples, next, Math.min(samples.size(), next + Math.max(1, reanchorPoints)));
                }
            }
        }

        if (!events.isEmpty()) {
            log.debug("CUSUM on {} found {} changepoint(s) (drift={}, threshold={})",
                    seriesId, events.size(), drift, threshold);
        }
        return events;
    }

    private static double mean(List<Sample> samples, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        return StatUtils.mean(values(samples, from, to));
    }

    private static double stddev(List<Sample> samples, int from, int to, double mean) {
        if (to - from < 2) {
            return 0.0;
        }
        return Math.sqrt(StatUtils.populationVariance(values(samples, from, to), mean));
    }

    private static double[] values(List<Sample> samples, int from, int to) {
        return samples.subList(from, to).stream().mapToDouble(Sample::value).toArray();
    }
}
