package com.z254.verity.detection;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.Baseline;
import com.z254.verity.domain.model.ChangeType;
import com.z254.verity.domain.model.ChangepointEvent;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.TimeInterval;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.exception.InsufficientHistoryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags intervals of a series that fall outside its baseline band.
 * <p>
 * A point is a candidate when it lies outside the band and its |z| reaches the configured
 * multiplier; against a flat baseline any deviation is a candidate. Consecutive candidates
 * form one interval, and runs separated by a single in-band point with opposite signs are
 * joined so alternating excursions read as one oscillation. Detection never crosses a
 * segment boundary of the normalized series.
 */
@Slf4j
@Component
public class AnomalyDetector {

    private final SeriesNormalizer normalizer;
    private final VerityProperties properties;

    public AnomalyDetector(SeriesNormalizer normalizer, VerityProperties properties) {
        this.normalizer = normalizer;
        this.properties = properties;
    }

    /**
     * Detect with the configured defaults and no changepoint confirmation.
     */
    public List<AnomalyEvent> detect(TimeSeries series, Baseline baseline) {
        AnalysisSettings settings = AnalysisSettings.defaults(properties);
        NormalizedSeries normalized = normalizer.normalize(series,
                properties.getFetch().getDefaultStep(), settings.getMaxGapSteps());
        return detect(normalized, baseline, List.of(), settings);
    }

    /**
     * Detect on a normalized series, confirming sustained shifts with {@code changepoints}.
     *
     * @throws InsufficientHistoryException when the series is shorter than the minimum history
     */
    public List<AnomalyEvent> detect(NormalizedSeries series, Baseline baseline,
                                     List<ChangepointEvent> changepoints, AnalysisSettings settings) {
        if (series.size() < settings.getMinHistory()) {
            throw new InsufficientHistoryException(series.getSeriesId(), series.size(), settings.getMinHistory());
        }

        List<AnomalyEvent> events = new ArrayList<>();
        for (List<Sample> segment : series.getSegments()) {
            events.addAll(detectInSegment(series, segment, baseline, changepoints, settings));
        }
        if (!events.isEmpty()) {
            log.debug("Detected {} anomalies on {}", events.size(), series.getSeriesId());
        }
        return events;
    }

    private List<AnomalyEvent> detectInSegment(NormalizedSeries series, List<Sample> segment, Baseline baseline,
                                               List<ChangepointEvent> changepoints, AnalysisSettings settings) {
        int n = segment.size();
        double[] z = new double[n];
        boolean[] candidate = new boolean[n];
        for (int i = 0; i < n; i++) {
            double value = segment.get(i).value();
            z[i] = baseline.zScore(value);
            candidate[i] = baseline.isOutsideBand(value)
                    && (Double.isInfinite(z[i]) || Math.abs(z[i]) >= settings.getZscoreMultiplier());
        }

        List<int[]> groups = group(candidate, z);
        List<AnomalyEvent> events = new ArrayList<>(groups.size());
        for (int[] g : groups) {
            events.add(toEvent(series, segment, baseline, z, candidate, g[0], g[1], changepoints, settings));
        }
        return events;
    }

    /**
     * Maximal candidate runs as {@code [first, last]} index pairs, with oscillation bridging.
     */
    private List<int[]> group(boolean[] candidate, double[] z) {
        List<int[]> runs = new ArrayList<>();
        int i = 0;
        while (i < candidate.length) {
            if (!candidate[i]) {
                i++;
                continue;
            }
            int start = i;
            while (i + 1 < candidate.length && candidate[i + 1]) {
                i++;
            }
            runs.add(new int[]{start, i});
            i++;
        }

        List<int[]> merged = new ArrayList<>();
        for (int[] run : runs) {
            if (!merged.isEmpty()) {
                int[] last = merged.get(merged.size() - 1);
                boolean oneApart = run[0] - last[1] == 2;
                boolean flips = Math.signum(z[last[1]]) != Math.signum(z[run[0]]);
                if (oneApart && flips) {
                    last[1] = run[1];
                    continue;
                }
            }
            merged.add(run);
        }
        return merged;
    }

    private AnomalyEvent toEvent(NormalizedSeries series, List<Sample> segment, Baseline baseline,
                                 double[] z, boolean[] candidate, int first, int last,
                                 List<ChangepointEvent> changepoints, AnalysisSettings settings) {
        double maxAbs = 0.0;
        int peak = first;
        int signChanges = 0;
        int points = 0;
        double previousSign = 0.0;
        for (int i = first; i <= last; i++) {
            if (!candidate[i]) {
                continue;
            }
            points++;
            double abs = Double.isInfinite(z[i]) ? settings.getFlatSeriesScore() : Math.abs(z[i]);
            if (abs > maxAbs) {
                maxAbs = abs;
                peak = i;
            }
            double sign = Math.signum(z[i]);
            if (previousSign != 0.0 && sign != previousSign) {
                signChanges++;
            }
            previousSign = sign;
        }

        Sample start = segment.get(first);
        Sample end = segment.get(last);
        TimeInterval interval = new TimeInterval(start.timestamp(), end.timestamp());
        int length = last - first + 1;
        boolean reverts = last + 1 < segment.size() && !candidate[last + 1];

        ChangeType changeType;
        if (signChanges >= settings.getOscillationMinSignChanges()) {
            changeType = ChangeType.OSCILLATION;
        } else if (length <= settings.getSpikeMaxSteps() && reverts) {
            changeType = z[peak] > 0 ? ChangeType.SPIKE : ChangeType.DROP;
        } else if (confirmedByChangepoint(interval, series.getStep(), changepoints, settings)) {
            changeType = ChangeType.SUSTAINED_SHIFT;
        } else {
            changeType = z[peak] > 0 ? ChangeType.SPIKE : ChangeType.DROP;
        }

        return AnomalyEvent.builder()
                .id(series.getSeriesId() + "@" + start.timestamp().toEpochMilli())
                .seriesId(series.getSeriesId())
                .service(series.getService())
                .interval(interval)
                .severity(settings.getSeverityBands().classify(maxAbs))
                .changeType(changeType)
                .score(maxAbs)
                .peakValue(segment.get(peak).value())
                .pointCount(points)
                .build();
    }

    private boolean confirmedByChangepoint(TimeInterval interval, Duration step,
                                           List<ChangepointEvent> changepoints, AnalysisSettings settings) {
        Duration tolerance = step.multipliedBy(settings.getChangepointToleranceSteps());
        return changepoints.stream().anyMatch(cp -> {
            Duration offset = Duration.between(interval.start(), cp.getTimestamp()).abs();
            return offset.compareTo(tolerance) <= 0;
        });
    }
}
