package com.z254.verity.causal;

import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.TimeSeries;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Forward-fills metric series onto the request grid so they can be compared lag by lag.
 */
@Component
public class SignalAligner {

    public AlignedSignals align(Collection<TimeSeries> series, Instant start, Instant end, Duration step) {
        if (series.isEmpty() || step == null || step.isZero() || step.isNegative() || !end.isAfter(start)) {
            return AlignedSignals.empty();
        }
        int slots = (int) (Duration.between(start, end).toMillis() / step.toMillis()) + 1;

        Map<String, double[]> aligned = new TreeMap<>();
        for (TimeSeries ts : series) {
            if (ts.isEmpty()) {
                continue;
            }
            aligned.put(ts.getId(), fill(ts.getSamples(), start, step, slots));
        }
        return new AlignedSignals(start, step, aligned);
    }

    private static double[] fill(List<Sample> samples, Instant start, Duration step, int slots) {
        double[] grid = new double[slots];
        Arrays.fill(grid, Double.NaN);
        int cursor = 0;
        double last = Double.NaN;
        for (int slot = 0; slot < slots; slot++) {
            Instant at = start.plus(step.multipliedBy(slot));
            while (cursor < samples.size() && !samples.get(cursor).timestamp().isAfter(at)) {
                double value = samples.get(cursor).value();
                if (Double.isFinite(value)) {
                    last = value;
                }
                cursor++;
            }
            grid[slot] = last;
        }
        return grid;
    }
}
