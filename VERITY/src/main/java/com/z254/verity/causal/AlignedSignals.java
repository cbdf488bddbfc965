package com.z254.verity.causal;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Metric series resampled onto one shared grid.
 * <p>
 * Slots before a series' first sample hold {@code NaN}.
 */
public final class AlignedSignals {

    private static final AlignedSignals EMPTY = new AlignedSignals(Instant.EPOCH, Duration.ofSeconds(1), Map.of());

    private final Instant origin;
    private final Duration step;
    private final Map<String, double[]> values;

    public AlignedSignals(Instant origin, Duration step, Map<String, double[]> values) {
        this.origin = origin;
        this.step = step;
        Map<String, double[]> copy = new TreeMap<>();
        values.forEach((id, series) -> copy.put(id, series.clone()));
        this.values = Collections.unmodifiableMap(copy);
    }

    public static AlignedSignals empty() {
        return EMPTY;
    }

    public Instant getOrigin() {
        return origin;
    }

    public Duration getStep() {
        return step;
    }

    public boolean contains(String signalId) {
        return values.containsKey(signalId);
    }

    public Optional<double[]> series(String signalId) {
        return Optional.ofNullable(values.get(signalId)).map(double[]::clone);
    }

    /**
     * The two series restricted to the slots where both hold a value, as {@code [a, b]}.
     * Empty when either signal is unknown.
     */
    public Optional<double[][]> pair(String a, String b) {
        double[] first = values.get(a);
        double[] second = values.get(b);
        if (first == null || second == null) {
            return Optional.empty();
        }
        int n = Math.min(first.length, second.length);
        double[] x = new double[n];
        double[] y = new double[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(first[i]) && Double.isFinite(second[i])) {
                x[count] = first[i];
                y[count] = second[i];
                count++;
            }
        }
        return Optional.of(new double[][]{Arrays.copyOf(x, count), Arrays.copyOf(y, count)});
    }

    public int size() {
        return values.size();
    }
}
