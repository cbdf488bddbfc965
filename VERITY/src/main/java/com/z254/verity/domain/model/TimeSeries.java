package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Ordered samples with strictly increasing timestamps, tied to the query that produced them.
 */
@Value
@Builder(toBuilder = true)
public class TimeSeries {
    String id;
    Query query;
    @Singular
    SortedMap<String, String> labels;
    @Singular
    List<Sample> samples;
    /** True when the samples came from the instant-query fallback */
    boolean fromFallback;

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int size() {
        return samples.size();
    }

    public double[] values() {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).value();
        }
        return values;
    }

    public String getService() {
        return query != null ? query.getService() : labels.get("service");
    }

    /**
     * Builds the canonical series id: the query id followed by its sorted label set.
     */
    public static String seriesId(String queryId, Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return queryId;
        }
        return queryId + new TreeMap<>(labels).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }
}
