package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.exception.DataSourceException;
import com.z254.verity.exception.InvalidQueryException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses Prometheus HTTP API query responses ({@code matrix}, {@code vector} and {@code scalar}).
 */
public final class PrometheusResponseParser {

    private PrometheusResponseParser() {
    }

    /**
     * One {@link TimeSeries} per result, ordered by series id.
     *
     * @throws InvalidQueryException when the body reports {@code status: error}
     */
    public static List<TimeSeries> parse(JsonNode root, Query query, String source) {
        String status = root.path("status").asText("");
        if ("error".equals(status)) {
            throw new InvalidQueryException(source, source + " query error ("
                    + root.path("errorType").asText("unknown") + "): " + root.path("error").asText(""));
        }
        if (!"success".equals(status)) {
            throw new DataSourceException(source, "Unexpected response status from " + source + ": " + status);
        }

        JsonNode data = root.path("data");
        String resultType = data.path("resultType").asText("");
        JsonNode result = data.path("result");
        List<TimeSeries> series = new ArrayList<>();

        switch (resultType) {
            case "matrix" -> result.forEach(item -> series.add(toSeries(item, item.path("values"), query)));
            case "vector" -> result.forEach(item -> {
                List<JsonNode> single = List.of(item.path("value"));
                series.add(toSeries(item, single, query));
            });
            case "scalar" -> series.add(toSeries(null, List.of(result), query));
            default -> {
                if (!result.isMissingNode() && !result.isEmpty()) {
                    throw new DataSourceException(source, "Unsupported result type from " + source + ": " + resultType);
                }
            }
        }
        series.sort(Comparator.comparing(TimeSeries::getId));
        return series;
    }

    static double parseValue(String raw) {
        return switch (raw) {
            case "+Inf", "Inf" -> Double.POSITIVE_INFINITY;
            case "-Inf" -> Double.NEGATIVE_INFINITY;
            case "NaN" -> Double.NaN;
            default -> Double.parseDouble(raw);
        };
    }

    static Instant parseTimestamp(JsonNode node) {
        double seconds = node.asDouble();
        return Instant.ofEpochMilli(Math.round(seconds * 1000.0));
    }

    private static TimeSeries toSeries(JsonNode item, Iterable<JsonNode> points, Query query) {
        Map<String, String> labels = new TreeMap<>();
        if (item != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = item.path("metric").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                labels.put(field.getKey(), field.getValue().asText());
            }
        }

        List<Sample> samples = new ArrayList<>();
        for (JsonNode point : points) {
            if (point.isArray() && point.size() == 2) {
                samples.add(new Sample(parseTimestamp(point.get(0)), parseValue(point.get(1).asText())));
            }
        }
        samples.sort(Comparator.comparing(Sample::timestamp));

        return TimeSeries.builder()
                .id(TimeSeries.seriesId(query.getId(), labels))
                .query(query)
                .labels(labels)
                .samples(samples)
                .build();
    }
}
