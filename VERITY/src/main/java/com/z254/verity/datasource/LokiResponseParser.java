package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.exception.InvalidQueryException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses Loki {@code streams} responses into log lines ordered by timestamp.
 */
public final class LokiResponseParser {

    private LokiResponseParser() {
    }

    public static List<LogLine> parse(JsonNode root, String source) {
        if ("error".equals(root.path("status").asText())) {
            throw new InvalidQueryException(source, source + " query error: " + root.path("error").asText(""));
        }
        List<LogLine> lines = new ArrayList<>();
        for (JsonNode stream : root.path("data").path("result")) {
            Map<String, String> labels = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = stream.path("stream").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                labels.put(field.getKey(), field.getValue().asText());
            }
            Map<String, String> frozen = Map.copyOf(labels);
            for (JsonNode value : stream.path("values")) {
                if (value.isArray() && value.size() >= 2) {
                    lines.add(new LogLine(fromNanos(value.get(0).asText()), value.get(1).asText(), frozen));
                }
            }
        }
        lines.sort(Comparator.comparing(LogLine::timestamp));
        return lines;
    }

    static Instant fromNanos(String nanos) {
        long value = Long.parseLong(nanos);
        return Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000_000L), Math.floorMod(value, 1_000_000_000L));
    }
}
