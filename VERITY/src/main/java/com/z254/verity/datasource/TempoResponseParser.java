package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.verity.domain.model.Span;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Parses Tempo search results into root-span summaries.
 * <p>
 * A trace counts as failed when any matched span carries {@code status.code} ERROR.
 */
public final class TempoResponseParser {

    private TempoResponseParser() {
    }

    public static List<Span> parse(JsonNode root) {
        List<Span> spans = new ArrayList<>();
        for (JsonNode trace : root.path("traces")) {
            Instant start = startOf(trace);
            if (start == null) {
                continue;
            }
            spans.add(Span.builder()
                    .traceId(trace.path("traceID").asText())
                    .service(trace.path("rootServiceName").asText("unknown"))
                    .operation(trace.path("rootTraceName").asText("unknown"))
                    .start(start)
                    .durationMs(trace.path("durationMs").asDouble(0.0))
                    .error(hasError(trace))
                    .build());
        }
        spans.sort(Comparator.comparing(Span::getStart).thenComparing(Span::getTraceId));
        return spans;
    }

    private static Instant startOf(JsonNode trace) {
        JsonNode nanos = trace.path("startTimeUnixNano");
        if (nanos.isMissingNode() || nanos.asText().isEmpty()) {
            return null;
        }
        try {
            return LokiResponseParser.fromNanos(nanos.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean hasError(JsonNode trace) {
        List<JsonNode> spanSets = new ArrayList<>();
        if (trace.path("spanSet").isObject()) {
            spanSets.add(trace.path("spanSet"));
        }
        trace.path("spanSets").forEach(spanSets::add);
        for (JsonNode spanSet : spanSets) {
            for (JsonNode span : spanSet.path("spans")) {
                for (JsonNode attribute : span.path("attributes")) {
                    if ("status.code".equals(attribute.path("key").asText())) {
                        String code = attribute.path("value").path("stringValue").asText("").toUpperCase(Locale.ROOT);
                        if ("STATUS_CODE_ERROR".equals(code) || "ERROR".equals(code)) {
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }
}
