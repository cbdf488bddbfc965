package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.config.VerityProperties.DataSourceConfig;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.domain.model.Query;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grafana Loki log range queries.
 */
public class LokiDataSource extends AbstractHttpDataSource {

    static final int DEFAULT_LIMIT = 5000;

    public LokiDataSource(DataSourceConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(config, webClientBuilder, objectMapper);
    }

    @Override
    public Mono<List<LogLine>> queryLogs(Query query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query.getExpression());
        params.put("start", String.valueOf(nanos(query.getStart())));
        params.put("end", String.valueOf(nanos(query.getEnd())));
        params.put("limit", String.valueOf(query.getLimit() != null ? query.getLimit() : DEFAULT_LIMIT));
        params.put("direction", "forward");
        return getJson("/loki/api/v1/query_range", params, query.getTenant())
                .map(body -> LokiResponseParser.parse(body, getName()));
    }

    private static long nanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }
}
