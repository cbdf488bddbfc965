package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.config.VerityProperties.DataSourceConfig;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.Span;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grafana Tempo TraceQL search.
 */
public class TempoDataSource extends AbstractHttpDataSource {

    static final int DEFAULT_LIMIT = 500;

    public TempoDataSource(DataSourceConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(config, webClientBuilder, objectMapper);
    }

    @Override
    public Mono<List<Span>> queryTraces(Query query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.getExpression());
        params.put("start", epochSeconds(query.getStart()));
        params.put("end", epochSeconds(query.getEnd()));
        params.put("limit", String.valueOf(query.getLimit() != null ? query.getLimit() : DEFAULT_LIMIT));
        return getJson("/api/search", params, query.getTenant())
                .map(TempoResponseParser::parse);
    }
}
