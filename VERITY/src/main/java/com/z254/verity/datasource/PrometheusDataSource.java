package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.config.VerityProperties.DataSourceConfig;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.TimeSeries;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connector for backends exposing the Prometheus query API under a path prefix.
 */
public abstract class PrometheusDataSource extends AbstractHttpDataSource {

    protected PrometheusDataSource(DataSourceConfig config, WebClient.Builder webClientBuilder,
                                   ObjectMapper objectMapper) {
        super(config, webClientBuilder, objectMapper);
    }

    /**
     * Path prefix in front of {@code /api/v1}.
     */
    protected abstract String apiPrefix();

    @Override
    public Mono<List<TimeSeries>> queryRange(Query query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query.getExpression());
        params.put("start", epochSeconds(query.getStart()));
        params.put("end", epochSeconds(query.getEnd()));
        params.put("step", stepSeconds(query.getStep()));
        return getJson(apiPrefix() + "/api/v1/query_range", params, query.getTenant())
                .map(body -> PrometheusResponseParser.parse(body, query, getName()));
    }

    @Override
    public Mono<List<TimeSeries>> queryInstant(Query query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query.getExpression());
        params.put("time", epochSeconds(query.getEnd()));
        return getJson(apiPrefix() + "/api/v1/query", params, query.getTenant())
                .map(body -> PrometheusResponseParser.parse(body, query, getName()));
    }
}
