package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.config.VerityProperties.DataSourceConfig;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Grafana Mimir, which serves the Prometheus API under {@code /prometheus}.
 */
public class MimirDataSource extends PrometheusDataSource {

    public MimirDataSource(DataSourceConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(config, webClientBuilder, objectMapper);
    }

    @Override
    protected String apiPrefix() {
        return "/prometheus";
    }
}
