package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.config.VerityProperties.DataSourceConfig;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates connectors from configuration.
 */
@Component
public class DataSourceFactory {

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    public DataSourceFactory(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
    }

    public DataSource create(DataSourceConfig config) {
        return switch (config.getType()) {
            case MIMIR -> new MimirDataSource(config, webClientBuilder, objectMapper);
            case VICTORIA_METRICS -> new VictoriaMetricsDataSource(config, webClientBuilder, objectMapper);
            case LOKI -> new LokiDataSource(config, webClientBuilder, objectMapper);
            case TEMPO -> new TempoDataSource(config, webClientBuilder, objectMapper);
        };
    }
}
