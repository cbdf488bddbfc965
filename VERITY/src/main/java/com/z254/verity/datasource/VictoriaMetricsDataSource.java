package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.config.VerityProperties.DataSourceConfig;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * VictoriaMetrics single-node, which serves the Prometheus API at the root.
 */
public class VictoriaMetricsDataSource extends PrometheusDataSource {

    public VictoriaMetricsDataSource(DataSourceConfig config, WebClient.Builder webClientBuilder,
                                     ObjectMapper objectMapper) {
        super(config, webClientBuilder, objectMapper);
    }

    @Override
    protected String apiPrefix() {
        return "";
    }
}
