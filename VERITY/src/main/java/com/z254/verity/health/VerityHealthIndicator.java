package com.z254.verity.health;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.datasource.AbstractHttpDataSource;
import com.z254.verity.datasource.DataSource;
import com.z254.verity.datasource.DataSourceRegistry;
import com.z254.verity.fetch.FallbackTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Health indicator for the VERITY service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Configured data sources and their circuit breaker state</li>
 *     <li>Degradation and fallback counts per source</li>
 *     <li>Analyses currently in flight</li>
 * </ul>
 * The service is DOWN only when sources are configured and every one of them is degraded.
 */
@Slf4j
@Component
public class VerityHealthIndicator implements ReactiveHealthIndicator {

    private final DataSourceRegistry registry;
    private final FallbackTracker fallbackTracker;
    private final VerityProperties properties;

    private final AtomicInteger activeAnalyses = new AtomicInteger(0);

    public VerityHealthIndicator(DataSourceRegistry registry,
                                 FallbackTracker fallbackTracker,
                                 VerityProperties properties) {
        this.registry = registry;
        this.fallbackTracker = fallbackTracker;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        List<DataSource> sources = registry.all();
        int degraded = 0;

        for (DataSource source : sources) {
            String prefix = "datasource." + source.getName();
            details.put(prefix + ".type", source.getType().name());
            if (source instanceof AbstractHttpDataSource http) {
                details.put(prefix + ".circuit", http.getCircuitState().name());
            }
            boolean isDegraded = fallbackTracker.isDegraded(source.getName());
            details.put(prefix + ".degraded", isDegraded);
            if (isDegraded) {
                degraded++;
            }
        }
        fallbackTracker.getAllStatuses().forEach((name, status) -> {
            details.put("datasource." + name + ".fallbacks", status.getFallbackCount());
            details.put("datasource." + name + ".failures", status.getFailureCount());
            if (status.getLastError() != null) {
                details.put("datasource." + name + ".lastError", status.getLastError());
            }
        });

        details.put("datasources", sources.size());
        details.put("degradedDatasources", degraded);
        details.put("activeAnalyses", activeAnalyses.get());
        details.put("fetchDeadline", properties.getFetch().getDeadline().toString());
        details.put("concurrencyLimit", properties.getFetch().getConcurrencyLimit());

        boolean healthy = sources.isEmpty() || degraded < sources.size();
        if (!healthy) {
            log.warn("All {} data source(s) degraded", sources.size());
        }
        return healthy
                ? Health.up().withDetails(details).build()
                : Health.down().withDetails(details).build();
    }

    public void incrementActiveAnalyses() {
        activeAnalyses.incrementAndGet();
    }

    public void decrementActiveAnalyses() {
        activeAnalyses.decrementAndGet();
    }
}
