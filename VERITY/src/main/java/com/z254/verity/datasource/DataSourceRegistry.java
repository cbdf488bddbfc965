package com.z254.verity.datasource;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.QueryKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Connectors by name, built once from configuration at startup.
 * <p>
 * The first configured source serving a query kind is its default.
 */
@Slf4j
@Component
public class DataSourceRegistry {

    private final Map<String, DataSource> sources = new ConcurrentSkipListMap<>();
    private final Map<QueryKind, String> defaults = new ConcurrentSkipListMap<>();

    @Autowired
    public DataSourceRegistry(VerityProperties properties, DataSourceFactory factory) {
        for (VerityProperties.DataSourceConfig config : properties.getDatasources()) {
            register(factory.create(config));
        }
        log.info("Registered {} data source(s): {}", sources.size(), sources.keySet());
    }

    public DataSourceRegistry() {
    }

    public void register(DataSource source) {
        sources.put(source.getName(), source);
        defaults.putIfAbsent(source.getType().getServes(), source.getName());
    }

    public Optional<DataSource> find(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public Optional<DataSource> defaultFor(QueryKind kind) {
        return Optional.ofNullable(defaults.get(kind)).map(sources::get);
    }

    public List<DataSource> all() {
        return List.copyOf(sources.values());
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }
}
