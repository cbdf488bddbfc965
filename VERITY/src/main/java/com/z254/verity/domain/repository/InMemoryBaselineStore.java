package com.z254.verity.domain.repository;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory seed store used until a durable baseline store is wired up.
 */
@Repository
public class InMemoryBaselineStore implements BaselineStore {

    private final Map<String, BaselineSeed> store = new ConcurrentHashMap<>();

    @Override
    public Optional<BaselineSeed> find(String tenant, String seriesId) {
        return Optional.ofNullable(store.get(key(tenant, seriesId)));
    }

    public void save(String tenant, String seriesId, BaselineSeed seed) {
        store.put(key(tenant, seriesId), seed);
    }

    private static String key(String tenant, String seriesId) {
        return tenant + "::" + seriesId;
    }
}
