package com.z254.verity.domain.repository;

import java.util.Optional;

/**
 * Read access to historical baseline seeds.
 */
public interface BaselineStore {

    /**
     * Look up the seed for a tenant's series.
     */
    Optional<BaselineSeed> find(String tenant, String seriesId);
}
