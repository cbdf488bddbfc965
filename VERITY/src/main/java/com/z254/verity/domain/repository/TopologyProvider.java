package com.z254.verity.domain.repository;

import java.util.OptionalInt;

/**
 * Service dependency topology supplied by an external loader.
 */
public interface TopologyProvider {

    /**
     * Hop count from {@code from} to {@code to} along dependency edges in either direction,
     * or empty when the services are unknown or unconnected.
     */
    OptionalInt distance(String from, String to);
}
