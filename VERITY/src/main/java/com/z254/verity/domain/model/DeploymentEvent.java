package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Deployment or config change known to the event registry.
 */
@Value
@Builder
public class DeploymentEvent {
    String service;
    Instant timestamp;
    String version;
    String author;
    @Builder.Default
    String environment = "production";
    @Builder.Default
    String source = "unknown";
    @Builder.Default
    Map<String, String> metadata = Map.of();
}
