package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Root span summary of a trace returned by a trace search.
 */
@Value
@Builder
public class Span {
    String traceId;
    String service;
    String operation;
    Instant start;
    double durationMs;
    boolean error;
}
