package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable telemetry selector issued against one data source over {@code [start, end)}.
 */
@Value
@Builder(toBuilder = true)
public class Query {
    /** Stable identifier, used as the series id prefix */
    String id;
    QueryKind kind;
    /** PromQL, LogQL or TraceQL expression */
    String expression;
    /** Name of the configured data source */
    String source;
    /** Tenant sent to multi-tenant backends */
    String tenant;
    /** Service the query is scoped to */
    String service;
    Instant start;
    Instant end;
    Duration step;
    /** Max lines or traces for log and trace queries */
    Integer limit;
}
