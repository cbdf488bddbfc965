package com.z254.verity.domain.model;

/**
 * Kind of telemetry a query selects.
 */
public enum QueryKind {
    METRIC,
    LOG,
    TRACE
}
