package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Recovered, per-series or per-slot condition surfaced on the final report.
 */
@Value
@Builder
public class ReportAnnotation {
    Type type;
    /** Series id, query id or source name the annotation is about */
    String subject;
    String message;

    public enum Type {
        INSUFFICIENT_HISTORY,
        DISCONTINUOUS_SERIES,
        FALLBACK_USED,
        FETCH_FAILED,
        NO_DATA,
        DEADLINE_EXCEEDED
    }
}
