package com.z254.verity.domain.model;

public enum FetchErrorKind {
    /** Query or deadline expired */
    TIMEOUT,
    /** Source unreachable after retries */
    UNAVAILABLE,
    /** Source rejected the query */
    INVALID_QUERY,
    /** Range and instant queries both returned nothing */
    NO_DATA,
    /** Query names a source that is not configured */
    UNKNOWN_SOURCE,
    /** Any other failure */
    FAILED
}
