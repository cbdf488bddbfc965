package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Log lines sharing one template once variable tokens are masked.
 */
@Value
@Builder
public class LogPattern {
    String signalId;
    /** Template with ids, timestamps, addresses and numbers replaced by {@code <_>} */
    String pattern;
    int count;
    Instant firstSeen;
    Instant lastSeen;
    double ratePerMinute;
    /** Shannon entropy in bits over the template tokens */
    double entropy;
    Severity severity;
    /** First raw line seen for the template */
    String sample;
}
