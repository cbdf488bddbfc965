package com.z254.verity.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * One log entry returned by a log source.
 */
public record LogLine(Instant timestamp, String line, Map<String, String> labels) {
}
