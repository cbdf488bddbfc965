package com.z254.verity.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the VERITY service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for tenant, service and analysis ids</li>
 *     <li>Analysis lifecycle events</li>
 *     <li>Fetch degradation and per-series skip events</li>
 * </ul>
 */
@Slf4j
@Component
public class VerityStructuredLogger {

    // MDC keys
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_SERVICE = "service";
    public static final String MDC_ANALYSIS_ID = "analysisId";

    /**
     * Log an analysis lifecycle event.
     */
    public void logAnalysisEvent(String analysisId, AnalysisEventType eventType, String message,
                                 Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        logData.put("analysisId", analysisId);
        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case ANALYSIS_STARTED, ANALYSIS_COMPLETED ->
                    log.info("{} | data={}", message, formatLogData(logData));
            case FETCH_DEGRADED, SERIES_SKIPPED, LOW_CONFIDENCE ->
                    log.warn("{} | data={}", message, formatLogData(logData));
            case ANALYSIS_FAILED ->
                    log.error("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        if (details != null) {
            logData.putAll(details);
        }

        if (duration.toMillis() > 5000) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Set the MDC context of one analysis.
     */
    public MDCScope withAnalysisContext(String tenant, String service, String analysisId) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(MDC_TENANT_ID, tenant != null ? tenant : "");
        context.put(MDC_SERVICE, service != null ? service : "");
        context.put(MDC_ANALYSIS_ID, analysisId);
        return withContext(context);
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum AnalysisEventType {
        ANALYSIS_STARTED, FETCH_DEGRADED, SERIES_SKIPPED,
        ANALYSIS_COMPLETED, ANALYSIS_FAILED, LOW_CONFIDENCE
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
