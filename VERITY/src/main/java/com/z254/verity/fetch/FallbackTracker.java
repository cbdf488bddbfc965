package com.z254.verity.fetch;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Degradation tracking per data source.
 * <p>
 * Records:
 * <ul>
 *     <li>Instant-query fallbacks taken after an empty range result</li>
 *     <li>Source failures (unavailable, timed out) and the last error</li>
 *     <li>Recovery when a source answers again</li>
 * </ul>
 */
@Slf4j
@Component
public class FallbackTracker {

    private final Map<String, FallbackStatus> statuses = new ConcurrentHashMap<>();

    public void recordFallback(String source, String queryId) {
        statuses.compute(source, (key, status) -> {
            FallbackStatus next = status != null ? status : FallbackStatus.healthy(key);
            next.setFallbackCount(next.getFallbackCount() + 1);
            next.setLastFallbackAt(Instant.now());
            return next;
        });
        log.debug("Instant fallback used: source={}, query={}", source, queryId);
    }

    public void recordFailure(String source, String error) {
        statuses.compute(source, (key, status) -> {
            FallbackStatus next = status != null ? status : FallbackStatus.healthy(key);
            next.setDegraded(true);
            next.setFailureCount(next.getFailureCount() + 1);
            next.setConsecutiveFailures(next.getConsecutiveFailures() + 1);
            next.setLastFailureAt(Instant.now());
            next.setLastError(error);
            return next;
        });
        log.warn("Data source degraded: source={}, error={}", source, error);
    }

    public void recordSuccess(String source) {
        statuses.compute(source, (key, status) -> {
            FallbackStatus next = status != null ? status : FallbackStatus.healthy(key);
            if (next.isDegraded()) {
                log.info("Data source recovered: {}", key);
            }
            next.setDegraded(false);
            next.setConsecutiveFailures(0);
            return next;
        });
    }

    public boolean isDegraded(String source) {
        FallbackStatus status = statuses.get(source);
        return status != null && status.isDegraded();
    }

    /**
     * Copies of every tracked status, keyed by source name.
     */
    public Map<String, FallbackStatus> getAllStatuses() {
        Map<String, FallbackStatus> copy = new TreeMap<>();
        statuses.forEach((name, status) -> copy.put(name, status.toBuilder().build()));
        return copy;
    }

    public void reset(String source) {
        statuses.remove(source);
    }

    // ========== Data Classes ==========

    @Data
    @Builder(toBuilder = true)
    public static class FallbackStatus {
        private String source;
        private boolean degraded;
        private int fallbackCount;
        private int failureCount;
        private int consecutiveFailures;
        private Instant lastFallbackAt;
        private Instant lastFailureAt;
        private String lastError;

        public static FallbackStatus healthy(String source) {
            return FallbackStatus.builder()
                    .source(source)
                    .degraded(false)
                    .build();
        }
    }
}
