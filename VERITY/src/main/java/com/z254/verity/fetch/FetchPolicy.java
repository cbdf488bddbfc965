package com.z254.verity.fetch;

import com.z254.verity.config.AnalysisSettings;

import java.time.Duration;

/**
 * Concurrency, timeout and retry limits of one fetch batch.
 *
 * @param deadline budget for the whole batch; each attempt's timeout is clipped to what remains
 */
public record FetchPolicy(int concurrencyLimit,
                          Duration queryTimeout,
                          Duration deadline,
                          int maxAttempts,
                          Duration initialBackoff,
                          Duration maxBackoff,
                          double jitter) {

    public static FetchPolicy from(AnalysisSettings settings) {
        return new FetchPolicy(
                settings.getConcurrencyLimit(),
                settings.getQueryTimeout(),
                settings.getDeadline(),
                settings.getMaxAttempts(),
                settings.getInitialBackoff(),
                settings.getMaxBackoff(),
                settings.getJitter());
    }

    public FetchPolicy withLimits(int concurrencyLimit, Duration queryTimeout) {
        return new FetchPolicy(concurrencyLimit, queryTimeout, deadline, maxAttempts, initialBackoff, maxBackoff, jitter);
    }
}
