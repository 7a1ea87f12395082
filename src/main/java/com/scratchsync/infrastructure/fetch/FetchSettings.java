package com.scratchsync.infrastructure.fetch;

/**
 * Timeouts and retry policy of the asset fetchers.
 *
 * @param maxAttempts      direct download attempts before giving up
 * @param baseDelayMs      backoff before retry i is {@code baseDelayMs * 2^i} plus jitter
 * @param jitterMs         upper bound (exclusive) of the random jitter added to each backoff
 * @param timeoutMs        connect and response timeout of a direct download
 * @param browserTimeoutMs navigation timeout of the headless browser
 */
public record FetchSettings(
    int maxAttempts,
    long baseDelayMs,
    long jitterMs,
    int timeoutMs,
    int browserTimeoutMs
) {
    public FetchSettings {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelayMs = Math.max(0, baseDelayMs);
        jitterMs = Math.max(0, jitterMs);
    }

    public static FetchSettings defaults() {
        return new FetchSettings(3, 250, 100, 10_000, 30_000);
    }

    /**
     * Backoff before retrying after attempt {@code attempt} (0-based) failed.
     */
    public long backoffMillis(int attempt, long jitter) {
        return baseDelayMs * (1L << attempt) + jitter;
    }
}
