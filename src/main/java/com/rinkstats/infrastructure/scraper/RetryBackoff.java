package com.rinkstats.infrastructure.scraper;

import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for transient fetch failures.
 */
public class RetryBackoff {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 413, 429, 500, 502, 503, 504);

    private final int maxAttempts;
    private final long minDelayMs;
    private final long maxDelayMs;

    public RetryBackoff(int maxAttempts, long minDelayMs, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (minDelayMs < 0 || maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("Invalid backoff bounds " + minDelayMs + ".." + maxDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the given retry (1 = first retry), within [minDelayMs, maxDelayMs].
     */
    public long delayMs(int retry) {
        double exponential = Math.min(maxDelayMs, minDelayMs * Math.pow(2, Math.max(0, retry - 1)));
        long half = (long) (exponential / 2);
        long jitter = half > 0 ? ThreadLocalRandom.current().nextLong(0, half + 1) : 0;
        long delay = half + jitter;
        return Math.max(minDelayMs, Math.min(maxDelayMs, delay));
    }

    public boolean isRetryableStatus(int statusCode) {
        return RETRYABLE_STATUSES.contains(statusCode);
    }
}
