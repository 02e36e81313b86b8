package io.artifacttracker.client;

import io.artifacttracker.core.TrackerDefaults;

import java.time.Duration;

/**
 * Retry policy for transient failures: up to {@code maxRetries} retries after the first attempt,
 * with exponential backoff starting at {@code retryDelayMillis}.
 *
 * @param maxRetries retries after the initial attempt; 0 disables retrying
 * @param retryDelayMillis base backoff delay in milliseconds, doubled per attempt
 */
public record RetryConfig(int maxRetries, long retryDelayMillis) {

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (retryDelayMillis < 0) {
            throw new IllegalArgumentException("retryDelayMillis must be >= 0, got " + retryDelayMillis);
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(TrackerDefaults.MAX_RETRIES, TrackerDefaults.RETRY_DELAY_MILLIS);
    }

    public static RetryConfig disabled() {
        return new RetryConfig(0, 0);
    }

    public static RetryConfig of(int maxRetries, Duration retryDelay) {
        return new RetryConfig(maxRetries, retryDelay.toMillis());
    }

    /**
     * Total transport invocations this policy allows.
     */
    public long maxAttempts() {
        return maxRetries + 1L;
    }
}
