package io.artifacttracker.client;

import io.artifacttracker.core.TrackerDefaults;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Client settings, usually read from the environment.
 *
 * <table>
 *   <caption>Environment variables</caption>
 *   <tr><td>{@code TRACKER_API_KEY}</td><td>credential, required</td></tr>
 *   <tr><td>{@code TRACKER_BASE_URL}</td><td>service root</td></tr>
 *   <tr><td>{@code TRACKER_TIMEOUT}</td><td>per-request timeout in seconds, &gt; 0</td></tr>
 *   <tr><td>{@code TRACKER_MAX_RETRIES}</td><td>retries after the first attempt, &gt;= 0</td></tr>
 *   <tr><td>{@code TRACKER_RETRY_DELAY}</td><td>base backoff in milliseconds, &gt;= 0</td></tr>
 * </table>
 *
 * Unset, unparseable or out-of-range optional values fall back to {@link TrackerDefaults}.
 */
public record TrackerConfig(String apiKey, String baseUrl, Duration timeout, RetryConfig retry) {

    public static final String ENV_API_KEY = "TRACKER_API_KEY";
    public static final String ENV_BASE_URL = "TRACKER_BASE_URL";
    public static final String ENV_TIMEOUT = "TRACKER_TIMEOUT";
    public static final String ENV_MAX_RETRIES = "TRACKER_MAX_RETRIES";
    public static final String ENV_RETRY_DELAY = "TRACKER_RETRY_DELAY";

    public TrackerConfig {
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(retry, "retry");
    }

    public static TrackerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalStateException if {@code TRACKER_API_KEY} is missing or empty
     */
    public static TrackerConfig fromEnvironment(Map<String, String> env) {
        String apiKey = env.get(ENV_API_KEY);
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalStateException(ENV_API_KEY + " environment variable is required");
        }

        String baseUrl = env.get(ENV_BASE_URL);
        if (baseUrl == null || baseUrl.isEmpty()) {
            baseUrl = TrackerDefaults.BASE_URL;
        }

        long timeoutSeconds = parse(env.get(ENV_TIMEOUT), 1, TrackerDefaults.TIMEOUT.toSeconds());
        int maxRetries = (int) parse(env.get(ENV_MAX_RETRIES), 0, TrackerDefaults.MAX_RETRIES);
        long retryDelay = parse(env.get(ENV_RETRY_DELAY), 0, TrackerDefaults.RETRY_DELAY_MILLIS);

        return new TrackerConfig(apiKey, baseUrl, Duration.ofSeconds(timeoutSeconds),
                new RetryConfig(maxRetries, retryDelay));
    }

    private static long parse(String raw, long min, long fallback) {
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw);
            return value >= min ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
