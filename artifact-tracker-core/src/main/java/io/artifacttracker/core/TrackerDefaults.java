package io.artifacttracker.core;

import java.time.Duration;

/**
 * Process-wide default values, consulted only when no explicit configuration is given.
 */
public final class TrackerDefaults {
    private TrackerDefaults() {}

    public static final String BASE_URL = "https://rally1.rallydev.com/slm/webservice/v2.0";

    public static final Duration TIMEOUT = Duration.ofSeconds(30);

    public static final int MAX_RETRIES = 3;

    public static final long RETRY_DELAY_MILLIS = 1000L;
}
