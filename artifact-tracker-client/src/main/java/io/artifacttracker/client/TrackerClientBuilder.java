package io.artifacttracker.client;

import io.artifacttracker.core.TrackerDefaults;
import io.artifacttracker.http.spi.HttpClientAdapter;
import io.artifacttracker.http.spi.JdkHttpClientAdapter;
import io.artifacttracker.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.ServiceLoader;

public final class TrackerClientBuilder {
    private String apiKey;
    private String baseUrl = TrackerDefaults.BASE_URL;
    private HttpClientAdapter transport;
    private JsonCodec jsonCodec;
    private Duration requestTimeout;
    private RetryConfig retryConfig;

    TrackerClientBuilder() {
    }

    /**
     * Credential sent in the {@code ZSESSIONID} header of every request. Required.
     */
    public TrackerClientBuilder apiKey(String apiKey) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        return this;
    }

    public TrackerClientBuilder baseUrl(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        return this;
    }

    public TrackerClientBuilder transport(HttpClientAdapter transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public TrackerClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public TrackerClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Upper bound for a single attempt. The whole operation, retries included, is bounded by
     * the {@link io.artifacttracker.core.RequestContext} instead.
     */
    public TrackerClientBuilder requestTimeout(Duration requestTimeout) {
        if (requestTimeout != null && (requestTimeout.isZero() || requestTimeout.isNegative())) {
            throw new IllegalArgumentException("requestTimeout must be positive, got " + requestTimeout);
        }
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * {@code null} keeps the built-in defaults.
     */
    public TrackerClientBuilder retryConfig(RetryConfig retryConfig) {
        this.retryConfig = retryConfig;
        return this;
    }

    public TrackerClient build() {
        if (apiKey == null) {
            throw new IllegalStateException("apiKey is required");
        }
        HttpClientAdapter resolvedTransport = transport;
        if (resolvedTransport == null) {
            resolvedTransport = JdkHttpClientAdapter.create();
        }
        JsonCodec resolvedCodec = jsonCodec;
        if (resolvedCodec == null) {
            resolvedCodec = ServiceLoader.load(JsonCodec.class).findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "No JsonCodec found on the classpath; add artifact-tracker-json-jackson or call jsonCodec(...)"));
        }
        return new TrackerClient(apiKey, baseUrl, resolvedTransport, resolvedCodec, requestTimeout, retryConfig);
    }
}
