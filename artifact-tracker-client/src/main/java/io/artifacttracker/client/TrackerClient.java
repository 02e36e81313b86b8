package io.artifacttracker.client;

import io.artifacttracker.client.resources.BuildDefinitions;
import io.artifacttracker.client.resources.Changesets;
import io.artifacttracker.client.resources.Defects;
import io.artifacttracker.client.resources.HierarchicalRequirements;
import io.artifacttracker.client.resources.Tasks;
import io.artifacttracker.core.Protocol;
import io.artifacttracker.core.RequestContext;
import io.artifacttracker.core.Urls;
import io.artifacttracker.http.spi.HttpClientAdapter;
import io.artifacttracker.http.spi.HttpClientException;
import io.artifacttracker.http.spi.HttpClientRequest;
import io.artifacttracker.http.spi.HttpClientResponse;
import io.artifacttracker.http.spi.JdkHttpClientAdapter;
import io.artifacttracker.json.spi.JsonCodec;
import io.artifacttracker.json.spi.JsonException;
import io.artifacttracker.json.spi.JsonType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client for the tracker REST service.
 *
 * <p>Each operation builds one HTTP exchange, runs it through the retry engine, and either decodes
 * a 2xx body into the requested type or throws a {@link TrackerException}. Operations are
 * synchronous and block the calling thread; pass a {@link RequestContext} to bound or cancel them.
 *
 * <pre>{@code
 * TrackerClient client = TrackerClient.builder()
 *         .apiKey(System.getenv("TRACKER_API_KEY"))
 *         .build();
 * List<Defect> open = client.defects().query(RequestContext.withTimeout(Duration.ofSeconds(20)),
 *         Map.of("State", "Open"));
 * }</pre>
 *
 * <p>Instances are safe to share between threads. The retry configuration is the only mutable
 * state; replacing it affects operations that start afterwards.
 */
public final class TrackerClient {

    private static final Logger log = LoggerFactory.getLogger(TrackerClient.class);

    private final String apiKey;
    private final String baseUrl;
    private final HttpClientAdapter transport;
    private final JsonCodec codec;
    private final Duration requestTimeout;
    private final ErrorParser errorParser;
    private final RetryExecutor retryExecutor;

    private volatile RetryConfig retryConfig;

    private final Defects defects;
    private final Tasks tasks;
    private final HierarchicalRequirements hierarchicalRequirements;
    private final Changesets changesets;
    private final BuildDefinitions buildDefinitions;

    TrackerClient(String apiKey, String baseUrl, HttpClientAdapter transport, JsonCodec codec,
                  Duration requestTimeout, RetryConfig retryConfig) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.requestTimeout = requestTimeout;
        this.retryConfig = retryConfig;
        this.errorParser = new ErrorParser(codec);
        this.retryExecutor = new RetryExecutor(transport, this::effectiveRetryConfig);

        this.defects = new Defects(this);
        this.tasks = new Tasks(this);
        this.hierarchicalRequirements = new HierarchicalRequirements(this);
        this.changesets = new Changesets(this);
        this.buildDefinitions = new BuildDefinitions(this);
    }

    public static TrackerClientBuilder builder() {
        return new TrackerClientBuilder();
    }

    /**
     * Client with default retry policy, no per-request timeout and the JSON codec found on the classpath.
     */
    public static TrackerClient create(String apiKey, String baseUrl, HttpClientAdapter transport) {
        return builder().apiKey(apiKey).baseUrl(baseUrl).transport(transport).build();
    }

    /**
     * Client configured from {@code TRACKER_*} environment variables on the JDK HTTP client.
     *
     * @throws IllegalStateException if {@code TRACKER_API_KEY} is not set
     */
    public static TrackerClient fromEnvironment() {
        return fromConfig(TrackerConfig.fromEnvironment());
    }

    public static TrackerClient fromConfig(TrackerConfig config) {
        Objects.requireNonNull(config, "config");
        return builder()
                .apiKey(config.apiKey())
                .baseUrl(config.baseUrl())
                .transport(JdkHttpClientAdapter.create(config.timeout()))
                .requestTimeout(config.timeout())
                .retryConfig(config.retry())
                .build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * The transport every exchange goes through.
     */
    public HttpClientAdapter transport() {
        return transport;
    }

    public JsonCodec codec() {
        return codec;
    }

    public Optional<Duration> requestTimeout() {
        return Optional.ofNullable(requestTimeout);
    }

    /**
     * The configured retry policy, or empty when built-in defaults apply.
     */
    public Optional<RetryConfig> getRetryConfig() {
        return Optional.ofNullable(retryConfig);
    }

    /**
     * Replaces the retry policy. {@code null} restores the built-in defaults.
     */
    public void setRetryConfig(RetryConfig retryConfig) {
        this.retryConfig = retryConfig;
    }

    RetryConfig effectiveRetryConfig() {
        RetryConfig current = retryConfig;
        return current == null ? RetryConfig.defaults() : current;
    }

    public Defects defects() {
        return defects;
    }

    public Tasks tasks() {
        return tasks;
    }

    public HierarchicalRequirements hierarchicalRequirements() {
        return hierarchicalRequirements;
    }

    public Changesets changesets() {
        return changesets;
    }

    public BuildDefinitions buildDefinitions() {
        return buildDefinitions;
    }

    // ===== Operations =====

    /**
     * Lists artifacts of {@code resourceType} matching every filter. Each entry becomes one
     * {@code query=( key = value )} parameter, in the map's iteration order.
     */
    public <T> T query(RequestContext ctx, String resourceType, Map<String, String> filters, Class<T> responseType)
            throws TrackerException {
        return query(ctx, resourceType, filters, JsonType.of(responseType));
    }

    public <T> T query(RequestContext ctx, String resourceType, Map<String, String> filters, JsonType<T> responseType)
            throws TrackerException {
        List<Map.Entry<String, String>> params = new ArrayList<>();
        params.add(Map.entry(Protocol.Q_FETCH, Protocol.BOOL_TRUE));
        if (filters != null) {
            for (Map.Entry<String, String> filter : filters.entrySet()) {
                params.add(Map.entry(Protocol.Q_QUERY, Protocol.queryTerm(filter.getKey(), filter.getValue())));
            }
        }
        URI uri = Urls.withQuery(resourceUri(resourceType), params);
        return execute(ctx, HttpClientRequest.get(uri), null, responseType);
    }

    public <T> T get(RequestContext ctx, String resourceType, String objectId, Class<T> responseType)
            throws TrackerException {
        return get(ctx, resourceType, objectId, JsonType.of(responseType));
    }

    public <T> T get(RequestContext ctx, String resourceType, String objectId, JsonType<T> responseType)
            throws TrackerException {
        URI uri = withFetch(resourceUri(resourceType, objectId));
        return execute(ctx, HttpClientRequest.get(uri), null, responseType);
    }

    public <T> T create(RequestContext ctx, String resourceType, Object input, Class<T> responseType)
            throws TrackerException {
        return create(ctx, resourceType, input, JsonType.of(responseType));
    }

    public <T> T create(RequestContext ctx, String resourceType, Object input, JsonType<T> responseType)
            throws TrackerException {
        URI uri = resourceUri(resourceType, Protocol.PATH_CREATE);
        return execute(ctx, HttpClientRequest.post(uri), encode(input), responseType);
    }

    public <T> T update(RequestContext ctx, String resourceType, String objectId, Object input, Class<T> responseType)
            throws TrackerException {
        return update(ctx, resourceType, objectId, input, JsonType.of(responseType));
    }

    public <T> T update(RequestContext ctx, String resourceType, String objectId, Object input, JsonType<T> responseType)
            throws TrackerException {
        URI uri = resourceUri(resourceType, objectId);
        return execute(ctx, HttpClientRequest.post(uri), encode(input), responseType);
    }

    public <T> T delete(RequestContext ctx, String resourceType, String objectId, Class<T> responseType)
            throws TrackerException {
        return delete(ctx, resourceType, objectId, JsonType.of(responseType));
    }

    public <T> T delete(RequestContext ctx, String resourceType, String objectId, JsonType<T> responseType)
            throws TrackerException {
        URI uri = withFetch(resourceUri(resourceType, objectId));
        return execute(ctx, HttpClientRequest.delete(uri), null, responseType);
    }

    // ===== Dispatch =====

    private <T> T execute(RequestContext ctx, HttpClientRequest.Builder builder, byte[] body, JsonType<T> responseType)
            throws TrackerException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(responseType, "responseType");

        builder.header(Protocol.H_SESSION_ID, apiKey)
                .header(Protocol.H_ACCEPT, Protocol.CT_JSON)
                .timeout(requestTimeout);
        if (body != null) {
            builder.header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON).body(body);
        }
        HttpClientRequest request = builder.build();

        HttpClientResponse response;
        try {
            response = retryExecutor.execute(request, ctx);
        } catch (HttpClientException e) {
            throw new RequestExecutionException("failed to execute request " + request + ": " + e.getMessage(), e);
        }

        try {
            byte[] content;
            try {
                content = response.body().readAllBytes();
            } catch (IOException e) {
                throw new RequestExecutionException("failed to read response body of " + request, e);
            }

            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw errorParser.parseError(status, content);
            }
            try {
                return codec.readValue(content, responseType);
            } catch (JsonException e) {
                throw new ResponseDecodeException("failed to decode response of " + request + " as " + responseType, e);
            }
        } finally {
            closeQuietly(response);
        }
    }

    private byte[] encode(Object input) throws RequestEncodeException {
        try {
            return codec.writeBytes(input);
        } catch (JsonException e) {
            throw new RequestEncodeException("failed to encode request body", e);
        }
    }

    private URI resourceUri(String resourceType, String... segments) throws RequestExecutionException {
        Objects.requireNonNull(resourceType, "resourceType");
        String[] path = new String[segments.length + 1];
        path[0] = resourceType;
        for (int i = 0; i < segments.length; i++) {
            path[i + 1] = Objects.requireNonNull(segments[i], "objectId");
        }
        try {
            return Urls.resource(baseUrl, path);
        } catch (IllegalArgumentException e) {
            throw new RequestExecutionException("failed to parse URL", e);
        }
    }

    private static URI withFetch(URI uri) {
        return Urls.withQuery(uri, List.of(Map.entry(Protocol.Q_FETCH, Protocol.BOOL_TRUE)));
    }

    private static void closeQuietly(HttpClientResponse response) {
        try {
            response.close();
        } catch (IOException e) {
            log.debug("Failed to close response", e);
        }
    }
}
