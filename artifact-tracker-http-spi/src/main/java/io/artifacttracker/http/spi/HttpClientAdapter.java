package io.artifacttracker.http.spi;

import io.artifacttracker.core.RequestContext;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the tracker client to work with different
 * HTTP client libraries (JDK HttpClient, Apache HttpClient, OkHttp, etc.)
 * without direct dependency on any specific implementation. It is also the seam
 * tests use to replay scripted responses.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com")).build();
 * try (HttpClientResponse response = adapter.send(request, RequestContext.background())) {
 *     byte[] body = response.body().readAllBytes();
 * }
 * }</pre>
 */
@FunctionalInterface
public interface HttpClientAdapter {

    /**
     * Sends one fully formed HTTP request and returns the response.
     *
     * <p>The exchange is aborted when {@code context} fires; the adapter then throws
     * {@link HttpClientException}. The caller owns the returned response and must close it.
     *
     * @param request the HTTP request to send
     * @param context cancellation and deadline signal for the exchange
     * @return the HTTP response with a single-read body stream
     * @throws HttpClientException if the request fails or is aborted
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request, RequestContext context) throws HttpClientException;
}
