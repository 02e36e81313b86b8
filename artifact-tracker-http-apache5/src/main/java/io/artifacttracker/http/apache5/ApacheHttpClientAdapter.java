package io.artifacttracker.http.apache5;

import io.artifacttracker.core.RequestContext;
import io.artifacttracker.http.spi.HttpClientAdapter;
import io.artifacttracker.http.spi.HttpClientException;
import io.artifacttracker.http.spi.HttpClientRequest;
import io.artifacttracker.http.spi.HttpClientResponse;
import io.artifacttracker.http.spi.HttpTimeoutException;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using Apache HttpClient 5 (classic API).
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {

    private final CloseableHttpClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new ApacheHttpClientAdapter
     */
    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpClients.createDefault());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the Apache HttpClient to use
     * @return a new ApacheHttpClientAdapter
     */
    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request, RequestContext context) throws HttpClientException {
        HttpUriRequestBase apacheRequest = toApacheRequest(request);
        try (RequestContext.Registration ignored = context.onDone(apacheRequest::cancel)) {
            ClassicHttpResponse response = httpClient.executeOpen(HttpHost.create(request.uri()), apacheRequest, null);
            return new StreamingResponse(response);
        } catch (IOException e) {
            if (apacheRequest.isCancelled()) {
                throw new HttpClientException("Request cancelled", e);
            }
            if (e instanceof InterruptedIOException) {
                throw new HttpTimeoutException(e);
            }
            throw new HttpClientException(e);
        }
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        if (request.hasBody()) {
            String contentType = request.header("Content-Type");
            ContentType type = contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_OCTET_STREAM;
            apacheRequest.setEntity(new ByteArrayEntity(request.body(), type));
        }

        // Content-Type travels on the entity
        request.headers().forEach((name, value) -> {
            if (!name.equalsIgnoreCase("Content-Type")) {
                apacheRequest.setHeader(name, value);
            }
        });

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final ClassicHttpResponse response;

        StreamingResponse(ClassicHttpResponse response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.getCode();
        }

        @Override
        public Map<String, List<String>> headers() {
            Map<String, List<String>> headers = new LinkedHashMap<>();
            for (Header h : response.getHeaders()) {
                headers.computeIfAbsent(h.getName(), k -> new ArrayList<>()).add(h.getValue());
            }
            return headers;
        }

        @Override
        public Optional<String> header(String name) {
            Header h = response.getFirstHeader(name);
            return h == null ? Optional.empty() : Optional.ofNullable(h.getValue());
        }

        @Override
        public InputStream body() throws IOException {
            HttpEntity entity = response.getEntity();
            return entity == null ? InputStream.nullInputStream() : entity.getContent();
        }

        @Override
        public void close() throws IOException {
            response.close();
        }
    }
}
