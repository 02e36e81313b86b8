package io.artifacttracker.http.spi;

import io.artifacttracker.core.RequestContext;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request, RequestContext context) throws HttpClientException {
        Call call = clientWithTimeout(request).newCall(toOkHttpRequest(request));
        try (RequestContext.Registration ignored = context.onDone(call::cancel)) {
            return new StreamingResponse(call.execute());
        } catch (IOException e) {
            if (call.isCanceled()) {
                throw new HttpClientException("Request cancelled", e);
            }
            if (e instanceof InterruptedIOException) {
                throw new HttpTimeoutException(e);
            }
            throw new HttpClientException(e);
        }
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.hasBody()) {
            String contentType = request.header("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "DELETE" -> { if (body != null) builder.delete(body); else builder.delete(); }
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final Response response;

        StreamingResponse(Response response) { this.response = response; }

        @Override public int statusCode() { return response.code(); }
        @Override public Map<String, List<String>> headers() { return response.headers().toMultimap(); }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(response.header(name)); }

        @Override
        public InputStream body() {
            ResponseBody body = response.body();
            return body != null ? body.byteStream() : InputStream.nullInputStream();
        }

        @Override
        public void close() {
            response.close();
        }
    }
}
