package io.artifacttracker.http.spi;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>The body is a single-read stream backed by the underlying connection. Callers must
 * {@link #close()} the response once they are done with it, including when they discard it
 * without reading.
 */
public interface HttpClientResponse extends Closeable {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns all response headers. Lookups through this map are case-sensitive;
     * prefer {@link #header(String)}.
     */
    Map<String, List<String>> headers();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    default Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> e : headers().entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.ofNullable(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the response body stream. Never null; empty when the response has no body.
     * @throws IOException if the body cannot be opened
     */
    InputStream body() throws IOException;

    /**
     * Releases the body and the underlying connection.
     */
    @Override
    void close() throws IOException;

    /**
     * Creates an in-memory response, for adapters that buffer and for test doubles.
     */
    static HttpClientResponse of(int statusCode, Map<String, List<String>> headers, byte[] body) {
        return new BufferedResponse(statusCode, headers, body);
    }

    final class BufferedResponse implements HttpClientResponse {
        private final int statusCode;
        private final Map<String, List<String>> headers;
        private final InputStream body;
        private boolean closed;

        private BufferedResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
            this.statusCode = statusCode;
            this.headers = headers == null ? Map.of() : Map.copyOf(headers);
            this.body = new ByteArrayInputStream(body == null ? new byte[0] : body);
        }

        @Override
        public int statusCode() {
            return statusCode;
        }

        @Override
        public Map<String, List<String>> headers() {
            return headers;
        }

        @Override
        public InputStream body() {
            return body;
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
