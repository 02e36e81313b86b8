package io.artifacttracker.client;

import io.artifacttracker.core.Protocol;
import io.artifacttracker.json.spi.JsonCodec;
import io.artifacttracker.json.spi.JsonException;
import io.artifacttracker.json.spi.JsonType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a non-2xx response into a {@link TrackerApiException}.
 *
 * <p>The tracker wraps errors in a result envelope keyed {@code OperationResult},
 * {@code CreateResult} or {@code QueryResult}. The first of those present (in that order)
 * supplies the error and warning lists. Anything else degrades to status plus raw body.
 */
public final class ErrorParser {

    private static final JsonType<Map<String, Object>> ENVELOPE =
            JsonType.parameterized(Map.class, String.class, Object.class);

    private static final List<String> ENVELOPE_KEYS = List.of(
            Protocol.ENVELOPE_OPERATION_RESULT,
            Protocol.ENVELOPE_CREATE_RESULT,
            Protocol.ENVELOPE_QUERY_RESULT);

    private final JsonCodec codec;

    public ErrorParser(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Never returns {@code null} and never throws.
     */
    public TrackerApiException parseError(int statusCode, byte[] body) {
        String raw = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        Map<String, Object> envelope = readEnvelope(body);
        if (envelope == null) {
            return new TrackerApiException(statusCode, raw, List.of(), List.of());
        }
        for (String key : ENVELOPE_KEYS) {
            Object result = envelope.get(key);
            if (result == null) {
                continue;
            }
            if (!(result instanceof Map)) {
                break;
            }
            Map<?, ?> fields = (Map<?, ?>) result;
            List<String> errors = stringList(fields.get(Protocol.FIELD_ERRORS));
            List<String> warnings = stringList(fields.get(Protocol.FIELD_WARNINGS));
            if (errors == null || warnings == null) {
                break;
            }
            String detail = errors.isEmpty() ? raw : String.join("; ", errors);
            return new TrackerApiException(statusCode, detail, errors, warnings);
        }
        return new TrackerApiException(statusCode, raw, List.of(), List.of());
    }

    private Map<String, Object> readEnvelope(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return codec.readValue(body, ENVELOPE);
        } catch (JsonException | RuntimeException e) {
            // not JSON, or not an object: the raw body stands as the message
            return null;
        }
    }

    // null when the value is neither absent nor a list of strings
    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            return null;
        }
        List<String> out = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                return null;
            }
            out.add((String) item);
        }
        return out;
    }
}
