package io.artifacttracker.json.spi;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.) and are
 * discovered with {@link java.util.ServiceLoader} when the client is not given one explicitly.
 *
 * <p>This interface intentionally avoids exposing tree model abstractions.
 * Instead, use strongly-typed POJOs or records for request and response payloads.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the bytes are not JSON or do not match the target shape
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON bytes to a generic type such as {@code QueryResponse<Defect>}.
     * @param data JSON bytes
     * @param type target type token
     * @return deserialized object
     * @throws JsonException if the bytes are not JSON or do not match the target shape
     */
    <T> T readValue(byte[] data, JsonType<T> type) throws JsonException;
}
