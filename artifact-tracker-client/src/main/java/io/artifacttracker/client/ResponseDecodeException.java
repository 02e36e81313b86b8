package io.artifacttracker.client;

/**
 * A successful response body did not match the expected output shape.
 */
public class ResponseDecodeException extends TrackerException {

    public ResponseDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
