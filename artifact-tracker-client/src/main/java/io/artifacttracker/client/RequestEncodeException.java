package io.artifacttracker.client;

/**
 * The request payload could not be serialized to JSON.
 */
public class RequestEncodeException extends TrackerException {

    public RequestEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
