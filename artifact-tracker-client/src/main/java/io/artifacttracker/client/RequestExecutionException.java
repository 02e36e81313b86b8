package io.artifacttracker.client;

/**
 * The request could not be executed: no response was received to classify.
 */
public class RequestExecutionException extends TrackerException {

    public RequestExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
