package io.artifacttracker.client;

/**
 * Base class for failures of a tracker operation.
 *
 * <p>Subclasses separate the outcomes a caller acts on differently:
 * <ul>
 *   <li>{@link TrackerApiException}: the service answered and rejected the request</li>
 *   <li>{@link RequestExecutionException}: the service could not be reached
 *       ({@link RetriesExhaustedException} when every permitted attempt failed)</li>
 *   <li>{@link RequestCancelledException}: the operation's context fired</li>
 *   <li>{@link ResponseDecodeException} and {@link RequestEncodeException}: payload shape problems</li>
 * </ul>
 */
public abstract class TrackerException extends Exception {

    protected TrackerException(String message) {
        super(message);
    }

    protected TrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
