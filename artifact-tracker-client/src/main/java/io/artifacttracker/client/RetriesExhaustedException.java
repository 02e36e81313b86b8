package io.artifacttracker.client;

/**
 * Every permitted attempt failed with a retryable transport error.
 * The cause is the failure of the last attempt.
 */
public class RetriesExhaustedException extends RequestExecutionException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("request failed after " + attempts + (attempts == 1 ? " attempt" : " attempts")
                + (lastFailure == null ? "" : ": " + lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }

    /**
     * Number of transport invocations made, including the first one.
     */
    public int getAttempts() {
        return attempts;
    }
}
