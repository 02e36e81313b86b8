package io.artifacttracker.client;

import io.artifacttracker.core.CancellationReason;

import java.util.OptionalInt;

/**
 * The operation's {@link io.artifacttracker.core.RequestContext} fired before it finished.
 * The cause, when present, is the failure of the most recent attempt.
 */
public class RequestCancelledException extends TrackerException {

    private final int attempts;
    private final CancellationReason reason;
    private final int lastStatusCode;

    public RequestCancelledException(int attempts, CancellationReason reason, int lastStatusCode, Throwable lastFailure) {
        super(describe(attempts, reason, lastStatusCode), lastFailure);
        this.attempts = attempts;
        this.reason = reason;
        this.lastStatusCode = lastStatusCode;
    }

    /**
     * Number of transport invocations made before the context fired.
     */
    public int getAttempts() {
        return attempts;
    }

    public CancellationReason getReason() {
        return reason;
    }

    /**
     * Status of the last response discarded for a retry, if an attempt got that far.
     */
    public OptionalInt getLastStatusCode() {
        return lastStatusCode > 0 ? OptionalInt.of(lastStatusCode) : OptionalInt.empty();
    }

    private static String describe(int attempts, CancellationReason reason, int lastStatusCode) {
        StringBuilder sb = new StringBuilder(reason == CancellationReason.DEADLINE_EXCEEDED
                ? "request deadline exceeded" : "request cancelled");
        sb.append(" after ").append(attempts).append(attempts == 1 ? " attempt" : " attempts");
        if (lastStatusCode > 0) {
            sb.append(" (last status ").append(lastStatusCode).append(')');
        }
        return sb.toString();
    }
}
