package io.artifacttracker.client;

import java.util.List;
import java.util.Objects;

/**
 * Structured error for a final non-2xx response from the tracker service.
 *
 * <p>{@link #getErrors()} and {@link #getWarnings()} hold the lists the service reported in its
 * result envelope, verbatim. {@link #getDetail()} is the joined error list when there is one,
 * otherwise the raw response body.
 */
public class TrackerApiException extends TrackerException {

    /**
     * Reference error with status 0; {@link #matches(TrackerApiException)} accepts any
     * tracker API error against it.
     */
    public static final TrackerApiException ANY = new TrackerApiException(0, "", List.of(), List.of());

    private final int statusCode;
    private final String detail;
    private final List<String> errors;
    private final List<String> warnings;

    public TrackerApiException(int statusCode, String detail, List<String> errors, List<String> warnings) {
        super(render(statusCode, detail, errors));
        this.statusCode = statusCode;
        this.detail = detail == null ? "" : detail;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Creates a reference error that matches errors with the given status.
     */
    public static TrackerApiException ofStatus(int statusCode) {
        return new TrackerApiException(statusCode, "", List.of(), List.of());
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getDetail() {
        return detail;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Whether this error is of the same kind as {@code reference}: the reference has status 0
     * or both statuses are equal. Messages are not compared.
     */
    public boolean matches(TrackerApiException reference) {
        if (reference == null) {
            return false;
        }
        return reference.statusCode == 0 || reference.statusCode == statusCode;
    }

    /**
     * Whether {@code failure}, or any throwable in its cause chain, is a tracker API error
     * matching {@code reference}.
     */
    public static boolean matches(Throwable failure, TrackerApiException reference) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof TrackerApiException && ((TrackerApiException) t).matches(reference)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    /**
     * Structural equality over status, detail, errors and warnings, so that parsing the same
     * response twice gives equal errors. Stack traces and causes are not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TrackerApiException that = (TrackerApiException) o;
        return statusCode == that.statusCode
                && detail.equals(that.detail)
                && errors.equals(that.errors)
                && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statusCode, detail, errors, warnings);
    }

    private static String render(int statusCode, String detail, List<String> errors) {
        String prefix = "Tracker API error (status " + statusCode + ")";
        if (errors != null && !errors.isEmpty()) {
            return prefix + ": " + String.join("; ", errors);
        }
        if (detail != null && !detail.isEmpty()) {
            return prefix + ": " + detail;
        }
        return prefix;
    }
}
