package io.artifacttracker.core;

/**
 * Why a {@link RequestContext} fired.
 */
public enum CancellationReason {
    /** {@link RequestContext#cancel()} was called. */
    CANCELLED,
    /** The context deadline passed. */
    DEADLINE_EXCEEDED
}
