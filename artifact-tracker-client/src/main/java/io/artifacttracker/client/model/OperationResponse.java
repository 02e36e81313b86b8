package io.artifacttracker.client.model;

/**
 * {@code {"OperationResult": {...}}}, returned by update and delete.
 */
public record OperationResponse<T>(ObjectResult<T> operationResult) {
}
