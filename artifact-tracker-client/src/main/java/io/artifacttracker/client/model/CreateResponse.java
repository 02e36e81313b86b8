package io.artifacttracker.client.model;

/**
 * {@code {"CreateResult": {...}}}
 */
public record CreateResponse<T>(ObjectResult<T> createResult) {
}
