package io.artifacttracker.client.model;

/**
 * {@code {"QueryResult": {...}}}
 */
public record QueryResponse<T>(QueryResult<T> queryResult) {
}
