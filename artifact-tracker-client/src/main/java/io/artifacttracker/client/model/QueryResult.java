package io.artifacttracker.client.model;

import java.util.List;

/**
 * One page of query results. Only the page the service returns is exposed; pages are not followed.
 */
public record QueryResult<T>(List<T> results, int totalResultCount, List<String> errors, List<String> warnings) {

    public QueryResult {
        results = results == null ? List.of() : List.copyOf(results);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
