package io.artifacttracker.client.model;

import java.util.List;

/**
 * Result envelope carrying a single artifact, as returned by create, update and delete.
 */
public record ObjectResult<T>(T object, List<String> errors, List<String> warnings) {

    public ObjectResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
