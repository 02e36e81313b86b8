package io.artifacttracker.client.model;

import java.time.Instant;

public record BuildDefinition(
        Long objectID,
        String name,
        String description,
        String uri,
        Instant lastBuildDate,
        Instant creationDate) {

    public static BuildDefinition named(String name) {
        return new BuildDefinition(null, name, null, null, null, null);
    }

    public BuildDefinition withObjectID(Long objectID) {
        return new BuildDefinition(objectID, name, description, uri, lastBuildDate, creationDate);
    }
}
