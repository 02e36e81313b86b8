package io.artifacttracker.client.model;

import java.time.Instant;

/**
 * A source-control changeset linked to tracked artifacts.
 */
public record Changeset(
        Long objectID,
        String name,
        String message,
        String revision,
        String uri,
        Instant commitTimestamp,
        Instant creationDate) {

    public static Changeset ofRevision(String revision, String message) {
        return new Changeset(null, null, message, revision, null, null, null);
    }

    public Changeset withObjectID(Long objectID) {
        return new Changeset(objectID, name, message, revision, uri, commitTimestamp, creationDate);
    }
}
