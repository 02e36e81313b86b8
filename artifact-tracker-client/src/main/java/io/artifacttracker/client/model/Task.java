package io.artifacttracker.client.model;

import java.time.Instant;

public record Task(
        Long objectID,
        String formattedID,
        String name,
        String description,
        String state,
        Double estimate,
        Double toDo,
        Double actuals,
        Instant creationDate,
        Instant lastUpdateDate) {

    public static Task named(String name) {
        return new Task(null, null, name, null, null, null, null, null, null, null);
    }

    public Task withObjectID(Long objectID) {
        return new Task(objectID, formattedID, name, description, state, estimate, toDo, actuals,
                creationDate, lastUpdateDate);
    }
}
