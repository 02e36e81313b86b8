package io.artifacttracker.client.model;

import java.time.Instant;

/**
 * A defect artifact. Unset fields are {@code null} and are left out of request bodies.
 */
public record Defect(
        Long objectID,
        String formattedID,
        String name,
        String description,
        String state,
        String severity,
        String priority,
        String scheduleState,
        String environment,
        Instant creationDate,
        Instant lastUpdateDate) {

    /**
     * A defect carrying only a name, as used when filing a new one.
     */
    public static Defect named(String name) {
        return new Defect(null, null, name, null, null, null, null, null, null, null, null);
    }

    public Defect withObjectID(Long objectID) {
        return new Defect(objectID, formattedID, name, description, state, severity, priority, scheduleState,
                environment, creationDate, lastUpdateDate);
    }
}
