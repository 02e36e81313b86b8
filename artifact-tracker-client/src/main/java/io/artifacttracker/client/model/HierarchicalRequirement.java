package io.artifacttracker.client.model;

import java.time.Instant;

/**
 * A user story. The service calls these hierarchical requirements.
 */
public record HierarchicalRequirement(
        Long objectID,
        String formattedID,
        String name,
        String description,
        String scheduleState,
        Double planEstimate,
        Boolean blocked,
        Instant creationDate,
        Instant lastUpdateDate) {

    public static HierarchicalRequirement named(String name) {
        return new HierarchicalRequirement(null, null, name, null, null, null, null, null, null);
    }

    public HierarchicalRequirement withObjectID(Long objectID) {
        return new HierarchicalRequirement(objectID, formattedID, name, description, scheduleState, planEstimate,
                blocked, creationDate, lastUpdateDate);
    }
}
