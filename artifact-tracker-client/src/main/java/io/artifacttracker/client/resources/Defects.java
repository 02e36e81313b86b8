package io.artifacttracker.client.resources;

import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.model.Defect;

/**
 * Defects at {@code /defect}.
 */
public final class Defects extends ArtifactResource<Defect> {

    public Defects(TrackerClient client) {
        super(client, "defect", "Defect", Defect.class, Defect::objectID);
    }
}
