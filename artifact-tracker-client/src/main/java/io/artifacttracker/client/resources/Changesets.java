package io.artifacttracker.client.resources;

import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.model.Changeset;

public final class Changesets extends ArtifactResource<Changeset> {

    public Changesets(TrackerClient client) {
        super(client, "changeset", "Changeset", Changeset.class, Changeset::objectID);
    }
}
