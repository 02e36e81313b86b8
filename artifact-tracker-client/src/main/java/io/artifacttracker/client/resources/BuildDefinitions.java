package io.artifacttracker.client.resources;

import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.model.BuildDefinition;

public final class BuildDefinitions extends ArtifactResource<BuildDefinition> {

    public BuildDefinitions(TrackerClient client) {
        super(client, "builddefinition", "BuildDefinition", BuildDefinition.class, BuildDefinition::objectID);
    }
}
