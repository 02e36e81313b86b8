package io.artifacttracker.client.resources;

import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.model.HierarchicalRequirement;

/**
 * User stories at {@code /hierarchicalrequirement}.
 */
public final class HierarchicalRequirements extends ArtifactResource<HierarchicalRequirement> {

    public HierarchicalRequirements(TrackerClient client) {
        super(client, "hierarchicalrequirement", "HierarchicalRequirement", HierarchicalRequirement.class, HierarchicalRequirement::objectID);
    }
}
