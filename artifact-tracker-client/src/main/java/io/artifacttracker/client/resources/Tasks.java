package io.artifacttracker.client.resources;

import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.model.Task;

public final class Tasks extends ArtifactResource<Task> {

    public Tasks(TrackerClient client) {
        super(client, "task", "Task", Task.class, Task::objectID);
    }
}
