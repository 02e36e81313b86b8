package io.artifacttracker.client.resources;

import io.artifacttracker.client.RetryConfig;
import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.model.BuildDefinition;
import io.artifacttracker.client.model.Changeset;
import io.artifacttracker.client.model.HierarchicalRequirement;
import io.artifacttracker.client.model.Task;
import io.artifacttracker.core.RequestContext;
import io.artifacttracker.http.spi.JdkHttpClientAdapter;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactResourcesTest {

    private MockWebServer server;
    private TrackerClient client;
    private final RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(10));

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = TrackerClient.builder()
                .apiKey("_key")
                .baseUrl(server.url("/v2.0/").toString())
                .transport(JdkHttpClientAdapter.create())
                .retryConfig(RetryConfig.disabled())
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse().addHeader("Content-Type", "application/json").setBody(body));
    }

    private RecordedRequest takeRequest() throws InterruptedException {
        return server.takeRequest(5, TimeUnit.SECONDS);
    }

    @Test
    void tasksReadTaskFields() throws Exception {
        enqueueJson("{\"QueryResult\": {\"TotalResultCount\": 1,"
                + " \"Results\": [{\"ObjectID\": 5, \"FormattedID\": \"TA5\", \"Estimate\": 3.0, \"ToDo\": 1.5}]}}");

        Task task = client.tasks().query(ctx, Map.of("FormattedID", "TA5")).get(0);

        assertThat(task.estimate()).isEqualTo(3.0);
        assertThat(task.toDo()).isEqualTo(1.5);
        assertThat(takeRequest().getRequestUrl().encodedPath()).isEqualTo("/v2.0/task");
    }

    @Test
    void hierarchicalRequirementsUseLowerCasePathAndTypeNameWrapper() throws Exception {
        enqueueJson("{\"CreateResult\": {\"Object\": {\"ObjectID\": 8, \"FormattedID\": \"US8\", \"ScheduleState\": \"Defined\"}}}");

        HierarchicalRequirement story = client.hierarchicalRequirements()
                .create(ctx, HierarchicalRequirement.named("Login with SSO"));

        assertThat(story.formattedID()).isEqualTo("US8");
        RecordedRequest request = takeRequest();
        assertThat(request.getPath()).isEqualTo("/v2.0/hierarchicalrequirement/create");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"HierarchicalRequirement\":{\"Name\":\"Login with SSO\"}}");
    }

    @Test
    void changesetsUpdateByObjectId() throws Exception {
        enqueueJson("{\"OperationResult\": {\"Object\": {\"ObjectID\": 3, \"Revision\": \"abc123\","
                + " \"CommitTimestamp\": \"2024-05-01T10:00:00Z\"}}}");

        Changeset updated = client.changesets()
                .update(ctx, Changeset.ofRevision("abc123", "Fix login").withObjectID(3L));

        assertThat(updated.commitTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        RecordedRequest request = takeRequest();
        assertThat(request.getPath()).isEqualTo("/v2.0/changeset/3");
        assertThat(request.getBody().readUtf8())
                .startsWith("{\"Changeset\":{")
                .contains("\"Revision\":\"abc123\"", "\"Message\":\"Fix login\"");
    }

    @Test
    void buildDefinitionsGetAndDelete() throws Exception {
        enqueueJson("{\"BuildDefinition\": {\"ObjectID\": 11, \"Name\": \"nightly\"}}");
        enqueueJson("{\"OperationResult\": {\"Errors\": [], \"Warnings\": []}}");

        BuildDefinition definition = client.buildDefinitions().get(ctx, "11");
        client.buildDefinitions().delete(ctx, "11");

        assertThat(definition.name()).isEqualTo("nightly");
        assertThat(takeRequest().getPath()).isEqualTo("/v2.0/builddefinition/11?fetch=true");
        RecordedRequest delete = takeRequest();
        assertThat(delete.getMethod()).isEqualTo("DELETE");
        assertThat(delete.getPath()).isEqualTo("/v2.0/builddefinition/11?fetch=true");
    }

    @Test
    void describesItself() {
        assertThat(client.defects().typeName()).isEqualTo("Defect");
        assertThat(client.changesets().toString()).isEqualTo("Changesets[changeset -> Changeset]");
    }
}
