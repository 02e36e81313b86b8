package io.artifacttracker.client.resources;

import io.artifacttracker.client.ResponseDecodeException;
import io.artifacttracker.client.RetryConfig;
import io.artifacttracker.client.TrackerApiException;
import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.model.Defect;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefectsTest {

    private MockWebServer server;
    private Defects defects;
    private final RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(10));

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        TrackerClient client = TrackerClient.builder()
                .apiKey("_key")
                .baseUrl(server.url("/slm/webservice/v2.0").toString())
                .transport(JdkHttpClientAdapter.create())
                .retryConfig(new RetryConfig(1, 1))
                .build();
        defects = client.defects();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private void enqueueJson(int status, String body) {
        server.enqueue(new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body));
    }

    private RecordedRequest takeRequest() throws InterruptedException {
        return server.takeRequest(5, TimeUnit.SECONDS);
    }

    @Test
    void queryReturnsResultsPage() throws Exception {
        enqueueJson(200, "{\"QueryResult\": {\"Errors\": [], \"Warnings\": [], \"TotalResultCount\": 2,"
                + " \"Results\": ["
                + "{\"_ref\": \"https://x/defect/1\", \"ObjectID\": 1, \"FormattedID\": \"DE1\", \"Name\": \"Crash\","
                + " \"CreationDate\": \"2016-01-21T21:47:08.551Z\"},"
                + "{\"ObjectID\": 2, \"FormattedID\": \"DE2\", \"Name\": \"Hang\", \"State\": \"Open\"}]}}");

        List<Defect> found = defects.query(ctx, Map.of("State", "Open"));

        assertThat(found).extracting(Defect::formattedID).containsExactly("DE1", "DE2");
        assertThat(found.get(0).creationDate()).isEqualTo(Instant.parse("2016-01-21T21:47:08.551Z"));
        assertThat(found.get(1).state()).isEqualTo("Open");

        RecordedRequest request = takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/slm/webservice/v2.0/defect");
        assertThat(request.getRequestUrl().queryParameter("fetch")).isEqualTo("true");
        assertThat(request.getRequestUrl().queryParameterValues("query")).containsExactly("( State = Open )");
        assertThat(request.getHeader("ZSESSIONID")).isEqualTo("_key");
    }

    @Test
    void queryWithoutResultEnvelopeIsEmpty() throws Exception {
        enqueueJson(200, "{}");

        assertThat(defects.query(ctx, Map.of())).isEmpty();
    }

    @Test
    void getUnwrapsTypeNamedMember() throws Exception {
        enqueueJson(200, "{\"Defect\": {\"ObjectID\": 42, \"FormattedID\": \"DE42\", \"Severity\": \"Crash/Data Loss\"}}");

        Defect defect = defects.get(ctx, "42");

        assertThat(defect.objectID()).isEqualTo(42L);
        assertThat(defect.severity()).isEqualTo("Crash/Data Loss");
        assertThat(takeRequest().getPath()).isEqualTo("/slm/webservice/v2.0/defect/42?fetch=true");
    }

    @Test
    void getAcceptsLowerCaseMember() throws Exception {
        enqueueJson(200, "{\"defect\": {\"ObjectID\": 42}}");

        assertThat(defects.get(ctx, "42").objectID()).isEqualTo(42L);
    }

    @Test
    void getWithoutMemberIsDecodeFailure() {
        enqueueJson(200, "{\"Task\": {\"ObjectID\": 42}}");

        assertThatThrownBy(() -> defects.get(ctx, "42"))
                .isInstanceOf(ResponseDecodeException.class)
                .hasMessageContaining("no Defect member");
    }

    @Test
    void createWrapsBodyAndUnwrapsCreateResult() throws Exception {
        enqueueJson(200, "{\"CreateResult\": {\"Errors\": [], \"Warnings\": [],"
                + " \"Object\": {\"ObjectID\": 77, \"FormattedID\": \"DE77\", \"Name\": \"Broken login\"}}}");

        Defect created = defects.create(ctx, Defect.named("Broken login"));

        assertThat(created.objectID()).isEqualTo(77L);
        assertThat(created.formattedID()).isEqualTo("DE77");

        RecordedRequest request = takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/slm/webservice/v2.0/defect/create");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"Defect\":{\"Name\":\"Broken login\"}}");
    }

    @Test
    void createRejectionCarriesServiceErrors() {
        enqueueJson(422, "{\"CreateResult\": {\"Errors\": [\"Validation error: Defect.Name should not be null\"],"
                + " \"Warnings\": [\"It is no longer necessary to append \\\".js\\\"\"]}}");

        assertThatThrownBy(() -> defects.create(ctx, Defect.named(null)))
                .isInstanceOfSatisfying(TrackerApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(422);
                    assertThat(e.getErrors()).containsExactly("Validation error: Defect.Name should not be null");
                    assertThat(e.getWarnings()).hasSize(1);
                });
    }

    @Test
    void updatePostsToObjectIdAndUnwrapsOperationResult() throws Exception {
        enqueueJson(200, "{\"OperationResult\": {\"Errors\": [], \"Warnings\": [],"
                + " \"Object\": {\"ObjectID\": 77, \"Name\": \"Renamed\", \"State\": \"Fixed\"}}}");
        Defect change = new Defect(77L, null, "Renamed", null, "Fixed", null, null, null, null, null, null);

        Defect updated = defects.update(ctx, change);

        assertThat(updated.state()).isEqualTo("Fixed");
        RecordedRequest request = takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/slm/webservice/v2.0/defect/77");
        assertThat(request.getBody().readUtf8())
                .startsWith("{\"Defect\":{")
                .contains("\"ObjectID\":77", "\"Name\":\"Renamed\"", "\"State\":\"Fixed\"");
    }

    @Test
    void updateWithoutObjectIdIsRejectedLocally() {
        assertThatThrownBy(() -> defects.update(ctx, Defect.named("x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void deleteSendsDelete() throws Exception {
        enqueueJson(200, "{\"OperationResult\": {\"Errors\": [], \"Warnings\": []}}");

        defects.delete(ctx, "77");

        RecordedRequest request = takeRequest();
        assertThat(request.getMethod()).isEqualTo("DELETE");
        assertThat(request.getPath()).isEqualTo("/slm/webservice/v2.0/defect/77?fetch=true");
    }

    @Test
    void deleteOfMissingObjectMatchesNotFound() {
        enqueueJson(404, "{\"OperationResult\": {\"Errors\": [\"Cannot find object to delete\"]}}");

        assertThatThrownBy(() -> defects.delete(ctx, "77"))
                .satisfies(e -> assertThat(TrackerApiException.matches(e, TrackerApiException.ofStatus(404))).isTrue());
    }
}
