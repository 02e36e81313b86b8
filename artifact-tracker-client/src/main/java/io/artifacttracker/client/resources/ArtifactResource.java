package io.artifacttracker.client.resources;

import io.artifacttracker.client.ResponseDecodeException;
import io.artifacttracker.client.TrackerClient;
import io.artifacttracker.client.TrackerException;
import io.artifacttracker.client.model.CreateResponse;
import io.artifacttracker.client.model.ObjectResult;
import io.artifacttracker.client.model.OperationResponse;
import io.artifacttracker.client.model.QueryResponse;
import io.artifacttracker.client.model.QueryResult;
import io.artifacttracker.core.RequestContext;
import io.artifacttracker.json.spi.JsonType;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed CRUD operations for one artifact type.
 *
 * <p>Create and update bodies are wrapped as {@code {"<TypeName>": {...}}}. Responses are unwrapped
 * from the envelope each endpoint uses: {@code QueryResult.Results} for queries,
 * {@code {"<TypeName>": {...}}} for reads, {@code CreateResult.Object} for creates and
 * {@code OperationResult.Object} for updates.
 *
 * @param <T> the artifact record type
 */
public abstract class ArtifactResource<T> {

    private final TrackerClient client;
    private final String resourceType;
    private final String typeName;
    private final Class<T> artifactType;
    private final Function<T, Long> objectId;

    private final JsonType<QueryResponse<T>> queryResponseType;
    private final JsonType<Map<String, T>> getResponseType;
    private final JsonType<CreateResponse<T>> createResponseType;
    private final JsonType<OperationResponse<T>> operationResponseType;

    /**
     * @param resourceType lower-case path segment, e.g. {@code defect}
     * @param typeName wire type name used as body and read wrapper key, e.g. {@code Defect}
     * @param objectId extracts the identifier used by {@link #update}
     */
    protected ArtifactResource(TrackerClient client, String resourceType, String typeName,
                               Class<T> artifactType, Function<T, Long> objectId) {
        this.client = Objects.requireNonNull(client, "client");
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.artifactType = Objects.requireNonNull(artifactType, "artifactType");
        this.objectId = Objects.requireNonNull(objectId, "objectId");

        this.queryResponseType = JsonType.parameterized(QueryResponse.class, artifactType);
        this.getResponseType = JsonType.parameterized(Map.class, String.class, artifactType);
        this.createResponseType = JsonType.parameterized(CreateResponse.class, artifactType);
        this.operationResponseType = JsonType.parameterized(OperationResponse.class, artifactType);
    }

    public String resourceType() {
        return resourceType;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Artifacts matching every filter, from the first result page. Empty when nothing matches.
     */
    public List<T> query(RequestContext ctx, Map<String, String> filters) throws TrackerException {
        QueryResponse<T> response = client.query(ctx, resourceType, filters, queryResponseType);
        QueryResult<T> result = response == null ? null : response.queryResult();
        return result == null ? List.of() : result.results();
    }

    public T get(RequestContext ctx, String objectId) throws TrackerException {
        Map<String, T> response = client.get(ctx, resourceType, objectId, getResponseType);
        if (response != null) {
            for (Map.Entry<String, T> entry : response.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(typeName) && entry.getValue() != null) {
                    return entry.getValue();
                }
            }
        }
        throw new ResponseDecodeException("response for " + resourceType + "/" + objectId
                + " has no " + typeName + " member", null);
    }

    public T create(RequestContext ctx, T artifact) throws TrackerException {
        Objects.requireNonNull(artifact, "artifact");
        CreateResponse<T> response = client.create(ctx, resourceType, Map.of(typeName, artifact), createResponseType);
        return unwrap(response == null ? null : response.createResult(), "CreateResult");
    }

    /**
     * Updates the artifact identified by its object ID with the fields set on {@code artifact}.
     *
     * @throws IllegalArgumentException if the artifact has no object ID
     */
    public T update(RequestContext ctx, T artifact) throws TrackerException {
        Objects.requireNonNull(artifact, "artifact");
        Long id = objectId.apply(artifact);
        if (id == null) {
            throw new IllegalArgumentException(typeName + " has no ObjectID; it cannot be updated");
        }
        OperationResponse<T> response = client.update(ctx, resourceType, String.valueOf(id),
                Map.of(typeName, artifact), operationResponseType);
        return unwrap(response == null ? null : response.operationResult(), "OperationResult");
    }

    public void delete(RequestContext ctx, String objectId) throws TrackerException {
        client.delete(ctx, resourceType, objectId, operationResponseType);
    }

    private T unwrap(ObjectResult<T> result, String envelope) throws ResponseDecodeException {
        if (result == null || result.object() == null) {
            throw new ResponseDecodeException(envelope + " of " + typeName + " response carries no object", null);
        }
        return result.object();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + resourceType + " -> " + artifactType.getSimpleName() + "]";
    }
}
