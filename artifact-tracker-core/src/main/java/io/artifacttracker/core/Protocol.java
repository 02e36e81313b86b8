package io.artifacttracker.core;

/**
 * Tracker wire protocol constants (query keys, header names, envelope keys and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings and no JSON library dependencies.
 * It only models protocol-level concerns shared by the transport and client modules.
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_FETCH = "fetch";
    public static final String Q_QUERY = "query";

    // Path segments
    public static final String PATH_CREATE = "create";

    // Request headers
    public static final String H_SESSION_ID = "ZSESSIONID";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";

    // Content types
    public static final String CT_JSON = "application/json";

    // Result envelopes, in the order they are consulted when reading an error body
    public static final String ENVELOPE_OPERATION_RESULT = "OperationResult";
    public static final String ENVELOPE_CREATE_RESULT = "CreateResult";
    public static final String ENVELOPE_QUERY_RESULT = "QueryResult";
    public static final String FIELD_ERRORS = "Errors";
    public static final String FIELD_WARNINGS = "Warnings";

    /** Canonical boolean textual value used by the protocol for true. */
    public static final String BOOL_TRUE = "true";

    /**
     * Renders one filter term as understood by the query endpoint: {@code ( key = value )}.
     * Values are not quoted or escaped; callers format them.
     */
    public static String queryTerm(String key, String value) {
        return "( " + key + " = " + value + " )";
    }
}
