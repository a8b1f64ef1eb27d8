package io.uvlanalyzer.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.uvlanalyzer.core.error.AnalysisException;
import io.uvlanalyzer.core.error.AnalysisTimeoutException;
import io.uvlanalyzer.core.error.ModelLoadException;

/**
 * Builds RFC 9457 Problem Details bodies for the tool server.
 *
 * <p>
 * Analysis errors reuse the URN of the engine exception; request-level errors (unknown
 * operation, unreadable body) have their own {@code urn:uvl-analyzer:server:*} types:
 * <pre>{@code
 * {
 * "type": "urn:uvl-analyzer:error:unknown-feature",
 * "title": "Unknown Feature",
 * "status": 400,
 * "detail": "Unknown feature: 'Keyboard'",
 * "instance": "/tools/commonality"
 * }
 * }</pre>
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String CONTENT_TYPE = "application/problem+json";

    static final String URN_UNKNOWN_OPERATION = "urn:uvl-analyzer:server:unknown-operation";
    static final String URN_BAD_REQUEST = "urn:uvl-analyzer:server:bad-request";
    static final String URN_BODY_TOO_LARGE = "urn:uvl-analyzer:server:body-too-large";
    static final String URN_INTERNAL_ERROR = "urn:uvl-analyzer:server:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /** {@code 404}: the path names no operation. */
    public static JsonNode unknownOperation(String operation, String instancePath) {
        return build(
                URN_UNKNOWN_OPERATION, "Unknown Operation", 404, "Unknown operation: '" + operation + "'", instancePath);
    }

    /** {@code 400}: the request body is not the expected JSON object. */
    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** {@code 413}: the request body exceeds {@code server.max-body-bytes}. */
    public static JsonNode bodyTooLarge(String detail, String instancePath) {
        return build(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    /** {@code 500}: an unexpected failure. */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    /**
     * Maps an engine exception: malformed models are {@code 422}, timeouts {@code 504}, other
     * analysis errors (unknown feature, invalid argument) {@code 400}.
     */
    public static JsonNode fromAnalysisException(AnalysisException e, String instancePath) {
        return build(e.urn(), titleFor(e.urn()), statusFor(e), e.detail(), instancePath);
    }

    /** HTTP status for an engine exception. */
    public static int statusFor(AnalysisException e) {
        if (e instanceof ModelLoadException) {
            return 422;
        }
        if (e instanceof AnalysisTimeoutException) {
            return 504;
        }
        return 400;
    }

    /** "urn:uvl-analyzer:error:unknown-feature" → "Unknown Feature". */
    static String titleFor(String urn) {
        String slug = urn.substring(urn.lastIndexOf(':') + 1);
        StringBuilder title = new StringBuilder();
        for (String word : slug.split("-")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
