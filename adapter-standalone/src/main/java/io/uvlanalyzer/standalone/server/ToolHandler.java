package io.uvlanalyzer.standalone.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.uvlanalyzer.core.engine.AnalysisEngine;
import io.uvlanalyzer.core.engine.AnalysisResult;
import io.uvlanalyzer.core.engine.Operation;
import io.uvlanalyzer.core.error.AnalysisException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one analysis per request: {@code POST /tools/{operation}}.
 *
 * <p>
 * Request body:
 * <pre>{@code
 * {
 * "content": "features\n    Root\n ...",
 * "config_file": "Camera",
 * "selected_features": ["Root", "Camera"]
 * }
 * }</pre>
 * {@code config_file} carries the operation's extra parameter (feature name, criteria, sample
 * size); {@code selected_features} is the list form for {@code satisfiable_configuration} and
 * wins over {@code config_file} there.
 *
 * <p>
 * Success is {@code 200 {"operation": ..., "result": ..., "duration_ms": ...}}. Failures are
 * RFC 9457 problem details; see {@link ProblemDetail}.
 */
public final class ToolHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ToolHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String OPERATION_PARAM = "operation";

    private final AnalysisEngine engine;
    private final long maxBodyBytes;

    public ToolHandler(AnalysisEngine engine, long maxBodyBytes) {
        this.engine = engine;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(Context ctx) {
        String wireName = ctx.pathParam(OPERATION_PARAM);
        Optional<Operation> operation = Operation.fromWireName(wireName);
        if (operation.isEmpty()) {
            LOG.debug("Rejected unknown operation '{}'", wireName);
            writeProblem(ctx, ProblemDetail.unknownOperation(wireName, ctx.path()));
            return;
        }

        long contentLength = ctx.contentLength();
        if (contentLength > maxBodyBytes) {
            LOG.warn("Request body too large: {} bytes (limit {})", contentLength, maxBodyBytes);
            writeProblem(ctx, ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()));
            return;
        }
        // Chunked requests carry no Content-Length; the limit applies to the bytes received.
        byte[] bytes = ctx.bodyAsBytes();
        if (bytes.length > maxBodyBytes) {
            LOG.warn("Request body too large: {} bytes (limit {})", bytes.length, maxBodyBytes);
            writeProblem(ctx, ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()));
            return;
        }
        String body = new String(bytes, StandardCharsets.UTF_8);

        ToolRequest request;
        try {
            request = ToolRequest.parse(body, operation.get());
        } catch (IllegalArgumentException e) {
            writeProblem(ctx, ProblemDetail.badRequest(e.getMessage(), ctx.path()));
            return;
        }

        try {
            AnalysisResult result = engine.execute(operation.get(), request.content(), request.argument());
            ObjectNode response = MAPPER.createObjectNode();
            response.put("operation", result.operation().wireName());
            response.set("result", result.value());
            response.put("duration_ms", result.durationMs());
            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(response.toString());
        } catch (AnalysisException e) {
            writeProblem(ctx, ProblemDetail.fromAnalysisException(e, ctx.path()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure in operation {}: {}", wireName, e.getMessage(), e);
            writeProblem(ctx, ProblemDetail.internalError("Internal error while running " + wireName, ctx.path()));
        }
    }

    private static void writeProblem(Context ctx, JsonNode problem) {
        ctx.status(problem.get("status").asInt());
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(problem.toString());
    }

    /** The decoded request body. {@code argument} is null when the request carries none. */
    record ToolRequest(String content, String argument) {

        static ToolRequest parse(String body, Operation operation) {
            JsonNode root;
            try {
                root = MAPPER.readTree(body);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
            }
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Request body must be a JSON object");
            }
            JsonNode content = root.path("content");
            if (!content.isTextual()) {
                throw new IllegalArgumentException("Request body must contain the model text as a 'content' string");
            }

            JsonNode selected = root.path("selected_features");
            if (operation.parameter() == Operation.Parameter.SELECTION && !selected.isMissingNode() && !selected.isNull()) {
                if (!selected.isArray()) {
                    throw new IllegalArgumentException("'selected_features' must be an array of feature names");
                }
                return new ToolRequest(content.asText(), selected.toString());
            }
            return new ToolRequest(content.asText(), argument(root.path("config_file")));
        }

        private static String argument(JsonNode node) {
            if (node.isMissingNode() || node.isNull()) {
                return null;
            }
            // Numbers, arrays and objects are handed over in their JSON form.
            return node.isTextual() ? node.asText() : node.toString();
        }
    }
}
