package io.uvlanalyzer.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.uvlanalyzer.core.engine.Operation;
import java.util.Locale;

/**
 * Lists the available tools: one entry per {@link Operation} with its wire name, description
 * and the kind of {@code config_file} parameter it expects.
 */
public final class ToolListHandler implements Handler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String body;

    public ToolListHandler() {
        ArrayNode tools = MAPPER.createArrayNode();
        for (Operation operation : Operation.values()) {
            ObjectNode tool = tools.addObject();
            tool.put("name", operation.wireName());
            tool.put("description", operation.description());
            tool.put("parameter", operation.parameter().name().toLowerCase(Locale.ROOT));
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.set("tools", tools);
        this.body = root.toString();
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body);
    }
}
