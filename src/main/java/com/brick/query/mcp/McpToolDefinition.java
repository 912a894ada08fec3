package com.brick.query.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A Model Context Protocol tool that an agent can call.
 *
 * @param name        tool name, e.g. {@code ask_building_graph}
 * @param description what the tool does, shown to the agent
 * @param inputSchema JSON Schema of the arguments
 * @param handler     runs the tool on the argument map and returns a JSON-ready result map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(inputSchema, "inputSchema is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(inputSchema);
    }

    public Map<String, Object> invoke(Map<String, Object> arguments) {
        return handler.apply(arguments != null ? arguments : Map.of());
    }
}
