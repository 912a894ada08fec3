package com.brick.query.mcp;

import com.brick.query.api.PipelineResult;
import com.brick.query.api.QueryExplanation;
import com.brick.query.api.QueryPipeline;
import com.brick.query.core.model.QueryLocale;
import com.brick.query.graph.GraphConnection;
import com.brick.query.ontology.BrickOntology;
import com.brick.query.ontology.EntityDefinition;
import com.brick.query.ontology.TraversalPattern;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MCP tools over the query pipeline. All tools are read-only: the generated Cypher only
 * ever matches and returns, and nothing here writes to the graph.
 *
 * <ul>
 *   <li>{@code ask_building_graph} -- answer a question about the building</li>
 *   <li>{@code explain_question} -- show the structured query and Cypher a question maps to</li>
 *   <li>{@code list_entity_types} -- list the ontology's entity definitions</li>
 *   <li>{@code list_traversal_patterns} -- list the named traversal patterns</li>
 * </ul>
 */
public final class BrickQueryMcpTools {

    private final QueryPipeline pipeline;
    private final GraphConnection connection;

    public BrickQueryMcpTools(QueryPipeline pipeline, GraphConnection connection) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        this.connection = Objects.requireNonNull(connection, "connection is required");
    }

    public List<McpToolDefinition> getToolDefinitions() {
        return List.of(
                buildAskTool(),
                buildExplainTool(),
                buildListEntityTypesTool(),
                buildListTraversalPatternsTool()
        );
    }

    public Optional<McpToolDefinition> getTool(String name) {
        return getToolDefinitions().stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    private McpToolDefinition buildAskTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "question", Map.of("type", "string",
                                "description", "Question about the building, in Norwegian or English"),
                        "language", Map.of("type", "string", "enum", List.of("no", "en"),
                                "description", "Answer language, defaults to the pipeline's default")
                ),
                "required", List.of("question")
        );

        return new McpToolDefinition(
                "ask_building_graph",
                "Answer a natural-language question about buildings, floors, zones, equipment, sensors and meters "
                        + "from the Brick knowledge graph.",
                schema,
                params -> {
                    String question = requireString(params, "question");
                    PipelineResult result = pipeline.process(question, locale(params), connection);
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("success", result.success());
                    out.put("state", result.state().name());
                    out.put("response", result.response());
                    out.put("resultCount", result.resultCount());
                    out.put("intent", result.intent().kind().getCode());
                    if (result.generatedQuery() != null) {
                        out.put("operation", result.generatedQuery().operationName());
                    }
                    return out;
                }
        );
    }

    private McpToolDefinition buildExplainTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "question", Map.of("type", "string", "description", "Question to explain")
                ),
                "required", List.of("question")
        );

        return new McpToolDefinition(
                "explain_question",
                "Show how a question is interpreted: intent, structured query and Cypher. Does not query the graph.",
                schema,
                params -> {
                    QueryExplanation explanation = pipeline.explain(requireString(params, "question"));
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("intent", explanation.intent().kind().getCode());
                    out.put("entityType", explanation.intent().entity().map(t -> t.getTypeName()).orElse(null));
                    out.put("confidence", explanation.intent().confidence());
                    out.put("lowConfidence", explanation.lowConfidence());
                    out.put("graphql", explanation.generatedQuery().queryText());
                    if (explanation.resolvedQuery() != null) {
                        out.put("cypher", explanation.resolvedQuery().cypher());
                        out.put("parameters", explanation.resolvedQuery().parameters());
                        out.put("description", explanation.resolvedQuery().description());
                    } else {
                        out.put("error", explanation.error());
                    }
                    return out;
                }
        );
    }

    private McpToolDefinition buildListEntityTypesTool() {
        return new McpToolDefinition(
                "list_entity_types",
                "List the Brick entity types the query compiler understands, with their graph labels.",
                Map.of("type", "object", "properties", Map.of()),
                params -> {
                    BrickOntology ontology = pipeline.getOntology();
                    List<Map<String, Object>> types = ontology.getEntityDefinitions().stream()
                            .map(BrickQueryMcpTools::describe)
                            .toList();
                    return Map.of("count", types.size(), "entityTypes", types);
                }
        );
    }

    private McpToolDefinition buildListTraversalPatternsTool() {
        return new McpToolDefinition(
                "list_traversal_patterns",
                "List the named multi-hop traversal patterns and the phrases that trigger them.",
                Map.of("type", "object", "properties", Map.of()),
                params -> {
                    List<TraversalPattern> patterns = pipeline.getOntology().getTraversals();
                    List<Map<String, Object>> maps = patterns.stream()
                            .map(p -> Map.<String, Object>of(
                                    "name", p.name(),
                                    "description", p.description(),
                                    "path", p.path(),
                                    "keywords", p.keywords()
                            ))
                            .toList();
                    return Map.of("count", maps.size(), "patterns", maps);
                }
        );
    }

    private static Map<String, Object> describe(EntityDefinition definition) {
        return Map.of(
                "name", definition.getName(),
                "label", definition.getType().getLabel(),
                "category", definition.getType().getCategory().name(),
                "description", definition.getDescription(),
                "fields", definition.getScalarFields().stream().map(f -> f.name()).toList()
        );
    }

    private QueryLocale locale(Map<String, Object> params) {
        Object language = params.get("language");
        return language instanceof String code && !code.isBlank()
                ? QueryLocale.fromCode(code)
                : pipeline.getOptions().getDefaultLocale();
    }

    private static String requireString(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException("'" + key + "' is required");
        }
        return s;
    }
}
