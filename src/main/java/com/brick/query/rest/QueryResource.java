package com.brick.query.rest;

import com.brick.query.api.PipelineResult;
import com.brick.query.api.QueryExplanation;
import com.brick.query.api.QueryPipeline;
import com.brick.query.core.model.QueryLocale;
import com.brick.query.graph.GraphConnection;
import com.brick.query.health.HealthCheckRegistry;
import com.brick.query.health.HealthStatus;
import com.brick.query.ontology.EntityDefinition;
import com.brick.query.ontology.TraversalPattern;
import com.brick.query.rest.dto.ErrorResponse;
import com.brick.query.rest.dto.ExplainResponse;
import com.brick.query.rest.dto.QueryRequest;
import com.brick.query.rest.dto.QueryResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST resource for natural-language building queries.
 *
 * <p>Answers are always returned with status 200, including pipeline failures such as low
 * confidence or an unreachable database; {@code success} and {@code state} in the body tell
 * them apart. Invalid input yields 400.</p>
 */
@Path("/api/v1/kg")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Knowledge Graph Query", description = "Ask questions about buildings in natural language")
public class QueryResource {
    private static final Logger log = LoggerFactory.getLogger(QueryResource.class);

    static final Map<String, List<String>> EXAMPLES = Map.of(
            "norwegian", List.of(
                    "Vis alle sensorer i bygget",
                    "Hvilke soner mater AHU-en?",
                    "List alle temperatursensorer",
                    "Hva er bygningens adresse?",
                    "Vis tidsserie-IDer",
                    "Sensorer i Foyer",
                    "Antall etasjer",
                    "Vis alle målere",
                    "Hvilket utstyr finnes i HVAC-systemet?"),
            "english", List.of(
                    "Show all sensors in the building",
                    "Which zones does the AHU feed?",
                    "List all temperature sensors",
                    "What is the building address?",
                    "Show timeseries IDs",
                    "Sensors in Foyer zone",
                    "Number of floors",
                    "Show all meters",
                    "What equipment is in the HVAC system?"));

    private static final String MISSING_BODY = "Request body with a question is required";
    private static final String INTERNAL_ERROR = "An internal error occurred. Check server logs for details.";

    private final QueryPipeline pipeline;
    private final GraphConnection connection;
    private final HealthCheckRegistry healthChecks;

    @Inject
    public QueryResource(QueryPipeline pipeline, GraphConnection connection, HealthCheckRegistry healthChecks) {
        this.pipeline = pipeline;
        this.connection = connection;
        this.healthChecks = healthChecks;
    }

    /**
     * POST /api/v1/kg/query
     */
    @POST
    @Path("/query")
    @Operation(summary = "Answer a question",
            description = "Runs the question through intent extraction, query generation, Cypher resolution, "
                    + "execution and formatting.")
    @APIResponse(responseCode = "200", description = "Question processed; see success and state")
    @APIResponse(responseCode = "400", description = "Missing, too long or malformed question, or unknown language")
    public Response query(QueryRequest request) {
        return answer(request, "/api/v1/kg/query");
    }

    /**
     * GET /api/v1/kg/query?q=...&lang=no
     */
    @GET
    @Path("/query")
    @Operation(summary = "Answer a question (GET)")
    @APIResponse(responseCode = "200", description = "Question processed; see success and state")
    @APIResponse(responseCode = "400", description = "Missing, too long or malformed question, or unknown language")
    public Response queryGet(
            @Parameter(description = "Natural-language question") @QueryParam("q") String question,
            @Parameter(description = "Answer language (no/en)") @QueryParam("lang") @DefaultValue("no") String language) {
        QueryRequest request;
        try {
            request = new QueryRequest(question, language, false);
        } catch (IllegalArgumentException e) {
            return badRequest(e, "/api/v1/kg/query");
        }
        return answer(request, "/api/v1/kg/query");
    }

    /**
     * POST /api/v1/kg/explain
     */
    @POST
    @Path("/explain")
    @Operation(summary = "Explain a question",
            description = "Shows the intent, structured query and Cypher for a question without executing it.")
    @APIResponse(responseCode = "200", description = "Explanation returned")
    @APIResponse(responseCode = "400", description = "Invalid question")
    public Response explain(QueryRequest request) {
        if (request == null) {
            return badRequest(new IllegalArgumentException(MISSING_BODY), "/api/v1/kg/explain");
        }
        try {
            QueryExplanation explanation = pipeline.explain(request.question(), locale(request.language()));
            return Response.ok(ExplainResponse.from(explanation)).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, "/api/v1/kg/explain");
        } catch (Exception e) {
            log.error("explain.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, "/api/v1/kg/explain"))
                    .build();
        }
    }

    /**
     * GET /api/v1/kg/ontology
     */
    @GET
    @Path("/ontology")
    @Operation(summary = "Describe the ontology",
            description = "Lists the Brick entity types, their fields and synonyms, and the traversal patterns.")
    @APIResponse(responseCode = "200", description = "Ontology returned")
    public Response ontology() {
        Map<String, Object> entities = new LinkedHashMap<>();
        for (EntityDefinition definition : pipeline.getOntology().getEntityDefinitions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", definition.getName());
            entry.put("label", definition.getType().getLabel());
            entry.put("description", definition.getDescription());
            entry.put("fields", definition.getScalarFields().stream().map(f -> f.name()).toList());
            entry.put("synonyms_no", firstThree(definition.getSynonyms(QueryLocale.NO)));
            entry.put("synonyms_en", firstThree(definition.getSynonyms(QueryLocale.EN)));
            entities.put(definition.getType().getTypeName(), entry);
        }
        List<String> traversals = pipeline.getOntology().getTraversals().stream()
                .map(TraversalPattern::name)
                .toList();
        return Response.ok(Map.of(
                "pipeline", "NL -> Intent -> GraphQL -> Cypher -> FalkorDB",
                "entities", entities,
                "traversals", traversals
        )).build();
    }

    /**
     * GET /api/v1/kg/examples
     */
    @GET
    @Path("/examples")
    @Operation(summary = "Example questions in Norwegian and English")
    @APIResponse(responseCode = "200", description = "Examples returned")
    public Response examples() {
        return Response.ok(EXAMPLES).build();
    }

    /**
     * GET /api/v1/kg/health
     */
    @GET
    @Path("/health")
    @Operation(summary = "Health of the graph engine, language model and ontology")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = healthChecks.checkAll();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.status().name());
        body.put("message", status.message());
        body.put("graphName", connection.getGraphName());
        body.put("checks", status.details());
        return Response.status(status.isDown() ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK)
                .entity(body)
                .build();
    }

    private Response answer(QueryRequest request, String path) {
        if (request == null) {
            return badRequest(new IllegalArgumentException(MISSING_BODY), path);
        }
        try {
            PipelineResult result = pipeline.process(request.question(), locale(request.language()), connection);
            return Response.ok(QueryResponse.from(result, request.debugEnabled())).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, path);
        } catch (Exception e) {
            log.error("query.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    private QueryLocale locale(String language) {
        return language == null || language.isBlank()
                ? pipeline.getOptions().getDefaultLocale()
                : QueryLocale.fromCode(language);
    }

    private static Response badRequest(IllegalArgumentException e, String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(e.getMessage(), path))
                .build();
    }

    private static List<String> firstThree(List<String> values) {
        return values.size() > 3 ? values.subList(0, 3) : values;
    }
}
