package com.brick.query.cypher;

import com.brick.query.core.model.EntityCategory;
import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.ResolvedQuery;
import com.brick.query.graph.InputSanitizer;
import com.brick.query.graphql.FieldNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates a structured query into a parameterised Cypher query over the Brick graph.
 *
 * <p>The root field picks a {@link ResolverRule}; its arguments and the request variables
 * become filters; its selection set becomes the projection, with nested relation fields
 * collected through {@code OPTIONAL MATCH} so that a node without related data still
 * yields its row. Values are only ever bound as parameters. The query text holds fixed
 * template fragments, labels from {@link EntityType}, and labels that passed
 * {@link InputSanitizer#validateLabel(String)}.</p>
 *
 * <pre>
 * CypherResolver resolver = new CypherResolver();
 * ResolvedQuery cypher = resolver.resolve(generatedQuery);
 * List&lt;Map&lt;String, Object&gt;&gt; rows = connection.query(cypher.cypher(), cypher.parameters());
 * </pre>
 */
public class CypherResolver {
    private static final Logger log = LoggerFactory.getLogger(CypherResolver.class);

    public static final String FALLBACK_CYPHER = "MATCH (n) RETURN labels(n)[0] AS type, count(*) AS count";
    static final String FALLBACK_DESCRIPTION = "Default query - node type counts";

    private static final List<ResolverRule> RULES = List.of(
            ResolverRule.of("single_building", NodeFamily.BUILDING, ResolverRule.Shape.SINGLE, "building"),
            ResolverRule.of("building_list", NodeFamily.BUILDING, ResolverRule.Shape.LIST, "buildings"),
            ResolverRule.of("floors", NodeFamily.FLOOR, ResolverRule.Shape.LIST, "floors", "floor"),
            ResolverRule.of("zones", NodeFamily.ZONE, ResolverRule.Shape.LIST, "zones", "zone"),
            ResolverRule.of("rooms", NodeFamily.ROOM, ResolverRule.Shape.LIST, "rooms", "room"),
            ResolverRule.of("systems", NodeFamily.SYSTEM, ResolverRule.Shape.LIST, "systems", "system"),
            ResolverRule.of("equipment", NodeFamily.EQUIPMENT, ResolverRule.Shape.LIST, "equipment"),
            ResolverRule.of("sensors", NodeFamily.SENSOR, ResolverRule.Shape.LIST, "sensors", "sensor"),
            ResolverRule.of("meters", NodeFamily.METER, ResolverRule.Shape.LIST, "meters", "meter"),
            ResolverRule.of("timeseries", NodeFamily.TIMESERIES, ResolverRule.Shape.LIST, "timeseries"),
            ResolverRule.of("sensor_count", NodeFamily.SENSOR, ResolverRule.Shape.COUNT, "sensorcount"),
            ResolverRule.of("equipment_count", NodeFamily.EQUIPMENT, ResolverRule.Shape.COUNT, "equipmentcount")
    );

    private final UnresolvedQueryPolicy unresolvedPolicy;

    public CypherResolver() {
        this(UnresolvedQueryPolicy.DEFAULT_TEMPLATE);
    }

    public CypherResolver(UnresolvedQueryPolicy unresolvedPolicy) {
        this.unresolvedPolicy = Objects.requireNonNull(unresolvedPolicy, "unresolvedPolicy is required");
    }

    public ResolvedQuery resolve(GeneratedQuery query) {
        return resolve(query.queryText(), query.variables());
    }

    /**
     * Resolves a structured query.
     *
     * @param queryText structured query text
     * @param variables variable values, may be {@code null}
     * @throws QueryResolutionException  when a sub-type filter is not a valid label
     * @throws UnresolvedQueryException  when the root is unknown and the policy is {@link UnresolvedQueryPolicy#FAIL}
     */
    public ResolvedQuery resolve(String queryText, Map<String, Object> variables) {
        Map<String, Object> vars = variables != null ? variables : Map.of();
        Optional<ParsedOperation> parsed = OperationParser.parse(queryText);
        String root = parsed.map(ParsedOperation::rootField).orElse("");

        for (ResolverRule rule : RULES) {
            if (rule.matches(root)) {
                ResolvedQuery resolved = build(rule, parsed.get(), vars);
                log.debug("cypher.resolved rule={} cypher={}", rule.name(), resolved.cypher());
                return resolved;
            }
        }
        return unresolved(root, vars);
    }

    public UnresolvedQueryPolicy getUnresolvedPolicy() {
        return unresolvedPolicy;
    }

    private ResolvedQuery unresolved(String root, Map<String, Object> variables) {
        String operation = root.isEmpty() ? "<none>" : root;
        if (unresolvedPolicy == UnresolvedQueryPolicy.FAIL) {
            log.warn("cypher.unresolved operation={} policy=FAIL", operation);
            throw new UnresolvedQueryException(operation);
        }
        log.warn("cypher.unresolved operation={} policy=DEFAULT_TEMPLATE", operation);
        return new ResolvedQuery(FALLBACK_CYPHER, scalarInputs(variables), FALLBACK_DESCRIPTION, root, true);
    }

    // ========== Template construction ==========

    private ResolvedQuery build(ResolverRule rule, ParsedOperation operation, Map<String, Object> variables) {
        NodeFamily family = rule.family();
        String x = family.variable();
        Map<String, Object> inputs = mergeInputs(operation, variables);
        Map<String, Object> params = scalarInputs(inputs);
        List<String> conditions = new ArrayList<>();

        String subTypeLabel = subTypeLabel(family, inputs);
        List<String> labels = family.labels();
        String nodePattern;
        if (subTypeLabel != null) {
            nodePattern = "(" + x + ":" + subTypeLabel + ")";
        } else if (labels.size() == 1) {
            nodePattern = "(" + x + ":" + labels.get(0) + ")";
        } else {
            nodePattern = "(" + x + ")";
            conditions.add(labelDisjunction(x, labels));
        }

        NodeFamily.Scope scope = null;
        for (NodeFamily.Scope candidate : family.scopes()) {
            String value = input(inputs, candidate.key());
            if (value != null) {
                scope = candidate;
                params.put(candidate.key(), value);
                break;
            }
        }
        String match = scope != null ? scope.template().replace("%X", nodePattern) : nodePattern;

        String id = input(inputs, "id");
        String name = input(inputs, "name");
        if (id != null || name != null) {
            conditions.add("($id = '' OR " + x + ".id = $id)");
            conditions.add("($name = '' OR toLower(" + x + ".name) CONTAINS toLower($name))");
            params.put("id", id != null ? id : "");
            params.put("name", name != null ? name : "");
        }

        StringBuilder cypher = new StringBuilder("MATCH ").append(match);
        if (!conditions.isEmpty()) {
            cypher.append("\nWHERE ").append(String.join(" AND ", conditions));
        }

        if (rule.shape() == ResolverRule.Shape.COUNT) {
            cypher.append("\nRETURN count(").append(x).append(") AS count");
        } else {
            List<String> carried = new ArrayList<>(List.of(x));
            List<String> projection = project(cypher, family, x, operation.selection(), carried, new int[]{0});
            String orderKey = family == NodeFamily.FLOOR ? "level" : "name";
            cypher.append("\nWITH ").append(String.join(", ", carried))
                    .append(" ORDER BY ").append(x).append('.').append(orderKey);
            cypher.append("\nRETURN ").append(x).append(" {").append(String.join(", ", projection))
                    .append("} AS ").append(family.alias());
            if (rule.shape() == ResolverRule.Shape.SINGLE) {
                cypher.append("\nLIMIT 1");
            }
        }

        return new ResolvedQuery(cypher.toString(), params,
                describe(rule, family, subTypeLabel, scope), operation.rootField(), false);
    }

    /**
     * Builds the projection of {@code var}, emitting collection clauses for nested relation
     * fields. Each collected alias is appended to {@code carried}.
     */
    private List<String> project(StringBuilder cypher, NodeFamily family, String var, List<Selection> selection,
                                 List<String> carried, int[] counter) {
        List<Selection> fields = selection.isEmpty() ? leaves(family.defaultProjection()) : selection;
        List<String> projection = new ArrayList<>();
        for (Selection field : fields) {
            Optional<NodeFamily.Hop> hop = family.hop(field.name());
            if (hop.isPresent()) {
                String alias = collect(cypher, var, hop.get(), field, carried, counter);
                carried.add(alias);
                projection.add(field.name() + ": " + alias);
            } else if (field.isLeaf()) {
                projection.add(leafProjection(family, var, field.name()));
            } else {
                log.debug("cypher.selection.skipped field={} family={}", field.name(), family);
            }
        }
        if (projection.isEmpty()) {
            projection.add(".id");
        }
        return projection;
    }

    private String collect(StringBuilder cypher, String parentVar, NodeFamily.Hop hop, Selection field,
                           List<String> carried, int[] counter) {
        NodeFamily target = hop.target();
        String n = "n" + (++counter[0]);
        List<String> targetLabels = target.labels();
        String to = targetLabels.size() == 1 ? n + ":" + targetLabels.get(0) : n;
        cypher.append("\nOPTIONAL MATCH ").append(hop.pattern(parentVar, to));
        if (targetLabels.size() > 1) {
            cypher.append("\nWHERE ").append(labelDisjunction(n, targetLabels));
        }

        List<String> inner = new ArrayList<>(carried);
        inner.add(n);
        List<String> projection = project(cypher, target, n, field.children(), inner, counter);

        String alias = parentVar + "_" + field.name();
        cypher.append("\nWITH ").append(String.join(", ", carried))
                .append(", collect(DISTINCT ").append(n).append(" {").append(String.join(", ", projection))
                .append("}) AS ").append(alias);
        return alias;
    }

    private static String leafProjection(NodeFamily family, String var, String field) {
        if ("type".equals(field) || family.subTypeField().map(field::equals).orElse(false)) {
            return field + ": labels(" + var + ")[0]";
        }
        return "." + FieldNames.toSnakeCase(field);
    }

    private static List<Selection> leaves(List<String> names) {
        return names.stream().map(n -> new Selection(FieldNames.toCamelCase(n), List.of())).toList();
    }

    private static String labelDisjunction(String var, List<String> labels) {
        return "(" + String.join(" OR ", labels.stream().map(l -> var + ":" + l).toList()) + ")";
    }

    // ========== Inputs ==========

    /**
     * Root literals first, then arguments bound to variables, then the variables themselves.
     */
    private static Map<String, Object> mergeInputs(ParsedOperation operation, Map<String, Object> variables) {
        Map<String, Object> inputs = new LinkedHashMap<>(operation.literals());
        operation.variableRefs().forEach((argument, variable) -> {
            Object value = variables.get(variable);
            if (value != null) {
                inputs.put(argument, value);
            }
        });
        variables.forEach((key, value) -> {
            if (value != null) {
                inputs.put(key, value);
            }
        });
        return inputs;
    }

    /**
     * Non-empty string, number and boolean inputs under their original keys.
     */
    private static Map<String, Object> scalarInputs(Map<String, Object> inputs) {
        Map<String, Object> params = new LinkedHashMap<>();
        inputs.forEach((key, value) -> {
            if (value instanceof String s) {
                if (!s.isEmpty()) {
                    params.put(key, s);
                }
            } else if (value instanceof Number || value instanceof Boolean) {
                params.put(key, value);
            }
        });
        return params;
    }

    /**
     * Looks up a camelCase input, falling back to its snake_case alias.
     */
    private static String input(Map<String, Object> inputs, String key) {
        Object value = inputs.get(key);
        if (value == null) {
            value = inputs.get(FieldNames.toSnakeCase(key));
        }
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private static String subTypeLabel(NodeFamily family, Map<String, Object> inputs) {
        if (family.subTypeField().isEmpty()) {
            return null;
        }
        String key = family.subTypeField().get();
        String value = input(inputs, key);
        if (value == null) {
            return null;
        }
        EntityCategory category = family.category().orElse(null);
        Optional<EntityType> known = EntityType.fromLabel(value)
                .filter(t -> t.getCategory() == category)
                .or(() -> EntityType.fromTypeName(value, category));
        if (known.isPresent()) {
            return known.get().getLabel();
        }

        String raw = value.startsWith(EntityType.LABEL_PREFIX) ? value.substring(EntityType.LABEL_PREFIX.length()) : value;
        try {
            InputSanitizer.validateLabel(raw);
        } catch (IllegalArgumentException e) {
            throw new QueryResolutionException("Invalid " + key + " '" + value + "': " + e.getMessage(), e);
        }
        log.debug("cypher.subtype.unknown {}={} label={}{}", key, value, EntityType.LABEL_PREFIX, raw);
        return EntityType.LABEL_PREFIX + raw;
    }

    private static String describe(ResolverRule rule, NodeFamily family, String subTypeLabel, NodeFamily.Scope scope) {
        String subType = subTypeLabel != null ? subTypeLabel.substring(EntityType.LABEL_PREFIX.length()) : null;
        return switch (rule.shape()) {
            case SINGLE -> "Get " + family.alias() + " with related entities";
            case COUNT -> "Count " + (subType != null ? subType : "all") + " " + family.plural();
            case LIST -> {
                StringBuilder sb = new StringBuilder("Get ");
                if (subType != null) {
                    sb.append(subType).append(' ');
                } else if (scope == null) {
                    sb.append("all ");
                }
                sb.append(family.plural());
                if (scope != null) {
                    sb.append(" for ").append(scope.noun());
                }
                yield sb.toString();
            }
        };
    }
}
