package com.brick.query.health;

import com.brick.query.graph.GraphConnection;

import java.util.List;
import java.util.Map;

/**
 * Checks that the knowledge graph answers and is not empty.
 * An unreachable engine is DOWN; a reachable but unseeded graph is DEGRADED.
 */
public class FalkorDBHealthCheck implements HealthCheck {

    static final String PROBE = "MATCH (n) RETURN count(n) AS nodes";

    private final GraphConnection connection;

    public FalkorDBHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "falkordb";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            List<Map<String, Object>> rows = connection.query(PROBE);
            long latencyMs = System.currentTimeMillis() - startMs;
            long nodes = nodeCount(rows);

            HealthStatus status = nodes > 0
                    ? HealthStatus.up()
                    : HealthStatus.degraded("Graph '" + connection.getGraphName() + "' is empty");
            return status.withDetail("latencyMs", latencyMs)
                    .withDetail("graphName", connection.getGraphName())
                    .withDetail("nodes", nodes);
        } catch (RuntimeException e) {
            return HealthStatus.down("FalkorDB connection failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }

    private static long nodeCount(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        Object value = rows.get(0).get("nodes");
        return value instanceof Number number ? number.longValue() : 0;
    }
}
