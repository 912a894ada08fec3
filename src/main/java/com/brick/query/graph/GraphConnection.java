package com.brick.query.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph engine holding the Brick knowledge graph.
 * Owned by the caller; the query pipeline never opens or closes one.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params bound parameters
     * @throws GraphConnectionException when the engine cannot be reached
     * @throws GraphExecutionException  when the engine rejects the statement
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Runs a read query.
     *
     * @param query  the Cypher query
     * @param params bound parameters
     * @return one map per row, keyed by return alias, in engine order
     * @throws GraphConnectionException when the engine cannot be reached
     * @throws GraphExecutionException  when the engine rejects the query
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    @Override
    void close();
}
