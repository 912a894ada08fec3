package com.brick.query.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} backed by the JFalkorDB client.
 * Parameters are handed to the driver's parameterised query call, never spliced into the text.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connection.initialized host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.debug("graph.execute query={}", query);
        try {
            graph.query(query, params != null ? params : Map.of());
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.debug("graph.query query={} params={}", query, params);
        ResultSet resultSet;
        try {
            resultSet = graph.query(query, params != null ? params : Map.of());
        } catch (RuntimeException e) {
            throw translate(e);
        }

        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("graph.query.done rows={}", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("graph.connection.check.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    /**
     * Maps a driver failure to a connection failure when a socket-level cause is present.
     */
    static GraphExecutionException translate(RuntimeException e) {
        if (e instanceof GraphExecutionException graphException) {
            return graphException;
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (isConnectionFailure(e)) {
            return new GraphConnectionException(message, e);
        }
        return new GraphExecutionException(message, e);
    }

    static boolean isConnectionFailure(Throwable e) {
        Throwable current = e;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof IOException
                    || current.getClass().getSimpleName().endsWith("ConnectionException")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("graph.connection.close.failed graph={}", graphName, e);
        }
        log.info("graph.connection.closed graph={}", graphName);
    }
}
