package com.brick.query.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a Brick graph from a classpath script into a {@link GraphConnection}.
 *
 * <p>The script holds one Cypher statement per block, each terminated by a semicolon at
 * the end of a line. Lines starting with {@code //} are comments.</p>
 *
 * <pre>
 * GraphSeeder.operaHouse().seed(connection);
 * </pre>
 */
public class GraphSeeder {
    private static final Logger log = LoggerFactory.getLogger(GraphSeeder.class);

    public static final String OPERA_HOUSE_SCRIPT = "seed/opera-house.cypher";

    private final String resource;

    public GraphSeeder(String resource) {
        this.resource = resource;
    }

    public static GraphSeeder operaHouse() {
        return new GraphSeeder(OPERA_HOUSE_SCRIPT);
    }

    /**
     * Removes every node and edge from the graph.
     */
    public void clear(GraphConnection connection) {
        connection.execute("MATCH (n) DETACH DELETE n");
        log.info("graph.cleared graph={}", connection.getGraphName());
    }

    /**
     * Runs every statement of the script in order.
     *
     * @return the number of statements executed
     */
    public int seed(GraphConnection connection) {
        List<String> statements = loadStatements();
        for (String statement : statements) {
            connection.execute(statement);
        }
        log.info("graph.seeded graph={} script={} statements={}",
                connection.getGraphName(), resource, statements.size());
        return statements.size();
    }

    /**
     * Parses the script into statements without their terminating semicolons.
     */
    public List<String> loadStatements() {
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
        if (in == null) {
            in = GraphSeeder.class.getClassLoader().getResourceAsStream(resource);
        }
        if (in == null) {
            throw new IllegalStateException("Seed script not found on classpath: " + resource);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(reader.lines().toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read seed script " + resource, e);
        }
    }

    static List<String> parse(List<String> lines) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("//")) {
                continue;
            }
            if (current.length() > 0) {
                current.append('\n');
            }
            if (line.endsWith(";")) {
                current.append(line, 0, line.length() - 1);
                statements.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(line);
            }
        }
        if (!current.toString().isBlank()) {
            statements.add(current.toString().strip());
        }
        return statements;
    }
}
