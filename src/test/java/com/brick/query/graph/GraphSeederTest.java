package com.brick.query.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphSeeder Tests")
class GraphSeederTest {

    @Test
    @DisplayName("parse should skip comments and blank lines and split on trailing semicolons")
    void parseStatements() {
        List<String> statements = GraphSeeder.parse(List.of(
                "// header",
                "",
                "CREATE (:brick_Building {id: 'b1'});",
                "MATCH (b:brick_Building {id: 'b1'})",
                "  CREATE (b)-[:brick_hasPart]->(:brick_Floor {id: 'f1'});",
                "   // trailing comment",
                "CREATE (:brick_Meter {id: 'm1'})"));

        assertEquals(List.of(
                "CREATE (:brick_Building {id: 'b1'})",
                "MATCH (b:brick_Building {id: 'b1'})\nCREATE (b)-[:brick_hasPart]->(:brick_Floor {id: 'f1'})",
                "CREATE (:brick_Meter {id: 'm1'})"), statements);
    }

    @Test
    @DisplayName("opera house script should load from the classpath")
    void operaHouseScript() {
        List<String> statements = GraphSeeder.operaHouse().loadStatements();

        assertFalse(statements.isEmpty());
        assertTrue(statements.get(0).startsWith("CREATE (:brick_Building {id: 'building_opera'"));
        assertTrue(statements.stream().anyMatch(s -> s.contains("brick_Temperature_Sensor")));
        assertTrue(statements.stream().noneMatch(s -> s.endsWith(";")));
    }

    @Test
    @DisplayName("missing script should fail with a clear message")
    void missingScript() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new GraphSeeder("seed/none.cypher").loadStatements());
        assertTrue(e.getMessage().contains("seed/none.cypher"));
    }

    @Test
    @DisplayName("seed and clear should run statements against the connection")
    void seedAndClear() {
        RecordingConnection connection = new RecordingConnection();
        GraphSeeder seeder = GraphSeeder.operaHouse();

        int count = seeder.seed(connection);
        seeder.clear(connection);

        assertEquals(count + 1, connection.executed.size());
        assertEquals(seeder.loadStatements(), connection.executed.subList(0, count));
        assertEquals("MATCH (n) DETACH DELETE n", connection.executed.get(count));
    }

    private static class RecordingConnection implements GraphConnection {
        final List<String> executed = new ArrayList<>();

        @Override
        public void execute(String query, Map<String, Object> params) {
            executed.add(query);
        }

        @Override
        public List<Map<String, Object>> query(String query, Map<String, Object> params) {
            return List.of();
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public String getGraphName() {
            return "test";
        }

        @Override
        public void close() {
        }
    }
}
