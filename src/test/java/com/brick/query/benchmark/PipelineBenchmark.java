package com.brick.query.benchmark;

import com.brick.query.api.PipelineResult;
import com.brick.query.api.QueryPipeline;
import com.brick.query.api.StubGraphConnection;
import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.QueryLocale;
import com.brick.query.cypher.CypherResolver;
import com.brick.query.graphql.GraphQLGenerator;
import com.brick.query.intent.RuleBasedIntentExtractor;
import com.brick.query.ontology.BrickOntology;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for the compile stages of the query pipeline.
 * The graph is stubbed, so these measure extraction, generation, resolution and formatting only.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class PipelineBenchmark {

    private static final String[] QUESTIONS = {
            "Vis alle sensorer i bygget",
            "Hvilke soner mater AHU-en?",
            "List alle temperatursensorer",
            "Hva er bygningens adresse?",
            "Vis tidsserie-IDer",
            "Sensorer i Foyer",
            "Antall etasjer",
            "Vis alle målere",
            "Which zones does the AHU feed?",
            "How many CO2 sensors are there?"
    };

    @Param({"10", "200"})
    private int rowCount;

    private QueryPipeline pipeline;
    private StubGraphConnection connection;
    private RuleBasedIntentExtractor extractor;
    private GraphQLGenerator generator;
    private CypherResolver resolver;
    private int counter;

    @Setup(Level.Trial)
    public void setUp() {
        BrickOntology ontology = BrickOntology.defaultOntology();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            rows.add(Map.of("sensor", Map.of("id", "sensor_" + i, "name", "Sensor " + i, "unit", "degC",
                    "sensorType", "brick_Temperature_Sensor")));
        }
        connection = new StubGraphConnection().returning(rows);
        pipeline = QueryPipeline.builder().ontology(ontology).build();
        extractor = new RuleBasedIntentExtractor(ontology);
        generator = new GraphQLGenerator(ontology);
        resolver = new CypherResolver();
        counter = 0;
    }

    /**
     * Rule-based extraction, generation and resolution, without execution.
     */
    @Benchmark
    public void compileQuestion(Blackhole bh) {
        String question = QUESTIONS[counter++ % QUESTIONS.length];
        ExtractedIntent intent = extractor.extract(question);
        GeneratedQuery query = generator.generate(intent);
        bh.consume(resolver.resolve(query));
    }

    /**
     * The full pipeline against a stub returning {@code rowCount} rows.
     */
    @Benchmark
    public void processQuestion(Blackhole bh) {
        String question = QUESTIONS[counter++ % QUESTIONS.length];
        PipelineResult result = pipeline.process(question, QueryLocale.NO, connection);
        bh.consume(result);
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(PipelineBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
