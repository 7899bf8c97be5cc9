package io.github.manjago.esdl.integration;

import com.typesafe.config.ConfigFactory;
import io.github.manjago.esdl.bind.BindingResolver;
import io.github.manjago.esdl.bind.BoundProgram;
import io.github.manjago.esdl.config.ConfigContext;
import io.github.manjago.esdl.config.ExperimentConfig;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.landscape.Landscape;
import io.github.manjago.esdl.landscape.Landscapes;
import io.github.manjago.esdl.landscape.SymbolicRegression;
import io.github.manjago.esdl.lang.Parser;
import io.github.manjago.esdl.ops.OperatorRegistry;
import io.github.manjago.esdl.persistence.ArchivingListener;
import io.github.manjago.esdl.persistence.YieldArchive;
import io.github.manjago.esdl.run.PipelineInterpreter;
import io.github.manjago.esdl.run.RunStats;
import io.github.manjago.esdl.run.TerminationReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the example pipelines: parse, bind, run, archive.
 */
@DisplayName("Smoke Tests")
class SmokeTest {

    @TempDir
    Path tempDir;

    private static String resource(String name) throws IOException {
        try (InputStream is = SmokeTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(is, name + " should be in test resources");
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static PipelineInterpreter prepare(String definition, ExperimentConfig config,
                                               RandomStreams streams) throws Exception {
        ConfigContext context = ConfigContext.builder().override("system.size", 12L).build();
        BoundProgram program = new BindingResolver(OperatorRegistry.withBuiltins(), context)
                .bind(new Parser().parse(definition));
        Landscape landscape = Landscapes.create(config.landscape(), context.getConfig(), config.expansion());
        return new PipelineInterpreter(program, config, streams, landscape);
    }

    private RunStats runArchived(String definition, ExperimentConfig config, Path archiveFile) throws Exception {
        RandomStreams streams = config.createStreams();
        PipelineInterpreter interpreter = prepare(definition, config, streams);
        try (YieldArchive archive = YieldArchive.create(archiveFile)) {
            archive.recordRun(streams, definition, config.landscape());
            interpreter.addListener(new ArchivingListener(archive));
            return interpreter.run();
        }
    }

    @Test
    @DisplayName("OneMax runs to its generation limit")
    void oneMax() throws Exception {
        ExperimentConfig config = ExperimentConfig.builder()
                .maxGenerations(15)
                .landscape("onemax")
                .reportInterval(5)
                .build();

        RunStats stats = prepare(resource("onemax-smoke.esdl"), config, config.createStreams()).run();

        assertEquals(15L, stats.generation());
        assertEquals(12, stats.populationSizes().get("population"));
        assertTrue(stats.bestFitness() >= 8.0, "best " + stats.bestFitness());
    }

    @Test
    @DisplayName("Determinism: same seeds produce identical archives")
    void determinism() throws Exception {
        String definition = resource("onemax-smoke.esdl");
        ExperimentConfig config = ExperimentConfig.builder()
                .maxGenerations(10)
                .landscape("onemax")
                .breedingSeed(2024)
                .landscapeSeed(7)
                .reportInterval(0)
                .build();

        runArchived(definition, config, tempDir.resolve("a.mv"));
        runArchived(definition, config, tempDir.resolve("b.mv"));

        YieldArchive.ArchiveData a = YieldArchive.load(tempDir.resolve("a.mv"));
        YieldArchive.ArchiveData b = YieldArchive.load(tempDir.resolve("b.mv"));

        assertEquals(11, a.yields().size());
        assertEquals(a.yields().size(), b.yields().size());
        for (int y = 0; y < a.yields().size(); y++) {
            var left = a.yields().get(y).individuals();
            var right = b.yields().get(y).individuals();
            for (int i = 0; i < left.size(); i++) {
                assertEquals(left.get(i).genome(), right.get(i).genome());
                assertEquals(left.get(i).birth(), right.get(i).birth());
            }
        }
        assertEquals(TerminationReason.GENERATION_LIMIT, a.termination());
        assertEquals(2024L, a.breedingSeed());
        assertEquals(definition, a.definition());
    }

    @Test
    @DisplayName("Grammatical evolution on the default regression landscape")
    void regression() throws Exception {
        ExperimentConfig config = ExperimentConfig.fromConfig(ConfigFactory.defaultReference())
                .toBuilder()
                .maxGenerations(5)
                .landscape("regression")
                .reportInterval(0)
                .build();

        PipelineInterpreter interpreter = prepare(resource("regression-smoke.esdl"), config, config.createStreams());
        RunStats stats = interpreter.run();

        assertEquals(5L, stats.generation());
        assertEquals(12, interpreter.getPopulation("population").size());
        assertTrue(stats.hasBestFitness());
        assertTrue(stats.bestFitness() <= 0.0);
        assertTrue(stats.bestFitness() > SymbolicRegression.WORST);
    }
}
