package io.github.manjago.esdl.persistence;

import io.github.manjago.esdl.bind.BindingResolver;
import io.github.manjago.esdl.bind.BoundProgram;
import io.github.manjago.esdl.config.ConfigContext;
import io.github.manjago.esdl.config.ExperimentConfig;
import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.Population;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.landscape.OneMax;
import io.github.manjago.esdl.lang.Parser;
import io.github.manjago.esdl.ops.OperatorRegistry;
import io.github.manjago.esdl.run.PipelineInterpreter;
import io.github.manjago.esdl.run.RunStats;
import io.github.manjago.esdl.run.TerminationReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for YieldArchive.
 */
class YieldArchiveTest {

    @TempDir
    Path tempDir;

    private static Population population(String name, Individual... individuals) {
        Population population = new Population(name);
        for (Individual individual : individuals) {
            population.add(individual);
        }
        return population;
    }

    private static Individual evaluated(Genome genome, long birth, double fitness) {
        Individual individual = new Individual(genome, birth);
        individual.setFitness(fitness);
        return individual;
    }

    private static RunStats stats(long generation) {
        return new RunStats(generation, 40, 30, 5.0, 2, Map.of("p", 4), 10);
    }

    @Test
    @DisplayName("Run metadata, yields and termination are read back")
    void roundTrip() throws Exception {
        Path file = tempDir.resolve("run.mv");
        String definition = "FROM random_binary(length=3) SELECT 2 p\nYIELD p";

        try (YieldArchive archive = YieldArchive.create(file)) {
            archive.recordRun(new RandomStreams(11, 22), definition, "onemax");
            archive.recordYield("p", population("p",
                    evaluated(Genome.binary(new boolean[]{true, false, true}), 0, 2.0),
                    evaluated(Genome.binary(new boolean[]{false, false, true}), 1, 1.0)), 0);
            archive.recordYield("q", population("q",
                    evaluated(Genome.reals(new double[]{0.25, -0.5}, -1.0, 1.0), 2, -0.3125)), 1);
            archive.recordTermination(TerminationReason.GENERATION_LIMIT, stats(1));
        }

        YieldArchive.ArchiveData data = YieldArchive.load(file);

        assertEquals(1, data.version());
        assertEquals(11L, data.breedingSeed());
        assertEquals(22L, data.landscapeSeed());
        assertEquals(definition, data.definition());
        assertEquals("onemax", data.landscape());
        assertEquals(TerminationReason.GENERATION_LIMIT, data.termination());
        assertEquals(1L, data.generations());
        assertEquals(2, data.yields().size());

        YieldArchive.YieldRecord first = data.yieldsOf("p").get(0);
        assertEquals(0L, first.generation());
        assertEquals(2.0, first.bestFitness());
        assertEquals(Genome.binary(new boolean[]{true, false, true}), first.individuals().get(0).genome());
        assertEquals(1L, first.individuals().get(1).birth());

        YieldArchive.ArchivedIndividual real = data.yieldsOf("q").get(0).individuals().get(0);
        assertEquals(Genome.reals(new double[]{0.25, -0.5}, -1.0, 1.0), real.genome());
        assertEquals(-1.0, real.genome().getLowest());
        assertEquals(-0.3125, real.fitness());
    }

    @Test
    @DisplayName("Stream states at each yield resume the run's random sequences")
    void streamStates() throws Exception {
        Path file = tempDir.resolve("streams.mv");
        RandomStreams streams = new RandomStreams(11, 22);
        long[] expectedBreeding = new long[5];
        long[] expectedLandscape = new long[5];

        try (YieldArchive archive = YieldArchive.create(file)) {
            archive.recordRun(streams, "YIELD p", "onemax");
            for (int i = 0; i < 7; i++) {
                streams.breeding().nextLong();
            }
            streams.landscape().nextDouble();
            archive.recordYield("p", population("p", new Individual(Genome.binary(new boolean[]{true}), 0)), 0);

            for (int i = 0; i < 5; i++) {
                expectedBreeding[i] = streams.breeding().nextLong();
                expectedLandscape[i] = streams.landscape().nextLong();
            }
        }

        YieldArchive.YieldRecord record = YieldArchive.load(file).yields().get(0);
        assertNotNull(record.breedingState());
        assertEquals(11L, record.breedingState().initialSeed());
        assertEquals(22L, record.landscapeState().initialSeed());

        RandomStreams resumed = record.restoreStreams();
        assertEquals(11L, resumed.breedingSeed());
        assertEquals(22L, resumed.landscapeSeed());
        for (int i = 0; i < 5; i++) {
            assertEquals(expectedBreeding[i], resumed.breeding().nextLong());
            assertEquals(expectedLandscape[i], resumed.landscape().nextLong());
        }
    }

    @Test
    @DisplayName("Integer and codon genomes keep their kind and bounds")
    void integerKinds() throws Exception {
        Path file = tempDir.resolve("kinds.mv");
        Genome codons = Genome.codons(new int[]{4, 200, 0}, 0, 255);
        Genome integers = Genome.integers(new int[]{-3, 3}, -5, 5);

        try (YieldArchive archive = YieldArchive.create(file)) {
            archive.recordYield("g", population("g", new Individual(codons, 0), new Individual(integers, 1)), 0);
        }

        YieldArchive.YieldRecord record = YieldArchive.load(file).yields().get(0);
        assertEquals(codons, record.individuals().get(0).genome());
        assertEquals(integers, record.individuals().get(1).genome());
        assertTrue(Double.isNaN(record.individuals().get(0).fitness()));
        assertTrue(Double.isNaN(record.bestFitness()));
        assertNull(record.breedingState());
        assertThrows(IllegalStateException.class, record::restoreStreams);
    }

    @Test
    @DisplayName("An archive without a termination record is reported as unfinished")
    void unfinished() throws Exception {
        Path file = tempDir.resolve("partial.mv");
        try (YieldArchive archive = YieldArchive.create(file)) {
            archive.recordRun(RandomStreams.withDefaults(), "YIELD p", "none");
        }

        assertNull(YieldArchive.load(file).termination());
        assertTrue(YieldArchive.getInfo(file).contains("unfinished"));
    }

    @Test
    @DisplayName("create replaces an existing archive")
    void replaces() throws Exception {
        Path file = tempDir.resolve("again.mv");
        try (YieldArchive archive = YieldArchive.create(file)) {
            archive.recordYield("p", population("p", new Individual(Genome.binary(new boolean[]{true}), 0)), 0);
        }
        try (YieldArchive archive = YieldArchive.create(file)) {
            assertEquals(file, archive.getPath());
        }
        assertTrue(YieldArchive.load(file).yields().isEmpty());
    }

    @Test
    @DisplayName("Missing and corrupt files")
    void badFiles() throws Exception {
        assertThrows(IOException.class, () -> YieldArchive.load(tempDir.resolve("missing.mv")));

        Path garbage = tempDir.resolve("garbage.mv");
        Files.writeString(garbage, "not an archive");
        assertTrue(YieldArchive.getInfo(garbage).startsWith("Invalid archive"));
    }

    @Test
    @DisplayName("ArchivingListener records every YIELD of a run")
    void listener() throws Exception {
        Path file = tempDir.resolve("listener.mv");
        String source = """
                FROM random_binary(length=8) SELECT 6 p
                YIELD p
                BEGIN generation
                    FROM p SELECT 6 p USING tournament, mutate_bitflip
                    YIELD p
                END generation
                """;
        BoundProgram program = new BindingResolver(OperatorRegistry.withBuiltins(), ConfigContext.defaults())
                .bind(new Parser().parse(source));
        ExperimentConfig config = ExperimentConfig.builder().maxGenerations(3).reportInterval(0).build();
        RandomStreams streams = config.createStreams();

        try (YieldArchive archive = YieldArchive.create(file)) {
            archive.recordRun(streams, source, "onemax");
            PipelineInterpreter interpreter = new PipelineInterpreter(program, config, streams, new OneMax());
            interpreter.addListener(new ArchivingListener(archive));
            interpreter.run();
        }

        YieldArchive.ArchiveData data = YieldArchive.load(file);
        assertEquals(4, data.yields().size());
        assertEquals(3L, data.yields().get(3).generation());
        assertEquals(TerminationReason.GENERATION_LIMIT, data.termination());
        assertEquals(3L, data.generations());
        data.yields().forEach(y -> assertEquals(6, y.individuals().size()));
        data.yields().forEach(y -> assertNotNull(y.landscapeState()));
        assertFalse(Arrays.equals(data.yields().get(0).breedingState().stateBytes(),
                data.yields().get(3).breedingState().stateBytes()));
    }
}
