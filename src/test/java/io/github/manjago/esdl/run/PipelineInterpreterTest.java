package io.github.manjago.esdl.run;

import io.github.manjago.esdl.bind.BindingResolver;
import io.github.manjago.esdl.bind.BoundProgram;
import io.github.manjago.esdl.config.ConfigContext;
import io.github.manjago.esdl.config.ExperimentConfig;
import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.Population;
import io.github.manjago.esdl.landscape.Landscape;
import io.github.manjago.esdl.landscape.OneMax;
import io.github.manjago.esdl.lang.EvaluationException;
import io.github.manjago.esdl.lang.Parser;
import io.github.manjago.esdl.ops.OperatorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PipelineInterpreter.
 */
class PipelineInterpreterTest {

    private static final String ONEMAX = """
            FROM random_binary(length=16) SELECT 20 population
            YIELD population

            BEGIN generation
                FROM population SELECT 20 offspring USING tournament(k=3), crossover_one, mutate_bitflip(per_gene_rate=1/16)
                FROM population, offspring SELECT 20 population USING best
                YIELD population
            END generation
            """;

    private static ExperimentConfig config(long generations) {
        return ExperimentConfig.builder()
                .maxGenerations(generations)
                .reportInterval(0)
                .build();
    }

    private static PipelineInterpreter interpreter(String source, ExperimentConfig config, Landscape landscape)
            throws Exception {
        BoundProgram program = new BindingResolver(OperatorRegistry.withBuiltins(), ConfigContext.defaults())
                .bind(new Parser().parse(source));
        return new PipelineInterpreter(program, config, config.createStreams(), landscape);
    }

    private static PipelineInterpreter interpreter(String source) throws Exception {
        return interpreter(source, config(10), new OneMax());
    }

    /**
     * Records every yielded population as detached copies.
     */
    private static class Recorder implements PipelineListener {
        final List<List<Individual>> yields = new ArrayList<>();
        final List<RunStats> generations = new ArrayList<>();
        TerminationReason reason;
        boolean initialized;

        @Override
        public void onInitialized(RunStats stats) {
            initialized = true;
        }

        @Override
        public void onYield(String name, Population population, long generation) {
            population.forEach(i -> assertTrue(i.hasFitness()));
            yields.add(population.snapshot());
        }

        @Override
        public void onGeneration(RunStats stats) {
            generations.add(stats);
        }

        @Override
        public void onTerminated(TerminationReason reason, RunStats stats) {
            this.reason = reason;
        }
    }

    @Nested
    @DisplayName("FROM-SELECT sizing")
    class Sizing {

        @Test
        @DisplayName("A generator fills a sized destination")
        void generatorFill() throws Exception {
            PipelineInterpreter interpreter = interpreter("FROM random_int(length=4) SELECT 5 population");
            RunStats stats = interpreter.run();

            assertEquals(5, interpreter.getPopulation("population").size());
            assertEquals(5L, stats.births());
            assertEquals(RunState.TERMINATED, interpreter.getState());
        }

        @Test
        @DisplayName("Sized destinations are filled in order, the unsized one takes the rest")
        void split() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_int(length=2) SELECT 5 p\nFROM p SELECT 1 a, 2 b, c");
            interpreter.run();

            Population p = interpreter.getPopulation("p");
            assertEquals(1, interpreter.getPopulation("a").size());
            assertEquals(2, interpreter.getPopulation("b").size());
            assertEquals(2, interpreter.getPopulation("c").size());
            assertEquals(p.get(0).getGenome(), interpreter.getPopulation("a").get(0).getGenome());
            assertEquals(p.get(4).getGenome(), interpreter.getPopulation("c").get(1).getGenome());
        }

        @Test
        @DisplayName("A stream that ends early is a size error")
        void tooFew() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_int(length=2) SELECT 3 p\nFROM p SELECT 5 q");
            PopulationSizeException e = assertThrows(PopulationSizeException.class, interpreter::run);

            assertEquals("q", e.getPopulation());
            assertEquals(5L, e.getRequested());
            assertEquals(3L, e.getProduced());
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Excess individuals of an exact stream are a size error")
        void excessExact() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_int(length=2) SELECT 3 p\nFROM p SELECT 2 q USING mutate_random");
            assertThrows(PopulationSizeException.class, interpreter::run);
        }

        @Test
        @DisplayName("Excess individuals of a finite selector are dropped")
        void excessTruncated() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_binary(length=8) SELECT 6 p\nFROM p SELECT 2 q USING best");
            interpreter.run();

            Population q = interpreter.getPopulation("q");
            assertEquals(2, q.size());
            assertEquals(interpreter.getPopulation("p").bestFitness(), q.bestFitness());
        }

        @Test
        @DisplayName("An unbounded stream needs a count")
        void unsizedUnbounded() throws Exception {
            PipelineInterpreter interpreter = interpreter("FROM random_int(length=2) SELECT p");
            PopulationSizeException e = assertThrows(PopulationSizeException.class, interpreter::run);
            assertEquals(-1L, e.getRequested());
        }

        @Test
        @DisplayName("Counts may come from run variables")
        void variableCount() throws Exception {
            PipelineInterpreter interpreter = interpreter("n = 2 + 1\nFROM random_int(length=2) SELECT (n * 2) p");
            interpreter.run();
            assertEquals(6, interpreter.getPopulation("p").size());
            assertEquals(3L, interpreter.getVariable("n"));
        }

        @Test
        @DisplayName("Negative counts are rejected")
        void negativeCount() throws Exception {
            PipelineInterpreter interpreter = interpreter("n = -2\nFROM random_int(length=2) SELECT (n) p");
            assertThrows(PopulationSizeException.class, interpreter::run);
        }

        @Test
        @DisplayName("Selected individuals are copies when the source survives")
        void ownership() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_binary(length=4) SELECT 3 p\nFROM p SELECT 3 q USING select_all");
            interpreter.run();

            Population p = interpreter.getPopulation("p");
            Population q = interpreter.getPopulation("q");
            for (int i = 0; i < 3; i++) {
                assertNotSame(p.get(i), q.get(i));
                assertEquals(p.get(i).getGenome(), q.get(i).getGenome());
            }
        }
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("YIELD evaluates members and reports them to listeners")
        void yield() throws Exception {
            PipelineInterpreter interpreter = interpreter("FROM random_binary(length=8) SELECT 4 p\nYIELD p");
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            RunStats stats = interpreter.run();

            assertTrue(recorder.initialized);
            assertEquals(1, recorder.yields.size());
            assertEquals(4L, stats.evaluations());
            assertTrue(stats.hasBestFitness());
            assertEquals(TerminationReason.SINGLE_SHOT, recorder.reason);
        }

        @Test
        @DisplayName("EVAL recomputes fitness even when cached")
        void eval() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_binary(length=8) SELECT 3 p\nEVAL p\nEVAL p\nYIELD p");
            RunStats stats = interpreter.run();
            assertEquals(6L, stats.evaluations());
        }

        @Test
        @DisplayName("REPEAT runs its body the given number of times")
        void repeat() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "k = 3\nREPEAT k\n  FROM random_binary(length=2) SELECT 2 p\nEND REPEAT");
            RunStats stats = interpreter.run();
            assertEquals(6L, stats.births());
        }

        @Test
        @DisplayName("REPEAT with a negative count fails")
        void negativeRepeat() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "k = -1\nREPEAT k\n  FROM random_binary(length=2) SELECT 2 p\nEND REPEAT");
            assertThrows(EvaluationException.class, interpreter::run);
        }

        @Test
        @DisplayName("An alias keeps the old population when the original name is replaced")
        void alias() throws Exception {
            PipelineInterpreter interpreter = interpreter("""
                    FROM random_binary(length=4) SELECT 3 p
                    old = p
                    FROM random_binary(length=4) SELECT 5 p
                    """);
            interpreter.run();

            assertEquals(3, interpreter.getPopulation("old").size());
            assertEquals(5, interpreter.getPopulation("p").size());
        }

        @Test
        @DisplayName("Run variables are evaluated in order and feed operator arguments")
        void variables() throws Exception {
            PipelineInterpreter interpreter = interpreter("""
                    rate = 1 / 4
                    FROM random_binary(length=4) SELECT 4 p
                    FROM p SELECT 4 p USING mutate_bitflip(per_gene_rate=rate)
                    """);
            interpreter.run();
            assertEquals(0.25, interpreter.getVariable("rate"));
        }

        @Test
        @DisplayName("Host-supplied populations are used as sources")
        void hostPopulation() throws Exception {
            BoundProgram program = new BindingResolver(OperatorRegistry.withBuiltins(), ConfigContext.defaults())
                    .declarePopulation("seed")
                    .bind(new Parser().parse("FROM seed SELECT 2 p USING best"));
            ExperimentConfig config = config(1);
            PipelineInterpreter interpreter = new PipelineInterpreter(program, config, config.createStreams(),
                    new OneMax());

            Population seed = new Population("seed");
            seed.add(new Individual(Genome.binary(new boolean[]{true, true, true}), 0));
            seed.add(new Individual(Genome.binary(new boolean[]{false, false, false}), 1));
            seed.add(new Individual(Genome.binary(new boolean[]{true, true, false}), 2));
            interpreter.putPopulation("seed", seed);
            interpreter.run();

            Population p = interpreter.getPopulation("p");
            assertEquals(3.0, p.get(0).getFitness());
            assertEquals(2.0, p.get(1).getFitness());
            assertThrows(IllegalStateException.class, () -> interpreter.putPopulation("late", seed));
        }

        @Test
        @DisplayName("A declared population that was never supplied fails at run time")
        void missingPopulation() throws Exception {
            BoundProgram program = new BindingResolver(OperatorRegistry.withBuiltins(), ConfigContext.defaults())
                    .declarePopulation("seed")
                    .bind(new Parser().parse("YIELD seed"));
            ExperimentConfig config = config(1);
            PipelineInterpreter interpreter = new PipelineInterpreter(program, config, config.createStreams(),
                    new OneMax());
            assertThrows(EvaluationException.class, interpreter::run);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Operator errors carry the statement location")
        void operatorFailure() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_int(length=4) SELECT 2 p\nFROM p SELECT 2 q USING mutate_bitflip");
            OperatorExecutionException e = assertThrows(OperatorExecutionException.class, interpreter::run);

            assertEquals(2, e.getLine());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertNull(interpreter.getPopulation("q"));
        }

        @Test
        @DisplayName("Without a landscape YIELD publishes unevaluated individuals")
        void yieldWithoutLandscape() throws Exception {
            PipelineInterpreter interpreter = interpreter(
                    "FROM random_int(length=4) SELECT 5 population\nYIELD population", config(1), null);
            List<Population> published = new ArrayList<>();
            interpreter.addListener(new PipelineListener() {
                @Override
                public void onYield(String name, Population population, long generation) {
                    assertEquals("population", name);
                    population.forEach(i -> assertFalse(i.hasFitness()));
                    published.add(population);
                }
            });

            RunStats stats = interpreter.run();

            assertEquals(1, published.size());
            assertEquals(5, published.get(0).size());
            assertFalse(stats.hasBestFitness());
            assertEquals(0L, stats.evaluations());
        }

        @Test
        @DisplayName("EVAL and fitness-reading operators fail without a landscape")
        void fitnessWithoutLandscape() throws Exception {
            PipelineInterpreter eval = interpreter("FROM random_binary(length=4) SELECT 2 p\nEVAL p",
                    config(1), null);
            OperatorExecutionException e = assertThrows(OperatorExecutionException.class, eval::run);
            assertEquals(2, e.getLine());

            PipelineInterpreter tournament = interpreter(
                    "FROM random_binary(length=4) SELECT 2 p\nFROM p SELECT 2 q USING tournament", config(1), null);
            assertThrows(OperatorExecutionException.class, tournament::run);
        }

        @Test
        @DisplayName("An interpreter runs only once")
        void runOnce() throws Exception {
            PipelineInterpreter interpreter = interpreter("FROM random_binary(length=4) SELECT 2 p");
            interpreter.run();
            assertThrows(IllegalStateException.class, interpreter::run);
        }
    }

    @Nested
    @DisplayName("Generations and termination")
    class Termination {

        @Test
        @DisplayName("Generation limit")
        void generationLimit() throws Exception {
            PipelineInterpreter interpreter = interpreter(ONEMAX, config(5), new OneMax());
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            RunStats stats = interpreter.run();

            assertEquals(TerminationReason.GENERATION_LIMIT, recorder.reason);
            assertEquals(5L, stats.generation());
            assertEquals(5, recorder.generations.size());
            assertEquals(6, recorder.yields.size());
            assertEquals(20, stats.populationSizes().get("population"));
        }

        @Test
        @DisplayName("A generation block without YIELD still counts generations")
        void generationWithoutYield() throws Exception {
            PipelineInterpreter interpreter = interpreter("""
                    FROM random_binary(length=4) SELECT 3 p
                    BEGIN generation
                        FROM p SELECT 3 p USING mutate_bitflip
                    END generation
                    """, config(3), new OneMax());
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            RunStats stats = interpreter.run();

            assertEquals(TerminationReason.GENERATION_LIMIT, recorder.reason);
            assertEquals(3L, stats.generation());
            assertEquals(3, recorder.generations.size());
            assertTrue(recorder.yields.isEmpty());
        }

        @Test
        @DisplayName("Elitist replacement never loses the best fitness")
        void monotoneBest() throws Exception {
            PipelineInterpreter interpreter = interpreter(ONEMAX, config(20), new OneMax());
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            interpreter.run();

            double previous = Double.NEGATIVE_INFINITY;
            for (List<Individual> yielded : recorder.yields) {
                double best = yielded.stream().mapToDouble(Individual::getFitness).max().orElseThrow();
                assertTrue(best >= previous);
                previous = best;
            }
        }

        @Test
        @DisplayName("Fitness target")
        void fitnessTarget() throws Exception {
            ExperimentConfig config = config(1000).toBuilder().fitnessTarget(10.0).build();
            PipelineInterpreter interpreter = interpreter(ONEMAX, config, new OneMax());
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            RunStats stats = interpreter.run();

            assertEquals(TerminationReason.FITNESS_TARGET, recorder.reason);
            assertTrue(stats.bestFitness() >= 10.0);
            assertTrue(stats.generation() < 1000);
        }

        @Test
        @DisplayName("Stable best fitness")
        void stable() throws Exception {
            String program = """
                    FROM random_binary(length=8) SELECT 4 p
                    YIELD p
                    BEGIN generation
                        YIELD p
                    END generation
                    """;
            ExperimentConfig config = config(100).toBuilder().stableGenerations(3).build();
            PipelineInterpreter interpreter = interpreter(program, config, new OneMax());
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            RunStats stats = interpreter.run();

            assertEquals(TerminationReason.STABLE, recorder.reason);
            assertEquals(3L, stats.generation());
            assertEquals(0L, stats.lastImprovement());
        }

        @Test
        @DisplayName("stop() ends the run at the next generation boundary")
        void cancel() throws Exception {
            PipelineInterpreter interpreter = interpreter(ONEMAX, config(0), new OneMax());
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            interpreter.addListener(new PipelineListener() {
                @Override
                public void onGeneration(RunStats stats) {
                    if (stats.generation() == 4) {
                        interpreter.stop();
                    }
                }
            });
            RunStats stats = interpreter.run();

            assertEquals(TerminationReason.CANCELLED, recorder.reason);
            assertEquals(4L, stats.generation());
            assertFalse(interpreter.isRunning());
        }
    }

    @Nested
    @DisplayName("Reproducibility")
    class Reproducibility {

        private List<List<Individual>> yields(ExperimentConfig config) throws Exception {
            PipelineInterpreter interpreter = interpreter(ONEMAX, config, new OneMax());
            Recorder recorder = new Recorder();
            interpreter.addListener(recorder);
            interpreter.run();
            return recorder.yields;
        }

        private static void assertSameGenomes(List<List<Individual>> a, List<List<Individual>> b) {
            assertEquals(a.size(), b.size());
            for (int y = 0; y < a.size(); y++) {
                assertEquals(a.get(y).size(), b.get(y).size());
                for (int i = 0; i < a.get(y).size(); i++) {
                    assertEquals(a.get(y).get(i).getGenome(), b.get(y).get(i).getGenome());
                    assertEquals(a.get(y).get(i).getFitness(), b.get(y).get(i).getFitness());
                }
            }
        }

        @Test
        @DisplayName("Same seeds give the same YIELD sequence")
        void sameSeeds() throws Exception {
            ExperimentConfig config = config(10).toBuilder().breedingSeed(42).landscapeSeed(7).build();
            assertSameGenomes(yields(config), yields(config));
        }

        @Test
        @DisplayName("A deterministic landscape ignores the landscape seed")
        void landscapeSeedIndependent() throws Exception {
            ExperimentConfig a = config(5).toBuilder().breedingSeed(42).landscapeSeed(1).build();
            ExperimentConfig b = a.toBuilder().landscapeSeed(2).build();
            assertSameGenomes(yields(a), yields(b));
        }
    }
}
