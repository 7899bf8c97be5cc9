package io.github.manjago.esdl.cli;

import io.github.manjago.esdl.bind.BoundProgram;
import io.github.manjago.esdl.config.ConfigContext;
import io.github.manjago.esdl.config.ExperimentConfig;
import io.github.manjago.esdl.core.Population;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.grammar.GrammarException;
import io.github.manjago.esdl.landscape.Landscape;
import io.github.manjago.esdl.landscape.Landscapes;
import io.github.manjago.esdl.lang.EsdlException;
import io.github.manjago.esdl.lang.Parser;
import io.github.manjago.esdl.lang.ast.Program;
import io.github.manjago.esdl.persistence.ArchivingListener;
import io.github.manjago.esdl.persistence.YieldArchive;
import io.github.manjago.esdl.run.PipelineInterpreter;
import io.github.manjago.esdl.run.PipelineListener;
import io.github.manjago.esdl.run.RunStats;
import io.github.manjago.esdl.run.TerminationReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Run a pipeline.
 *
 * Examples:
 *   esdl run onemax.esdl                                  # Run with defaults
 *   esdl run onemax.esdl -g 50 --landscape onemax         # 50 generations on OneMax
 *   esdl run onemax.esdl -f experiment.conf               # Use an experiment file
 *   esdl run onemax.esdl --set size=40 --set "rate=1/size" # Override variables
 *   esdl run onemax.esdl --archive run.mv                 # Record every YIELD
 */
@Command(
    name = "run",
    description = "Run a pipeline definition",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", description = "Pipeline definition file")
    private Path pipelineFile;

    @Option(names = {"-f", "--config"}, description = "Experiment configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-g", "--generations"}, description = "Max generations (0 = unbounded)")
    private Long maxGenerations;

    @Option(names = {"--seed"}, description = "Breeding stream seed")
    private Long breedingSeed;

    @Option(names = {"--landscape-seed"}, description = "Landscape stream seed")
    private Long landscapeSeed;

    @Option(names = {"--time-seed"}, description = "Derive both seeds from the clock")
    private boolean timeSeed;

    @Option(names = {"--set"}, paramLabel = "KEY=EXPR",
            description = "Override a variable or setting (repeatable)")
    private List<String> settings = new ArrayList<>();

    @Option(names = {"--landscape"}, description = "Landscape: onemax, sphere, regression or none")
    private String landscapeName;

    @Option(names = {"--archive"}, description = "Record every YIELD into this MVStore file")
    private Path archiveFile;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            ConfigContext context = ExperimentSetup.context(configFile, settings);
            ExperimentConfig config = buildConfig(context);

            String definition = Files.readString(pipelineFile, StandardCharsets.UTF_8);
            Program program = new Parser().parse(definition);
            BoundProgram bound = ExperimentSetup.bind(program, context);

            RandomStreams streams = config.createStreams();
            Landscape landscape = Landscapes.create(config.landscape(), context.getConfig(), config.expansion());

            if (!quiet) {
                printBanner();
                System.out.println(config);
            }

            PipelineInterpreter interpreter = new PipelineInterpreter(bound, config, streams, landscape);
            if (!quiet) {
                interpreter.addListener(new ConsoleProgressListener());
            }

            Thread shutdownHook = new Thread(() -> {
                if (interpreter.isRunning()) {
                    System.out.println("\nStopping at the next generation boundary...");
                    interpreter.stop();
                    try {
                        Thread.sleep(100);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            RunStats stats;
            try {
                if (config.archiveFile() != null) {
                    try (YieldArchive archive = YieldArchive.create(config.archiveFile())) {
                        archive.recordRun(streams, definition, config.landscape());
                        interpreter.addListener(new ArchivingListener(archive));
                        stats = interpreter.run();
                    }
                } else {
                    stats = interpreter.run();
                }
            } finally {
                removeShutdownHook(shutdownHook);
            }

            if (!quiet) {
                System.out.println();
                System.out.println(stats);
            } else if (stats.hasBestFitness()) {
                System.out.println(stats.bestFitness());
            }
            return 0;

        } catch (EsdlException | GrammarException e) {
            System.err.println("Error in " + pipelineFile + ": " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_DEFINITION_ERROR;
        } catch (IOException e) {
            System.err.println("I/O error: " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Run failed", e);
            System.err.println("Error: " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_FAILURE;
        }
    }

    private ExperimentConfig buildConfig(ConfigContext context) {
        // Start from the layered configuration, then apply explicit options
        ExperimentConfig.Builder builder = ExperimentConfig.fromConfig(context.getConfig()).toBuilder();

        if (maxGenerations != null) builder.maxGenerations(maxGenerations);
        if (breedingSeed != null) builder.breedingSeed(breedingSeed);
        if (landscapeSeed != null) builder.landscapeSeed(landscapeSeed);
        if (timeSeed) builder.timeBasedSeed(true);
        if (landscapeName != null) builder.landscape(landscapeName);
        if (archiveFile != null) builder.archiveFile(archiveFile);

        return builder.build();
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, hook already running");
        }
    }

    private void printBanner() {
        System.out.println();
        System.out.println("=== ESDL: " + pipelineFile.getFileName() + " ===");
        System.out.println();
    }

    /**
     * One progress line per generation, rewritten in place.
     */
    private static class ConsoleProgressListener implements PipelineListener {

        @Override
        public void onYield(String name, Population population, long generation) {
            if (generation == 0) {
                System.out.printf("YIELD %s: %d individuals, best %s%n", name, population.size(),
                        population.bestFitness().isPresent()
                                ? String.valueOf(population.bestFitness().getAsDouble()) : "n/a");
            }
        }

        @Override
        public void onGeneration(RunStats stats) {
            System.out.printf("\rGeneration %,d  |  best %s  |  births %,d  |  evaluations %,d   ",
                    stats.generation(),
                    stats.hasBestFitness() ? String.format("%.6g", stats.bestFitness()) : "n/a",
                    stats.births(),
                    stats.evaluations());
            System.out.flush();
        }

        @Override
        public void onTerminated(TerminationReason reason, RunStats stats) {
            System.out.printf("%nTerminated: %s%n", reason);
        }
    }
}
