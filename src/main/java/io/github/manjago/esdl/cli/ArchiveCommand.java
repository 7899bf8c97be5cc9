package io.github.manjago.esdl.cli;

import io.github.manjago.esdl.persistence.YieldArchive;
import io.github.manjago.esdl.persistence.YieldArchive.ArchiveData;
import io.github.manjago.esdl.persistence.YieldArchive.ArchivedIndividual;
import io.github.manjago.esdl.persistence.YieldArchive.YieldRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Show the contents of a yield archive written by {@code run --archive}.
 */
@Command(
    name = "archive",
    description = "Show the yields recorded in an archive file",
    mixinStandardHelpOptions = true
)
public class ArchiveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Archive file (.mv)")
    private Path archiveFile;

    @Option(names = {"-p", "--population"}, description = "Only yields of this population")
    private String population;

    @Option(names = {"-a", "--all"}, description = "List every individual of every yield")
    private boolean showAll;

    @Option(names = {"--definition"}, description = "Print the archived pipeline definition")
    private boolean showDefinition;

    @Override
    public Integer call() {
        try {
            ArchiveData data = YieldArchive.load(archiveFile);

            System.out.println("=".repeat(60));
            System.out.println("ARCHIVE: " + archiveFile.getFileName());
            System.out.println("=".repeat(60));
            System.out.printf("  Version:         %d%n", data.version());
            System.out.printf("  Seeds:           breeding %d, landscape %d%n",
                    data.breedingSeed(), data.landscapeSeed());
            System.out.printf("  Landscape:       %s%n", data.landscape());
            System.out.printf("  Generations:     %,d%n", data.generations());
            System.out.printf("  Termination:     %s%n",
                    data.termination() == null ? "unfinished" : data.termination());
            System.out.printf("  Yields:          %,d%n", data.yields().size());
            System.out.println();

            if (showDefinition) {
                System.out.println(data.definition());
                System.out.println();
            }

            System.out.printf("%-12s %-20s %8s %14s%n", "GENERATION", "POPULATION", "SIZE", "BEST");
            for (YieldRecord record : population == null ? data.yields() : data.yieldsOf(population)) {
                double best = record.bestFitness();
                System.out.printf("%-12d %-20s %8d %14s%n", record.generation(), record.population(),
                        record.individuals().size(), Double.isNaN(best) ? "n/a" : String.format("%.6g", best));
                if (showAll) {
                    for (ArchivedIndividual individual : record.individuals()) {
                        System.out.printf("    #%-8d %14s  %s%n", individual.birth(),
                                Double.isNaN(individual.fitness()) ? "n/a" : String.valueOf(individual.fitness()),
                                individual.genome());
                    }
                }
            }
            return 0;

        } catch (IOException e) {
            System.err.println("Error reading archive: " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_FAILURE;
        }
    }
}
