package io.github.manjago.esdl.cli;

import io.github.manjago.esdl.bind.BoundProgram;
import io.github.manjago.esdl.config.ConfigContext;
import io.github.manjago.esdl.lang.EsdlException;
import io.github.manjago.esdl.lang.Parser;
import io.github.manjago.esdl.lang.ast.Program;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Parse and bind a pipeline without running it, then print the bound statements.
 */
@Command(
    name = "check",
    description = "Parse and bind a pipeline definition without running it",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Pipeline definition file")
    private Path pipelineFile;

    @Option(names = {"-f", "--config"}, description = "Experiment configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"--set"}, paramLabel = "KEY=EXPR", description = "Override a variable (repeatable)")
    private List<String> settings = new ArrayList<>();

    @Override
    public Integer call() {
        try {
            ConfigContext context = ExperimentSetup.context(configFile, settings);
            Program program = new Parser().parseFile(pipelineFile);
            BoundProgram bound = ExperimentSetup.bind(program, context);

            System.out.println(pipelineFile.getFileName() + ": OK");
            System.out.printf("  Populations: %s%n", bound.populations());
            System.out.printf("  Variables:   %s%n", bound.variables());
            System.out.printf("  Mode:        %s%n", bound.isSingleShot() ? "single-shot" : "generational");
            System.out.println();
            System.out.print(bound.describe());
            return 0;

        } catch (EsdlException e) {
            System.err.println(pipelineFile.getFileName() + ": " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_DEFINITION_ERROR;
        } catch (IOException e) {
            System.err.println("I/O error: " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_FAILURE;
        }
    }
}
