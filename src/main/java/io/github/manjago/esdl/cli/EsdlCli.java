package io.github.manjago.esdl.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * ESDL CLI - define and run evolutionary pipelines.
 *
 * Usage:
 *   esdl run pipeline.esdl [options]     - Run a pipeline
 *   esdl check pipeline.esdl             - Parse and bind without running
 *   esdl expand -f grammar.conf -g 4,1,2 - Map a codon genome through a grammar
 *   esdl archive run.mv                  - Show a yield archive
 *   esdl info                            - Show version, defaults and operators
 */
@Command(
    name = "esdl",
    description = "Evolutionary systems definition language",
    mixinStandardHelpOptions = true,
    version = "ESDL 1.0.0",
    subcommands = {
        RunCommand.class,
        CheckCommand.class,
        ExpandCommand.class,
        ArchiveCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class EsdlCli implements Runnable {

    /** Exit code for pipeline, grammar and binding errors. */
    public static final int EXIT_DEFINITION_ERROR = 1;

    /** Exit code for everything else (I/O, unexpected failures). */
    public static final int EXIT_FAILURE = 2;

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new EsdlCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
