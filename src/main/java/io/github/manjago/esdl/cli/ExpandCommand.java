package io.github.manjago.esdl.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.esdl.config.ExperimentConfig;
import io.github.manjago.esdl.grammar.ExpansionOptions;
import io.github.manjago.esdl.grammar.ExpansionResult;
import io.github.manjago.esdl.grammar.Grammar;
import io.github.manjago.esdl.grammar.GrammarException;
import io.github.manjago.esdl.grammar.GrammarExpander;
import io.github.manjago.esdl.grammar.WrapPolicy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Map a codon genome through a grammar and print the generated text.
 *
 * Examples:
 *   esdl expand --genome 4,1,2                      # Built-in regression grammar
 *   esdl expand -f grammar.conf --genome 4,1,2,9,3  # Grammar file (rules at the root)
 *   esdl expand -f grammar.conf --genome 7 --wrap fail
 */
@Command(
    name = "expand",
    description = "Expand a codon genome through a grammar",
    mixinStandardHelpOptions = true
)
public class ExpandCommand implements Callable<Integer> {

    private static final String BUILTIN_GRAMMAR = "landscapes.regression.grammar";

    @Option(names = {"-f", "--grammar"}, description = "Grammar file (HOCON, rule name -> productions)")
    private Path grammarFile;

    @Option(names = {"--genome"}, split = ",", required = true, description = "Codons, comma separated")
    private int[] genome;

    @Option(names = {"--max-depth"}, description = "Maximum derivation depth")
    private Integer maxDepth;

    @Option(names = {"--wrap"}, description = "Genome exhaustion policy: ${COMPLETION-CANDIDATES}")
    private WrapPolicy wrapPolicy;

    @Option(names = {"--wrap-limit"}, description = "Maximum genome restarts under WRAP (0 = unlimited)")
    private Integer wrapLimit;

    @Option(names = {"--terminals"}, split = ",", description = "Names emitted by TERMINAL")
    private List<String> terminals;

    @Option(names = {"--show-grammar"}, description = "Print the grammar before expanding")
    private boolean showGrammar;

    @Option(names = {"-q", "--quiet"}, description = "Print only the generated text")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            Config source = grammarFile != null
                    ? ConfigFactory.parseFile(grammarFile.toFile()).resolve()
                    : ConfigFactory.load().getConfig(BUILTIN_GRAMMAR);
            Grammar grammar = Grammar.fromConfig(source);
            if (showGrammar) {
                System.out.println(grammar);
                System.out.println();
            }

            GrammarExpander expander = new GrammarExpander(grammar, buildOptions());
            ExpansionResult result = expander.expand(genome);

            System.out.println(result.text());
            if (!quiet) {
                System.out.printf("%n(%d codons used, %d wraps)%n", result.codonsUsed(), result.wraps());
            }
            return 0;

        } catch (GrammarException e) {
            System.err.println("Grammar error: " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_DEFINITION_ERROR;
        } catch (RuntimeException e) {
            System.err.println("Error: " + ExperimentSetup.describe(e));
            return EsdlCli.EXIT_FAILURE;
        }
    }

    private ExpansionOptions buildOptions() {
        ExpansionOptions.Builder builder = ExperimentConfig.defaults().expansion().toBuilder();

        if (maxDepth != null) builder.maxDepth(maxDepth);
        if (wrapPolicy != null) builder.wrapPolicy(wrapPolicy);
        if (wrapLimit != null) builder.wrapLimit(wrapLimit);
        if (terminals != null) builder.terminals(terminals);

        return builder.build();
    }
}
