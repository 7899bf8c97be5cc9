package io.github.manjago.esdl.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Genotype-to-phenotype mapper for Grammatical Evolution.
 * <p>
 * Derivation is depth-first and leftmost, starting at {@link Grammar#START}. Each rule
 * with more than one production consumes the next codon and picks production
 * {@code codon mod count}; a rule with a single production consumes nothing.
 * <p>
 * The derivation runs on an explicit work stack, so the depth bound is enforced the
 * same way whatever the thread's call-stack size. Expansion is pure: the same grammar,
 * genome and options always give the same result.
 */
public class GrammarExpander {

    private static final Logger log = LoggerFactory.getLogger(GrammarExpander.class);

    private final Grammar grammar;
    private final ExpansionOptions options;

    public GrammarExpander(Grammar grammar) {
        this(grammar, ExpansionOptions.defaults());
    }

    public GrammarExpander(Grammar grammar, ExpansionOptions options) {
        this.grammar = grammar;
        this.options = options;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public ExpansionOptions getOptions() {
        return options;
    }

    /**
     * Derive program text from a codon sequence.
     *
     * @param genome non-negative codons
     * @return text plus codon accounting
     * @throws GrammarRecursionLimitException nesting deeper than {@code maxDepth}
     *         or more than {@code maxExpansions} rule expansions
     * @throws GrammarDepthException {@code DEC_INDENT} at indent level zero
     * @throws GenomeExhaustedException codons ran out and the wrap policy forbids reuse
     */
    public ExpansionResult expand(int[] genome) throws GrammarException {
        CodonReader codons = new CodonReader(genome, options);
        StringBuilder out = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(Symbol.rule(Grammar.START), 1));

        int indent = 0;
        int expansions = 0;

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Symbol symbol = frame.symbol();

            if (!symbol.isRule()) {
                out.append(symbol.value());
                continue;
            }

            BuiltinRule builtin = BuiltinRule.of(symbol.value());
            if (builtin != null) {
                switch (builtin) {
                    case TERMINAL -> out.append(terminal(codons.next()));
                    case INDENT -> out.append(" ".repeat(indent * options.indentWidth()));
                    case INC_INDENT -> indent++;
                    case DEC_INDENT -> {
                        if (indent == 0) {
                            throw new GrammarDepthException("DEC_INDENT below indent level zero");
                        }
                        indent--;
                    }
                    case NEWLINE -> out.append('\n');
                }
                continue;
            }

            if (frame.depth() > options.maxDepth()) {
                throw new GrammarRecursionLimitException(
                        "Derivation deeper than " + options.maxDepth() + " levels", symbol.value());
            }
            if (++expansions > options.maxExpansions()) {
                throw new GrammarRecursionLimitException(
                        "More than " + options.maxExpansions() + " rule expansions", symbol.value());
            }

            List<Production> productions = grammar.productions(symbol.value());
            Production chosen = productions.size() == 1
                    ? productions.get(0)
                    : productions.get(codons.next() % productions.size());

            // Push right to left so the leftmost symbol is expanded first
            List<Symbol> symbols = chosen.symbols();
            for (int i = symbols.size() - 1; i >= 0; i--) {
                stack.push(new Frame(symbols.get(i), frame.depth() + 1));
            }
        }

        ExpansionResult result = new ExpansionResult(out.toString(), codons.getUsed(), codons.getWraps());
        log.trace("Expanded {} codons ({} wraps) into {} chars", result.codonsUsed(), result.wraps(),
                result.text().length());
        return result;
    }

    private String terminal(int codon) {
        List<String> terminals = options.terminals();
        if (terminals.isEmpty()) {
            return "T[" + codon + "]";
        }
        return terminals.get(codon % terminals.size());
    }

    private record Frame(Symbol symbol, int depth) {
    }

    /**
     * Sequential codon source applying the wrap policy.
     */
    private static final class CodonReader {
        private final int[] genome;
        private final WrapPolicy policy;
        private final int wrapLimit;

        private int position;
        private int used;
        private int wraps;

        CodonReader(int[] genome, ExpansionOptions options) {
            this.genome = genome;
            this.policy = options.wrapPolicy();
            this.wrapLimit = options.wrapLimit();
        }

        int next() throws GenomeExhaustedException {
            if (position >= genome.length) {
                switch (policy) {
                    case FAIL -> throw new GenomeExhaustedException("Genome exhausted", used);
                    case PAD -> {
                        used++;
                        return 0;
                    }
                    case WRAP -> {
                        if (genome.length == 0) {
                            throw new GenomeExhaustedException("Cannot wrap an empty genome", used);
                        }
                        if (wrapLimit > 0 && wraps >= wrapLimit) {
                            throw new GenomeExhaustedException("Wrap limit " + wrapLimit + " reached", used);
                        }
                        wraps++;
                        position = 0;
                    }
                }
            }
            int codon = genome[position++];
            if (codon < 0) {
                throw new IllegalArgumentException("Negative codon at position " + (position - 1) + ": " + codon);
            }
            used++;
            return codon;
        }

        int getUsed() {
            return used;
        }

        int getWraps() {
            return wraps;
        }
    }
}
