package io.github.manjago.esdl.grammar;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Limits and policies of one grammar expansion.
 *
 * @param maxDepth deepest rule nesting allowed; the start rule is at depth 1
 * @param maxExpansions total rule expansions allowed for one derivation
 * @param wrapPolicy what to do when the genome runs out of codons
 * @param wrapLimit how often WRAP may restart the genome (0 = unlimited)
 * @param indentWidth spaces emitted per indent level by {@code INDENT}
 * @param terminals names chosen by {@code TERMINAL}; empty means {@code T[codon]}
 */
public record ExpansionOptions(
        int maxDepth,
        int maxExpansions,
        WrapPolicy wrapPolicy,
        int wrapLimit,
        int indentWidth,
        List<String> terminals
) {

    public ExpansionOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        }
        if (maxExpansions < 1) {
            throw new IllegalArgumentException("maxExpansions must be >= 1: " + maxExpansions);
        }
        if (wrapPolicy == null) {
            throw new IllegalArgumentException("wrapPolicy must not be null");
        }
        if (wrapLimit < 0) {
            throw new IllegalArgumentException("wrapLimit must be >= 0: " + wrapLimit);
        }
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must be >= 0: " + indentWidth);
        }
        terminals = terminals == null ? List.of() : List.copyOf(terminals);
    }

    public static ExpansionOptions defaults() {
        return new ExpansionOptions(100, 10_000, WrapPolicy.WRAP, 0, 1, List.of());
    }

    /**
     * Read options from an {@code esdl.expansion}-shaped block.
     */
    public static ExpansionOptions fromConfig(Config config) {
        return new ExpansionOptions(
                config.getInt("max-depth"),
                config.getInt("max-expansions"),
                config.getEnum(WrapPolicy.class, "wrap-policy"),
                config.getInt("wrap-limit"),
                config.getInt("indent-width"),
                config.getStringList("terminals")
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxDepth(maxDepth)
                .maxExpansions(maxExpansions)
                .wrapPolicy(wrapPolicy)
                .wrapLimit(wrapLimit)
                .indentWidth(indentWidth)
                .terminals(terminals);
    }

    public static class Builder {
        private int maxDepth = 100;
        private int maxExpansions = 10_000;
        private WrapPolicy wrapPolicy = WrapPolicy.WRAP;
        private int wrapLimit = 0;
        private int indentWidth = 1;
        private List<String> terminals = List.of();

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxExpansions(int maxExpansions) {
            this.maxExpansions = maxExpansions;
            return this;
        }

        public Builder wrapPolicy(WrapPolicy wrapPolicy) {
            this.wrapPolicy = wrapPolicy;
            return this;
        }

        public Builder wrapLimit(int wrapLimit) {
            this.wrapLimit = wrapLimit;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder terminals(List<String> terminals) {
            this.terminals = terminals;
            return this;
        }

        public ExpansionOptions build() {
            return new ExpansionOptions(maxDepth, maxExpansions, wrapPolicy, wrapLimit, indentWidth, terminals);
        }
    }
}
