package io.github.manjago.esdl.grammar;

/**
 * Derivation exceeded the configured depth or expansion budget.
 */
public class GrammarRecursionLimitException extends GrammarException {

    private final String rule;

    public GrammarRecursionLimitException(String message, String rule) {
        super(message + " (while expanding '" + rule + "')");
        this.rule = rule;
    }

    /**
     * Rule being expanded when the budget ran out.
     */
    public String getRule() {
        return rule;
    }
}
