package io.github.manjago.esdl.grammar;

import java.util.List;

/**
 * Invalid grammar. Lists every violation found, not just the first.
 */
public class GrammarDefinitionException extends GrammarException {

    private final List<String> violations;

    public GrammarDefinitionException(List<String> violations) {
        super("Invalid grammar (" + violations.size() + " problem" + (violations.size() == 1 ? "" : "s") + "):\n  "
                + String.join("\n  ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
