package io.github.manjago.esdl.grammar;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One alternative of a rule.
 */
public record Production(List<Symbol> symbols) {

    public Production {
        symbols = List.copyOf(symbols);
    }

    @Override
    public String toString() {
        return symbols.stream().map(Symbol::toString).collect(Collectors.joining(" "));
    }
}
