package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

import java.util.List;

/**
 * {@code YIELD name, ...} - publishes populations to observers.
 */
public record YieldStatement(List<String> names, SourceLocation location) implements Statement {

    public YieldStatement {
        names = List.copyOf(names);
    }

    @Override
    public String toString() {
        return "YIELD " + String.join(", ", names);
    }
}
