package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

import java.util.List;

/**
 * {@code EVAL name, ...} - forces re-evaluation of fitness.
 */
public record EvalStatement(List<String> names, SourceLocation location) implements Statement {

    public EvalStatement {
        names = List.copyOf(names);
    }

    @Override
    public String toString() {
        return "EVAL " + String.join(", ", names);
    }
}
