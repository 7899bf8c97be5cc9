package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * {@code name = expression}
 */
public record AssignStatement(String name, Expression value, SourceLocation location) implements Statement {

    @Override
    public String toString() {
        return name + " = " + value;
    }
}
