package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * Named argument {@code key=value} of an operator invocation.
 */
public record Argument(String name, Expression value, SourceLocation location) {

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
