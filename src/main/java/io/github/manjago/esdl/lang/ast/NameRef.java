package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * Reference to a run variable, population or dotted configuration key.
 */
public record NameRef(String name, SourceLocation location) implements Expression {

    @Override
    public String toString() {
        return name;
    }
}
