package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * Literal value: {@code Long}, {@code Double}, {@code String} or {@code Boolean}.
 */
public record Literal(Object value, SourceLocation location) implements Expression {

    @Override
    public String toString() {
        return value instanceof String s ? '"' + s + '"' : String.valueOf(value);
    }
}
