package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

import java.util.List;

/**
 * {@code REPEAT count ... END REPEAT}
 */
public record RepeatStatement(Expression count, List<Statement> body, SourceLocation location) implements Statement {

    public RepeatStatement {
        body = List.copyOf(body);
    }
}
