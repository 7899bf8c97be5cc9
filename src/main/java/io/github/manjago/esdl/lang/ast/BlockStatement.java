package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

import java.util.List;

/**
 * {@code BEGIN name ... END name}. The name is stored lower-case.
 */
public record BlockStatement(String name, List<Statement> body, SourceLocation location) implements Statement {

    public BlockStatement {
        body = List.copyOf(body);
    }
}
