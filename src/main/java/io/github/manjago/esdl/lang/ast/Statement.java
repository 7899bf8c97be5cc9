package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * One pipeline statement.
 */
public interface Statement {

    SourceLocation location();
}
