package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * Restricted value expression: literals, dotted names, arithmetic and boolean
 * operators. There are no calls, so evaluating an expression can never run code.
 */
public interface Expression {

    SourceLocation location();
}
