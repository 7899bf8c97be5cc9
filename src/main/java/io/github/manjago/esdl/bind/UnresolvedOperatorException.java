package io.github.manjago.esdl.bind;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * Operator name not present in the registry.
 */
public class UnresolvedOperatorException extends BindingException {

    private final String operator;

    public UnresolvedOperatorException(String operator, SourceLocation location) {
        super("Unknown operator '" + operator + "'", location);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
