package io.github.manjago.esdl.bind;

import io.github.manjago.esdl.lang.SourceLocation;

/**
 * Name that is neither a declared population, a run variable, a configuration
 * value nor a parameter of the operator it is passed to.
 */
public class UnresolvedVariableException extends BindingException {

    private final String name;

    public UnresolvedVariableException(String message, String name, SourceLocation location) {
        super(message, location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
