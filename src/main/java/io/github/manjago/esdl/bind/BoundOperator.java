package io.github.manjago.esdl.bind;

import io.github.manjago.esdl.lang.SourceLocation;
import io.github.manjago.esdl.lang.ast.Expression;
import io.github.manjago.esdl.lang.ast.Literal;
import io.github.manjago.esdl.ops.OperatorDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operator invocation resolved to its implementation, with one expression per declared
 * parameter. Configuration references are already substituted; what remains are
 * literals and run-variable references evaluated at execution time.
 */
public record BoundOperator(OperatorDescriptor descriptor, Map<String, Expression> arguments,
                            SourceLocation location) {

    public BoundOperator {
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public String name() {
        return descriptor.name();
    }

    /**
     * True if every argument is a literal, i.e. nothing depends on run variables.
     */
    public boolean isConstant() {
        return arguments.values().stream().allMatch(Literal.class::isInstance);
    }

    @Override
    public String toString() {
        return arguments.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", descriptor.name() + "(", ")"));
    }
}
