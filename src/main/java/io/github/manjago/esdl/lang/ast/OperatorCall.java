package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator invocation {@code name(key=value, ...)}, or a bare name.
 * <p>
 * In a FROM clause a bare name may also denote a population; the binder decides.
 *
 * @param parenthesized whether an argument list (possibly empty) was written
 */
public record OperatorCall(String name, List<Argument> arguments, boolean parenthesized, SourceLocation location) {

    public OperatorCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String toString() {
        if (!parenthesized) {
            return name;
        }
        return name + arguments.stream().map(Argument::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
