package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code FROM sources SELECT destinations [USING operator, ...]}
 */
public record FromStatement(List<OperatorCall> sources, List<Destination> destinations, List<OperatorCall> chain,
                            SourceLocation location) implements Statement {

    public FromStatement {
        sources = List.copyOf(sources);
        destinations = List.copyOf(destinations);
        chain = List.copyOf(chain);
    }

    @Override
    public String toString() {
        String text = "FROM " + join(sources) + " SELECT " + join(destinations);
        return chain.isEmpty() ? text : text + " USING " + join(chain);
    }

    private static String join(List<?> items) {
        return items.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
