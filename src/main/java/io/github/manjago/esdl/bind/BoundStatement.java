package io.github.manjago.esdl.bind;

import io.github.manjago.esdl.lang.SourceLocation;
import io.github.manjago.esdl.lang.ast.Expression;
import io.github.manjago.esdl.ops.Cardinality;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Statement ready for execution.
 */
public interface BoundStatement {

    SourceLocation location();

    /**
     * One element of a FROM clause: a declared population or a generator.
     */
    record Source(@Nullable String population, @Nullable BoundOperator generator) {

        public static Source population(String name) {
            return new Source(name, null);
        }

        public static Source generator(BoundOperator generator) {
            return new Source(null, generator);
        }

        public boolean isPopulation() {
            return population != null;
        }

        @Override
        public String toString() {
            return population != null ? population : String.valueOf(generator);
        }
    }

    /**
     * One destination of a SELECT clause; a null count takes the rest of the stream.
     */
    record Target(String name, @Nullable Expression count, SourceLocation location) {

        public boolean isSized() {
            return count != null;
        }

        @Override
        public String toString() {
            return count == null ? name : "(" + count + ") " + name;
        }
    }

    /**
     * @param cardinality what the combined stream promises, used to decide whether excess is an error
     */
    record From(List<Source> sources, List<Target> destinations, List<BoundOperator> chain,
                Cardinality cardinality, SourceLocation location) implements BoundStatement {

        public From {
            sources = List.copyOf(sources);
            destinations = List.copyOf(destinations);
            chain = List.copyOf(chain);
        }

        @Override
        public String toString() {
            String text = "FROM " + join(sources) + " SELECT " + join(destinations);
            return (chain.isEmpty() ? text : text + " USING " + join(chain)) + "  [" + cardinality + "]";
        }
    }

    record Yield(List<String> names, SourceLocation location) implements BoundStatement {

        public Yield {
            names = List.copyOf(names);
        }

        @Override
        public String toString() {
            return "YIELD " + String.join(", ", names);
        }
    }

    record Eval(List<String> names, SourceLocation location) implements BoundStatement {

        public Eval {
            names = List.copyOf(names);
        }

        @Override
        public String toString() {
            return "EVAL " + String.join(", ", names);
        }
    }

    /**
     * Either a run-variable assignment ({@code value} set) or a population alias ({@code aliasOf} set).
     */
    record Assign(String name, @Nullable Expression value, @Nullable String aliasOf,
                  SourceLocation location) implements BoundStatement {

        public boolean isAlias() {
            return aliasOf != null;
        }

        @Override
        public String toString() {
            return name + " = " + (aliasOf != null ? aliasOf + "  [alias]" : value);
        }
    }

    record Repeat(Expression count, List<BoundStatement> body, SourceLocation location) implements BoundStatement {

        public Repeat {
            body = List.copyOf(body);
        }

        @Override
        public String toString() {
            return "REPEAT " + count + " (" + body.size() + " statements)";
        }
    }

    private static String join(List<?> items) {
        return items.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
