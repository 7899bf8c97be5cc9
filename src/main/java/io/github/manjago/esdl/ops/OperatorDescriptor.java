package io.github.manjago.esdl.ops;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Capability descriptor of a registered operator: what it is called, where it may
 * appear, which parameters it accepts and how many individuals it produces.
 */
public record OperatorDescriptor(
        String name,
        Role role,
        List<ParamSpec> params,
        Cardinality cardinality,
        @Nullable Generator generator,
        @Nullable Filter filter,
        String description
) {

    public enum Role {
        /** Appears in a FROM clause and creates individuals. */
        GENERATOR,
        /** Appears in a USING chain and transforms a stream. */
        FILTER
    }

    public OperatorDescriptor {
        Objects.requireNonNull(name, "name");
        params = List.copyOf(params);
        if (role == Role.GENERATOR && generator == null) {
            throw new IllegalArgumentException("Generator " + name + " has no implementation");
        }
        if (role == Role.FILTER && filter == null) {
            throw new IllegalArgumentException("Filter " + name + " has no implementation");
        }
    }

    public static OperatorDescriptor generator(String name, String description, Generator generator,
                                               ParamSpec... params) {
        return new OperatorDescriptor(name, Role.GENERATOR, List.of(params), Cardinality.UNBOUNDED,
                generator, null, description);
    }

    public static OperatorDescriptor filter(String name, String description, Cardinality cardinality,
                                            Filter filter, ParamSpec... params) {
        return new OperatorDescriptor(name, Role.FILTER, List.of(params), cardinality, null, filter, description);
    }

    public Optional<ParamSpec> param(String paramName) {
        return params.stream().filter(p -> p.name().equals(paramName)).findFirst();
    }

    public boolean isGenerator() {
        return role == Role.GENERATOR;
    }

    /**
     * Signature line, e.g. {@code tournament(k:int=2, replacement:bool=true) -> UNBOUNDED}.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i));
        }
        return sb.append(") -> ").append(cardinality).toString();
    }
}
