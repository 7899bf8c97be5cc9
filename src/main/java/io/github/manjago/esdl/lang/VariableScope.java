package io.github.manjago.esdl.lang;

import java.util.Map;
import java.util.Optional;

/**
 * Source of variable values for {@link ExpressionEvaluator}.
 */
@FunctionalInterface
public interface VariableScope {

    /**
     * @return {@code Long}, {@code Double}, {@code String} or {@code Boolean}, empty if unknown
     */
    Optional<Object> lookup(String name);

    VariableScope EMPTY = name -> Optional.empty();

    static VariableScope of(Map<String, ?> values) {
        return name -> Optional.<Object>ofNullable(values.get(name));
    }

    /**
     * This scope first, then {@code fallback}.
     */
    default VariableScope orElse(VariableScope fallback) {
        return name -> {
            Optional<Object> value = lookup(name);
            return value.isPresent() ? value : fallback.lookup(name);
        };
    }
}
