package io.github.manjago.esdl.ops;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully resolved, typed arguments of one operator invocation.
 */
public final class OperatorArgs {

    public static final OperatorArgs EMPTY = new OperatorArgs(Map.of());

    private final Map<String, Object> values;

    public OperatorArgs(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int getInt(String name) {
        long value = (Long) require(name);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Argument " + name + " out of int range: " + value);
        }
        return (int) value;
    }

    public long getLong(String name) {
        return (Long) require(name);
    }

    public double getDouble(String name) {
        return ((Number) require(name)).doubleValue();
    }

    public boolean getBoolean(String name) {
        return (Boolean) require(name);
    }

    public String getString(String name) {
        return (String) require(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No argument named " + name);
        }
        return value;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
