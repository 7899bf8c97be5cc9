package io.github.manjago.esdl.ops;

/**
 * Declared type of an operator parameter.
 */
public enum ParamType {
    INT,
    REAL,
    BOOL,
    STRING;

    /**
     * Convert an evaluated value to this type.
     *
     * @return {@code Long}, {@code Double}, {@code Boolean} or {@code String}
     * @throws IllegalArgumentException if the value does not fit
     */
    public Object coerce(Object value) {
        return switch (this) {
            case INT -> {
                if (value instanceof Long) {
                    yield value;
                }
                if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
                    yield d.longValue();
                }
                throw mismatch(value);
            }
            case REAL -> {
                if (value instanceof Number n) {
                    yield n.doubleValue();
                }
                throw mismatch(value);
            }
            case BOOL -> {
                if (value instanceof Boolean) {
                    yield value;
                }
                throw mismatch(value);
            }
            case STRING -> {
                if (value instanceof String) {
                    yield value;
                }
                throw mismatch(value);
            }
        };
    }

    private IllegalArgumentException mismatch(Object value) {
        return new IllegalArgumentException("Expected " + name().toLowerCase() + ", got " + value);
    }
}
