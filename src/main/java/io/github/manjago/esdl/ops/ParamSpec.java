package io.github.manjago.esdl.ops;

/**
 * One named parameter of an operator.
 *
 * @param defaultValue used when neither the call nor the configuration supplies a value
 */
public record ParamSpec(String name, ParamType type, Object defaultValue) {

    public ParamSpec {
        defaultValue = type.coerce(defaultValue);
    }

    public static ParamSpec integer(String name, long defaultValue) {
        return new ParamSpec(name, ParamType.INT, defaultValue);
    }

    public static ParamSpec real(String name, double defaultValue) {
        return new ParamSpec(name, ParamType.REAL, defaultValue);
    }

    public static ParamSpec bool(String name, boolean defaultValue) {
        return new ParamSpec(name, ParamType.BOOL, defaultValue);
    }

    public static ParamSpec string(String name, String defaultValue) {
        return new ParamSpec(name, ParamType.STRING, defaultValue);
    }

    @Override
    public String toString() {
        return name + ":" + type.name().toLowerCase() + "=" + defaultValue;
    }
}
