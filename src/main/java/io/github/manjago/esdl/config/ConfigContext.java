package io.github.manjago.esdl.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the experiment variables a pipeline can reference.
 * <p>
 * Layers, highest priority first:
 * <ol>
 *   <li>command-line or batch overrides</li>
 *   <li>the named experiment configuration</li>
 *   <li>plug-in defaults (landscape, operators)</li>
 *   <li>species defaults ({@code reference.conf})</li>
 * </ol>
 * A bare name such as {@code size} is looked up as written and then as {@code system.size}.
 * The context never changes once built; overrides produce a new instance.
 */
public final class ConfigContext {

    private static final Logger log = LoggerFactory.getLogger(ConfigContext.class);

    /** Section that bare variable names fall back to. */
    public static final String SYSTEM_SECTION = "system";

    private final Config config;

    private ConfigContext(Config config) {
        this.config = config;
    }

    /**
     * Context over an already composed configuration.
     */
    public static ConfigContext of(Config config) {
        return new ConfigContext(config.resolve());
    }

    /**
     * Context holding only the species defaults.
     */
    public static ConfigContext defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Scalar value of a variable.
     *
     * @param name dotted key or bare name
     * @return {@code Long}, {@code Double}, {@code String} or {@code Boolean};
     *         empty if absent or not a scalar
     */
    public Optional<Object> lookup(String name) {
        Optional<Object> direct = scalar(name);
        if (direct.isPresent()) {
            return direct;
        }
        return scalar(SYSTEM_SECTION + "." + name);
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * New context with the given dotted keys overriding everything else.
     */
    public ConfigContext withOverrides(Map<String, ?> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        return new ConfigContext(ConfigFactory.parseMap(overrides).withFallback(config).resolve());
    }

    private Optional<Object> scalar(String path) {
        if (!config.hasPath(path)) {
            return Optional.empty();
        }
        ConfigValue value = config.getValue(path);
        ConfigValueType type = value.valueType();
        return switch (type) {
            case NUMBER -> Optional.of(normalize((Number) value.unwrapped()));
            case STRING, BOOLEAN -> Optional.of(value.unwrapped());
            default -> Optional.empty();
        };
    }

    private static Object normalize(Number number) {
        if (number instanceof Integer || number instanceof Long) {
            return number.longValue();
        }
        return number.doubleValue();
    }

    @Override
    public String toString() {
        return "ConfigContext" + config.root().keySet();
    }

    // ========== Builder ==========

    public static class Builder {
        private final Map<String, Object> overrides = new LinkedHashMap<>();
        private Config named = ConfigFactory.empty();
        private Config pluginDefaults = ConfigFactory.empty();
        private Config speciesDefaults = ConfigFactory.defaultReference();

        public Builder override(String key, Object value) {
            overrides.put(key, value);
            return this;
        }

        public Builder overrides(Map<String, ?> values) {
            overrides.putAll(values);
            return this;
        }

        public Builder named(Config config) {
            this.named = config;
            return this;
        }

        public Builder namedFile(Path file) {
            this.named = ConfigFactory.parseFile(file.toFile());
            return this;
        }

        public Builder pluginDefaults(Config config) {
            this.pluginDefaults = config;
            return this;
        }

        public Builder speciesDefaults(Config config) {
            this.speciesDefaults = config;
            return this;
        }

        public ConfigContext build() {
            Config composed = ConfigFactory.parseMap(overrides)
                    .withFallback(named)
                    .withFallback(pluginDefaults)
                    .withFallback(speciesDefaults)
                    .resolve();
            log.debug("Configuration context built ({} overrides)", overrides.size());
            return new ConfigContext(composed);
        }
    }
}
