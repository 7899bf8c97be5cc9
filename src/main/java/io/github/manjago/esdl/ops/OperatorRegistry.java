package io.github.manjago.esdl.ops;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operators available to pipelines, keyed by lower-case name.
 * <p>
 * Populated by explicit {@link #register} calls when the host starts; nothing is
 * discovered or loaded dynamically.
 */
public class OperatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperatorRegistry.class);

    private final Map<String, OperatorDescriptor> operators = new TreeMap<>();

    /**
     * Registry with every built-in generator, selector and variation operator.
     */
    public static OperatorRegistry withBuiltins() {
        OperatorRegistry registry = new OperatorRegistry();
        Generators.registerAll(registry);
        Selectors.registerAll(registry);
        Variation.registerAll(registry);
        log.debug("Registered {} built-in operators", registry.size());
        return registry;
    }

    /**
     * Add an operator.
     *
     * @throws IllegalArgumentException if the name is already taken
     */
    public OperatorRegistry register(OperatorDescriptor descriptor) {
        String key = descriptor.name().toLowerCase(Locale.ROOT);
        if (operators.putIfAbsent(key, descriptor) != null) {
            throw new IllegalArgumentException("Operator already registered: " + descriptor.name());
        }
        return this;
    }

    public @Nullable OperatorDescriptor lookup(String name) {
        return operators.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public Collection<OperatorDescriptor> all() {
        return Collections.unmodifiableCollection(operators.values());
    }

    public int size() {
        return operators.size();
    }
}
