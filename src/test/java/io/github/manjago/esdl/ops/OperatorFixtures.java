package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.landscape.OneMax;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for operator tests.
 */
final class OperatorFixtures {

    static final OperatorRegistry REGISTRY = OperatorRegistry.withBuiltins();

    private OperatorFixtures() {
    }

    static OperatorContext context(long seed) {
        return new OperatorContext(new RandomStreams(seed, seed), new OneMax());
    }

    static OperatorDescriptor operator(String name) {
        OperatorDescriptor descriptor = REGISTRY.lookup(name);
        if (descriptor == null) {
            throw new IllegalArgumentException("No operator " + name);
        }
        return descriptor;
    }

    /**
     * Declared defaults overridden by name/value pairs.
     */
    static OperatorArgs args(OperatorDescriptor descriptor, Object... pairs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ParamSpec spec : descriptor.params()) {
            values.put(spec.name(), spec.defaultValue());
        }
        for (int i = 0; i < pairs.length; i += 2) {
            String name = (String) pairs[i];
            ParamSpec spec = descriptor.param(name).orElseThrow();
            values.put(name, spec.type().coerce(pairs[i + 1]));
        }
        return new OperatorArgs(values);
    }

    static Iterator<Individual> apply(String name, List<Individual> input, OperatorContext ctx, Object... pairs) {
        OperatorDescriptor descriptor = operator(name);
        return descriptor.filter().apply(input.iterator(), args(descriptor, pairs), ctx);
    }

    static Iterator<Individual> generate(String name, OperatorContext ctx, Object... pairs) {
        OperatorDescriptor descriptor = operator(name);
        return descriptor.generator().generate(args(descriptor, pairs), ctx);
    }

    static List<Individual> take(Iterator<Individual> stream, int count) {
        List<Individual> taken = new ArrayList<>();
        while (taken.size() < count && stream.hasNext()) {
            taken.add(stream.next());
        }
        return taken;
    }

    static List<Individual> drain(Iterator<Individual> stream) {
        return take(stream, Integer.MAX_VALUE);
    }

    /**
     * Binary individual from a pattern such as {@code "0110"}; OneMax fitness is the count of 1s.
     */
    static Individual bits(String pattern, long birth) {
        boolean[] bits = new boolean[pattern.length()];
        for (int i = 0; i < bits.length; i++) {
            bits[i] = pattern.charAt(i) == '1';
        }
        return new Individual(Genome.binary(bits), birth);
    }
}
