package io.github.manjago.esdl.ops;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OperatorRegistry and operator descriptors.
 */
class OperatorRegistryTest {

    @ParameterizedTest
    @ValueSource(strings = {"random_binary", "random_int", "random_real", "random_ge"})
    @DisplayName("Built-in generators are registered as unbounded sources")
    void generators(String name) {
        OperatorDescriptor descriptor = OperatorRegistry.withBuiltins().lookup(name);
        assertNotNull(descriptor);
        assertTrue(descriptor.isGenerator());
        assertEquals(Cardinality.UNBOUNDED, descriptor.cardinality());
    }

    @Test
    @DisplayName("Selector and variation cardinalities")
    void cardinalities() {
        OperatorRegistry registry = OperatorRegistry.withBuiltins();
        for (String name : List.of("best", "worst", "select_all", "uniform_shuffle")) {
            assertEquals(Cardinality.AT_LEAST, registry.lookup(name).cardinality(), name);
        }
        for (String name : List.of("tournament", "binary_tournament", "uniform_random",
                "fitness_proportional", "repeat", "best_only", "worst_only")) {
            assertEquals(Cardinality.UNBOUNDED, registry.lookup(name).cardinality(), name);
        }
        for (String name : List.of("crossover_one", "crossover_uniform", "mutate_random",
                "mutate_bitflip", "mutate_gaussian", "mutate_delta")) {
            assertEquals(Cardinality.EXACT, registry.lookup(name).cardinality(), name);
        }
    }

    @Test
    @DisplayName("Lookup ignores case")
    void caseInsensitive() {
        OperatorRegistry registry = OperatorRegistry.withBuiltins();
        assertSame(registry.lookup("tournament"), registry.lookup("Tournament"));
        assertTrue(registry.contains("BEST"));
        assertNull(registry.lookup("no_such_operator"));
    }

    @Test
    @DisplayName("Duplicate names are rejected")
    void duplicate() {
        OperatorRegistry registry = new OperatorRegistry();
        Filter identity = (input, args, ctx) -> input;
        registry.register(OperatorDescriptor.filter("keep", "Identity", Cardinality.EXACT, identity));

        assertThrows(IllegalArgumentException.class, () -> registry.register(
                OperatorDescriptor.filter("KEEP", "Identity again", Cardinality.EXACT, identity)));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Custom operators take part like built-ins")
    void customOperator() {
        OperatorRegistry registry = OperatorRegistry.withBuiltins();
        int before = registry.size();
        registry.register(OperatorDescriptor.filter("first_only", "The first individual",
                Cardinality.AT_LEAST,
                (input, args, ctx) -> input.hasNext() ? List.of(input.next()).iterator() : input));

        assertEquals(before + 1, registry.size());
        Iterator<?> out = registry.lookup("first_only").filter().apply(
                List.of(OperatorFixtures.bits("1", 0), OperatorFixtures.bits("0", 1)).iterator(),
                OperatorArgs.EMPTY, OperatorFixtures.context(1));
        assertTrue(out.hasNext());
        out.next();
        assertFalse(out.hasNext());
    }

    @Test
    @DisplayName("Descriptors must carry their implementation")
    void missingImplementation() {
        assertThrows(IllegalArgumentException.class, () -> new OperatorDescriptor("x",
                OperatorDescriptor.Role.FILTER, List.of(), Cardinality.EXACT, null, null, ""));
    }

    @Test
    @DisplayName("Signature lists typed parameters with defaults")
    void signature() {
        String signature = OperatorRegistry.withBuiltins().lookup("tournament").signature();
        assertEquals("tournament(k:int=2, replacement:bool=true, greediness:real=1.0) -> UNBOUNDED", signature);
    }

    @Test
    @DisplayName("Parameter types coerce compatible values only")
    void coercion() {
        assertEquals(3L, ParamType.INT.coerce(3.0));
        assertEquals(2.0, ParamType.REAL.coerce(2L));
        assertThrows(IllegalArgumentException.class, () -> ParamType.INT.coerce(2.5));
        assertThrows(IllegalArgumentException.class, () -> ParamType.BOOL.coerce(1L));
        assertThrows(IllegalArgumentException.class, () -> ParamType.STRING.coerce(true));
    }

    @Test
    @DisplayName("A stream is as permissive as its least restrictive stage")
    void cardinalityThen() {
        assertEquals(Cardinality.AT_LEAST, Cardinality.EXACT.then(Cardinality.AT_LEAST));
        assertEquals(Cardinality.UNBOUNDED, Cardinality.UNBOUNDED.then(Cardinality.EXACT));
        assertEquals(Cardinality.EXACT, Cardinality.EXACT.then(Cardinality.EXACT));
        assertFalse(Cardinality.EXACT.isTruncatable());
    }
}
