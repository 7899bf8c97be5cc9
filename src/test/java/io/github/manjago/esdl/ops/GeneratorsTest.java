package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.SpeciesKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static io.github.manjago.esdl.ops.OperatorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the built-in generators.
 */
class GeneratorsTest {

    @Test
    @DisplayName("Generators never run dry")
    void unbounded() {
        Iterator<Individual> stream = generate("random_binary", context(1), "length", 8L);
        List<Individual> taken = take(stream, 500);
        assertEquals(500, taken.size());
        assertTrue(stream.hasNext());
        taken.forEach(i -> assertEquals(8, i.getGenome().length()));
    }

    @Test
    @DisplayName("Every new individual gets the next birth number and no fitness")
    void births() {
        OperatorContext ctx = context(1);
        List<Individual> taken = take(generate("random_int", ctx, "length", 3L), 4);

        for (int i = 0; i < taken.size(); i++) {
            assertEquals(i, taken.get(i).getBirth());
            assertFalse(taken.get(i).hasFitness());
        }
        assertEquals(4L, ctx.getBirths());
    }

    @Test
    @DisplayName("Same breeding seed, same individuals")
    void reproducible() {
        List<Individual> a = take(generate("random_real", context(77), "length", 5L), 10);
        List<Individual> b = take(generate("random_real", context(77), "length", 5L), 10);
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).getGenome(), b.get(i).getGenome());
        }
    }

    @Test
    @DisplayName("Integer genes stay inside the inclusive bounds")
    void integerBounds() {
        for (Individual individual : take(generate("random_int", context(3),
                "length", 20L, "lowest", -2L, "highest", 2L), 50)) {
            assertEquals(SpeciesKind.INTEGER, individual.getGenome().getKind());
            for (int gene : individual.getGenome().ints()) {
                assertTrue(gene >= -2 && gene <= 2, "gene " + gene);
            }
        }
    }

    @Test
    @DisplayName("Integer bounds spanning more than Integer.MAX_VALUE")
    void wideIntegerBounds() {
        for (Individual individual : take(generate("random_int", context(4),
                "length", 4L, "lowest", -2_000_000_000L, "highest", 2_000_000_000L), 5)) {
            for (int gene : individual.getGenome().ints()) {
                assertTrue(gene >= -2_000_000_000 && gene <= 2_000_000_000, "gene " + gene);
            }
        }
    }

    @Test
    @DisplayName("Real genes stay inside [lowest, highest)")
    void realBounds() {
        for (Individual individual : take(generate("random_real", context(4),
                "length", 10L, "lowest", -1.0, "highest", 1.0), 50)) {
            for (double gene : individual.getGenome().reals()) {
                assertTrue(gene >= -1.0 && gene < 1.0, "gene " + gene);
            }
        }
    }

    @Test
    @DisplayName("Without a fixed length, lengths vary within [shortest, longest]")
    void variableLength() {
        List<Individual> taken = take(generate("random_binary", context(5),
                "shortest", 2L, "longest", 6L), 200);
        int min = taken.stream().mapToInt(i -> i.getGenome().length()).min().orElseThrow();
        int max = taken.stream().mapToInt(i -> i.getGenome().length()).max().orElseThrow();
        assertEquals(2, min);
        assertEquals(6, max);
    }

    @Test
    @DisplayName("GE codons are non-negative and bounded")
    void geCodons() {
        for (Individual individual : take(generate("random_ge", context(6),
                "length", 30L, "highest", 7L), 20)) {
            assertEquals(SpeciesKind.GE, individual.getGenome().getKind());
            for (int codon : individual.getGenome().ints()) {
                assertTrue(codon >= 0 && codon <= 7);
            }
        }
    }

    @Test
    @DisplayName("Invalid parameters fail when the first individual is drawn")
    void invalidParameters() {
        Iterator<Individual> negative = generate("random_ge", context(1), "lowest", -1L);
        assertThrows(IllegalArgumentException.class, negative::next);

        Iterator<Individual> range = generate("random_binary", context(1), "shortest", 5L, "longest", 2L);
        assertThrows(IllegalArgumentException.class, range::hasNext);
    }
}
