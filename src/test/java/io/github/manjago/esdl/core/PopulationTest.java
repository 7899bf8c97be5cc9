package io.github.manjago.esdl.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Population ownership and Individual fitness caching.
 */
class PopulationTest {

    private Individual individual;

    @BeforeEach
    void setUp() {
        individual = new Individual(Genome.binary(new boolean[]{true, false, true}), 1);
    }

    @Test
    @DisplayName("A free individual is stored as is")
    void addFree() {
        Population population = new Population("p");
        assertSame(individual, population.add(individual));
        assertEquals(1, population.size());
    }

    @Test
    @DisplayName("An individual owned elsewhere is copied")
    void addOwned() {
        Population first = new Population("a");
        Population second = new Population("b");
        first.add(individual);

        Individual stored = second.add(individual);

        assertNotSame(individual, stored);
        assertEquals(individual.getGenome(), stored.getGenome());
        assertSame(individual, first.get(0));
    }

    @Test
    @DisplayName("Selecting the same individual twice stores two objects")
    void addTwice() {
        Population population = new Population("p");
        Individual a = population.add(individual);
        Individual b = population.add(individual);
        assertNotSame(a, b);
        assertEquals(2, population.size());
    }

    @Test
    @DisplayName("Released members can be adopted without copying")
    void release() {
        Population first = new Population("a");
        first.add(individual);
        first.release();

        assertTrue(first.isEmpty());
        assertSame(individual, new Population("b").add(individual));
    }

    @Test
    @DisplayName("Snapshots are detached from later fitness changes")
    void snapshot() {
        Population population = new Population("p");
        population.add(individual).setFitness(2.0);

        List<Individual> snapshot = population.snapshot();
        population.get(0).setFitness(5.0);

        assertEquals(2.0, snapshot.get(0).getFitness());
    }

    @Test
    @DisplayName("Members view is read-only")
    void membersReadOnly() {
        Population population = new Population("p", List.of(individual));
        assertThrows(UnsupportedOperationException.class, () -> population.members().clear());
    }

    @Test
    @DisplayName("Best fitness ignores unevaluated members")
    void bestFitness() {
        Population population = new Population("p");
        assertTrue(population.bestFitness().isEmpty());

        population.add(individual);
        assertTrue(population.bestFitness().isEmpty());

        Individual other = new Individual(Genome.binary(new boolean[]{true}), 2);
        other.setFitness(3.0);
        population.add(other);
        individual.setFitness(1.0);

        assertEquals(3.0, population.bestFitness().getAsDouble());
    }

    @Test
    @DisplayName("Fitness is cached until invalidated")
    void fitnessCache() {
        assertFalse(individual.hasFitness());
        assertTrue(Double.isNaN(individual.getFitness()));

        individual.setFitness(4.0);
        assertTrue(individual.hasFitness());

        individual.invalidateFitness();
        assertFalse(individual.hasFitness());
    }

    @Test
    @DisplayName("Ranking puts unset fitness below everything")
    void ranking() {
        Individual low = new Individual(Genome.binary(new boolean[]{false}), 2);
        low.setFitness(-100.0);
        Individual high = new Individual(Genome.binary(new boolean[]{true}), 3);
        high.setFitness(1.0);

        List<Individual> sorted = new ArrayList<>(List.of(high, individual, low));
        sorted.sort(Individual.BY_FITNESS);

        assertEquals(List.of(individual, low, high), sorted);
    }

    @Test
    @DisplayName("Derived children start unevaluated with a statistic tag")
    void derive() {
        individual.setFitness(1.0);
        Individual child = individual.derive(Genome.binary(new boolean[]{false}), 9, "mutated");

        assertFalse(child.hasFitness());
        assertEquals(9L, child.getBirth());
        assertEquals(1, child.getStatistic().get("mutated"));
    }
}
