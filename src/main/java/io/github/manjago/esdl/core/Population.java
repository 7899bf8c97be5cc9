package io.github.manjago.esdl.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Named, ordered sequence of individuals.
 * <p>
 * Order is insertion order. A population owns its members: adding an individual
 * owned by a different population stores a copy, so no individual is ever
 * referenced by two populations at once.
 */
public class Population implements Iterable<Individual> {

    private final String name;
    private final List<Individual> members = new ArrayList<>();

    public Population(String name) {
        this.name = name;
    }

    public Population(String name, Collection<Individual> individuals) {
        this(name);
        individuals.forEach(this::add);
    }

    public String getName() {
        return name;
    }

    /**
     * Append an individual, copying it if another population owns it.
     *
     * @return the instance actually stored
     */
    public Individual add(@NotNull Individual individual) {
        // Owned by us already means a repeated selection: store a second copy
        Individual stored = individual.getOwner() == null ? individual : individual.copy();
        stored.setOwner(this);
        members.add(stored);
        return stored;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public Individual get(int index) {
        return members.get(index);
    }

    /**
     * Unmodifiable live view of the members.
     */
    public List<Individual> members() {
        return Collections.unmodifiableList(members);
    }

    /**
     * Detached copy for observers that outlive the current statement.
     */
    public List<Individual> snapshot() {
        List<Individual> copies = new ArrayList<>(members.size());
        for (Individual individual : members) {
            copies.add(individual.copy());
        }
        return copies;
    }

    /**
     * Give up ownership of all members (the population is being discarded).
     */
    public void release() {
        for (Individual individual : members) {
            if (individual.getOwner() == this) {
                individual.setOwner(null);
            }
        }
        members.clear();
    }

    /**
     * Best evaluated fitness, empty if no member has been evaluated.
     */
    public OptionalDouble bestFitness() {
        return members.stream()
                .filter(Individual::hasFitness)
                .mapToDouble(Individual::getFitness)
                .filter(f -> !Double.isNaN(f))
                .max();
    }

    @Override
    public @NotNull Iterator<Individual> iterator() {
        return members().iterator();
    }

    @Override
    public String toString() {
        return String.format("Population[%s, size=%d]", name, members.size());
    }
}
