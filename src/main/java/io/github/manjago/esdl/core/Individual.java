package io.github.manjago.esdl.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One candidate solution: genome, cached fitness and statistic tags.
 * <p>
 * Fitness is unset until first evaluated and then cached until
 * {@link #invalidateFitness()} is called. Higher fitness is better; an unset or
 * {@code NaN} fitness sorts below every real value.
 * <p>
 * An individual is owned by at most one {@link Population} at a time. Populations
 * store a copy when handed an individual that another population still owns.
 */
public class Individual {

    /**
     * Orders individuals by fitness, worst first. Unset and NaN fitness sort lowest.
     */
    public static final Comparator<Individual> BY_FITNESS =
            Comparator.comparingDouble(Individual::rankingFitness);

    private final Genome genome;
    private final long birth;
    private final Map<String, Integer> statistic;

    private double fitness = Double.NaN;
    private boolean evaluated;

    // Population currently holding this individual (null = free)
    private Population owner;

    /**
     * Create a new individual.
     *
     * @param genome the genome
     * @param birth run-wide birth serial number
     */
    public Individual(@NotNull Genome genome, long birth) {
        this(genome, birth, Map.of());
    }

    public Individual(@NotNull Genome genome, long birth, Map<String, Integer> statistic) {
        this.genome = Objects.requireNonNull(genome, "genome");
        this.birth = birth;
        this.statistic = new LinkedHashMap<>(statistic);
    }

    // ========== Getters ==========

    public @NotNull Genome getGenome() {
        return genome;
    }

    public long getBirth() {
        return birth;
    }

    public Map<String, Integer> getStatistic() {
        return Collections.unmodifiableMap(statistic);
    }

    public void tag(String key, int value) {
        statistic.put(key, value);
    }

    // ========== Fitness ==========

    public boolean hasFitness() {
        return evaluated;
    }

    /**
     * Cached fitness, or {@code NaN} if not yet evaluated.
     */
    public double getFitness() {
        return fitness;
    }

    public void setFitness(double fitness) {
        this.fitness = fitness;
        this.evaluated = true;
    }

    /**
     * Forget the cached fitness so that the next evaluation recomputes it.
     */
    public void invalidateFitness() {
        this.fitness = Double.NaN;
        this.evaluated = false;
    }

    private double rankingFitness() {
        return Double.isNaN(fitness) ? Double.NEGATIVE_INFINITY : fitness;
    }

    // ========== Ownership ==========

    @Nullable Population getOwner() {
        return owner;
    }

    void setOwner(@Nullable Population owner) {
        this.owner = owner;
    }

    /**
     * Detached copy with the same genome, fitness, birth and statistics.
     */
    public Individual copy() {
        Individual copy = new Individual(genome, birth, statistic);
        copy.fitness = fitness;
        copy.evaluated = evaluated;
        return copy;
    }

    /**
     * Child with a new genome, unset fitness and a single statistic tag.
     */
    public Individual derive(@NotNull Genome childGenome, long childBirth, String statisticKey) {
        Individual child = new Individual(childGenome, childBirth);
        child.statistic.put(statisticKey, 1);
        return child;
    }

    // ========== Object methods ==========

    @Override
    public String toString() {
        return String.format("Individual#%d[%s, fitness=%s]",
                birth, genome, evaluated ? String.valueOf(fitness) : "unset");
    }
}
