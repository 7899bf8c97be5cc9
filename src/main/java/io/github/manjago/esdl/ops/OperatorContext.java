package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.core.StreamRng;
import io.github.manjago.esdl.landscape.Landscape;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Per-run services available to operators.
 * <p>
 * Operators draw randomness only from {@link #breeding()}. Fitness is evaluated lazily
 * through the landscape, which receives the landscape stream.
 */
public class OperatorContext {

    /** Largest stream an operator may materialise; guards against draining an unbounded input. */
    public static final int MAX_MATERIALIZED = 1_000_000;

    private final RandomStreams streams;
    private final Landscape landscape;

    private long births;
    private long evaluations;

    public OperatorContext(RandomStreams streams, @Nullable Landscape landscape) {
        this.streams = streams;
        this.landscape = landscape;
    }

    public StreamRng breeding() {
        return streams.breeding();
    }

    public RandomStreams getStreams() {
        return streams;
    }

    public @Nullable Landscape getLandscape() {
        return landscape;
    }

    // ========== Fitness ==========

    /**
     * Cached fitness of an individual, evaluating it first if needed.
     */
    public double fitness(Individual individual) {
        if (!individual.hasFitness()) {
            evaluate(individual);
        }
        return individual.getFitness();
    }

    /**
     * Evaluate unconditionally and cache the result.
     */
    public void evaluate(Individual individual) {
        if (landscape == null) {
            throw new IllegalStateException("Fitness requested but no landscape is configured");
        }
        individual.setFitness(landscape.evaluate(individual.getGenome(), streams.landscape()));
        evaluations++;
    }

    public long getEvaluations() {
        return evaluations;
    }

    // ========== Births ==========

    /**
     * Next run-wide birth serial number.
     */
    public long nextBirth() {
        return births++;
    }

    public long getBirths() {
        return births;
    }

    // ========== Helpers ==========

    /**
     * Pull the whole input into a list.
     *
     * @throws IllegalStateException if the input looks unbounded
     */
    public List<Individual> drain(Iterator<Individual> input) {
        List<Individual> all = new ArrayList<>();
        while (input.hasNext()) {
            if (all.size() >= MAX_MATERIALIZED) {
                throw new IllegalStateException("Input stream exceeds " + MAX_MATERIALIZED
                        + " individuals; an unbounded selector probably feeds a sorting operator");
            }
            all.add(input.next());
        }
        return all;
    }
}
