package io.github.manjago.esdl.landscape;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.SpeciesKind;
import io.github.manjago.esdl.core.StreamRng;

/**
 * Fitness function of an experiment.
 * <p>
 * Higher is better. Implementations may draw only from the stream they are given,
 * which is always the run's landscape stream.
 */
public interface Landscape {

    String getName();

    /**
     * Genome kind this landscape understands.
     */
    SpeciesKind getKind();

    double evaluate(Genome genome, StreamRng rng);
}
