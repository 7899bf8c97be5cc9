package io.github.manjago.esdl.landscape;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.SpeciesKind;
import io.github.manjago.esdl.core.StreamRng;

/**
 * Number of set bits. The optimum of a length-n genome is n.
 */
public class OneMax implements Landscape {

    public static final String NAME = "onemax";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SpeciesKind getKind() {
        return SpeciesKind.BINARY;
    }

    @Override
    public double evaluate(Genome genome, StreamRng rng) {
        int ones = 0;
        for (boolean bit : genome.bits()) {
            if (bit) {
                ones++;
            }
        }
        return ones;
    }
}
