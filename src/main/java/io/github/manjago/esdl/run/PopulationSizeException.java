package io.github.manjago.esdl.run;

import io.github.manjago.esdl.lang.EsdlException;
import io.github.manjago.esdl.lang.SourceLocation;

/**
 * A FROM statement could not store exactly the requested number of individuals.
 */
public class PopulationSizeException extends EsdlException {

    private final String population;
    private final long requested;
    private final long produced;

    public PopulationSizeException(String message, String population, long requested, long produced,
                                   SourceLocation location) {
        super(message, location);
        this.population = population;
        this.requested = requested;
        this.produced = produced;
    }

    public String getPopulation() {
        return population;
    }

    /**
     * Requested count, or -1 for an unsized destination.
     */
    public long getRequested() {
        return requested;
    }

    public long getProduced() {
        return produced;
    }
}
