package io.github.manjago.esdl.run;

import io.github.manjago.esdl.core.Population;

/**
 * Listener for pipeline events.
 *
 * Callbacks run synchronously on the interpreter thread. A population passed to
 * {@link #onYield} may be changed or discarded by the next statement, so keep a
 * {@link Population#snapshot()} rather than the population itself.
 */
public interface PipelineListener {

    /**
     * Called once the statements outside any block have run.
     */
    default void onInitialized(RunStats stats) {}

    /**
     * Called for every population published by YIELD. Members are already evaluated.
     *
     * @param name population name as written in the YIELD statement
     * @param population the live population
     * @param generation generations completed so far (0 while initializing)
     */
    default void onYield(String name, Population population, long generation) {}

    /**
     * Called after each full pass of the generation block.
     */
    default void onGeneration(RunStats stats) {}

    /**
     * Called when the run ends normally.
     */
    default void onTerminated(TerminationReason reason, RunStats stats) {}

    /**
     * No-op listener that does nothing.
     */
    PipelineListener NOOP = new PipelineListener() {};
}
