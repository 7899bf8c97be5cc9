package io.github.manjago.esdl.run;

/**
 * Why a run ended normally.
 */
public enum TerminationReason {
    /** The configured number of generations has run. */
    GENERATION_LIMIT,
    /** A yielded individual reached the fitness target. */
    FITNESS_TARGET,
    /** The best yielded fitness stopped improving. */
    STABLE,
    /** The program has no generation block. */
    SINGLE_SHOT,
    /** {@link PipelineInterpreter#stop()} was called. */
    CANCELLED
}
