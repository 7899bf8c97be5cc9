package io.github.manjago.esdl.run;

/**
 * Lifecycle of a {@link PipelineInterpreter}.
 */
public enum RunState {
    CREATED,
    INITIALIZING,
    RUNNING_GENERATION,
    TERMINATED
}
