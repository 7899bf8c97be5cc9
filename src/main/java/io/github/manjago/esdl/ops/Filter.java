package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Individual;

import java.util.Iterator;

/**
 * Stage of an operator chain: turns one lazy stream of individuals into another.
 * <p>
 * Implementations pull from {@code input} only as far as needed and draw random
 * numbers when an element is produced, never ahead of time.
 */
@FunctionalInterface
public interface Filter {

    Iterator<Individual> apply(Iterator<Individual> input, OperatorArgs args, OperatorContext context);
}
