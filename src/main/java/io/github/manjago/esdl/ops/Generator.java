package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Individual;

import java.util.Iterator;

/**
 * Source operator: creates new individuals from nothing.
 */
@FunctionalInterface
public interface Generator {

    Iterator<Individual> generate(OperatorArgs args, OperatorContext context);
}
