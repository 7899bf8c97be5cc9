package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.StreamRng;

import java.util.Iterator;
import java.util.function.Function;

/**
 * Built-in generators. Each one produces fresh random individuals forever.
 * <p>
 * Lengths: a positive {@code length} fixes the genome length, otherwise each genome
 * gets a uniform length in {@code [shortest, longest]}.
 */
public final class Generators {

    private Generators() {
    }

    public static void registerAll(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.generator("random_binary",
                "Random bit strings",
                (args, ctx) -> generate(args, ctx, rng -> {
                    boolean[] bits = new boolean[length(args, rng)];
                    for (int i = 0; i < bits.length; i++) {
                        bits[i] = rng.nextBoolean();
                    }
                    return Genome.binary(bits);
                }),
                ParamSpec.integer("length", 0),
                ParamSpec.integer("shortest", 10),
                ParamSpec.integer("longest", 10)));

        registry.register(OperatorDescriptor.generator("random_int",
                "Random integer vectors in [lowest, highest]",
                (args, ctx) -> generate(args, ctx, rng -> {
                    int lowest = args.getInt("lowest");
                    int highest = args.getInt("highest");
                    int[] genes = new int[length(args, rng)];
                    for (int i = 0; i < genes.length; i++) {
                        genes[i] = rng.nextIntInclusive(lowest, highest);
                    }
                    return Genome.integers(genes, lowest, highest);
                }),
                ParamSpec.integer("length", 0),
                ParamSpec.integer("shortest", 10),
                ParamSpec.integer("longest", 10),
                ParamSpec.integer("lowest", 0),
                ParamSpec.integer("highest", 9)));

        registry.register(OperatorDescriptor.generator("random_real",
                "Random real vectors in [lowest, highest)",
                (args, ctx) -> generate(args, ctx, rng -> {
                    double lowest = args.getDouble("lowest");
                    double highest = args.getDouble("highest");
                    double[] genes = new double[length(args, rng)];
                    for (int i = 0; i < genes.length; i++) {
                        genes[i] = rng.nextDouble(lowest, highest);
                    }
                    return Genome.reals(genes, lowest, highest);
                }),
                ParamSpec.integer("length", 0),
                ParamSpec.integer("shortest", 10),
                ParamSpec.integer("longest", 10),
                ParamSpec.real("lowest", 0.0),
                ParamSpec.real("highest", 1.0)));

        registry.register(OperatorDescriptor.generator("random_ge",
                "Random codon sequences for grammatical evolution",
                (args, ctx) -> generate(args, ctx, rng -> {
                    int lowest = args.getInt("lowest");
                    int highest = args.getInt("highest");
                    if (lowest < 0) {
                        throw new IllegalArgumentException("Codons must be non-negative, lowest=" + lowest);
                    }
                    int[] codons = new int[length(args, rng)];
                    for (int i = 0; i < codons.length; i++) {
                        codons[i] = rng.nextIntInclusive(lowest, highest);
                    }
                    return Genome.codons(codons, lowest, highest);
                }),
                ParamSpec.integer("length", 0),
                ParamSpec.integer("shortest", 20),
                ParamSpec.integer("longest", 20),
                ParamSpec.integer("lowest", 0),
                ParamSpec.integer("highest", 255)));
    }

    private static Iterator<Individual> generate(OperatorArgs args, OperatorContext ctx,
                                                 Function<StreamRng, Genome> factory) {
        return new LazyIterator<>() {
            @Override
            protected Individual computeNext() {
                Genome genome = factory.apply(ctx.breeding());
                return new Individual(genome, ctx.nextBirth());
            }
        };
    }

    private static int length(OperatorArgs args, StreamRng rng) {
        int length = args.getInt("length");
        if (length > 0) {
            return length;
        }
        int shortest = args.getInt("shortest");
        int longest = args.getInt("longest");
        if (shortest < 0 || longest < shortest) {
            throw new IllegalArgumentException("Invalid length range [" + shortest + ", " + longest + "]");
        }
        return shortest == longest ? shortest : rng.nextIntInclusive(shortest, longest);
    }
}
