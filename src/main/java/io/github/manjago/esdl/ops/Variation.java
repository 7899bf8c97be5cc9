package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.SpeciesKind;
import io.github.manjago.esdl.core.StreamRng;

import java.util.Iterator;

/**
 * Built-in crossover and mutation operators.
 * <p>
 * Individuals that are not selected for variation (under the per-pair or
 * per-individual rate) pass through unchanged. Changed individuals are new
 * children with unset fitness. A rate of 1.0 or more skips the random draw.
 */
public final class Variation {

    private Variation() {
    }

    public static void registerAll(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.filter("crossover_one",
                "Single-point crossover of consecutive pairs; an odd last individual is dropped",
                Cardinality.EXACT,
                (input, args, ctx) -> pairs(input, ctx, args.getDouble("per_pair_rate"),
                        (a, b, rng) -> crossOne(a, b, rng)),
                ParamSpec.real("per_pair_rate", 1.0)));

        registry.register(OperatorDescriptor.filter("crossover_uniform",
                "Gene-wise swap of consecutive pairs",
                Cardinality.EXACT,
                (input, args, ctx) -> {
                    double perGene = args.getDouble("per_gene_rate");
                    return pairs(input, ctx, args.getDouble("per_pair_rate"),
                            (a, b, rng) -> crossUniform(a, b, perGene, rng));
                },
                ParamSpec.real("per_pair_rate", 1.0),
                ParamSpec.real("per_gene_rate", 0.5)));

        registry.register(OperatorDescriptor.filter("mutate_random",
                "Replace genes with random values within the genome bounds",
                Cardinality.EXACT,
                (input, args, ctx) -> mutate(input, ctx, args,
                        (genome, perGene, rng) -> mutateRandom(genome, perGene, rng)),
                ParamSpec.real("per_indiv_rate", 1.0),
                ParamSpec.real("per_gene_rate", 0.1)));

        registry.register(OperatorDescriptor.filter("mutate_bitflip",
                "Invert bits of binary genomes",
                Cardinality.EXACT,
                (input, args, ctx) -> mutate(input, ctx, args,
                        (genome, perGene, rng) -> mutateBitflip(genome, perGene, rng)),
                ParamSpec.real("per_indiv_rate", 1.0),
                ParamSpec.real("per_gene_rate", 0.1)));

        registry.register(OperatorDescriptor.filter("mutate_gaussian",
                "Add normally distributed noise to numeric genes, clamped to the bounds",
                Cardinality.EXACT,
                (input, args, ctx) -> {
                    double sigma = args.getDouble("sigma");
                    return mutate(input, ctx, args,
                            (genome, perGene, rng) -> mutateNumeric(genome, perGene, rng,
                                    () -> rng.nextGaussian() * sigma));
                },
                ParamSpec.real("sigma", 0.1),
                ParamSpec.real("per_indiv_rate", 1.0),
                ParamSpec.real("per_gene_rate", 0.1)));

        registry.register(OperatorDescriptor.filter("mutate_delta",
                "Add or subtract a fixed step to numeric genes, clamped to the bounds",
                Cardinality.EXACT,
                (input, args, ctx) -> {
                    double step = args.getDouble("step_size");
                    double positive = args.getDouble("positive_rate");
                    return mutate(input, ctx, args,
                            (genome, perGene, rng) -> mutateNumeric(genome, perGene, rng,
                                    () -> rng.nextBoolean(positive) ? step : -step));
                },
                ParamSpec.real("step_size", 0.1),
                ParamSpec.real("per_indiv_rate", 1.0),
                ParamSpec.real("per_gene_rate", 0.1),
                ParamSpec.real("positive_rate", 0.5)));
    }

    // ========== Stream shapes ==========

    @FunctionalInterface
    interface Recombination {
        Genome[] cross(Genome a, Genome b, StreamRng rng);
    }

    @FunctionalInterface
    interface Mutation {
        Genome mutate(Genome genome, double perGeneRate, StreamRng rng);
    }

    @FunctionalInterface
    interface Delta {
        double next();
    }

    private static Iterator<Individual> pairs(Iterator<Individual> input, OperatorContext ctx,
                                              double perPairRate, Recombination recombination) {
        return new LazyIterator<>() {
            private Individual pending;

            @Override
            protected Individual computeNext() {
                if (pending != null) {
                    Individual result = pending;
                    pending = null;
                    return result;
                }
                if (!input.hasNext()) {
                    return null;
                }
                Individual first = input.next();
                if (!input.hasNext()) {
                    return null;
                }
                Individual second = input.next();

                StreamRng rng = ctx.breeding();
                if (perPairRate < 1.0 && !rng.nextBoolean(perPairRate)) {
                    pending = second;
                    return first;
                }
                Genome[] children = recombination.cross(first.getGenome(), second.getGenome(), rng);
                if (children == null) {
                    pending = second;
                    return first;
                }
                Individual child = first.derive(children[0], ctx.nextBirth(), "recombined");
                pending = second.derive(children[1], ctx.nextBirth(), "recombined");
                return child;
            }
        };
    }

    private static Iterator<Individual> mutate(Iterator<Individual> input, OperatorContext ctx,
                                               OperatorArgs args, Mutation mutation) {
        double perIndividual = args.getDouble("per_indiv_rate");
        double perGene = args.getDouble("per_gene_rate");
        return new LazyIterator<>() {
            @Override
            protected Individual computeNext() {
                if (!input.hasNext()) {
                    return null;
                }
                Individual individual = input.next();
                StreamRng rng = ctx.breeding();
                if (perIndividual < 1.0 && !rng.nextBoolean(perIndividual)) {
                    return individual;
                }
                Genome mutated = mutation.mutate(individual.getGenome(), perGene, rng);
                return individual.derive(mutated, ctx.nextBirth(), "mutated");
            }
        };
    }

    private static boolean chosen(double rate, StreamRng rng) {
        return rate >= 1.0 || rng.nextBoolean(rate);
    }

    // ========== Crossover ==========

    /**
     * Children of a single-point crossover, or {@code null} if a parent is too short to cut.
     * The cut is uniform in {@code [1, shorter length - 1]}.
     */
    static Genome[] crossOne(Genome a, Genome b, StreamRng rng) {
        requireSameKind(a, b);
        int shorter = Math.min(a.length(), b.length());
        if (shorter < 2) {
            return null;
        }
        int cut = rng.nextIntInclusive(1, shorter - 1);
        return switch (a.getKind()) {
            case BINARY -> {
                boolean[] x = a.bits();
                boolean[] y = b.bits();
                yield new Genome[]{a.withBits(join(x, y, cut)), b.withBits(join(y, x, cut))};
            }
            case INTEGER, GE -> {
                int[] x = a.ints();
                int[] y = b.ints();
                yield new Genome[]{a.withInts(join(x, y, cut)), b.withInts(join(y, x, cut))};
            }
            case REAL -> {
                double[] x = a.reals();
                double[] y = b.reals();
                yield new Genome[]{a.withReals(join(x, y, cut)), b.withReals(join(y, x, cut))};
            }
        };
    }

    /**
     * Swap each gene of the common prefix with probability {@code perGeneRate}.
     */
    static Genome[] crossUniform(Genome a, Genome b, double perGeneRate, StreamRng rng) {
        requireSameKind(a, b);
        int shorter = Math.min(a.length(), b.length());
        return switch (a.getKind()) {
            case BINARY -> {
                boolean[] x = a.bits();
                boolean[] y = b.bits();
                for (int i = 0; i < shorter; i++) {
                    if (chosen(perGeneRate, rng)) {
                        boolean t = x[i];
                        x[i] = y[i];
                        y[i] = t;
                    }
                }
                yield new Genome[]{a.withBits(x), b.withBits(y)};
            }
            case INTEGER, GE -> {
                int[] x = a.ints();
                int[] y = b.ints();
                for (int i = 0; i < shorter; i++) {
                    if (chosen(perGeneRate, rng)) {
                        int t = x[i];
                        x[i] = y[i];
                        y[i] = t;
                    }
                }
                yield new Genome[]{a.withInts(x), b.withInts(y)};
            }
            case REAL -> {
                double[] x = a.reals();
                double[] y = b.reals();
                for (int i = 0; i < shorter; i++) {
                    if (chosen(perGeneRate, rng)) {
                        double t = x[i];
                        x[i] = y[i];
                        y[i] = t;
                    }
                }
                yield new Genome[]{a.withReals(x), b.withReals(y)};
            }
        };
    }

    private static void requireSameKind(Genome a, Genome b) {
        if (a.getKind() != b.getKind()) {
            throw new IllegalArgumentException("Cannot recombine " + a.getKind() + " with " + b.getKind());
        }
    }

    // head of first up to cut, then tail of second from cut
    private static boolean[] join(boolean[] head, boolean[] tail, int cut) {
        boolean[] result = new boolean[tail.length];
        System.arraycopy(head, 0, result, 0, cut);
        System.arraycopy(tail, cut, result, cut, tail.length - cut);
        return result;
    }

    private static int[] join(int[] head, int[] tail, int cut) {
        int[] result = new int[tail.length];
        System.arraycopy(head, 0, result, 0, cut);
        System.arraycopy(tail, cut, result, cut, tail.length - cut);
        return result;
    }

    private static double[] join(double[] head, double[] tail, int cut) {
        double[] result = new double[tail.length];
        System.arraycopy(head, 0, result, 0, cut);
        System.arraycopy(tail, cut, result, cut, tail.length - cut);
        return result;
    }

    // ========== Mutation ==========

    static Genome mutateRandom(Genome genome, double perGeneRate, StreamRng rng) {
        return switch (genome.getKind()) {
            case BINARY -> {
                boolean[] bits = genome.bits();
                for (int i = 0; i < bits.length; i++) {
                    if (chosen(perGeneRate, rng)) {
                        bits[i] = rng.nextBoolean();
                    }
                }
                yield genome.withBits(bits);
            }
            case INTEGER, GE -> {
                int[] genes = genome.ints();
                int lowest = (int) genome.getLowest();
                int highest = (int) genome.getHighest();
                for (int i = 0; i < genes.length; i++) {
                    if (chosen(perGeneRate, rng)) {
                        genes[i] = rng.nextIntInclusive(lowest, highest);
                    }
                }
                yield genome.withInts(genes);
            }
            case REAL -> {
                double[] genes = genome.reals();
                for (int i = 0; i < genes.length; i++) {
                    if (chosen(perGeneRate, rng)) {
                        genes[i] = rng.nextDouble(genome.getLowest(), genome.getHighest());
                    }
                }
                yield genome.withReals(genes);
            }
        };
    }

    static Genome mutateBitflip(Genome genome, double perGeneRate, StreamRng rng) {
        if (genome.getKind() != SpeciesKind.BINARY) {
            throw new IllegalArgumentException("mutate_bitflip needs a binary genome, got " + genome.getKind());
        }
        boolean[] bits = genome.bits();
        for (int i = 0; i < bits.length; i++) {
            if (chosen(perGeneRate, rng)) {
                bits[i] = !bits[i];
            }
        }
        return genome.withBits(bits);
    }

    /**
     * Add a delta to each chosen gene and clamp to the genome bounds. Integer genes are rounded.
     */
    static Genome mutateNumeric(Genome genome, double perGeneRate, StreamRng rng, Delta delta) {
        double lowest = genome.getLowest();
        double highest = genome.getHighest();
        return switch (genome.getKind()) {
            case REAL -> {
                double[] genes = genome.reals();
                for (int i = 0; i < genes.length; i++) {
                    if (chosen(perGeneRate, rng)) {
                        genes[i] = clamp(genes[i] + delta.next(), lowest, highest);
                    }
                }
                yield genome.withReals(genes);
            }
            case INTEGER, GE -> {
                int[] genes = genome.ints();
                for (int i = 0; i < genes.length; i++) {
                    if (chosen(perGeneRate, rng)) {
                        genes[i] = (int) Math.round(clamp(genes[i] + delta.next(), lowest, highest));
                    }
                }
                yield genome.withInts(genes);
            }
            case BINARY -> throw new IllegalArgumentException("Numeric mutation needs a numeric genome, got BINARY");
        };
    }

    private static double clamp(double value, double lowest, double highest) {
        return value < lowest ? lowest : Math.min(value, highest);
    }
}
