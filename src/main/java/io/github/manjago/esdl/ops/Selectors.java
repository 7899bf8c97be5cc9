package io.github.manjago.esdl.ops;

import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.StreamRng;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Built-in selection operators. Selectors pass individuals through unchanged; the
 * destination population decides whether they are copied.
 */
public final class Selectors {

    private Selectors() {
    }

    public static void registerAll(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.filter("select_all",
                "Every input individual, in order",
                Cardinality.AT_LEAST,
                (input, args, ctx) -> input));

        registry.register(OperatorDescriptor.filter("repeat",
                "The input in order, restarting at the end forever",
                Cardinality.UNBOUNDED,
                (input, args, ctx) -> repeat(ctx.drain(input))));

        registry.register(OperatorDescriptor.filter("best",
                "Input sorted by decreasing fitness",
                Cardinality.AT_LEAST,
                (input, args, ctx) -> sorted(input, ctx, true)));

        registry.register(OperatorDescriptor.filter("worst",
                "Input sorted by increasing fitness",
                Cardinality.AT_LEAST,
                (input, args, ctx) -> sorted(input, ctx, false)));

        registry.register(OperatorDescriptor.filter("best_only",
                "The fittest individual, repeated forever",
                Cardinality.UNBOUNDED,
                (input, args, ctx) -> only(input, ctx, true)));

        registry.register(OperatorDescriptor.filter("worst_only",
                "The least fit individual, repeated forever",
                Cardinality.UNBOUNDED,
                (input, args, ctx) -> only(input, ctx, false)));

        registry.register(OperatorDescriptor.filter("tournament",
                "Best of k random contenders; greediness is the chance the best one wins",
                Cardinality.UNBOUNDED,
                (input, args, ctx) -> tournament(ctx.drain(input), args.getInt("k"),
                        args.getBoolean("replacement"), args.getDouble("greediness"), ctx),
                ParamSpec.integer("k", 2),
                ParamSpec.bool("replacement", true),
                ParamSpec.real("greediness", 1.0)));

        registry.register(OperatorDescriptor.filter("binary_tournament",
                "Tournament with k = 2",
                Cardinality.UNBOUNDED,
                (input, args, ctx) -> tournament(ctx.drain(input), 2,
                        args.getBoolean("replacement"), args.getDouble("greediness"), ctx),
                ParamSpec.bool("replacement", true),
                ParamSpec.real("greediness", 1.0)));

        registry.register(OperatorDescriptor.filter("uniform_random",
                "Random picks regardless of fitness",
                Cardinality.UNBOUNDED,
                (input, args, ctx) -> uniformRandom(ctx.drain(input), args.getBoolean("replacement"), ctx),
                ParamSpec.bool("replacement", true)));

        registry.register(OperatorDescriptor.filter("uniform_shuffle",
                "The input in random order, each individual once",
                Cardinality.AT_LEAST,
                (input, args, ctx) -> {
                    List<Individual> all = ctx.drain(input);
                    ctx.breeding().shuffle(all);
                    return all.iterator();
                }));

        registry.register(OperatorDescriptor.filter("fitness_proportional",
                "Roulette-wheel selection with replacement",
                Cardinality.UNBOUNDED,
                (input, args, ctx) -> fitnessProportional(ctx.drain(input), ctx)));
    }

    // ========== Implementations ==========

    private static Iterator<Individual> repeat(List<Individual> group) {
        return new LazyIterator<>() {
            private int index;

            @Override
            protected Individual computeNext() {
                if (group.isEmpty()) {
                    return null;
                }
                Individual next = group.get(index);
                index = (index + 1) % group.size();
                return next;
            }
        };
    }

    private static Iterator<Individual> sorted(Iterator<Individual> input, OperatorContext ctx, boolean best) {
        List<Individual> all = ctx.drain(input);
        all.forEach(ctx::fitness);
        Comparator<Individual> order = best ? Individual.BY_FITNESS.reversed() : Individual.BY_FITNESS;
        // List.sort is stable: equal fitness keeps input order
        all.sort(order);
        return all.iterator();
    }

    private static Iterator<Individual> only(Iterator<Individual> input, OperatorContext ctx, boolean best) {
        List<Individual> all = ctx.drain(input);
        all.forEach(ctx::fitness);
        if (all.isEmpty()) {
            return all.iterator();
        }
        Individual chosen = all.get(0);
        for (Individual candidate : all) {
            int cmp = Individual.BY_FITNESS.compare(candidate, chosen);
            if (best ? cmp > 0 : cmp < 0) {
                chosen = candidate;
            }
        }
        return repeat(List.of(chosen));
    }

    /**
     * With replacement the tournament never ends. Without replacement each winner
     * leaves the pool; once fewer than k remain they are returned best first.
     */
    static Iterator<Individual> tournament(List<Individual> pool, int k, boolean replacement,
                                           double greediness, OperatorContext ctx) {
        if (k < 2) {
            throw new IllegalArgumentException("Tournament size k must be at least 2, got " + k);
        }
        List<Individual> remaining = new ArrayList<>(pool);
        return new LazyIterator<>() {
            @Override
            protected Individual computeNext() {
                if (remaining.isEmpty()) {
                    return null;
                }
                StreamRng rng = ctx.breeding();
                if (!replacement && remaining.size() < k) {
                    remaining.forEach(ctx::fitness);
                    remaining.sort(Individual.BY_FITNESS.reversed());
                    return remaining.remove(0);
                }
                List<Integer> contenders = new ArrayList<>(k);
                for (int i = 0; i < k; i++) {
                    contenders.add(rng.nextInt(remaining.size()));
                }
                int winner = contenders.get(0);
                for (int index : contenders) {
                    if (ctx.fitness(remaining.get(index)) > ctx.fitness(remaining.get(winner))) {
                        winner = index;
                    }
                }
                int chosen = winner;
                if (greediness < 1.0 && !rng.nextBoolean(greediness)) {
                    contenders.remove(Integer.valueOf(winner));
                    chosen = contenders.get(rng.nextInt(contenders.size()));
                }
                return replacement ? remaining.get(chosen) : remaining.remove(chosen);
            }
        };
    }

    private static Iterator<Individual> uniformRandom(List<Individual> pool, boolean replacement,
                                                      OperatorContext ctx) {
        List<Individual> remaining = new ArrayList<>(pool);
        return new LazyIterator<>() {
            @Override
            protected Individual computeNext() {
                if (remaining.isEmpty()) {
                    return null;
                }
                int index = ctx.breeding().nextInt(remaining.size());
                return replacement ? remaining.get(index) : remaining.remove(index);
            }
        };
    }

    /**
     * Weights are fitness clipped at zero; if every weight is zero the pick is uniform.
     */
    private static Iterator<Individual> fitnessProportional(List<Individual> pool, OperatorContext ctx) {
        double[] cumulative = new double[pool.size()];
        double total = 0;
        for (int i = 0; i < pool.size(); i++) {
            double f = ctx.fitness(pool.get(i));
            total += Double.isNaN(f) || f < 0 ? 0 : f;
            cumulative[i] = total;
        }
        double sum = total;
        return new LazyIterator<>() {
            @Override
            protected Individual computeNext() {
                if (pool.isEmpty()) {
                    return null;
                }
                StreamRng rng = ctx.breeding();
                if (sum <= 0) {
                    return pool.get(rng.nextInt(pool.size()));
                }
                double target = rng.nextDouble() * sum;
                for (int i = 0; i < cumulative.length; i++) {
                    if (target < cumulative[i]) {
                        return pool.get(i);
                    }
                }
                return pool.get(pool.size() - 1);
            }
        };
    }
}
