package io.github.manjago.esdl.run;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Snapshot of run statistics.
 */
public record RunStats(
    long generation,
    long births,
    long evaluations,
    double bestFitness,             // NaN until something was yielded
    long lastImprovement,           // generation of the last best-fitness improvement
    Map<String, Integer> populationSizes,
    long elapsedMillis
) {

    public RunStats {
        populationSizes = Map.copyOf(populationSizes);
    }

    public boolean hasBestFitness() {
        return !Double.isNaN(bestFitness);
    }

    /**
     * Generations per second since the run started.
     */
    public double generationsPerSecond() {
        return elapsedMillis > 0 ? generation * 1000.0 / elapsedMillis : 0;
    }

    @Override
    public String toString() {
        return String.format("""
            === Run Statistics ===
            Generations:      %,d (%.1f/sec)
            Births:           %,d
            Evaluations:      %,d
            Best fitness:     %s (since generation %d)
            Populations:      %s
            Elapsed:          %,d ms
            """,
            generation, generationsPerSecond(),
            births,
            evaluations,
            hasBestFitness() ? String.valueOf(bestFitness) : "n/a", lastImprovement,
            populationSizes.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ")),
            elapsedMillis
        );
    }
}
