package io.github.manjago.esdl.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.grammar.ExpansionOptions;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Run settings of one experiment.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf under {@code esdl}.
 */
public record ExperimentConfig(
    // Random streams
    long breedingSeed,
    long landscapeSeed,
    boolean timeBasedSeed,

    // Limits
    long maxGenerations,        // 0 = unbounded
    double fitnessTarget,       // NaN = off
    int stableGenerations,      // 0 = off

    // Grammar expansion
    ExpansionOptions expansion,

    // Evaluation
    String landscape,           // "none" = no evaluator

    // Reporting and persistence
    int reportInterval,
    @Nullable Path archiveFile
) {

    /**
     * Load default configuration.
     */
    public static ExperimentConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static ExperimentConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load()).resolve();
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static ExperimentConfig fromConfig(Config config) {
        Config c = config.getConfig("esdl");
        String archive = c.getString("archive.file");

        return new ExperimentConfig(
            c.getLong("seeds.breeding"),
            c.getLong("seeds.landscape"),
            c.getBoolean("seeds.time-based"),
            c.getLong("limits.generations"),
            c.hasPath("limits.fitness") ? c.getDouble("limits.fitness") : Double.NaN,
            c.getInt("limits.stable"),
            ExpansionOptions.fromConfig(c.getConfig("expansion")),
            c.getString("landscape"),
            c.getInt("reporting.interval"),
            archive.isBlank() ? null : Path.of(archive)
        );
    }

    public boolean hasFitnessTarget() {
        return !Double.isNaN(fitnessTarget);
    }

    /**
     * Random streams seeded as configured.
     */
    public RandomStreams createStreams() {
        return RandomStreams.create(breedingSeed, landscapeSeed, timeBasedSeed);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .breedingSeed(breedingSeed)
            .landscapeSeed(landscapeSeed)
            .timeBasedSeed(timeBasedSeed)
            .maxGenerations(maxGenerations)
            .fitnessTarget(fitnessTarget)
            .stableGenerations(stableGenerations)
            .expansion(expansion)
            .landscape(landscape)
            .reportInterval(reportInterval)
            .archiveFile(archiveFile);
    }

    public static class Builder {
        private long breedingSeed = RandomStreams.DEFAULT_SEED;
        private long landscapeSeed = RandomStreams.DEFAULT_SEED;
        private boolean timeBasedSeed = false;
        private long maxGenerations = 100;
        private double fitnessTarget = Double.NaN;
        private int stableGenerations = 0;
        private ExpansionOptions expansion = ExpansionOptions.defaults();
        private String landscape = "none";
        private int reportInterval = 10;
        private Path archiveFile = null;

        public Builder breedingSeed(long seed) { this.breedingSeed = seed; return this; }
        public Builder landscapeSeed(long seed) { this.landscapeSeed = seed; return this; }
        public Builder timeBasedSeed(boolean timeBased) { this.timeBasedSeed = timeBased; return this; }
        public Builder maxGenerations(long max) { this.maxGenerations = max; return this; }
        public Builder fitnessTarget(double target) { this.fitnessTarget = target; return this; }
        public Builder stableGenerations(int generations) { this.stableGenerations = generations; return this; }
        public Builder expansion(ExpansionOptions options) { this.expansion = options; return this; }
        public Builder landscape(String name) { this.landscape = name; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }
        public Builder archiveFile(Path file) { this.archiveFile = file; return this; }

        public ExperimentConfig build() {
            return new ExperimentConfig(
                breedingSeed, landscapeSeed, timeBasedSeed,
                maxGenerations, fitnessTarget, stableGenerations,
                expansion, landscape, reportInterval, archiveFile
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            ExperimentConfig:
              seeds.breeding:         %d
              seeds.landscape:        %d
              seeds.time-based:       %s
              limits.generations:     %s
              limits.fitness:         %s
              limits.stable:          %s
              expansion.max-depth:    %d
              expansion.wrap-policy:  %s
              landscape:              %s
              reporting.interval:     %,d generations
              archive.file:           %s
            """,
            breedingSeed,
            landscapeSeed,
            timeBasedSeed,
            maxGenerations == 0 ? "unbounded" : String.format("%,d", maxGenerations),
            hasFitnessTarget() ? String.valueOf(fitnessTarget) : "off",
            stableGenerations == 0 ? "off" : String.valueOf(stableGenerations),
            expansion.maxDepth(),
            expansion.wrapPolicy(),
            landscape,
            reportInterval,
            archiveFile == null ? "disabled" : archiveFile
        );
    }
}
