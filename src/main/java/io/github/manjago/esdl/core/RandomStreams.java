package io.github.manjago.esdl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The two independent random streams of one pipeline execution.
 *
 * <ul>
 *   <li>{@code breeding} - drawn by every stochastic operator (selection, crossover, mutation)</li>
 *   <li>{@code landscape} - drawn only by evaluator code</li>
 * </ul>
 *
 * Each stream is a separate generator object, so reseeding one never shifts the
 * other's sequence. Instances are never shared between concurrent runs.
 */
public final class RandomStreams {

    private static final Logger log = LoggerFactory.getLogger(RandomStreams.class);

    public static final long DEFAULT_SEED = 12345L;

    public static final String BREEDING = "breeding";
    public static final String LANDSCAPE = "landscape";

    private StreamRng breeding;
    private StreamRng landscape;

    public RandomStreams(long breedingSeed, long landscapeSeed) {
        requireSeed(breedingSeed);
        requireSeed(landscapeSeed);
        this.breeding = new StreamRng(BREEDING, breedingSeed);
        this.landscape = new StreamRng(LANDSCAPE, landscapeSeed);
    }

    private RandomStreams(StreamRng breeding, StreamRng landscape) {
        this.breeding = breeding;
        this.landscape = landscape;
    }

    /**
     * Streams resumed from saved states, e.g. read back from a yield archive.
     */
    public static RandomStreams restore(StreamRng.StreamState breeding, StreamRng.StreamState landscape) {
        log.debug("Restoring streams (breeding seed: {}, landscape seed: {})",
                breeding.initialSeed(), landscape.initialSeed());
        return new RandomStreams(StreamRng.restore(BREEDING, breeding), StreamRng.restore(LANDSCAPE, landscape));
    }

    /**
     * Both streams seeded with {@link #DEFAULT_SEED}.
     */
    public static RandomStreams withDefaults() {
        return new RandomStreams(DEFAULT_SEED, DEFAULT_SEED);
    }

    /**
     * Resolve seeds the way a host does: fixed seeds unless the time-based flag is set.
     */
    public static RandomStreams create(long breedingSeed, long landscapeSeed, boolean timeBased) {
        if (!timeBased) {
            return new RandomStreams(breedingSeed, landscapeSeed);
        }
        long now = System.nanoTime();
        long b = now & Long.MAX_VALUE;
        long l = Long.rotateLeft(now, 17) & Long.MAX_VALUE;
        log.info("Using time-based seeds (breeding: {}, landscape: {})", b, l);
        return new RandomStreams(b, l);
    }

    public StreamRng breeding() {
        return breeding;
    }

    public StreamRng landscape() {
        return landscape;
    }

    /**
     * Replace the breeding stream with a freshly seeded one.
     */
    public void reseedBreeding(long seed) {
        requireSeed(seed);
        breeding = new StreamRng(BREEDING, seed);
        log.debug("Breeding stream reseeded with {}", seed);
    }

    /**
     * Replace the landscape stream with a freshly seeded one.
     */
    public void reseedLandscape(long seed) {
        requireSeed(seed);
        landscape = new StreamRng(LANDSCAPE, seed);
        log.debug("Landscape stream reseeded with {}", seed);
    }

    public long breedingSeed() {
        return breeding.getInitialSeed();
    }

    public long landscapeSeed() {
        return landscape.getInitialSeed();
    }

    private static void requireSeed(long seed) {
        if (seed < 0) {
            throw new IllegalArgumentException("Seed must be non-negative: " + seed);
        }
    }
}
