package io.github.manjago.esdl.core;

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.RandomProviderDefaultState;
import org.apache.commons.rng.sampling.ListSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.io.Serial;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Deterministic pseudo-random stream with save/restore state capability.
 *
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP algorithm:
 * - Fast and high quality
 * - State is just 2 longs (128 bits)
 * - Supports explicit save/restore for archived runs
 *
 * IMPORTANT: Do not change RandomSource between versions!
 * Changing algorithm would break experiment repeatability.
 */
public final class StreamRng {

    /**
     * Fixed algorithm - DO NOT CHANGE for backwards compatibility.
     */
    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final String name;
    private final long initialSeed;
    private final RestorableUniformRandomProvider rng;
    private final ZigguratSampler.NormalizedGaussian gaussian;

    /**
     * Create new stream with given seed.
     */
    public StreamRng(String name, long seed) {
        this.name = name;
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
    }

    private StreamRng(String name, long initialSeed, RandomProviderState state) {
        this(name, initialSeed);
        this.rng.restoreState(state);
    }

    // ========== Draws ==========

    /**
     * Returns uniformly distributed int.
     */
    public int nextInt() {
        return rng.nextInt();
    }

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed int in [lowest, highest] (both inclusive).
     */
    public int nextIntInclusive(int lowest, int highest) {
        if (highest < lowest) {
            throw new IllegalArgumentException("highest < lowest: " + highest + " < " + lowest);
        }
        // Span as long: [MIN_VALUE, MAX_VALUE] has 2^32 values
        long span = (long) highest - lowest + 1;
        return (int) (lowest + rng.nextLong(span));
    }

    /**
     * Returns uniformly distributed long.
     */
    public long nextLong() {
        return rng.nextLong();
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Returns uniformly distributed double in [lowest, highest).
     */
    public double nextDouble(double lowest, double highest) {
        return lowest + rng.nextDouble() * (highest - lowest);
    }

    /**
     * Returns a standard normal sample (mean 0, deviation 1).
     */
    public double nextGaussian() {
        return gaussian.sample();
    }

    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    /**
     * Returns uniformly distributed boolean.
     */
    public boolean nextBoolean() {
        return rng.nextBoolean();
    }

    /**
     * Shuffle the list in place.
     */
    public <T> void shuffle(List<T> list) {
        ListSampler.shuffle(rng, list);
    }

    // ========== State Management ==========

    public String getName() {
        return name;
    }

    /**
     * Get initial seed (for logging/reproduction).
     */
    public long getInitialSeed() {
        return initialSeed;
    }

    /**
     * Save current state.
     */
    public StreamState saveState() {
        RandomProviderState state = rng.saveState();
        byte[] stateBytes = ((RandomProviderDefaultState) state).getState();
        return new StreamState(initialSeed, stateBytes);
    }

    /**
     * Restore a stream from saved state.
     */
    public static StreamRng restore(String name, StreamState state) {
        RandomProviderState rngState = new RandomProviderDefaultState(state.stateBytes());
        return new StreamRng(name, state.initialSeed(), rngState);
    }

    // ========== State Record ==========

    /**
     * Immutable snapshot of stream state for serialization.
     */
    public record StreamState(long initialSeed, byte[] stateBytes) implements Serializable {

        @Serial
        private static final long serialVersionUID = 1L;

        /**
         * Format: [8 bytes seed][4 bytes length][N bytes state]
         */
        public byte[] toBytes() {
            ByteBuffer buf = ByteBuffer.allocate(8 + 4 + stateBytes.length);
            buf.putLong(initialSeed);
            buf.putInt(stateBytes.length);
            buf.put(stateBytes);
            return buf.array();
        }

        public static StreamState fromBytes(byte[] bytes) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            long seed = buf.getLong();
            int len = buf.getInt();
            byte[] stateBytes = new byte[len];
            buf.get(stateBytes);
            return new StreamState(seed, stateBytes);
        }
    }
}
