package io.github.manjago.esdl.core;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable genome: a species tag plus an opaque payload.
 * <p>
 * Payload by kind:
 * <ul>
 *   <li>{@link SpeciesKind#BINARY} - {@code boolean[]}</li>
 *   <li>{@link SpeciesKind#INTEGER}, {@link SpeciesKind#GE} - {@code int[]}</li>
 *   <li>{@link SpeciesKind#REAL} - {@code double[]}</li>
 * </ul>
 * Integer, GE and real genomes carry the inclusive value bounds used at initialisation,
 * so mutation can reintroduce values that are missing from the current genes.
 * Accessors return copies; operators build new genomes with the {@code with*} methods.
 */
public final class Genome {

    private final SpeciesKind kind;
    private final Object payload;
    private final double lowest;
    private final double highest;

    private Genome(SpeciesKind kind, Object payload, double lowest, double highest) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.lowest = lowest;
        this.highest = highest;
    }

    // ========== Factories ==========

    public static @NotNull Genome binary(boolean[] bits) {
        return new Genome(SpeciesKind.BINARY, bits.clone(), 0, 1);
    }

    public static @NotNull Genome integers(int[] genes, int lowest, int highest) {
        checkBounds(lowest, highest);
        return new Genome(SpeciesKind.INTEGER, genes.clone(), lowest, highest);
    }

    public static @NotNull Genome reals(double[] genes, double lowest, double highest) {
        checkBounds(lowest, highest);
        return new Genome(SpeciesKind.REAL, genes.clone(), lowest, highest);
    }

    public static @NotNull Genome codons(int[] codons, int lowest, int highest) {
        checkBounds(lowest, highest);
        for (int codon : codons) {
            if (codon < 0) {
                throw new IllegalArgumentException("Codons must be non-negative: " + codon);
            }
        }
        return new Genome(SpeciesKind.GE, codons.clone(), lowest, highest);
    }

    private static void checkBounds(double lowest, double highest) {
        if (highest < lowest) {
            throw new IllegalArgumentException("highest < lowest: " + highest + " < " + lowest);
        }
    }

    // ========== Accessors ==========

    public @NotNull SpeciesKind getKind() {
        return kind;
    }

    public int length() {
        return switch (kind) {
            case BINARY -> ((boolean[]) payload).length;
            case INTEGER, GE -> ((int[]) payload).length;
            case REAL -> ((double[]) payload).length;
        };
    }

    public boolean[] bits() {
        require(SpeciesKind.BINARY);
        return ((boolean[]) payload).clone();
    }

    /**
     * Integer genes of an {@code INTEGER} or {@code GE} genome.
     */
    public int[] ints() {
        if (!kind.isIntegral()) {
            throw new IllegalStateException("Genome is " + kind + ", not integral");
        }
        return ((int[]) payload).clone();
    }

    public double[] reals() {
        require(SpeciesKind.REAL);
        return ((double[]) payload).clone();
    }

    public double getLowest() {
        return lowest;
    }

    public double getHighest() {
        return highest;
    }

    // ========== Derivation ==========

    /**
     * New genome of the same kind and bounds with different integer genes.
     */
    public @NotNull Genome withInts(int[] genes) {
        if (kind == SpeciesKind.GE) {
            return codons(genes, (int) lowest, (int) highest);
        }
        require(SpeciesKind.INTEGER);
        return integers(genes, (int) lowest, (int) highest);
    }

    public @NotNull Genome withBits(boolean[] bits) {
        require(SpeciesKind.BINARY);
        return binary(bits);
    }

    public @NotNull Genome withReals(double[] genes) {
        require(SpeciesKind.REAL);
        return reals(genes, lowest, highest);
    }

    private void require(SpeciesKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Genome is " + kind + ", expected " + expected);
        }
    }

    // ========== Object methods ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Genome other)) return false;
        if (kind != other.kind || lowest != other.lowest || highest != other.highest) return false;
        return switch (kind) {
            case BINARY -> Arrays.equals((boolean[]) payload, (boolean[]) other.payload);
            case INTEGER, GE -> Arrays.equals((int[]) payload, (int[]) other.payload);
            case REAL -> Arrays.equals((double[]) payload, (double[]) other.payload);
        };
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        h = 31 * h + switch (kind) {
            case BINARY -> Arrays.hashCode((boolean[]) payload);
            case INTEGER, GE -> Arrays.hashCode((int[]) payload);
            case REAL -> Arrays.hashCode((double[]) payload);
        };
        return h;
    }

    /**
     * Compact gene listing, e.g. {@code 0110} for bits or {@code [4, 1, 2]} for integers.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case BINARY -> {
                StringBuilder sb = new StringBuilder();
                for (boolean bit : (boolean[]) payload) {
                    sb.append(bit ? '1' : '0');
                }
                yield sb.toString();
            }
            case INTEGER, GE -> Arrays.toString((int[]) payload);
            case REAL -> Arrays.toString((double[]) payload);
        };
    }
}
