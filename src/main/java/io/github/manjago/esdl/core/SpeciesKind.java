package io.github.manjago.esdl.core;

import org.jetbrains.annotations.Nullable;

/**
 * Genome representation tag.
 * <p>
 * The interpreter and operator registry only see this tag plus an opaque payload;
 * operators that care about the representation switch on it.
 */
public enum SpeciesKind {

    /** Fixed- or variable-length bit string. Payload: {@code boolean[]}. */
    BINARY("binary"),

    /** Bounded integers. Payload: {@code int[]}. */
    INTEGER("int"),

    /** Bounded reals. Payload: {@code double[]}. */
    REAL("real"),

    /** Grammatical Evolution codons. Payload: {@code int[]}, mapped through a grammar. */
    GE("ge");

    private final String shortName;

    SpeciesKind(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * Genes are integers (integer and GE species).
     */
    public boolean isIntegral() {
        return this == INTEGER || this == GE;
    }

    /**
     * Find kind by short name (case-insensitive).
     */
    public static @Nullable SpeciesKind fromShortName(String name) {
        for (SpeciesKind kind : values()) {
            if (kind.shortName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        return null;
    }
}
