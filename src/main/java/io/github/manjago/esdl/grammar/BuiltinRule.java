package io.github.manjago.esdl.grammar;

import org.jetbrains.annotations.Nullable;

/**
 * Rules supplied by the host and never authored in a grammar mapping.
 */
public enum BuiltinRule {

    /** Consumes one codon and emits one of the configured terminal names. */
    TERMINAL,

    /** Emits the current indent depth as spaces. */
    INDENT,

    /** Increases the indent depth by one. */
    INC_INDENT,

    /** Decreases the indent depth by one; never below zero. */
    DEC_INDENT,

    /** Emits a line break. */
    NEWLINE;

    public static @Nullable BuiltinRule of(String name) {
        for (BuiltinRule rule : values()) {
            if (rule.name().equals(name)) {
                return rule;
            }
        }
        return null;
    }

    public static boolean isBuiltin(String name) {
        return of(name) != null;
    }
}
