package io.github.manjago.esdl.lang;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One lexical token.
 *
 * @param type token category
 * @param text raw source text
 * @param literal parsed value for numbers ({@code Long} or {@code Double}) and strings
 * @param line 1-based line
 * @param column 1-based column of the first character
 */
public record Token(@NotNull TokenType type, @NotNull String text, @Nullable Object literal, int line, int column) {

    public SourceLocation location() {
        return new SourceLocation(line, column);
    }

    /**
     * Human readable form for diagnostics.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "<newline>";
            case END_OF_FILE -> "<end of input>";
            default -> text;
        };
    }

    @Override
    public String toString() {
        return type + "(" + describe() + ")@" + line + ":" + column;
    }
}
