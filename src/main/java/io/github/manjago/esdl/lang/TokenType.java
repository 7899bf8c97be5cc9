package io.github.manjago.esdl.lang;

import java.util.Locale;
import java.util.Map;

/**
 * Token categories of the pipeline language.
 */
public enum TokenType {
    // Keywords (matched case-insensitively)
    FROM, SELECT, USING, YIELD, BEGIN, END, REPEAT, EVAL,
    TRUE, FALSE, AND, OR, NOT,

    // Literals and names
    IDENTIFIER, NUMBER, STRING,

    // Punctuation and operators
    LEFT_PAREN, RIGHT_PAREN, COMMA, ASSIGN,
    PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
    EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Structure
    NEWLINE, SEMICOLON, END_OF_FILE;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("FROM", FROM),
            Map.entry("SELECT", SELECT),
            Map.entry("USING", USING),
            Map.entry("YIELD", YIELD),
            Map.entry("BEGIN", BEGIN),
            Map.entry("END", END),
            Map.entry("REPEAT", REPEAT),
            Map.entry("EVAL", EVAL),
            Map.entry("EVALUATE", EVAL),
            Map.entry("TRUE", TRUE),
            Map.entry("FALSE", FALSE),
            Map.entry("AND", AND),
            Map.entry("OR", OR),
            Map.entry("NOT", NOT)
    );

    /**
     * Keyword for a word, or {@link #IDENTIFIER} if it is not reserved.
     */
    public static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word.toUpperCase(Locale.ROOT), IDENTIFIER);
    }

    /**
     * Statement terminators: newline, semicolon or end of input.
     */
    public boolean isTerminator() {
        return this == NEWLINE || this == SEMICOLON || this == END_OF_FILE;
    }
}
