package io.github.manjago.esdl.grammar;

/**
 * One token of a production: literal text or a rule reference.
 */
public record Symbol(Kind kind, String value) {

    public enum Kind { LITERAL, RULE }

    public static Symbol literal(String text) {
        return new Symbol(Kind.LITERAL, text);
    }

    public static Symbol rule(String name) {
        return new Symbol(Kind.RULE, name);
    }

    public boolean isRule() {
        return kind == Kind.RULE;
    }

    @Override
    public String toString() {
        return kind == Kind.LITERAL ? '"' + value + '"' : value;
    }
}
