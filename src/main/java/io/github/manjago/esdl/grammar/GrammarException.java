package io.github.manjago.esdl.grammar;

/**
 * Base class for grammar definition and expansion failures.
 */
public class GrammarException extends Exception {

    public GrammarException(String message) {
        super(message);
    }
}
