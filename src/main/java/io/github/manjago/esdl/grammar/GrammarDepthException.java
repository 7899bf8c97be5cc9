package io.github.manjago.esdl.grammar;

/**
 * DEC_INDENT applied while the indent depth was already zero.
 */
public class GrammarDepthException extends GrammarException {

    public GrammarDepthException(String message) {
        super(message);
    }
}
