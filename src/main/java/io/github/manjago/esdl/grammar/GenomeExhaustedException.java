package io.github.manjago.esdl.grammar;

/**
 * The genome ran out of codons and the wrap policy does not allow reuse.
 */
public class GenomeExhaustedException extends GrammarException {

    private final int codonsUsed;

    public GenomeExhaustedException(String message, int codonsUsed) {
        super(message + " after " + codonsUsed + " codons");
        this.codonsUsed = codonsUsed;
    }

    public int getCodonsUsed() {
        return codonsUsed;
    }
}
