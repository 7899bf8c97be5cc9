package io.github.manjago.esdl.lang;

/**
 * Malformed pipeline text. No partial program is produced.
 */
public class SyntaxException extends EsdlException {

    private final String offendingToken;

    public SyntaxException(String message, Token token) {
        super(message + " (at '" + token.describe() + "')", token.location());
        this.offendingToken = token.text();
    }

    public SyntaxException(String message, SourceLocation location, String offendingToken) {
        super(message + " (at '" + offendingToken + "')", location);
        this.offendingToken = offendingToken;
    }

    /**
     * Raw text of the token the parser stopped at.
     */
    public String getOffendingToken() {
        return offendingToken;
    }
}
