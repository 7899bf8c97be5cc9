package io.github.manjago.esdl.lang;

/**
 * Position in pipeline source text. Lines and columns start at 1.
 */
public record SourceLocation(int line, int column) {

    /** Location of things that do not come from source text (e.g. generated defaults). */
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? "line " + line + ", column " + column : "<unknown>";
    }
}
