package io.github.manjago.esdl.lang;

import org.jetbrains.annotations.Nullable;

/**
 * Base class for every fatal error of a pipeline definition or run.
 * <p>
 * Carries the source location of the offending construct when one is known,
 * and prefixes the message with it.
 */
public abstract class EsdlException extends Exception {

    private final SourceLocation location;
    private final String detail;

    protected EsdlException(String message, @Nullable SourceLocation location) {
        this(message, location, null);
    }

    protected EsdlException(String message, @Nullable SourceLocation location, @Nullable Throwable cause) {
        super(format(message, location), cause);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.detail = message;
    }

    /**
     * Message without the location prefix.
     */
    public String getDetail() {
        return detail;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.line();
    }

    public int getColumn() {
        return location.column();
    }

    private static String format(String message, @Nullable SourceLocation location) {
        if (location == null || !location.isKnown()) {
            return message;
        }
        return "Line " + location.line() + ", column " + location.column() + ": " + message;
    }
}
