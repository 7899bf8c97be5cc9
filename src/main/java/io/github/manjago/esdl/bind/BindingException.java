package io.github.manjago.esdl.bind;

import io.github.manjago.esdl.lang.EsdlException;
import io.github.manjago.esdl.lang.SourceLocation;
import org.jetbrains.annotations.Nullable;

/**
 * The program parsed but cannot be bound to the registry and configuration.
 */
public class BindingException extends EsdlException {

    public BindingException(String message, @Nullable SourceLocation location) {
        super(message, location);
    }

    public BindingException(String message, @Nullable SourceLocation location, @Nullable Throwable cause) {
        super(message, location, cause);
    }
}
