package io.github.manjago.esdl.run;

import io.github.manjago.esdl.lang.EsdlException;
import io.github.manjago.esdl.lang.SourceLocation;

/**
 * An operator or the fitness evaluator failed while a statement was executing.
 * The run is over; nothing is retried.
 */
public class OperatorExecutionException extends EsdlException {

    public OperatorExecutionException(String message, SourceLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
