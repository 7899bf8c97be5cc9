package io.github.manjago.esdl.lang;

import org.jetbrains.annotations.Nullable;

/**
 * A restricted expression could not be evaluated: unknown name, wrong operand
 * type or arithmetic fault.
 */
public class EvaluationException extends EsdlException {

    public EvaluationException(String message, @Nullable SourceLocation location) {
        super(message, location);
    }
}
