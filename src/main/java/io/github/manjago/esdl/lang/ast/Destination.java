package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;
import org.jetbrains.annotations.Nullable;

/**
 * Destination of a SELECT clause. A missing count means "the rest of the stream".
 */
public record Destination(String name, @Nullable Expression count, SourceLocation location) {

    public boolean isSized() {
        return count != null;
    }

    @Override
    public String toString() {
        return count == null ? name : count + " " + name;
    }
}
