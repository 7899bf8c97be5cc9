package io.github.manjago.esdl.ops;

/**
 * How many individuals a stream may produce, relative to what a destination asks for.
 * Ordered from most to least restrictive.
 */
public enum Cardinality {

    /** Every produced individual must be stored; excess is a size error. */
    EXACT,

    /** A finite stream whose prefix is a valid selection; excess is truncated. */
    AT_LEAST,

    /** Never ends by itself; the destination count decides. */
    UNBOUNDED;

    /**
     * Cardinality of a stream passed through an operator: the less restrictive of the two.
     */
    public Cardinality then(Cardinality next) {
        return next.ordinal() > ordinal() ? next : this;
    }

    public boolean isTruncatable() {
        return this != EXACT;
    }
}
