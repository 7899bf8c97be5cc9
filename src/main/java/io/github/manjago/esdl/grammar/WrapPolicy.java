package io.github.manjago.esdl.grammar;

/**
 * What happens when a derivation needs more codons than the genome holds.
 */
public enum WrapPolicy {

    /** Start again from the first codon (up to the configured wrap limit). */
    WRAP,

    /** Fail with {@link GenomeExhaustedException}. */
    FAIL,

    /** Continue with codon value 0. */
    PAD
}
