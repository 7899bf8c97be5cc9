package io.github.manjago.esdl.grammar;

/**
 * Output of one derivation.
 *
 * @param text generated program text
 * @param codonsUsed codons consumed, counting reused ones again after a wrap
 * @param wraps how many times the genome was restarted from its first codon
 */
public record ExpansionResult(String text, int codonsUsed, int wraps) {
}
