package io.github.manjago.esdl.landscape;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.SpeciesKind;
import io.github.manjago.esdl.core.StreamRng;
import io.github.manjago.esdl.grammar.GrammarException;
import io.github.manjago.esdl.grammar.GrammarExpander;
import io.github.manjago.esdl.lang.EvaluationException;
import io.github.manjago.esdl.lang.ExpressionEvaluator;
import io.github.manjago.esdl.lang.Parser;
import io.github.manjago.esdl.lang.SyntaxException;
import io.github.manjago.esdl.lang.VariableScope;
import io.github.manjago.esdl.lang.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Grammatical evolution benchmark: fit an expression in {@code x} to a target function.
 * <p>
 * Each codon genome is expanded through the grammar, the resulting text is parsed as a
 * restricted expression and compared with the target at evenly spaced sample points.
 * Fitness is the negated sum of absolute errors, so a perfect fit scores 0.
 * Genomes that fail to expand, parse or evaluate get {@link #WORST}.
 */
public class SymbolicRegression implements Landscape {

    private static final Logger log = LoggerFactory.getLogger(SymbolicRegression.class);

    public static final String NAME = "regression";

    /** Fitness of an individual whose phenotype cannot be computed. */
    public static final double WORST = Double.NEGATIVE_INFINITY;

    private static final String VARIABLE = "x";

    private final GrammarExpander expander;
    private final double[] samples;
    private final double[] expected;

    /**
     * @param expander grammar mapper for genomes
     * @param target target function as a restricted expression in {@code x}
     * @param lowest first sample point
     * @param highest last sample point
     * @param sampleCount number of sample points, at least 2
     * @throws SyntaxException if the target does not parse
     * @throws EvaluationException if the target cannot be evaluated at a sample point
     */
    public SymbolicRegression(GrammarExpander expander, String target, double lowest, double highest,
                              int sampleCount) throws SyntaxException, EvaluationException {
        if (sampleCount < 2) {
            throw new IllegalArgumentException("At least 2 samples required, got " + sampleCount);
        }
        if (highest <= lowest) {
            throw new IllegalArgumentException("Empty sample range [" + lowest + ", " + highest + "]");
        }
        this.expander = expander;
        this.samples = new double[sampleCount];
        this.expected = new double[sampleCount];

        Expression targetExpression = new Parser().parseExpression(target);
        double step = (highest - lowest) / (sampleCount - 1);
        for (int i = 0; i < sampleCount; i++) {
            samples[i] = lowest + i * step;
            expected[i] = ExpressionEvaluator.evaluateDouble(targetExpression, at(samples[i]));
        }
        log.debug("Regression target '{}' sampled at {} points in [{}, {}]", target, sampleCount, lowest, highest);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SpeciesKind getKind() {
        return SpeciesKind.GE;
    }

    @Override
    public double evaluate(Genome genome, StreamRng rng) {
        String phenotype;
        try {
            phenotype = expander.expand(genome.ints()).text();
        } catch (GrammarException e) {
            log.debug("Genome {} does not map: {}", genome, e.getMessage());
            return WORST;
        }
        return score(phenotype);
    }

    /**
     * Fitness of an already expanded phenotype.
     */
    public double score(String phenotype) {
        try {
            Expression expression = new Parser().parseExpression(phenotype);
            double error = 0;
            for (int i = 0; i < samples.length; i++) {
                double actual = ExpressionEvaluator.evaluateDouble(expression, at(samples[i]));
                error += Math.abs(actual - expected[i]);
            }
            return Double.isNaN(error) ? WORST : -error;
        } catch (SyntaxException | EvaluationException e) {
            log.debug("Phenotype '{}' rejected: {}", phenotype, e.getMessage());
            return WORST;
        }
    }

    private static VariableScope at(double x) {
        return VariableScope.of(Map.of(VARIABLE, x));
    }

    public int getSampleCount() {
        return samples.length;
    }
}
