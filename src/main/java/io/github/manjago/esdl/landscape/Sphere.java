package io.github.manjago.esdl.landscape;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.SpeciesKind;
import io.github.manjago.esdl.core.StreamRng;

/**
 * Negated sum of squared distances from a centre point, optionally with Gaussian noise.
 * <p>
 * The optimum is 0 at the centre. Noise is drawn from the landscape stream only,
 * so it never shifts breeding decisions.
 */
public class Sphere implements Landscape {

    public static final String NAME = "sphere";

    private final double center;
    private final double noise;

    public Sphere() {
        this(0.0, 0.0);
    }

    public Sphere(double center, double noise) {
        if (noise < 0) {
            throw new IllegalArgumentException("Noise must be non-negative: " + noise);
        }
        this.center = center;
        this.noise = noise;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SpeciesKind getKind() {
        return SpeciesKind.REAL;
    }

    @Override
    public double evaluate(Genome genome, StreamRng rng) {
        double sum = 0;
        for (double gene : genome.reals()) {
            double d = gene - center;
            sum += d * d;
        }
        if (noise > 0) {
            sum += noise * rng.nextGaussian();
        }
        return -sum;
    }

    public double getCenter() {
        return center;
    }

    public double getNoise() {
        return noise;
    }
}
