package icealbedo.physics.simulator;

import java.util.Random;

/**
 * Fuente de ruido por defecto basada en {@link Random#nextGaussian()}.
 */
public class GaussianNoiseSource implements NoiseSource {

    private final Random random;

    public GaussianNoiseSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public double nextStandardNormal() {
        return random.nextGaussian();
    }
}
