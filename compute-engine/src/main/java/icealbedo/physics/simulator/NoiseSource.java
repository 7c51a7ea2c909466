package icealbedo.physics.simulator;

/**
 * Flujo de números aleatorios gaussianos propiedad exclusiva de una realización.
 * No es necesario que sea thread-safe: nunca se comparte entre realizaciones.
 */
public interface NoiseSource {

    /**
     * Siguiente muestra independiente de N(0, 1).
     */
    double nextStandardNormal();
}
