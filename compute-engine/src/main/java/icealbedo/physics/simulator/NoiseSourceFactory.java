package icealbedo.physics.simulator;

/**
 * Crea el flujo de ruido de una realización a partir de su semilla.
 * Permite inyectar generadores alternativos (o mocks en los tests).
 */
@FunctionalInterface
public interface NoiseSourceFactory {

    NoiseSource create(long seed);
}
