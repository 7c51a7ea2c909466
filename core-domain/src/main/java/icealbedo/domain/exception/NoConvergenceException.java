package icealbedo.domain.exception;

import lombok.Getter;

/**
 * El buscador de raíces agotó su presupuesto de iteraciones sin alcanzar la tolerancia.
 */
@Getter
public class NoConvergenceException extends ClimateSimulationException {

    /**
     * Mejor estimación encontrada (la de menor |flujo neto|), en K.
     */
    private final double lastEstimate;

    /**
     * Flujo neto residual en {@link #lastEstimate}.
     */
    private final double residual;

    private final int iterations;

    public NoConvergenceException(double lastEstimate, double residual, int iterations) {
        super(String.format("Sin convergencia tras %d iteraciones. Mejor estimación T=%.6f K (residuo %.3e)",
                iterations, lastEstimate, residual));
        this.lastEstimate = lastEstimate;
        this.residual = residual;
        this.iterations = iterations;
    }
}
