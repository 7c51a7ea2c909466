package icealbedo.physics.solver;

import icealbedo.config.PhysicalParameters;
import icealbedo.domain.climate.ClimateState;
import icealbedo.domain.simulation.Trajectory;

/**
 * Integra el sistema acoplado dT/dt, da/dt sin ruido sobre una malla de tiempos dada.
 */
public interface DeterministicIntegrator extends SolverComponent {

    /**
     * Muestrea la solución en cada uno de los instantes pedidos.
     *
     * @param params       Parámetros físicos (se ignoran las intensidades de ruido).
     * @param initialState Estado en {@code timePoints[0]}.
     * @param timePoints   Instantes estrictamente crecientes, al menos dos, en años.
     * @return Trayectoria con exactamente {@code timePoints.length} muestras; la primera es el estado inicial.
     * @throws IllegalArgumentException si la malla no es válida.
     * @throws icealbedo.domain.exception.NumericalDivergenceException si el estado deja de ser finito.
     */
    Trajectory integrate(PhysicalParameters params, ClimateState initialState, double[] timePoints);

    /**
     * Malla uniforme de {@code samples} puntos entre {@code start} y {@code end}, ambos incluidos.
     */
    static double[] uniformTimeGrid(double start, double end, int samples) {
        if (samples < 2) {
            throw new IllegalArgumentException("La malla necesita al menos dos puntos.");
        }
        if (end <= start) {
            throw new IllegalArgumentException("El tiempo final debe ser mayor que el inicial.");
        }
        double[] grid = new double[samples];
        double step = (end - start) / (samples - 1);
        for (int i = 0; i < samples; i++) {
            grid[i] = start + i * step;
        }
        grid[samples - 1] = end;
        return grid;
    }
}
