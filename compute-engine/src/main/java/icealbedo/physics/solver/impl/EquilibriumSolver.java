package icealbedo.physics.solver.impl;

import icealbedo.config.PhysicalParameters;
import icealbedo.domain.exception.NoConvergenceException;
import icealbedo.physics.model.FluxModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Biblioteca estática para localizar los estados estacionarios del modelo.
 * <p>
 * Resuelve netFlux(T) = 0 con Newton-Raphson usando la derivada analítica y cae a un
 * paso de secante cuando la derivada es casi nula. El método es local: con los
 * parámetros por defecto hay hasta tres raíces (fría estable, intermedia inestable y
 * cálida estable) y la que se obtiene depende de la semilla inicial.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class EquilibriumSolver {

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-6; // Sobre |netFlux|

    private static final double FLAT_DERIVATIVE = 1e-12;
    private static final double SECANT_PROBE = 1e-3; // K
    private static final double DISTINCT_ROOT_SEPARATION = 0.1; // K

    private EquilibriumSolver() {}

    public static double findRoot(PhysicalParameters params, double guess) {
        return findRoot(params, guess, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    public static double findRoot(PhysicalParameters params, double guess, double tolerance) {
        return findRoot(params, guess, tolerance, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Busca T* tal que |netFlux(T*)| <= tolerance partiendo de {@code guess}.
     *
     * @param params        Parámetros físicos.
     * @param guess         Temperatura inicial (K). Determina la cuenca de la raíz encontrada.
     * @param tolerance     Tolerancia absoluta sobre el flujo neto.
     * @param maxIterations Presupuesto de iteraciones.
     * @return Temperatura de equilibrio en K.
     * @throws NoConvergenceException si no se alcanza la tolerancia; lleva la mejor estimación.
     */
    public static double findRoot(PhysicalParameters params, double guess, double tolerance, int maxIterations) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("La tolerancia debe ser positiva.");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Se necesita al menos una iteración.");
        }

        FluxModel model = new FluxModel(params);

        double t = guess;
        double f = model.netFlux(t);
        double bestT = t;
        double bestResidual = Math.abs(f);
        double previousT = Double.NaN;
        double previousF = Double.NaN;
        int iterations = 0;

        for (int i = 0; i < maxIterations; i++) {
            // 1. Criterio de parada sobre el residuo
            if (Math.abs(f) <= tolerance) {
                log.debug("Equilibrio T*={} tras {} iteraciones (guess={})", t, i, guess);
                return t;
            }

            // 2. Pendiente: analítica, o secante si es plana
            double slope = model.netFluxDerivative(t);
            if (Math.abs(slope) < FLAT_DERIVATIVE) {
                slope = secantSlope(model, t, f, previousT, previousF);
            }
            if (Math.abs(slope) < FLAT_DERIVATIVE || !Double.isFinite(slope)) break; // Sin dirección útil

            // 3. Paso Newton
            double next = t - f / slope;
            if (!Double.isFinite(next)) break;

            previousT = t;
            previousF = f;
            t = next;
            f = model.netFlux(t);
            iterations++;

            if (Math.abs(f) < bestResidual) {
                bestResidual = Math.abs(f);
                bestT = t;
            }
        }

        if (Math.abs(f) <= tolerance) {
            return t;
        }
        throw new NoConvergenceException(bestT, bestResidual, iterations);
    }

    /**
     * Lanza el buscador desde varias semillas y devuelve las raíces distintas encontradas, ordenadas.
     * Las semillas que no convergen se descartan con un aviso.
     */
    public static List<Double> findEquilibria(PhysicalParameters params, List<Double> guesses,
                                              double tolerance, int maxIterations) {
        List<Double> roots = new ArrayList<>();
        for (double guess : guesses) {
            try {
                double root = findRoot(params, guess, tolerance, maxIterations);
                boolean known = roots.stream().anyMatch(r -> Math.abs(r - root) < DISTINCT_ROOT_SEPARATION);
                if (!known) {
                    roots.add(root);
                }
            } catch (NoConvergenceException e) {
                log.warn("Semilla {} K descartada: {}", guess, e.getMessage());
            }
        }
        Collections.sort(roots);
        return roots;
    }

    public static List<Double> findEquilibria(PhysicalParameters params, List<Double> guesses) {
        return findEquilibria(params, guesses, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Un equilibrio es estable si el flujo neto decrece al atravesarlo (perturbaciones se amortiguan).
     */
    public static boolean isStable(PhysicalParameters params, double equilibriumTemperature) {
        return new FluxModel(params).netFluxDerivative(equilibriumTemperature) < 0;
    }

    private static double secantSlope(FluxModel model, double t, double f, double previousT, double previousF) {
        if (Double.isFinite(previousT) && previousT != t) {
            return (f - previousF) / (t - previousT);
        }
        return (model.netFlux(t + SECANT_PROBE) - f) / SECANT_PROBE;
    }
}
