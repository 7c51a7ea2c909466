package icealbedo.physics.solver.impl;

import icealbedo.config.PhysicalParameters;
import icealbedo.domain.climate.ClimateState;
import icealbedo.domain.exception.NumericalDivergenceException;
import icealbedo.domain.simulation.Trajectory;
import icealbedo.physics.model.FluxModel;
import icealbedo.physics.solver.DeterministicIntegrator;
import lombok.Builder;
import lombok.With;
import lombok.extern.slf4j.Slf4j;

/**
 * Integrador Runge-Kutta clásico de 4º orden con sub-pasos fijos.
 * <p>
 * Entre dos instantes consecutivos de la malla pedida se dan tantos sub-pasos iguales
 * como hagan falta para no superar {@code maxInternalStep}. Así la precisión no depende
 * de lo gruesa que sea la malla de salida.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
@Builder
@With
public class RungeKuttaIntegrator implements DeterministicIntegrator {

    private static final double DEFAULT_MAX_INTERNAL_STEP = 1e-2; // años

    private final double maxInternalStep;

    public RungeKuttaIntegrator() {
        this(DEFAULT_MAX_INTERNAL_STEP);
    }

    /**
     * @param maxInternalStep Tamaño máximo del sub-paso interno, en años.
     */
    public RungeKuttaIntegrator(double maxInternalStep) {
        if (!(maxInternalStep > 0)) {
            throw new IllegalArgumentException("El sub-paso interno debe ser positivo.");
        }
        this.maxInternalStep = maxInternalStep;
    }

    @Override
    public String getName() {
        return "RK4";
    }

    @Override
    public String getDescription() {
        return "Runge-Kutta clásico de 4º orden con sub-pasos fijos de hasta " + maxInternalStep + " años";
    }

    @Override
    public Trajectory integrate(PhysicalParameters params, ClimateState initialState, double[] timePoints) {
        validateTimePoints(timePoints);
        if (!initialState.isFinite()) {
            throw new NumericalDivergenceException(0, initialState);
        }

        FluxModel model = new FluxModel(params);
        int samples = timePoints.length;
        double[] temperatures = new double[samples];
        double[] albedos = new double[samples];

        ClimateState current = initialState;
        temperatures[0] = current.temperature();
        albedos[0] = current.albedo();

        for (int i = 1; i < samples; i++) {
            double interval = timePoints[i] - timePoints[i - 1];
            // Holgura para que el redondeo de la malla no añada un sub-paso espurio
            int subSteps = Math.max(1, (int) Math.ceil(interval / maxInternalStep - 1e-9));
            double h = interval / subSteps;

            for (int k = 0; k < subSteps; k++) {
                ClimateState next = step(model, current, h);
                if (!next.isFinite()) {
                    throw new NumericalDivergenceException(i, current);
                }
                current = next;
            }

            temperatures[i] = current.temperature();
            albedos[i] = current.albedo();
        }

        log.debug("Integración {} completada: {} muestras, estado final {}", getName(), samples, current);
        return new Trajectory(timePoints, temperatures, albedos);
    }

    // Un paso RK4 sobre el campo vectorial del modelo
    private static ClimateState step(FluxModel model, ClimateState s, double h) {
        ClimateState k1 = model.rates(s);
        ClimateState k2 = model.rates(advance(s, k1, h / 2.0));
        ClimateState k3 = model.rates(advance(s, k2, h / 2.0));
        ClimateState k4 = model.rates(advance(s, k3, h));

        double dT = (k1.temperature() + 2.0 * k2.temperature() + 2.0 * k3.temperature() + k4.temperature()) / 6.0;
        double da = (k1.albedo() + 2.0 * k2.albedo() + 2.0 * k3.albedo() + k4.albedo()) / 6.0;

        return new ClimateState(s.temperature() + h * dT, s.albedo() + h * da);
    }

    private static ClimateState advance(ClimateState s, ClimateState rate, double h) {
        return new ClimateState(s.temperature() + h * rate.temperature(), s.albedo() + h * rate.albedo());
    }

    private static void validateTimePoints(double[] timePoints) {
        if (timePoints == null || timePoints.length < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos instantes de tiempo.");
        }
        for (int i = 1; i < timePoints.length; i++) {
            if (!(timePoints[i] > timePoints[i - 1])) {
                throw new IllegalArgumentException(String.format(
                        "Los instantes deben ser estrictamente crecientes (t[%d]=%s, t[%d]=%s).",
                        i - 1, timePoints[i - 1], i, timePoints[i]));
            }
        }
    }
}
