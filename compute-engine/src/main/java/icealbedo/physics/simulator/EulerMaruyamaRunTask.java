package icealbedo.physics.simulator;

import icealbedo.domain.climate.ClimateState;
import icealbedo.domain.exception.NumericalDivergenceException;
import icealbedo.domain.simulation.Trajectory;
import icealbedo.physics.model.FluxModel;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Tarea que integra UNA realización estocástica con el esquema Euler-Maruyama.
 * <p>
 * Está diseñada para ejecutarse en un pool de hilos: la tarea es dueña exclusiva de sus
 * buffers y de su {@link NoiseSource}; lo único compartido es el {@link FluxModel}, que es inmutable.
 * Los pasos de tiempo se resuelven en estricto orden secuencial.
 */
@RequiredArgsConstructor
public class EulerMaruyamaRunTask implements Callable<Trajectory> {

    // --- Entradas para la tarea ---
    private final int runIndex;
    private final FluxModel model;
    private final ClimateState initialState;
    private final double startTime;
    private final double dt;
    private final int stepCount;
    private final NoiseSource noise;

    @Override
    public Trajectory call() {
        if (!initialState.isFinite()) {
            throw new NumericalDivergenceException(runIndex, 0, initialState);
        }

        double[] times = new double[stepCount];
        double[] temperatures = new double[stepCount];
        double[] albedos = new double[stepCount];

        // Incremento browniano: N(0, dt) = √dt · N(0, 1)
        double sqrtDt = Math.sqrt(dt);
        double temperatureDiffusion = model.getParameters().temperatureNoise() * sqrtDt;
        double albedoDiffusion = model.getParameters().albedoNoise() * sqrtDt;

        double t = initialState.temperature();
        double a = initialState.albedo();
        times[0] = startTime;
        temperatures[0] = t;
        albedos[0] = a;

        for (int i = 1; i < stepCount; i++) {
            // Deriva evaluada en el estado anterior (esquema explícito)
            double driftT = model.temperatureRate(t, a);
            double driftA = model.albedoDerivative(t, a);

            // Dos muestras independientes por paso, siempre en el mismo orden (reproducibilidad)
            double nextT = t + driftT * dt + temperatureDiffusion * noise.nextStandardNormal();
            double nextA = a + driftA * dt + albedoDiffusion * noise.nextStandardNormal();

            if (!Double.isFinite(nextT) || !Double.isFinite(nextA)) {
                throw new NumericalDivergenceException(runIndex, i, new ClimateState(t, a));
            }

            t = nextT;
            a = nextA;
            times[i] = startTime + i * dt;
            temperatures[i] = t;
            albedos[i] = a;
        }

        return new Trajectory(times, temperatures, albedos);
    }
}
