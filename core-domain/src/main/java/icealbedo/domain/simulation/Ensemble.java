package icealbedo.domain.simulation;

import icealbedo.config.PhysicalParameters;
import icealbedo.domain.climate.ClimateState;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Conjunto de realizaciones estocásticas independientes.
 * <p>
 * Todas comparten parámetros físicos, malla temporal y estado inicial; cada una
 * consume su propio flujo de ruido. Cada {@link Trajectory} es propiedad exclusiva
 * del ensemble y no comparte memoria con las demás.
 */
@Value
public class Ensemble {

    PhysicalParameters parameters;

    ClimateState initialState;

    /**
     * Paso de tiempo del esquema, en años.
     */
    double timeStep;

    /**
     * Semilla maestra de la que se derivaron los flujos de ruido de cada realización.
     */
    long seed;

    List<Trajectory> runs;

    /**
     * Tiempo de cómputo en ms.
     */
    @EqualsAndHashCode.Exclude
    long simulationTime;

    @Builder
    public Ensemble(PhysicalParameters parameters, ClimateState initialState, double timeStep,
                    long seed, List<Trajectory> runs, long simulationTime) {
        if (runs == null || runs.isEmpty()) {
            throw new IllegalArgumentException("Un ensemble necesita al menos una realización.");
        }
        int samples = runs.get(0).size();
        for (int i = 1; i < runs.size(); i++) {
            if (runs.get(i).size() != samples) {
                throw new IllegalArgumentException(String.format(
                        "La realización %d tiene %d muestras, se esperaban %d.", i, runs.get(i).size(), samples));
            }
        }
        this.parameters = parameters;
        this.initialState = initialState;
        this.timeStep = timeStep;
        this.seed = seed;
        this.runs = List.copyOf(runs);
        this.simulationTime = simulationTime;
    }

    public int getRunCount() {
        return runs.size();
    }

    public int getStepCount() {
        return runs.get(0).size();
    }

    public Trajectory getRun(int index) {
        return runs.get(index);
    }

    /**
     * Distribución entre realizaciones de la temperatura en el último paso.
     */
    public double[] getFinalTemperatures() {
        double[] result = new double[runs.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = runs.get(i).getFinalState().temperature();
        }
        return result;
    }
}
