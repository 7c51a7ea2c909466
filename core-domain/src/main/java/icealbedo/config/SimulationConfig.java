package icealbedo.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import icealbedo.domain.climate.ClimateState;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Contenedor de los parámetros numéricos de una simulación.
 * Agrupa la condición inicial, la discretización temporal, el tamaño del ensemble
 * y los ajustes del buscador de equilibrios.
 */
@Value
@Builder
@With
@Jacksonized
public class SimulationConfig {

    /**
     * Temperatura inicial en K.
     */
    double initialTemperature;

    /**
     * Albedo inicial (adimensional).
     */
    double initialAlbedo;

    /**
     * Paso de tiempo del esquema Euler-Maruyama, en años.
     */
    double deltaTime;

    /**
     * Número de muestras de cada realización estocástica (incluida la inicial).
     */
    int stepCount;

    /**
     * Número de realizaciones independientes del ensemble.
     */
    int runCount;

    /**
     * Semilla maestra del ruido. Si es null se genera una nueva en cada ejecución.
     */
    Long seed;

    /**
     * Horizonte de la integración determinista, en años.
     */
    @Builder.Default
    double deterministicHorizon = 6.0;

    /**
     * Número de muestras de la trayectoria determinista.
     */
    @Builder.Default
    int deterministicSamples = 500;

    /**
     * Tolerancia absoluta sobre el flujo neto para el buscador de raíces.
     */
    @Builder.Default
    double solverTolerance = 1e-6;

    /**
     * Máximo de iteraciones del buscador de raíces.
     */
    @Builder.Default
    int solverMaxIterations = 100;

    /**
     * Temperaturas de arranque para localizar los equilibrios (uno por cuenca).
     */
    @Builder.Default
    List<Double> equilibriumGuesses = List.of(220.0, 265.0, 290.0);

    /**
     * Número de hilos para ejecutar las realizaciones del ensemble.
     */
    @Builder.Default
    int cpuProcessorCount = Runtime.getRuntime().availableProcessors();

    @JsonIgnore
    public ClimateState getInitialState() {
        return new ClimateState(initialTemperature, initialAlbedo);
    }

    @JsonIgnore
    public double getTotalTime() {
        return deltaTime * (stepCount - 1);
    }

    public static SimulationConfig getDefault() {
        return SimulationConfig.builder()
                .initialTemperature(240.0)
                .initialAlbedo(0.35)
                .deltaTime(0.01)
                .stepCount(2000)
                .runCount(200)
                .seed(12345L)
                .build();
    }
}
