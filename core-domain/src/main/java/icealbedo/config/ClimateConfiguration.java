package icealbedo.config;

/**
 * Configuración completa de una ejecución, tal y como se guarda en disco.
 *
 * @param physics    Parámetros físicos del modelo.
 * @param simulation Parámetros numéricos de la simulación.
 */
public record ClimateConfiguration(PhysicalParameters physics, SimulationConfig simulation) {

    public static ClimateConfiguration getDefault() {
        return new ClimateConfiguration(PhysicalParameters.getStochasticEarth(), SimulationConfig.getDefault());
    }
}
