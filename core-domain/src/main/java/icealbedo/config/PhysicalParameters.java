package icealbedo.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con todos los parámetros físicos del modelo de balance
 * energético con realimentación hielo-albedo.
 * <p>
 * Se fija en tiempo de configuración y nunca se muta durante una ejecución.
 * Todos los flujos del modelo se expresan normalizados por la constante solar.
 *
 * @param solarConstant          Constante solar S0 en W/m².
 * @param referenceTemperature   Escala de temperatura de referencia T0 en K. Convierte la tasa de flujo
 *                               adimensional en K/año.
 * @param emissivity             Emisividad efectiva de la atmósfera (adimensional).
 * @param stefanBoltzmann        Constante de Stefan-Boltzmann en W/(m²·K⁴).
 * @param iceAlbedo              Albedo de una Tierra totalmente helada (límite frío).
 * @param waterAlbedo            Albedo de una Tierra sin hielo (límite cálido).
 * @param transitionTemperature  Centro Tc de la transición hielo-agua en K.
 * @param transitionWidth        Anchura wT de la transición en K.
 * @param albedoRelaxationRate   Cociente de escalas de tiempo (delta). Velocidad de relajación del albedo
 *                               hacia su valor de equilibrio, en 1/año.
 * @param temperatureNoise       Intensidad del ruido aditivo sobre la temperatura (eta_T), en K/√año.
 * @param albedoNoise            Intensidad del ruido aditivo sobre el albedo (eta_a), en 1/√año.
 */
@Builder
@With
public record PhysicalParameters(
        // --- Radiación ---
        double solarConstant,
        double referenceTemperature,
        double emissivity,
        double stefanBoltzmann,

        // --- Realimentación hielo-albedo ---
        double iceAlbedo,
        double waterAlbedo,
        double transitionTemperature,
        double transitionWidth,
        double albedoRelaxationRate,

        // --- Forzamiento estocástico ---
        double temperatureNoise,
        double albedoNoise
) {

    /**
     * Parámetros de referencia de la Tierra actual, sin ruido.
     */
    public static PhysicalParameters getDefaultEarth() {
        return PhysicalParameters.builder()
                .solarConstant(1368.0)
                .referenceTemperature(288.0)
                .emissivity(0.61)
                .stefanBoltzmann(5.67e-8)
                .iceAlbedo(0.7)
                .waterAlbedo(0.3)
                .transitionTemperature(265.0)
                .transitionWidth(20.0)
                .albedoRelaxationRate(1e-2)
                .temperatureNoise(0.0)
                .albedoNoise(0.0)
                .build();
    }

    /**
     * Igual que {@link #getDefaultEarth()} pero con forzamiento estocástico moderado.
     */
    public static PhysicalParameters getStochasticEarth() {
        return getDefaultEarth()
                .withTemperatureNoise(1.0)
                .withAlbedoNoise(0.005);
    }

    @JsonIgnore
    public boolean isDeterministic() {
        return temperatureNoise == 0.0 && albedoNoise == 0.0;
    }
}
