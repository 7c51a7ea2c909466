package icealbedo.physics.model;

import icealbedo.config.PhysicalParameters;
import icealbedo.domain.climate.ClimateState;
import lombok.Getter;

/**
 * Modelo de balance energético de dimensión cero con realimentación hielo-albedo.
 * <p>
 * Todos los flujos están normalizados por la constante solar S0, de modo que el flujo
 * entrante es adimensional. Las funciones son totales sobre los reales: no se valida
 * ni se recorta ningún argumento (una temperatura negativa no tiene sentido físico,
 * pero la potencia par la evalúa igualmente).
 * <p>
 * Stateless y Thread-Safe.
 */
public class FluxModel {

    @Getter
    private final PhysicalParameters parameters;

    // Pre-cálculos de la curva de albedo y del término radiativo
    private final double albedoMidpoint;
    private final double albedoHalfRange;
    private final double halfWidth;
    private final double radiativeCoefficient;

    public FluxModel(PhysicalParameters parameters) {
        this.parameters = parameters;
        this.albedoMidpoint = (parameters.iceAlbedo() + parameters.waterAlbedo()) / 2.0;
        this.albedoHalfRange = (parameters.iceAlbedo() - parameters.waterAlbedo()) / 2.0;
        this.halfWidth = parameters.transitionWidth() / 2.0;
        this.radiativeCoefficient = parameters.emissivity() * parameters.stefanBoltzmann() / parameters.solarConstant();
    }

    /**
     * Radiación solar absorbida, promediada sobre la esfera: (1 - a) / 4.
     */
    public double incomingFlux(double albedo) {
        return (1.0 - albedo) / 4.0;
    }

    /**
     * Radiación de onda larga emitida: (ε·σ / S0) · T⁴.
     */
    public double outgoingFlux(double temperature) {
        double t2 = temperature * temperature;
        return radiativeCoefficient * t2 * t2;
    }

    /**
     * Albedo de equilibrio para una temperatura dada: escalón suave
     * A - B·tanh((T - Tc) / (wT/2)).
     * <p>
     * Monótono decreciente, tiende a a_water cuando T → ∞ y a a_ice cuando T → -∞.
     * Es derivable en todo punto, lo que mantiene estable al buscador de raíces.
     */
    public double albedoEquilibrium(double temperature) {
        return albedoMidpoint - albedoHalfRange * Math.tanh((temperature - parameters.transitionTemperature()) / halfWidth);
    }

    /**
     * Derivada analítica del albedo de equilibrio respecto a T: -(B / (wT/2)) · sech²(x).
     */
    public double albedoEquilibriumDerivative(double temperature) {
        double tanh = Math.tanh((temperature - parameters.transitionTemperature()) / halfWidth);
        return -(albedoHalfRange / halfWidth) * (1.0 - tanh * tanh);
    }

    /**
     * Desequilibrio radiativo adimensional para un estado (T, a).
     */
    public double temperatureDerivative(double temperature, double albedo) {
        return incomingFlux(albedo) - outgoingFlux(temperature);
    }

    /**
     * Relajación de primer orden del albedo hacia su equilibrio instantáneo.
     */
    public double albedoDerivative(double temperature, double albedo) {
        return parameters.albedoRelaxationRate() * (albedoEquilibrium(temperature) - albedo);
    }

    /**
     * Flujo neto en el límite de albedo rápido (albedo siempre en equilibrio).
     * Sus raíces son los estados estacionarios del sistema.
     */
    public double netFlux(double temperature) {
        return incomingFlux(albedoEquilibrium(temperature)) - outgoingFlux(temperature);
    }

    /**
     * Derivada analítica de {@link #netFlux(double)} respecto a T.
     * Negativa en los equilibrios estables y positiva en el inestable.
     */
    public double netFluxDerivative(double temperature) {
        double t3 = temperature * temperature * temperature;
        return -albedoEquilibriumDerivative(temperature) / 4.0 - 4.0 * radiativeCoefficient * t3;
    }

    /**
     * Tasa de cambio de la temperatura en K/año: T0 · (F_in - F_out).
     * <p>
     * Es el único punto donde se aplica la escala T0, de modo que todos los
     * integradores usan exactamente la misma conversión a tiempo físico.
     */
    public double temperatureRate(double temperature, double albedo) {
        return parameters.referenceTemperature() * temperatureDerivative(temperature, albedo);
    }

    /**
     * Campo vectorial del sistema acoplado: (dT/dt, da/dt) en unidades de tiempo físico.
     * Se devuelve como {@link ClimateState} para no confundir el orden de las componentes.
     */
    public ClimateState rates(ClimateState state) {
        return new ClimateState(
                temperatureRate(state.temperature(), state.albedo()),
                albedoDerivative(state.temperature(), state.albedo()));
    }

    // --- Versiones vectorizadas ---

    public double[] incomingFlux(double[] albedos) {
        double[] result = new double[albedos.length];
        for (int i = 0; i < albedos.length; i++) {
            result[i] = incomingFlux(albedos[i]);
        }
        return result;
    }

    public double[] outgoingFlux(double[] temperatures) {
        double[] result = new double[temperatures.length];
        for (int i = 0; i < temperatures.length; i++) {
            result[i] = outgoingFlux(temperatures[i]);
        }
        return result;
    }

    public double[] albedoEquilibrium(double[] temperatures) {
        double[] result = new double[temperatures.length];
        for (int i = 0; i < temperatures.length; i++) {
            result[i] = albedoEquilibrium(temperatures[i]);
        }
        return result;
    }

    public double[] netFlux(double[] temperatures) {
        double[] result = new double[temperatures.length];
        for (int i = 0; i < temperatures.length; i++) {
            result[i] = netFlux(temperatures[i]);
        }
        return result;
    }
}
