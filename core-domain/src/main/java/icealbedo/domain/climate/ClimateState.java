package icealbedo.domain.climate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.With;

/**
 * Estado instantáneo del sistema climático: temperatura media global y albedo planetario.
 * <p>
 * El albedo debería estar en [0, 1] y la temperatura ser positiva, pero el modelo
 * no los recorta: con ruido grande ambos pueden salir de su rango físico.
 *
 * @param temperature Temperatura media global en K.
 * @param albedo      Albedo planetario (adimensional).
 */
@With
public record ClimateState(double temperature, double albedo) {

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(temperature) && Double.isFinite(albedo);
    }

    @Override
    public String toString() {
        return String.format("ClimateState[T=%.4f K, a=%.5f]", temperature, albedo);
    }
}
