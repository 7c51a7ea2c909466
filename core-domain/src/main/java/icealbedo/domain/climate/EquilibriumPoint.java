package icealbedo.domain.climate;

/**
 * Estado estacionario del modelo en el límite de albedo rápido.
 *
 * @param temperature Temperatura de equilibrio T* en K.
 * @param albedo      Albedo de equilibrio en T*.
 * @param stable      true si las perturbaciones pequeñas se amortiguan (netFlux'(T*) < 0).
 */
public record EquilibriumPoint(double temperature, double albedo, boolean stable) {}
