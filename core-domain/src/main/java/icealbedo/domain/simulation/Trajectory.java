package icealbedo.domain.simulation;

import icealbedo.domain.climate.ClimateState;

import java.util.Arrays;

/**
 * Serie temporal inmutable de estados climáticos muestreada sobre una malla de tiempos fija.
 * <p>
 * ALMACENAMIENTO:
 * Tres arrays primitivos paralelos (tiempo, temperatura, albedo) en lugar de una lista de
 * {@link ClimateState}, para no instanciar un objeto por muestra en ensembles grandes.
 * Los arrays se clonan al construir y al exponerlos.
 */
public final class Trajectory {

    private final double[] times;
    private final double[] temperatures;
    private final double[] albedos;

    public Trajectory(double[] times, double[] temperatures, double[] albedos) {
        if (times == null || temperatures == null || albedos == null) {
            throw new IllegalArgumentException("Las series de la trayectoria no pueden ser nulas.");
        }
        if (times.length == 0) {
            throw new IllegalArgumentException("Una trayectoria necesita al menos una muestra.");
        }
        if (temperatures.length != times.length || albedos.length != times.length) {
            throw new IllegalArgumentException(String.format(
                    "Longitudes incoherentes: tiempos=%d, temperaturas=%d, albedos=%d",
                    times.length, temperatures.length, albedos.length));
        }
        this.times = times.clone();
        this.temperatures = temperatures.clone();
        this.albedos = albedos.clone();
    }

    public int size() {
        return times.length;
    }

    public double getTimeAt(int index) {
        return times[index];
    }

    public double getTemperatureAt(int index) {
        return temperatures[index];
    }

    public double getAlbedoAt(int index) {
        return albedos[index];
    }

    public ClimateState getStateAt(int index) {
        return new ClimateState(temperatures[index], albedos[index]);
    }

    public ClimateState getInitialState() {
        return getStateAt(0);
    }

    public ClimateState getFinalState() {
        return getStateAt(times.length - 1);
    }

    public double[] getTimes() {
        return times.clone();
    }

    public double[] getTemperatures() {
        return temperatures.clone();
    }

    public double[] getAlbedos() {
        return albedos.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trajectory other)) return false;
        return Arrays.equals(times, other.times)
                && Arrays.equals(temperatures, other.temperatures)
                && Arrays.equals(albedos, other.albedos);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(times);
        result = 31 * result + Arrays.hashCode(temperatures);
        result = 31 * result + Arrays.hashCode(albedos);
        return result;
    }

    @Override
    public String toString() {
        return "Trajectory[samples=" + times.length + ", initial=" + getInitialState()
                + ", final=" + getFinalState() + "]";
    }
}
