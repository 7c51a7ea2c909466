package icealbedo.domain.exception;

/**
 * Excepción base de los fallos numéricos del modelo climático.
 * <p>
 * Todos los fallos son locales a la ejecución que los provoca y se notifican de forma
 * síncrona al llamador; el núcleo nunca reintenta por su cuenta.
 */
public class ClimateSimulationException extends RuntimeException {

    public ClimateSimulationException(String message) {
        super(message);
    }

    public ClimateSimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
