package icealbedo.domain.exception;

import icealbedo.domain.climate.ClimateState;
import lombok.Getter;

/**
 * El estado intermedio de una integración dejó de ser finito.
 * La ejecución se aborta inmediatamente y no se reintenta.
 */
@Getter
public class NumericalDivergenceException extends ClimateSimulationException {

    /**
     * Realización del ensemble que divergió, o -1 en integraciones deterministas.
     */
    private final int runIndex;

    /**
     * Índice del paso en el que apareció el valor no finito.
     */
    private final int step;

    /**
     * Último estado finito antes de la divergencia.
     */
    private final ClimateState lastFiniteState;

    public NumericalDivergenceException(int runIndex, int step, ClimateState lastFiniteState) {
        super(String.format("Divergencia numérica en la realización %d, paso %d (último estado finito: %s)",
                runIndex, step, lastFiniteState));
        this.runIndex = runIndex;
        this.step = step;
        this.lastFiniteState = lastFiniteState;
    }

    public NumericalDivergenceException(int step, ClimateState lastFiniteState) {
        this(-1, step, lastFiniteState);
    }
}
