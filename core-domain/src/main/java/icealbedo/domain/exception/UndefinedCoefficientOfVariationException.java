package icealbedo.domain.exception;

import lombok.Getter;

/**
 * La media de la serie es exactamente cero y el coeficiente de variación no está definido.
 */
@Getter
public class UndefinedCoefficientOfVariationException extends ClimateSimulationException {

    private final int runIndex;

    public UndefinedCoefficientOfVariationException(int runIndex) {
        super("Coeficiente de variación indefinido: media nula en la realización " + runIndex);
        this.runIndex = runIndex;
    }
}
