package icealbedo.domain.simulation;

/**
 * Estadísticos temporales de la temperatura de una única realización.
 *
 * @param runIndex               Índice de la realización dentro del ensemble.
 * @param mean                   Media temporal de la temperatura (K).
 * @param standardDeviation      Desviación típica poblacional de la temperatura (K).
 * @param coefficientOfVariation Cociente std/mean (adimensional).
 */
public record RunStatistics(
        int runIndex,
        double mean,
        double standardDeviation,
        double coefficientOfVariation
) {}
