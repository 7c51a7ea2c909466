package icealbedo.domain.simulation;

import lombok.Builder;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Resumen estadístico de un {@link Ensemble}.
 * <p>
 * Los estadísticos por realización se calculan sobre su serie temporal; los agregados
 * se construyen con la distribución entre realizaciones de un escalar por realización.
 *
 * @param runs                            Estadísticos temporales de cada realización, en orden.
 * @param finalTemperatures               Temperatura del último paso de cada realización (K).
 * @param meanOfRunMeans                  Media de las medias temporales (K).
 * @param standardDeviationOfRunMeans     Desviación típica muestral de las medias temporales (K).
 * @param standardErrorOfMean             Error estándar de {@code meanOfRunMeans}: std / √N.
 * @param finalTemperatureMean            Media de la distribución de temperaturas finales (K).
 * @param finalTemperatureStandardDeviation Desviación típica muestral de las temperaturas finales (K).
 * @param coldStateFraction               Fracción de realizaciones que terminan por debajo del centro
 *                                        de la transición hielo-agua.
 */
@Builder
public record SummaryStatistics(
        List<RunStatistics> runs,
        double[] finalTemperatures,
        double meanOfRunMeans,
        double standardDeviationOfRunMeans,
        double standardErrorOfMean,
        double finalTemperatureMean,
        double finalTemperatureStandardDeviation,
        double coldStateFraction
) {

    public SummaryStatistics {
        runs = List.copyOf(runs);
        finalTemperatures = finalTemperatures.clone();
    }

    @Override
    public double[] finalTemperatures() {
        return finalTemperatures.clone();
    }

    // Igualdad por valor del array de temperaturas finales
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SummaryStatistics other)) return false;
        return runs.equals(other.runs)
                && Arrays.equals(finalTemperatures, other.finalTemperatures)
                && Double.compare(meanOfRunMeans, other.meanOfRunMeans) == 0
                && Double.compare(standardDeviationOfRunMeans, other.standardDeviationOfRunMeans) == 0
                && Double.compare(standardErrorOfMean, other.standardErrorOfMean) == 0
                && Double.compare(finalTemperatureMean, other.finalTemperatureMean) == 0
                && Double.compare(finalTemperatureStandardDeviation, other.finalTemperatureStandardDeviation) == 0
                && Double.compare(coldStateFraction, other.coldStateFraction) == 0;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(runs, meanOfRunMeans, standardDeviationOfRunMeans, standardErrorOfMean,
                finalTemperatureMean, finalTemperatureStandardDeviation, coldStateFraction);
        return 31 * result + Arrays.hashCode(finalTemperatures);
    }

    @Override
    public String toString() {
        return "SummaryStatistics[runs=" + runs.size()
                + ", finalTemperatures=" + Arrays.toString(finalTemperatures)
                + ", meanOfRunMeans=" + meanOfRunMeans
                + ", standardErrorOfMean=" + standardErrorOfMean
                + ", finalTemperatureMean=" + finalTemperatureMean
                + ", finalTemperatureStandardDeviation=" + finalTemperatureStandardDeviation
                + ", coldStateFraction=" + coldStateFraction + "]";
    }

    public int runCount() {
        return runs.size();
    }

    public double[] runMeans() {
        return runs.stream().mapToDouble(RunStatistics::mean).toArray();
    }

    public double[] coefficientsOfVariation() {
        return runs.stream().mapToDouble(RunStatistics::coefficientOfVariation).toArray();
    }
}
