package icealbedo.analysis;

import icealbedo.domain.exception.UndefinedCoefficientOfVariationException;
import icealbedo.domain.simulation.Ensemble;
import icealbedo.domain.simulation.RunStatistics;
import icealbedo.domain.simulation.SummaryStatistics;
import icealbedo.domain.simulation.Trajectory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Agregación estadística de un {@link Ensemble}.
 * <p>
 * Los estadísticos de cada realización se calculan sobre SU serie temporal de temperatura
 * (desviación poblacional). Los agregados entre realizaciones usan un escalar por
 * realización (su media o su temperatura final) y la desviación muestral.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class EnsembleStatistics {

    private EnsembleStatistics() {}

    /**
     * @throws UndefinedCoefficientOfVariationException si alguna realización tiene media exactamente cero.
     */
    public static SummaryStatistics summarize(Ensemble ensemble) {
        int runCount = ensemble.getRunCount();
        List<RunStatistics> perRun = new ArrayList<>(runCount);
        double[] runMeans = new double[runCount];

        for (int r = 0; r < runCount; r++) {
            RunStatistics stats = summarizeRun(r, ensemble.getRun(r));
            perRun.add(stats);
            runMeans[r] = stats.mean();
        }

        double[] finalTemperatures = ensemble.getFinalTemperatures();
        double transition = ensemble.getParameters() != null
                ? ensemble.getParameters().transitionTemperature()
                : Double.NaN;

        double runMeansStd = sampleStandardDeviation(runMeans);

        SummaryStatistics summary = SummaryStatistics.builder()
                .runs(perRun)
                .finalTemperatures(finalTemperatures)
                .meanOfRunMeans(mean(runMeans))
                .standardDeviationOfRunMeans(runMeansStd)
                .standardErrorOfMean(runMeansStd / Math.sqrt(runCount))
                .finalTemperatureMean(mean(finalTemperatures))
                .finalTemperatureStandardDeviation(sampleStandardDeviation(finalTemperatures))
                .coldStateFraction(fractionBelow(finalTemperatures, transition))
                .build();

        log.debug("Resumen de {} realizaciones: <T>={} K, T_final={} ± {} K, fracción fría={}",
                runCount, summary.meanOfRunMeans(), summary.finalTemperatureMean(),
                summary.finalTemperatureStandardDeviation(), summary.coldStateFraction());
        return summary;
    }

    /**
     * Media, desviación típica y coeficiente de variación de la temperatura de una realización.
     */
    public static RunStatistics summarizeRun(int runIndex, Trajectory run) {
        double[] temperatures = run.getTemperatures();
        double mean = mean(temperatures);
        double std = standardDeviation(temperatures);
        if (mean == 0.0) {
            throw new UndefinedCoefficientOfVariationException(runIndex);
        }
        return new RunStatistics(runIndex, mean, std, std / mean);
    }

    // --- Helpers numéricos ---

    public static double mean(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("No se puede promediar una serie vacía.");
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Desviación típica poblacional (divide por N).
     */
    public static double standardDeviation(double[] values) {
        return Math.sqrt(sumOfSquaredDeviations(values) / values.length);
    }

    /**
     * Desviación típica muestral (divide por N - 1). Cero con una sola muestra.
     */
    public static double sampleStandardDeviation(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return Math.sqrt(sumOfSquaredDeviations(values) / (values.length - 1));
    }

    /**
     * std / mean de una serie cualquiera.
     *
     * @throws UndefinedCoefficientOfVariationException si la media es exactamente cero (índice -1).
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0.0) {
            throw new UndefinedCoefficientOfVariationException(-1);
        }
        return standardDeviation(values) / mean;
    }

    public static double fractionBelow(double[] values, double threshold) {
        if (Double.isNaN(threshold)) {
            return Double.NaN;
        }
        int count = 0;
        for (double v : values) {
            if (v < threshold) count++;
        }
        return (double) count / values.length;
    }

    // Dos pasadas: media primero, desviaciones después
    private static double sumOfSquaredDeviations(double[] values) {
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum;
    }
}
