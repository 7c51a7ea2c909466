package icealbedo.analysis;

import icealbedo.config.PhysicalParameters;
import icealbedo.domain.climate.ClimateState;
import icealbedo.domain.exception.UndefinedCoefficientOfVariationException;
import icealbedo.domain.simulation.Ensemble;
import icealbedo.domain.simulation.RunStatistics;
import icealbedo.domain.simulation.SummaryStatistics;
import icealbedo.domain.simulation.Trajectory;
import icealbedo.physics.model.FluxModel;
import icealbedo.physics.simulator.StochasticEnsembleSimulator;
import icealbedo.physics.solver.impl.EquilibriumSolver;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class EnsembleStatisticsTest {

    private static final PhysicalParameters PARAMS = PhysicalParameters.getDefaultEarth();

    @Test
    @DisplayName("Estadísticos de una realización: media, desviación poblacional y CoV")
    void summarizeRun_shouldUseTemporalSeries() {
        Trajectory run = trajectory(1.0, 2.0, 3.0, 4.0);

        RunStatistics stats = EnsembleStatistics.summarizeRun(5, run);

        assertEquals(5, stats.runIndex());
        assertEquals(2.5, stats.mean(), 1e-12);
        assertEquals(Math.sqrt(1.25), stats.standardDeviation(), 1e-12);
        assertEquals(Math.sqrt(1.25) / 2.5, stats.coefficientOfVariation(), 1e-12);
    }

    @Test
    @DisplayName("Media nula: el CoV no está definido y se informa de la realización")
    void summarize_withZeroMeanRun_shouldThrowUndefinedCoV() {
        Ensemble ensemble = ensemble(trajectory(250.0, 251.0), trajectory(-1.0, 1.0));

        UndefinedCoefficientOfVariationException ex = assertThrows(UndefinedCoefficientOfVariationException.class,
                () -> EnsembleStatistics.summarize(ensemble));

        assertEquals(1, ex.getRunIndex());
        assertThrows(UndefinedCoefficientOfVariationException.class,
                () -> EnsembleStatistics.coefficientOfVariation(new double[]{-2.0, 2.0}));
    }

    @Test
    @DisplayName("Agregados entre realizaciones: desviación muestral y error estándar")
    void summarize_shouldAggregateAcrossRuns() {
        // ARRANGE: tres realizaciones constantes
        Ensemble ensemble = ensemble(trajectory(10.0, 10.0), trajectory(20.0, 20.0), trajectory(30.0, 30.0));

        // ACT
        SummaryStatistics summary = EnsembleStatistics.summarize(ensemble);

        // ASSERT
        assertEquals(3, summary.runCount());
        assertArrayEquals(new double[]{10.0, 20.0, 30.0}, summary.runMeans(), 0.0);
        assertArrayEquals(new double[]{0.0, 0.0, 0.0}, summary.coefficientsOfVariation(), 0.0);
        assertEquals(20.0, summary.meanOfRunMeans(), 1e-12);
        assertEquals(10.0, summary.standardDeviationOfRunMeans(), 1e-12);
        assertEquals(10.0 / Math.sqrt(3), summary.standardErrorOfMean(), 1e-12);
        assertEquals(20.0, summary.finalTemperatureMean(), 1e-12);
        assertEquals(10.0, summary.finalTemperatureStandardDeviation(), 1e-12);
    }

    @Test
    @DisplayName("Fracción fría: realizaciones que terminan bajo la temperatura de transición")
    void summarize_shouldCountColdFinalStates() {
        Ensemble ensemble = ensemble(trajectory(240.0, 260.0), trajectory(280.0, 270.0));

        SummaryStatistics summary = EnsembleStatistics.summarize(ensemble);

        assertArrayEquals(new double[]{260.0, 270.0}, summary.finalTemperatures(), 0.0);
        assertEquals(0.5, summary.coldStateFraction(), 0.0);
    }

    @Test
    @DisplayName("Helpers: serie vacía, una sola muestra y umbral indefinido")
    void helpers_shouldHandleEdgeCases() {
        assertThrows(IllegalArgumentException.class, () -> EnsembleStatistics.mean(new double[0]));
        assertEquals(0.0, EnsembleStatistics.sampleStandardDeviation(new double[]{3.0}), 0.0);
        assertEquals(0.0, EnsembleStatistics.standardDeviation(new double[]{3.0}), 0.0);
        assertTrue(Double.isNaN(EnsembleStatistics.fractionBelow(new double[]{1.0}, Double.NaN)));
    }

    @Test
    @DisplayName("Error estándar: 16 veces más realizaciones lo reducen ~4 veces")
    void standardErrorOfMean_shouldShrinkWithRunCount() {
        // ARRANGE
        PhysicalParameters params = PhysicalParameters.getStochasticEarth();
        double warm = EquilibriumSolver.findRoot(params, 290.0);
        ClimateState start = new ClimateState(warm, new FluxModel(params).albedoEquilibrium(warm));

        // ACT
        SummaryStatistics small;
        SummaryStatistics large;
        try (StochasticEnsembleSimulator simulator = new StochasticEnsembleSimulator(2)) {
            small = EnsembleStatistics.summarize(simulator.run(params, start, 0.02, 101, 100, 21L));
            large = EnsembleStatistics.summarize(simulator.run(params, start, 0.02, 101, 1600, 22L));
        }

        // ASSERT
        double ratio = large.standardErrorOfMean() / small.standardErrorOfMean();
        log.info("Error estándar: N=100 -> {}, N=1600 -> {} (cociente {})",
                small.standardErrorOfMean(), large.standardErrorOfMean(), ratio);
        assertThat(ratio).isBetween(0.15, 0.4);
        assertThat(large.runs()).hasSize(1600);
    }

    @Test
    @DisplayName("Reproducibilidad: misma semilla, mismo resumen estadístico")
    void summarize_withSameSeed_shouldProduceEqualSummaries() {
        // ARRANGE
        PhysicalParameters params = PhysicalParameters.getStochasticEarth();
        ClimateState start = new ClimateState(240.0, 0.35);

        // ACT
        SummaryStatistics first;
        SummaryStatistics second;
        try (StochasticEnsembleSimulator simulator = new StochasticEnsembleSimulator(2)) {
            first = EnsembleStatistics.summarize(simulator.run(params, start, 0.01, 50, 4, 9L));
            second = EnsembleStatistics.summarize(simulator.run(params, start, 0.01, 50, 4, 9L));
        }

        // ASSERT
        assertNotSame(first.finalTemperatures(), second.finalTemperatures());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertThat(first.toString()).contains("finalTemperatures=[");
    }

    private static Trajectory trajectory(double... temperatures) {
        double[] times = new double[temperatures.length];
        double[] albedos = new double[temperatures.length];
        for (int i = 0; i < temperatures.length; i++) {
            times[i] = i;
            albedos[i] = 0.3;
        }
        return new Trajectory(times, temperatures, albedos);
    }

    private static Ensemble ensemble(Trajectory... runs) {
        return Ensemble.builder()
                .parameters(PARAMS)
                .initialState(runs[0].getInitialState())
                .timeStep(1.0)
                .seed(0L)
                .runs(List.of(runs))
                .build();
    }
}
