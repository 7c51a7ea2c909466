package icealbedo.physics.simulator;

import icealbedo.analysis.EnsembleStatistics;
import icealbedo.config.PhysicalParameters;
import icealbedo.config.SimulationConfig;
import icealbedo.domain.climate.EquilibriumPoint;
import icealbedo.domain.simulation.Ensemble;
import icealbedo.domain.simulation.SummaryStatistics;
import icealbedo.domain.simulation.Trajectory;
import icealbedo.physics.model.FluxModel;
import icealbedo.physics.solver.DeterministicIntegrator;
import icealbedo.physics.solver.impl.EquilibriumSolver;
import icealbedo.physics.solver.impl.RungeKuttaIntegrator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Clase orquestadora de simulaciones.
 * <p>
 * Localiza los equilibrios del modelo, integra la trayectoria determinista desde el estado
 * inicial y lanza el ensemble estocástico, resumiéndolo al final. Es dueña del pool de
 * hilos del simulador, por eso debe cerrarse.
 */
@Slf4j
public class ClimateSimulationRunner implements AutoCloseable {

    @Getter
    private final PhysicalParameters parameters;
    @Getter
    private final SimulationConfig config;

    private final DeterministicIntegrator integrator;
    private final StochasticEnsembleSimulator simulator;

    public ClimateSimulationRunner(PhysicalParameters parameters, SimulationConfig config) {
        this(parameters, config, new RungeKuttaIntegrator(),
                new StochasticEnsembleSimulator(config.getCpuProcessorCount()));
    }

    ClimateSimulationRunner(PhysicalParameters parameters, SimulationConfig config,
                            DeterministicIntegrator integrator, StochasticEnsembleSimulator simulator) {
        this.parameters = parameters;
        this.config = config;
        this.integrator = integrator;
        this.simulator = simulator;
        log.info("ClimateSimulationRunner listo. (Integrador: {}, Esquema estocástico: {})",
                integrator.getName(), simulator.getName());
    }

    /**
     * Equilibrios distintos alcanzados desde las semillas configuradas, ordenados por temperatura.
     */
    public List<EquilibriumPoint> findEquilibria() {
        FluxModel model = new FluxModel(parameters);
        List<Double> roots = EquilibriumSolver.findEquilibria(parameters, config.getEquilibriumGuesses(),
                config.getSolverTolerance(), config.getSolverMaxIterations());

        List<EquilibriumPoint> points = new ArrayList<>(roots.size());
        for (double root : roots) {
            EquilibriumPoint point = new EquilibriumPoint(root, model.albedoEquilibrium(root),
                    EquilibriumSolver.isStable(parameters, root));
            log.info("Equilibrio: T*={} K, a*={} ({})", String.format("%.3f", root),
                    String.format("%.4f", point.albedo()), point.stable() ? "estable" : "inestable");
            points.add(point);
        }
        return points;
    }

    public Trajectory runDeterministic() {
        double[] grid = DeterministicIntegrator.uniformTimeGrid(0.0, config.getDeterministicHorizon(),
                config.getDeterministicSamples());
        return integrator.integrate(parameters, config.getInitialState(), grid);
    }

    public Ensemble runEnsemble() {
        if (config.getSeed() == null) {
            return simulator.run(parameters, config.getInitialState(), config.getDeltaTime(),
                    config.getStepCount(), config.getRunCount());
        }
        return simulator.run(parameters, config.getInitialState(), config.getDeltaTime(),
                config.getStepCount(), config.getRunCount(), config.getSeed());
    }

    /**
     * Ejecuta el flujo completo: equilibrios, trayectoria determinista, ensemble y resumen.
     */
    public ClimateReport runFullSimulation() {
        log.info("Iniciando simulación completa...");

        List<EquilibriumPoint> equilibria = findEquilibria();
        Trajectory deterministic = runDeterministic();
        log.info("Trayectoria determinista: {}", deterministic);

        Ensemble ensemble = runEnsemble();
        SummaryStatistics statistics = EnsembleStatistics.summarize(ensemble);
        log.info("Ensemble: T_final = {} ± {} K, fracción en la cuenca fría = {}",
                String.format("%.3f", statistics.finalTemperatureMean()),
                String.format("%.3f", statistics.finalTemperatureStandardDeviation()),
                statistics.coldStateFraction());

        return ClimateReport.builder()
                .equilibria(equilibria)
                .deterministicTrajectory(deterministic)
                .ensemble(ensemble)
                .statistics(statistics)
                .seed(ensemble.getSeed())
                .build();
    }

    @Override
    public void close() {
        simulator.close();
        log.info("ClimateSimulationRunner cerrado y recursos liberados.");
    }
}
