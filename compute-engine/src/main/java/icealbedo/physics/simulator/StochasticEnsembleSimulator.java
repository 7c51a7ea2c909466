package icealbedo.physics.simulator;

import icealbedo.config.PhysicalParameters;
import icealbedo.domain.climate.ClimateState;
import icealbedo.domain.exception.ClimateSimulationException;
import icealbedo.domain.simulation.Ensemble;
import icealbedo.domain.simulation.Trajectory;
import icealbedo.physics.model.FluxModel;
import icealbedo.physics.solver.SolverComponent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Orquestador de ensembles estocásticos.
 * <p>
 * Responsabilidades:
 * 1. Derivar, antes de lanzar nada, una semilla independiente por realización a partir de la semilla maestra.
 * 2. Repartir las realizaciones ({@link EulerMaruyamaRunTask}) en un pool de hilos fijo.
 * 3. Recoger las trayectorias en orden de realización y propagar el primer fallo sin descartar ninguna.
 * <p>
 * Como las semillas se reparten de forma secuencial y cada realización tiene su propio
 * generador, el resultado es idéntico bit a bit para una misma semilla, sea cual sea
 * el número de hilos o el orden en que terminen.
 */
@Slf4j
public class StochasticEnsembleSimulator implements SolverComponent, AutoCloseable {

    private final ExecutorService threadPool;
    private final NoiseSourceFactory noiseSourceFactory;

    public StochasticEnsembleSimulator(int processorCount) {
        this(processorCount, GaussianNoiseSource::new);
    }

    public StochasticEnsembleSimulator(int processorCount, NoiseSourceFactory noiseSourceFactory) {
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        this.noiseSourceFactory = noiseSourceFactory;
        log.info("StochasticEnsembleSimulator inicializado. (Hilos: {})", Math.max(processorCount, 1));
    }

    @Override
    public String getName() {
        return "Euler-Maruyama";
    }

    @Override
    public String getDescription() {
        return "Esquema explícito de orden fuerte 1/2 con incrementos brownianos N(0, dt)";
    }

    /**
     * Ejecuta el ensemble con una semilla nueva (registrada en el log y en el {@link Ensemble}).
     */
    public Ensemble run(PhysicalParameters params, ClimateState initialState, double dt, int numSteps, int numRuns) {
        long seed = ThreadLocalRandom.current().nextLong();
        log.info("Sin semilla explícita; usando semilla generada {}", seed);
        return run(params, initialState, 0.0, dt, numSteps, numRuns, seed);
    }

    public Ensemble run(PhysicalParameters params, ClimateState initialState, double dt, int numSteps, int numRuns,
                        long noiseSeed) {
        return run(params, initialState, 0.0, dt, numSteps, numRuns, noiseSeed);
    }

    /**
     * Genera {@code numRuns} realizaciones independientes sobre la malla
     * [t0, t0 + dt, ..., t0 + (numSteps - 1)·dt].
     *
     * @throws IllegalArgumentException si dt, numSteps o numRuns no son válidos.
     * @throws icealbedo.domain.exception.NumericalDivergenceException si alguna realización diverge.
     */
    public Ensemble run(PhysicalParameters params, ClimateState initialState, double startTime, double dt,
                        int numSteps, int numRuns, long noiseSeed) {
        validate(dt, numSteps, numRuns);
        long startMillis = System.currentTimeMillis();

        log.info("Iniciando ensemble: {} realizaciones x {} pasos (dt={}, eta_T={}, eta_a={}, semilla={})",
                numRuns, numSteps, dt, params.temperatureNoise(), params.albedoNoise(), noiseSeed);

        // 1. Semillas por realización, derivadas secuencialmente de la maestra
        SplittableRandom master = new SplittableRandom(noiseSeed);
        FluxModel model = new FluxModel(params);

        List<EulerMaruyamaRunTask> tasks = new ArrayList<>(numRuns);
        for (int r = 0; r < numRuns; r++) {
            NoiseSource noise = noiseSourceFactory.create(master.nextLong());
            tasks.add(new EulerMaruyamaRunTask(r, model, initialState, startTime, dt, numSteps, noise));
        }

        // 2. Ejecución paralela
        List<Future<Trajectory>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClimateSimulationException("Ensemble interrumpido.", e);
        }

        // 3. Recogida en orden
        List<Trajectory> runs = new ArrayList<>(numRuns);
        for (int r = 0; r < numRuns; r++) {
            runs.add(await(futures.get(r), r));
        }

        long elapsed = System.currentTimeMillis() - startMillis;
        log.info("Ensemble finalizado en {}ms.", elapsed);

        return Ensemble.builder()
                .parameters(params)
                .initialState(initialState)
                .timeStep(dt)
                .seed(noiseSeed)
                .runs(runs)
                .simulationTime(elapsed)
                .build();
    }

    private static Trajectory await(Future<Trajectory> future, int runIndex) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClimateSimulationException("Ensemble interrumpido esperando la realización " + runIndex, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                log.error("La realización {} ha fallado: {}", runIndex, runtime.getMessage());
                throw runtime;
            }
            throw new ClimateSimulationException("Error en la realización " + runIndex, cause);
        }
    }

    private static void validate(double dt, int numSteps, int numRuns) {
        if (!(dt > 0) || !Double.isFinite(dt)) {
            throw new IllegalArgumentException("El paso de tiempo debe ser un valor positivo y finito.");
        }
        if (numSteps < 1) {
            throw new IllegalArgumentException("Se necesita al menos un paso de tiempo.");
        }
        if (numRuns < 1) {
            throw new IllegalArgumentException("Se necesita al menos una realización.");
        }
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("StochasticEnsembleSimulator cerrado.");
    }
}
