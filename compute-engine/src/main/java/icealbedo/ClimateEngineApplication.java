package icealbedo;

import icealbedo.config.ClimateConfiguration;
import icealbedo.io.JsonFileHandler;
import icealbedo.physics.simulator.ClimateReport;
import icealbedo.physics.simulator.ClimateSimulationRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Punto de entrada por línea de comandos del motor climático.
 * <p>
 * Uso: {@code ClimateEngineApplication [config.json] [report.json]}
 * <ol>
 *     <li>Sin argumentos se usa la configuración por defecto (Tierra con ruido).</li>
 *     <li>El segundo argumento, si existe, recibe el resumen en JSON (equilibrios y estadísticos).</li>
 * </ol>
 */
@Slf4j
public class ClimateEngineApplication {

    public static void main(String[] args) {
        try {
            run(args);
        } catch (IOException e) {
            log.error(">>> FATAL: Error de entrada/salida.", e);
            System.exit(1);
        } catch (RuntimeException e) {
            log.error(">>> FATAL: La simulación ha fallado.", e);
            System.exit(2);
        }
    }

    static ClimateReport run(String[] args) throws IOException {
        JsonFileHandler jsonFileHandler = new JsonFileHandler();

        ClimateConfiguration configuration;
        if (args.length > 0) {
            configuration = jsonFileHandler.readConfiguration(args[0]);
        } else {
            log.info("Sin archivo de configuración: usando valores por defecto.");
            configuration = ClimateConfiguration.getDefault();
        }

        ClimateReport report;
        try (ClimateSimulationRunner runner = new ClimateSimulationRunner(configuration.physics(), configuration.simulation())) {
            report = runner.runFullSimulation();
        }

        if (args.length > 1) {
            jsonFileHandler.writeToFile(report, args[1]);
        }
        return report;
    }
}
