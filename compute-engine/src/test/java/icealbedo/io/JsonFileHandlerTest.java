package icealbedo.io;

import icealbedo.config.ClimateConfiguration;
import icealbedo.config.SimulationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas unitarias para la clase {@link JsonFileHandler}.
 * Verifican la lectura de configuraciones y la escritura de resultados a/desde archivos JSON.
 */
class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    // Directorio temporal fresco por test
    @TempDir
    Path tempDir;

    private record TestData(String name, double value, List<Double> items) {}

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    @Test
    @DisplayName("Debería leer la configuración de ejemplo aplicando los valores por defecto del builder")
    void readConfiguration_shouldApplyBuilderDefaults() throws IOException, URISyntaxException {
        // --- 1. Arrange ---
        Path fixture = Paths.get(getClass().getResource("/config/small-climate.json").toURI());

        // --- 2. Act ---
        ClimateConfiguration configuration = jsonFileHandler.readConfiguration(fixture.toString());

        // --- 3. Assert ---
        assertThat(configuration.physics().temperatureNoise()).isEqualTo(1.0);
        assertThat(configuration.physics().transitionTemperature()).isEqualTo(265.0);

        SimulationConfig simulation = configuration.simulation();
        assertThat(simulation.getRunCount()).isEqualTo(16);
        assertThat(simulation.getSeed()).isEqualTo(2024L);
        assertThat(simulation.getDeterministicSamples()).isEqualTo(100);
        // Campos ausentes en el archivo: valores por defecto
        assertThat(simulation.getSolverTolerance()).isEqualTo(1e-6);
        assertThat(simulation.getSolverMaxIterations()).isEqualTo(100);
        assertThat(simulation.getEquilibriumGuesses()).containsExactly(220.0, 265.0, 290.0);
        assertThat(simulation.getDeterministicHorizon()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Debería conservar la configuración tras escribirla y volver a leerla")
    void writeThenRead_shouldPreserveConfiguration() throws IOException {
        ClimateConfiguration original = ClimateConfiguration.getDefault();
        Path file = tempDir.resolve("nested/dir/config.json");

        jsonFileHandler.writeToFile(original, file.toString());
        ClimateConfiguration restored = jsonFileHandler.readConfiguration(file.toString());

        assertThat(file).exists();
        assertThat(Files.readString(file))
                .contains("\"physics\"")
                .contains("\"simulation\"")
                .doesNotContain("initialState")
                .doesNotContain("\"deterministic\"");
        assertThat(restored).isEqualTo(original);
    }

    @Test
    @DisplayName("Debería serializar un objeto genérico con formato indentado")
    void writeToFile_shouldIndentOutput() throws IOException {
        Path file = tempDir.resolve("data.json");

        jsonFileHandler.writeToFile(new TestData("albedo", 0.3, List.of(0.7, 0.3)), file.toString());

        assertThat(Files.readString(file))
                .contains("\"name\" : \"albedo\"")
                .contains("\"value\" : 0.3");
        assertThat(jsonFileHandler.readFromFile(file.toString(), TestData.class))
                .isEqualTo(new TestData("albedo", 0.3, List.of(0.7, 0.3)));
    }

    @Test
    @DisplayName("Debería rechazar propiedades desconocidas (erratas en la configuración)")
    void readConfiguration_withUnknownProperty_shouldThrow() throws IOException {
        Path file = tempDir.resolve("typo.json");
        Files.writeString(file, """
                {
                  "physics": { "solarConstant": 1368.0, "solarConstnt": 1.0 },
                  "simulation": { "deltaTime": 0.01 }
                }
                """);

        assertThrows(IOException.class, () -> jsonFileHandler.readConfiguration(file.toString()));
    }

    @Test
    @DisplayName("Debería exigir las dos secciones de la configuración")
    void readConfiguration_withMissingSection_shouldThrow() throws IOException {
        Path file = tempDir.resolve("partial.json");
        Files.writeString(file, "{ \"physics\": { \"solarConstant\": 1368.0 } }");

        IOException ex = assertThrows(IOException.class, () -> jsonFileHandler.readConfiguration(file.toString()));
        assertThat(ex.getMessage()).contains("simulation");
    }

    @Test
    @DisplayName("Debería lanzar IOException si el archivo no existe")
    void readFromFile_whenFileDoesNotExist_shouldThrowIOException() {
        Path missing = tempDir.resolve("missing.json");

        IOException ex = assertThrows(IOException.class,
                () -> jsonFileHandler.readFromFile(missing.toString(), ClimateConfiguration.class));
        assertThat(ex.getMessage()).contains("no existe");
    }
}
