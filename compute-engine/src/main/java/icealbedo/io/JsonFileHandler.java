package icealbedo.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import icealbedo.config.ClimateConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Gestiona la lectura de configuraciones y la escritura de resúmenes en archivos JSON.
 * <p>
 * Es genérica: trabaja con cualquier objeto compatible con Jackson (records incluidos).
 * Las trayectorias completas no se persisten; eso queda a cargo del llamador.
 */
@Slf4j
public class JsonFileHandler {

    // ObjectMapper es costoso de crear y thread-safe: uno compartido
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Un campo desconocido en la configuración es casi siempre una errata
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath Ruta del archivo de destino (ej: "out/report.json").
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public ClimateConfiguration readConfiguration(String filePath) throws IOException {
        ClimateConfiguration configuration = readFromFile(filePath, ClimateConfiguration.class);
        if (configuration.physics() == null || configuration.simulation() == null) {
            throw new IOException("La configuración debe contener las secciones 'physics' y 'simulation': " + filePath);
        }
        return configuration;
    }

    public String toJson(Object data) throws IOException {
        return objectMapper.writeValueAsString(data);
    }
}
