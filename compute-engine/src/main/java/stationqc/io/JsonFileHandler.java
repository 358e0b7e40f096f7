package stationqc.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import stationqc.config.QcConfig;
import stationqc.domain.qc.QcReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Lectura y escritura en JSON de configuraciones de control de calidad e informes.
 * <p>
 * Una configuración parcial es válida: los campos ausentes conservan sus valores por defecto.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una única instancia
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Un campo mal escrito en la configuración debe fallar, no ignorarse
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public QcConfig readConfig(String filePath) throws IOException {
        return readFromFile(filePath, QcConfig.class);
    }

    public void writeReport(QcReport report, String filePath) throws IOException {
        writeToFile(report, filePath);
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Writing {} to {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error writing JSON file {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException Si el archivo no existe, no se puede leer o su formato no es válido.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Reading {} from {}", objectType.getSimpleName(), path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error reading or parsing JSON file {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
