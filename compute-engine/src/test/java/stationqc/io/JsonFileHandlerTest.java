package stationqc.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import stationqc.config.QcConfig;
import stationqc.domain.qc.QcCheck;
import stationqc.domain.qc.QcReport;
import stationqc.stats.NamedAggregator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas de lectura de configuraciones y escritura de informes en JSON.
 */
class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    // Directorio temporal nuevo en cada test
    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    @Test
    @DisplayName("Debería escribir el informe con las claves de cada etapa")
    void writeReport_shouldUseCheckKeys() throws IOException {
        // --- 1. Arrange ---
        QcReport report = QcReport.builder()
                .record(QcCheck.UNRELIABLE, List.of("S02"))
                .record(QcCheck.RADIATIVE_ERROR, List.of("S03", "S09"))
                .build();
        Path outputFile = tempDir.resolve("reports/qc.json");

        // --- 2. Act ---
        jsonFileHandler.writeReport(report, outputFile.toString());

        // --- 3. Assert ---
        assertThat(outputFile).exists();
        assertThat(Files.readString(outputFile))
                .contains("\"unreliable\" : [ \"S02\" ]")
                .contains("\"radiative_error\" : [ \"S03\", \"S09\" ]");
        assertThat(jsonFileHandler.readFromFile(outputFile.toString(), QcReport.class)).isEqualTo(report);
    }

    @Test
    @DisplayName("Debería leer una configuración parcial manteniendo los valores por defecto")
    void readConfig_partialFile() throws IOException {
        // --- 1. Arrange ---
        String json = """
        {
          "unreliableThreshold": 0.35,
          "adjustElevation": false,
          "radiativeError": { "center": "mean", "divisor": "std", "distribution": "norm" },
          "dailyPeakWindows": { "autocorrelationWindowHours": 72 }
        }
        """;
        Path inputFile = tempDir.resolve("config.json");
        Files.writeString(inputFile, json);

        // --- 2. Act ---
        QcConfig config = jsonFileHandler.readConfig(inputFile.toString());

        // --- 3. Assert ---
        assertThat(config.getUnreliableThreshold()).isEqualTo(0.35);
        assertThat(config.getAdjustElevation()).isFalse();
        assertThat(config.getRadiativeError().getCenter()).isEqualTo(NamedAggregator.MEAN);
        assertThat(config.getRadiativeError().getDistribution()).isEqualTo("norm");
        assertThat(config.getRadiativeError().getUpperAlpha()).isEqualTo(0.95);
        assertThat(config.getDailyPeakWindows().getAutocorrelationWindowHours()).isEqualTo(72.0);
        assertThat(config.getDailyPeakWindows().getTargetPeriodHours()).isEqualTo(24.0);
        assertThat(config.getDailyPeakOverheating()).isEqualTo(QcConfig.getDefault().getDailyPeakOverheating());
    }

    @Test
    @DisplayName("Un campo desconocido en la configuración es un error")
    void readConfig_unknownField() throws IOException {
        Path inputFile = tempDir.resolve("typo.json");
        Files.writeString(inputFile, "{ \"unreliableTreshold\": 0.5 }");

        assertThatThrownBy(() -> jsonFileHandler.readConfig(inputFile.toString()))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Un estadístico desconocido en la configuración es un error")
    void readConfig_unknownAggregator() throws IOException {
        Path inputFile = tempDir.resolve("bad-aggregator.json");
        Files.writeString(inputFile, "{ \"radiativeError\": { \"divisor\": \"mode\" } }");

        assertThatThrownBy(() -> jsonFileHandler.readConfig(inputFile.toString()))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Debería lanzar IOException si el archivo no existe")
    void readFromFile_missingFile() {
        Path missing = tempDir.resolve("missing.json");

        IOException exception = assertThrows(IOException.class,
                () -> jsonFileHandler.readConfig(missing.toString()));

        assertThat(exception.getMessage()).contains("El archivo especificado no existe");
    }
}
