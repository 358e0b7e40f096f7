package stationqc.qc.detector;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import stationqc.config.DailyPeakConfig;
import stationqc.config.QcConfig;
import stationqc.config.RadiativeErrorConfig;
import stationqc.domain.exception.InsufficientDataException;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.stats.Aggregator;
import stationqc.testutil.SyntheticNetwork;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Slf4j
class DailyPeakOverheatingDetectorTest {

    // Cola superior más exigente que la de serie: solo un pico sistemático supera la prueba de amplitud
    private static final RadiativeErrorConfig STRICT_AMPLITUDE = RadiativeErrorConfig.getDefault().withUpperAlpha(0.999);

    private DailyPeakOverheatingDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DailyPeakOverheatingDetector();
    }

    private static MeasurementMatrix networkWithAfternoonSpike() {
        return SyntheticNetwork.hourly(3, 20, 0.5, 42L)
                .withDailySpike(7, 14, 8.0)
                .build();
    }

    @Test
    @DisplayName("Un pico diario a la misma hora supera las pruebas de periodicidad y amplitud")
    void detect_shouldFlagDailySpike() {
        // --- Arrange ---
        MeasurementMatrix matrix = networkWithAfternoonSpike();

        // --- Act ---
        List<String> flagged = detector.detect(matrix, STRICT_AMPLITUDE);

        // --- Assert ---
        assertThat(flagged).containsExactly("S07");
    }

    @Test
    @DisplayName("Con los umbrales por defecto solo se marca la estación con pico")
    void detect_defaultThresholdsFlagOnlySpike() {
        // --- Arrange ---
        // Seis días: la media horaria de una estación limpia no alcanza el valor crítico por azar.
        // Horizonte de 30 h: el retardo de 48 h no compite con el de un día.
        MeasurementMatrix matrix = SyntheticNetwork.hourly(6, 20, 0.5, 42L)
                .withDailySpike(7, 14, 8.0)
                .build();
        DailyPeakConfig oneDayHorizon = DailyPeakConfig.getDefault().withAutocorrelationWindowHours(30.0);

        // --- Act ---
        List<String> flagged = detector.detect(matrix, QcConfig.getDefault().getDailyPeakOverheating(), oneDayHorizon);
        log.info("Flagged with default thresholds: {}", flagged);

        // --- Assert ---
        assertThat(flagged).containsExactly("S07");
    }

    @Test
    @DisplayName("La proporción máxima de atípicos no influye en esta etapa")
    void detect_ignoresMaxPropThreshold() {
        MeasurementMatrix matrix = networkWithAfternoonSpike();

        List<String> flagged = detector.detect(matrix, STRICT_AMPLITUDE.withMaxPropThreshold(0.0));

        assertThat(flagged).isEqualTo(detector.detect(matrix, STRICT_AMPLITUDE.withMaxPropThreshold(1.0)));
        assertThat(flagged).containsExactly("S07");
    }

    @Test
    @DisplayName("Ajustar en paralelo no cambia el resultado")
    void detect_parallelFitsGiveSameResult() {
        MeasurementMatrix matrix = networkWithAfternoonSpike();
        DailyPeakConfig parallel = DailyPeakConfig.getDefault().withParallelStationFits(true);

        assertThat(detector.detect(matrix, STRICT_AMPLITUDE, parallel))
                .isEqualTo(detector.detect(matrix, STRICT_AMPLITUDE, DailyPeakConfig.getDefault()));
    }

    @Test
    @DisplayName("Una red sin picos no tiene estaciones sobrecalentadas")
    void detect_cleanNetwork() {
        MeasurementMatrix matrix = SyntheticNetwork.hourly(3, 20, 0.5, 42L).build();

        assertThat(detector.detect(matrix, STRICT_AMPLITUDE)).isEmpty();
    }

    @Test
    @DisplayName("Un índice irregular no permite inferir la frecuencia")
    void detect_irregularIndex() {
        LocalDateTime t0 = SyntheticNetwork.START;
        MeasurementMatrix matrix = MeasurementMatrix.of(
                List.of(t0, t0.plusHours(1), t0.plusHours(3), t0.plusHours(4)), List.of("A", "B"),
                new double[][]{{1, 2}, {1, 2}, {1, 2}, {1, 2}});

        assertThatThrownBy(() -> detector.detect(matrix, RadiativeErrorConfig.getDefault()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Un intervalo más largo que el periodo buscado es un error")
    void detect_samplingStepTooCoarse() {
        LocalDateTime t0 = SyntheticNetwork.START;
        MeasurementMatrix matrix = MeasurementMatrix.of(
                List.of(t0, t0.plusDays(2), t0.plusDays(4)), List.of("A", "B"),
                new double[][]{{1, 2}, {1, 2}, {1, 2}});

        assertThatThrownBy(() -> detector.detect(matrix, RadiativeErrorConfig.getDefault()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Una serie demasiado corta para el AR(p) es un error que nombra la estación")
    void detect_seriesTooShortForAutoregression() {
        MeasurementMatrix matrix = SyntheticNetwork.hourly(1, 3, 0.5, 1L).build();
        DailyPeakConfig longMemory = DailyPeakConfig.getDefault().withAutoregressiveWindowHours(30.0);

        assertThatThrownBy(() -> detector.detect(matrix, RadiativeErrorConfig.getDefault(), longMemory))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("S00");
    }

    @Test
    @DisplayName("Sin estaciones no hay nada que marcar")
    void detect_noStations() {
        MeasurementMatrix matrix = SyntheticNetwork.hourly(1, 3, 0.5, 1L).build().dropStations(List.of("S00", "S01", "S02"));

        assertThat(detector.detect(matrix, RadiativeErrorConfig.getDefault())).isEmpty();
    }

    @Test
    @DisplayName("El retardo pico ignora el retardo 0 y los NaN")
    void peakLag_shouldSkipLagZeroAndNaN() {
        assertThat(DailyPeakOverheatingDetector.peakLag(new double[]{1.0, 0.1, Double.NaN, 0.4, 0.2})).isEqualTo(3);
        assertThat(DailyPeakOverheatingDetector.peakLag(new double[]{1.0, Double.NaN})).isEqualTo(-1);
    }

    @Test
    @DisplayName("Los huecos se rellenan hacia delante y después hacia atrás")
    void fillGaps_forwardThenBackward() {
        double[] filled = DailyPeakOverheatingDetector.fillGaps(new double[]{Double.NaN, 1.0, Double.NaN, 3.0}, "A");

        assertThat(filled).containsExactly(1.0, 1.0, 1.0, 3.0);
        assertThatThrownBy(() -> DailyPeakOverheatingDetector.fillGaps(new double[]{Double.NaN}, "A"))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("La amplitud es la media de la hora pico dividida por el divisor de esa hora en toda la red")
    void peakHourAmplitudes_usesPooledHourlyDivisor() {
        LocalDateTime t0 = SyntheticNetwork.START;
        MeasurementMatrix scores = MeasurementMatrix.of(
                List.of(t0, t0.plusHours(1), t0.plusDays(1), t0.plusDays(1).plusHours(1)),
                List.of("A", "B"),
                new double[][]{{1.0, 0.0}, {3.0, 0.0}, {1.0, Double.NaN}, {5.0, 0.0}});
        Aggregator two = Aggregator.custom("two", values -> 2.0);

        double[] amplitudes = DailyPeakOverheatingDetector.peakHourAmplitudes(scores, two);

        // A: hora 1 con media 4; B: todas sus horas valen 0
        assertThat(amplitudes[0]).isCloseTo(2.0, within(1e-12));
        assertThat(amplitudes[1]).isCloseTo(0.0, within(1e-12));
    }
}
