package stationqc.qc.detector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import stationqc.config.QcConfig;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.testutil.SyntheticNetwork;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UnreliableStationDetectorTest {

    private final UnreliableStationDetector detector = new UnreliableStationDetector();

    private static MeasurementMatrix tenRowsWithMostlyMissingB() {
        double[][] values = new double[10][2];
        for (int row = 0; row < 10; row++) {
            values[row][0] = 0.0;
            values[row][1] = row < 2 ? 1.0 : Double.NaN;
        }
        List<LocalDateTime> timestamps = new ArrayList<>();
        for (int row = 0; row < 10; row++) {
            timestamps.add(SyntheticNetwork.START.plusHours(row));
        }
        return MeasurementMatrix.of(timestamps, List.of("A", "B"), values);
    }

    @Test
    @DisplayName("Una estación con un 80% de ausencias supera el umbral de 0.5")
    void detect_shouldFlagMostlyMissingStation() {
        assertThat(detector.detect(tenRowsWithMostlyMissingB(), 0.5)).containsExactly("B");
    }

    @Test
    @DisplayName("Con umbral 1.0 nunca se marca nada, ni siquiera una estación vacía")
    void detect_thresholdOneNeverFlags() {
        MeasurementMatrix matrix = SyntheticNetwork.hourly(1, 3, 0.1, 1L)
                .withMissing(2, t -> true)
                .build();

        assertThat(detector.detect(matrix, 1.0)).isEmpty();
    }

    @Test
    @DisplayName("La comparación es estricta")
    void detect_isStrict() {
        MeasurementMatrix matrix = SyntheticNetwork.hourly(1, 2, 0.1, 1L)
                .withMissing(0, t -> t % 2 == 0)
                .build();

        assertThat(detector.detect(matrix, 0.5)).isEmpty();
        assertThat(detector.detect(matrix, 0.49)).containsExactly("S00");
    }

    @Test
    @DisplayName("Sin filas no hay nada que marcar")
    void detect_emptyMatrix() {
        MeasurementMatrix empty = MeasurementMatrix.of(List.of(), List.of("A"), new double[0][]);

        assertThat(detector.detect(empty, QcConfig.getDefault())).isEmpty();
    }
}
