package stationqc.qc.statistics;

import lombok.extern.slf4j.Slf4j;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.stats.Aggregator;

/**
 * Z-scores transversales: cada celda se estandariza con el centro y el divisor de las
 * estaciones presentes en ese mismo instante.
 * <p>
 * {@code z(t, s) = (x(t, s) - center(t)) / divisor(t)}
 * <p>
 * Un divisor nulo o casi nulo no se protege: produce ±Infinity o NaN. Quien clasifique
 * los scores debe tratar los no finitos como no clasificables ({@link OutlierClassifier}
 * nunca marca un NaN).
 */
@Slf4j
public final class ZScoreCalculator {

    private ZScoreCalculator() {
    }

    public static MeasurementMatrix zScore(MeasurementMatrix matrix, Aggregator center, Aggregator divisor) {
        final int rows = matrix.getTimestampCount();
        final int cols = matrix.getStationCount();
        double[][] scores = new double[rows][cols];

        for (int row = 0; row < rows; row++) {
            double[] present = matrix.getPresentValues(row);
            double rowCenter = center.aggregate(present);
            double rowDivisor = divisor.aggregate(present);

            for (int col = 0; col < cols; col++) {
                // NaN se propaga solo: una lectura ausente sigue ausente
                scores[row][col] = (matrix.get(row, col) - rowCenter) / rowDivisor;
            }
        }

        log.debug("Z-scores calculados ({} / {}) sobre {}", center.getName(), divisor.getName(), matrix);
        return matrix.withValues(scores);
    }
}
