package stationqc.qc.detector;

import lombok.extern.slf4j.Slf4j;
import stationqc.config.QcConfig;
import stationqc.domain.qc.QcCheck;
import stationqc.domain.series.MeasurementMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * Estaciones poco fiables: proporción de lecturas ausentes estrictamente mayor que el umbral.
 */
@Slf4j
public class UnreliableStationDetector implements StationDetector {

    @Override
    public QcCheck getCheck() {
        return QcCheck.UNRELIABLE;
    }

    @Override
    public List<String> detect(MeasurementMatrix matrix, QcConfig config) {
        return detect(matrix, config.getUnreliableThreshold());
    }

    public List<String> detect(MeasurementMatrix matrix, double threshold) {
        final int rows = matrix.getTimestampCount();
        List<String> unreliable = new ArrayList<>();
        if (rows == 0) {
            return unreliable;
        }

        for (int col = 0; col < matrix.getStationCount(); col++) {
            int missing = 0;
            for (int row = 0; row < rows; row++) {
                if (MeasurementMatrix.isMissing(matrix.get(row, col))) {
                    missing++;
                }
            }
            double missingProportion = (double) missing / rows;
            if (missingProportion > threshold) {
                unreliable.add(matrix.getStationIds().get(col));
            }
        }

        log.info("Unreliable stations (missing > {}): {}", threshold, unreliable);
        return unreliable;
    }
}
