package stationqc.qc.detector;

import lombok.extern.slf4j.Slf4j;
import stationqc.config.QcConfig;
import stationqc.config.RadiativeErrorConfig;
import stationqc.domain.qc.QcCheck;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.domain.series.OutlierMask;
import stationqc.qc.statistics.CriticalValues;
import stationqc.qc.statistics.OutlierClassifier;
import stationqc.qc.statistics.ZScoreCalculator;

import java.util.ArrayList;
import java.util.List;

/**
 * Estaciones con error radiativo sistemático.
 * <p>
 * Una estación expuesta al sol directo se desvía con frecuencia de la distribución del resto
 * de la red. Las lecturas se estandarizan con un z-score robusto (mediana y Qn por defecto,
 * para que las propias estaciones defectuosas no inflen la escala) y se comparan con los
 * valores críticos de la distribución de referencia. Si la proporción de lecturas atípicas
 * de una estación supera {@code maxPropThreshold}, la estación se descarta.
 */
@Slf4j
public class RadiativeErrorDetector implements StationDetector {

    @Override
    public QcCheck getCheck() {
        return QcCheck.RADIATIVE_ERROR;
    }

    @Override
    public List<String> detect(MeasurementMatrix matrix, QcConfig config) {
        return detect(matrix, config.getRadiativeError());
    }

    public List<String> detect(MeasurementMatrix matrix, RadiativeErrorConfig config) {
        List<String> flagged = new ArrayList<>();
        final int rows = matrix.getTimestampCount();
        if (rows == 0) {
            return flagged;
        }

        int[] outlierCounts = outlierMask(matrix, config).countPerStation();
        for (int col = 0; col < outlierCounts.length; col++) {
            double proportion = (double) outlierCounts[col] / rows;
            if (proportion > config.getMaxPropThreshold()) {
                flagged.add(matrix.getStationIds().get(col));
            }
        }

        log.info("Radiative error stations (outlier proportion > {}): {}", config.getMaxPropThreshold(), flagged);
        return flagged;
    }

    /**
     * Máscara de lecturas atípicas según los valores críticos de la distribución de referencia.
     * Es también la máscara por defecto del reemplazo de atípicos.
     */
    public OutlierMask outlierMask(MeasurementMatrix matrix, RadiativeErrorConfig config) {
        CriticalValues critical = CriticalValues.forStations(matrix.getStationCount(), config);
        MeasurementMatrix scores = robustZScores(matrix, config);
        return OutlierClassifier.outlierMask(scores, critical.lower(), critical.upper());
    }

    public MeasurementMatrix robustZScores(MeasurementMatrix matrix, RadiativeErrorConfig config) {
        return ZScoreCalculator.zScore(matrix, config.getCenter(), config.getDivisor());
    }
}
