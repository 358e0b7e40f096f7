package stationqc.qc.detector;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import stationqc.config.QcConfig;
import stationqc.domain.qc.QcCheck;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.stats.NamedAggregator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Estaciones de interior.
 * <p>
 * Una estación instalada dentro de un edificio apenas sigue el ciclo diario exterior, así
 * que su serie se correlaciona poco con la mediana espacial de la red.
 */
@Slf4j
public class IndoorStationDetector implements StationDetector {

    @Override
    public QcCheck getCheck() {
        return QcCheck.INDOOR;
    }

    @Override
    public List<String> detect(MeasurementMatrix matrix, QcConfig config) {
        return detect(matrix, config.getIndoorCorrelationThreshold());
    }

    /**
     * @param threshold Correlación de Pearson por debajo de la cual (estrictamente) se marca la estación.
     */
    public List<String> detect(MeasurementMatrix matrix, double threshold) {
        double[] spatialMedian = spatialMedian(matrix);

        List<String> indoor = new ArrayList<>();
        for (int col = 0; col < matrix.getStationCount(); col++) {
            double correlation = correlation(matrix.getColumn(col), spatialMedian);
            log.debug("Station {} correlation with spatial median: {}", matrix.getStationIds().get(col), correlation);
            // Una correlación indefinida (NaN) no marca la estación
            if (correlation < threshold) {
                indoor.add(matrix.getStationIds().get(col));
            }
        }

        log.info("Indoor stations (correlation < {}): {}", threshold, indoor);
        return indoor;
    }

    /**
     * Mediana de las estaciones presentes en cada instante.
     */
    static double[] spatialMedian(MeasurementMatrix matrix) {
        double[] median = new double[matrix.getTimestampCount()];
        for (int row = 0; row < median.length; row++) {
            median[row] = NamedAggregator.MEDIAN.aggregate(matrix.getPresentValues(row));
        }
        return median;
    }

    /**
     * Correlación de Pearson sobre los instantes en los que ambas series tienen valor.
     */
    static double correlation(double[] series, double[] reference) {
        double[] x = new double[series.length];
        double[] y = new double[series.length];
        int pairs = 0;
        for (int i = 0; i < series.length; i++) {
            if (!MeasurementMatrix.isMissing(series[i]) && !MeasurementMatrix.isMissing(reference[i])) {
                x[pairs] = series[i];
                y[pairs] = reference[i];
                pairs++;
            }
        }
        if (pairs < 2) {
            return Double.NaN;
        }
        return new PearsonsCorrelation().correlation(Arrays.copyOf(x, pairs), Arrays.copyOf(y, pairs));
    }
}
