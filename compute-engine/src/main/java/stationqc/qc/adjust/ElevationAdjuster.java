package stationqc.qc.adjust;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import stationqc.domain.series.MeasurementMatrix;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Corrección del sesgo por altitud mediante un gradiente térmico vertical.
 * <p>
 * Cada estación se desplaza {@code lapseRate · (altitud - altitud media)}, con la media
 * calculada sobre las estaciones presentes en la matriz. El desplazamiento es aditivo y
 * constante en el tiempo; las lecturas ausentes siguen ausentes.
 */
@Slf4j
public class ElevationAdjuster {

    public static final double DRY_AIR_LAPSE_RATE = 0.0065;

    public MeasurementMatrix adjust(MeasurementMatrix matrix, Map<String, Double> elevations) {
        return adjust(matrix, elevations, DRY_AIR_LAPSE_RATE);
    }

    /**
     * @param elevations Altitud por estación. Puede contener estaciones que no estén en la matriz.
     * @throws IllegalArgumentException si alguna estación de la matriz no tiene altitud.
     */
    public MeasurementMatrix adjust(MeasurementMatrix matrix, Map<String, Double> elevations, double lapseRate) {
        final int cols = matrix.getStationCount();
        if (cols == 0) {
            return matrix;
        }

        double[] stationElevation = alignedElevations(matrix.getStationIds(), elevations);
        double meanElevation = StatUtils.mean(stationElevation);

        double[] offsets = new double[cols];
        for (int col = 0; col < cols; col++) {
            offsets[col] = lapseRate * (stationElevation[col] - meanElevation);
        }

        double[][] adjusted = matrix.toArray();
        for (double[] row : adjusted) {
            for (int col = 0; col < cols; col++) {
                row[col] += offsets[col];
            }
        }

        log.info("Elevation adjustment applied to {} stations (lapse rate {}, mean elevation {} m)",
                cols, lapseRate, meanElevation);
        return matrix.withValues(adjusted);
    }

    private static double[] alignedElevations(List<String> stationIds, Map<String, Double> elevations) {
        double[] aligned = new double[stationIds.size()];
        List<String> missing = new ArrayList<>();
        for (int col = 0; col < aligned.length; col++) {
            Double elevation = elevations.get(stationIds.get(col));
            if (elevation == null || Double.isNaN(elevation)) {
                missing.add(stationIds.get(col));
            } else {
                aligned[col] = elevation;
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Faltan altitudes para las estaciones: " + missing);
        }
        return aligned;
    }
}
