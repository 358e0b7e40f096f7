package stationqc.qc.statistics;

import stationqc.config.OutlierConfig;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.domain.series.OutlierMask;

/**
 * Convierte scores en máscaras de atípicos a partir de uno o dos umbrales de cola.
 * <p>
 * Las comparaciones son estrictas: un score exactamente igual al umbral no se marca.
 * Un umbral {@code null} desactiva esa cola; un score NaN nunca se marca.
 */
public final class OutlierClassifier {

    private OutlierClassifier() {
    }

    public static OutlierMask outlierMask(MeasurementMatrix scores, Double lowerThreshold, Double upperThreshold) {
        requireAnyThreshold(lowerThreshold, upperThreshold);
        final int rows = scores.getTimestampCount();
        final int cols = scores.getStationCount();
        boolean[][] flags = new boolean[rows][cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                flags[row][col] = isOutlier(scores.get(row, col), lowerThreshold, upperThreshold);
            }
        }
        return new OutlierMask(scores.getTimestamps(), scores.getStationIds(), flags);
    }

    /**
     * Versión vectorial, para un score por estación.
     */
    public static boolean[] outlierMask(double[] scores, Double lowerThreshold, Double upperThreshold) {
        requireAnyThreshold(lowerThreshold, upperThreshold);
        boolean[] flags = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            flags[i] = isOutlier(scores[i], lowerThreshold, upperThreshold);
        }
        return flags;
    }

    /**
     * Z-score y clasificación en una sola llamada, con los parámetros de {@link OutlierConfig}.
     */
    public static OutlierMask outlierMask(MeasurementMatrix matrix, OutlierConfig config) {
        MeasurementMatrix scores = ZScoreCalculator.zScore(matrix, config.getCenter(), config.getDivisor());
        return outlierMask(scores, config.getLowerThreshold(), config.getUpperThreshold());
    }

    private static boolean isOutlier(double score, Double lowerThreshold, Double upperThreshold) {
        return (lowerThreshold != null && score < lowerThreshold)
                || (upperThreshold != null && score > upperThreshold);
    }

    private static void requireAnyThreshold(Double lowerThreshold, Double upperThreshold) {
        if (lowerThreshold == null && upperThreshold == null) {
            throw new IllegalArgumentException("Se debe indicar al menos un umbral (inferior o superior).");
        }
    }
}
