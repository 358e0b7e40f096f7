package stationqc.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import stationqc.config.QcConfig;
import stationqc.domain.qc.QcCheck;
import stationqc.domain.qc.QcReport;
import stationqc.domain.qc.QcResult;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.domain.series.OutlierMask;
import stationqc.domain.station.StationMetadata;
import stationqc.qc.adjust.ElevationAdjuster;
import stationqc.qc.detector.DailyPeakOverheatingDetector;
import stationqc.qc.detector.IndoorStationDetector;
import stationqc.qc.detector.MislocatedStationDetector;
import stationqc.qc.detector.RadiativeErrorDetector;
import stationqc.qc.detector.StationDetector;
import stationqc.qc.detector.UnreliableStationDetector;
import stationqc.qc.statistics.OutlierClassifier;

import java.util.List;
import java.util.Map;

/**
 * Orquestador del control de calidad completo.
 * <p>
 * Orden fijo de etapas:
 * <pre>
 * mal ubicadas → poco fiables → [ajuste por altitud] → error radiativo
 *     → sobrecalentamiento en pico diario → interior → [reemplazo de atípicos]
 * </pre>
 * Cada etapa recibe la matriz ya filtrada por las anteriores, registra sus estaciones en el
 * informe y las elimina antes de pasar a la siguiente.
 * <p>
 * El ajuste por altitud es solo una lente para la detección: en modo reemplazo, los valores
 * devueltos son los originales (sin ajustar) de las estaciones supervivientes.
 * <p>
 * Los errores de cualquier etapa se propagan tal cual: no hay informes parciales.
 */
@Slf4j
@RequiredArgsConstructor
public class QualityControlService {

    private final MislocatedStationDetector mislocatedDetector;
    private final UnreliableStationDetector unreliableDetector;
    private final ElevationAdjuster elevationAdjuster;
    private final RadiativeErrorDetector radiativeErrorDetector;
    private final DailyPeakOverheatingDetector dailyPeakOverheatingDetector;
    private final IndoorStationDetector indoorDetector;

    /**
     * Servicio con las implementaciones por defecto de cada etapa.
     */
    public QualityControlService() {
        this(new MislocatedStationDetector(),
                new UnreliableStationDetector(),
                new ElevationAdjuster(),
                new RadiativeErrorDetector(),
                new DailyPeakOverheatingDetector(),
                new IndoorStationDetector());
    }

    /**
     * Control de calidad en modo exclusión: solo el informe.
     */
    public QcReport runQc(MeasurementMatrix matrix, StationMetadata metadata, QcConfig config) {
        return runQc(matrix, metadata, null, config);
    }

    /**
     * Control de calidad en modo exclusión con altitudes explícitas.
     *
     * @param elevations Altitudes por estación; {@code null} usa las de los metadatos.
     */
    public QcReport runQc(MeasurementMatrix matrix, StationMetadata metadata, Map<String, Double> elevations,
                          QcConfig config) {
        return fullQc(matrix, metadata, elevations, config.withReplaceOutliers(false)).report();
    }

    /**
     * Control de calidad completo.
     *
     * @param matrix     Mediciones originales. No se modifica.
     * @param metadata   Metadatos de estaciones; {@code null} omite la detección de mal ubicadas.
     * @param elevations Altitudes explícitas por estación; {@code null} usa las de los metadatos.
     * @param config     Parámetros de todas las etapas.
     * @return El informe y, si {@link QcConfig#isReplaceOutliers()}, la matriz con los atípicos reemplazados.
     */
    public QcResult fullQc(MeasurementMatrix matrix, StationMetadata metadata, Map<String, Double> elevations,
                           QcConfig config) {
        log.info("Starting full QC on {}", matrix);
        QcReport.Builder report = QcReport.builder();
        MeasurementMatrix filtered = matrix;

        // 1. Estaciones mal ubicadas (solo con metadatos)
        if (metadata != null) {
            List<String> mislocated = mislocatedDetector.detect(metadata);
            report.record(QcCheck.MISLOCATED, mislocated);
            filtered = filtered.dropStations(mislocated);
        } else {
            log.debug("No station metadata supplied: skipping mislocation check");
        }

        // 2. Estaciones poco fiables
        filtered = runStage(unreliableDetector, filtered, config, report);

        // 3. Ajuste por altitud (opcional)
        MeasurementMatrix lens = filtered;
        Map<String, Double> stationElevations = resolveElevations(filtered, metadata, elevations,
                config.getAdjustElevation());
        if (shouldAdjustElevation(config.getAdjustElevation(), stationElevations)) {
            lens = elevationAdjuster.adjust(filtered, stationElevations, config.getAtmosphericLapseRate());
        }

        // 4. Detectores estadísticos sobre la serie (posiblemente) ajustada
        for (StationDetector detector : List.of(radiativeErrorDetector, dailyPeakOverheatingDetector, indoorDetector)) {
            lens = runStage(detector, lens, config, report);
        }

        QcReport finalReport = report.build();
        log.info("QC finished: {} stations kept, {} discarded", lens.getStationCount(),
                finalReport.getAllFlaggedStations().size());

        if (!config.isReplaceOutliers()) {
            return QcResult.excluding(finalReport);
        }

        // 5. Reemplazo de atípicos sobre los valores originales
        OutlierMask outliers = config.getOutlierReplacement() == null
                ? radiativeErrorDetector.outlierMask(lens, config.getRadiativeError())
                : OutlierClassifier.outlierMask(lens, config.getOutlierReplacement());
        MeasurementMatrix original = matrix.selectStations(lens.getStationIds());
        MeasurementMatrix replaced = replaceOutliers(original, outliers, config.getReplacementValue());
        return new QcResult(finalReport, replaced);
    }

    private MeasurementMatrix runStage(StationDetector detector, MeasurementMatrix matrix, QcConfig config,
                                       QcReport.Builder report) {
        List<String> flagged = detector.detect(matrix, config);
        log.info("Stage {}: {} of {} stations flagged", detector.getCheck().getKey(), flagged.size(),
                matrix.getStationCount());
        report.record(detector.getCheck(), flagged);
        return matrix.dropStations(flagged);
    }

    /**
     * Altitudes a usar en el ajuste. Un mapa explícito tiene prioridad. Las altitudes de los
     * metadatos solo se aplican de forma implícita si cubren todas las estaciones que siguen en la
     * matriz; con el ajuste pedido expresamente se devuelven igualmente y el ajustador rechaza las
     * que falten.
     */
    private static Map<String, Double> resolveElevations(MeasurementMatrix matrix, StationMetadata metadata,
                                                         Map<String, Double> elevations, Boolean adjustElevation) {
        if (elevations != null) {
            return elevations;
        }
        if (metadata == null || !metadata.hasElevations()) {
            return null;
        }
        Map<String, Double> fromMetadata = metadata.getElevations();
        if (adjustElevation == null && !fromMetadata.keySet().containsAll(matrix.getStationIds())) {
            List<String> missing = matrix.getStationIds().stream()
                    .filter(id -> !fromMetadata.containsKey(id))
                    .toList();
            log.warn("Station metadata lacks elevation for {}: skipping elevation adjustment", missing);
            return null;
        }
        return fromMetadata;
    }

    private static boolean shouldAdjustElevation(Boolean adjustElevation, Map<String, Double> elevations) {
        if (adjustElevation == null) {
            return elevations != null;
        }
        if (adjustElevation && elevations == null) {
            throw new IllegalArgumentException(
                    "Se ha pedido el ajuste por altitud, pero no hay altitudes ni en los metadatos ni explícitas.");
        }
        return adjustElevation;
    }

    static MeasurementMatrix replaceOutliers(MeasurementMatrix original, OutlierMask outliers, double replacementValue) {
        double[][] values = original.toArray();
        int replaced = 0;
        for (int row = 0; row < values.length; row++) {
            for (int col = 0; col < values[row].length; col++) {
                if (outliers.isFlagged(row, col)) {
                    values[row][col] = replacementValue;
                    replaced++;
                }
            }
        }
        log.info("Replaced {} outlier readings with {}", replaced, replacementValue);
        return original.withValues(values);
    }
}
