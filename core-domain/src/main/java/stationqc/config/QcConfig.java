package stationqc.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Contenedor de todos los parámetros de un control de calidad completo.
 * <p>
 * Sustituye a una configuración global: cada llamada recibe la suya, y los valores por
 * defecto son los documentados para cada detector.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class QcConfig {

    /**
     * Proporción de lecturas ausentes a partir de la cual una estación no es fiable.
     */
    @Builder.Default
    double unreliableThreshold = 0.2;

    /**
     * Ajuste por altitud. {@code null}: automático, se aplica si hay altitudes disponibles.
     */
    Boolean adjustElevation;

    /**
     * Gradiente térmico vertical, en unidades de la medición por unidad de altitud.
     */
    @Builder.Default
    double atmosphericLapseRate = 0.0065;

    @Builder.Default
    RadiativeErrorConfig radiativeError = RadiativeErrorConfig.getDefault();

    /**
     * Umbrales de cola y z-score de la detección de sobrecalentamiento en el pico diario.
     * Esta etapa usa colas, distribución, centro y divisor;
     * {@link RadiativeErrorConfig#getMaxPropThreshold()} no interviene.
     */
    @Builder.Default
    RadiativeErrorConfig dailyPeakOverheating = RadiativeErrorConfig.getDefault();

    @Builder.Default
    DailyPeakConfig dailyPeakWindows = DailyPeakConfig.getDefault();

    /**
     * Correlación de Pearson con la mediana espacial por debajo de la cual una estación
     * se considera de interior.
     */
    @Builder.Default
    double indoorCorrelationThreshold = 0.9;

    /**
     * Si es true, además del informe se devuelve la matriz con los atípicos reemplazados.
     */
    boolean replaceOutliers;

    /**
     * Valor con el que se sustituyen las celdas atípicas.
     */
    @Builder.Default
    double replacementValue = Double.NaN;

    /**
     * Detección de atípicos para el reemplazo. {@code null}: se usan los parámetros de
     * {@link #radiativeError} (sin el umbral de proporción).
     */
    OutlierConfig outlierReplacement;

    public static QcConfig getDefault() {
        return QcConfig.builder().build();
    }
}
