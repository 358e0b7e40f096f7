package stationqc.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import stationqc.stats.Aggregator;
import stationqc.stats.NamedAggregator;

import java.util.List;

/**
 * Parámetros de la detección de errores radiativos. Los mismos umbrales de cola, distribución
 * y z-score robusto se reutilizan en la detección de sobrecalentamiento en el pico diario y
 * en el reemplazo de atípicos.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class RadiativeErrorConfig {

    /**
     * Probabilidad de la cola inferior para el valor crítico inferior.
     */
    @Builder.Default
    double lowerAlpha = 0.01;

    /**
     * Probabilidad acumulada para el valor crítico superior.
     */
    @Builder.Default
    double upperAlpha = 0.95;

    /**
     * Proporción máxima de lecturas atípicas a partir de la cual una estación se descarta
     * (comparación estricta).
     */
    @Builder.Default
    double maxPropThreshold = 0.2;

    /**
     * Distribución de referencia ("norm", "t", "cauchy"...). Si es nula se usa la normal con
     * 100 estaciones o más y la t de Student con n - 1 grados de libertad en otro caso.
     */
    String distribution;

    /**
     * Parámetros posicionales de la distribución: parámetros de forma, y opcionalmente
     * localización y escala.
     */
    @Builder.Default
    List<Double> shapeParams = List.of();

    /**
     * Centro del z-score robusto.
     */
    @Builder.Default
    Aggregator center = NamedAggregator.MEDIAN;

    /**
     * Divisor del z-score robusto.
     */
    @Builder.Default
    Aggregator divisor = NamedAggregator.QN;

    public static RadiativeErrorConfig getDefault() {
        return RadiativeErrorConfig.builder().build();
    }
}
