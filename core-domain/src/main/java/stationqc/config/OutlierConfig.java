package stationqc.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import stationqc.stats.Aggregator;
import stationqc.stats.NamedAggregator;

/**
 * Detección genérica de atípicos por z-score. Por defecto aplica la regla de las tres sigmas
 * sobre media y desviación típica. Un umbral nulo desactiva esa cola.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class OutlierConfig {

    @Builder.Default
    Aggregator center = NamedAggregator.MEAN;

    @Builder.Default
    Aggregator divisor = NamedAggregator.STD;

    @Builder.Default
    Double lowerThreshold = -3.0;

    @Builder.Default
    Double upperThreshold = 3.0;

    public static OutlierConfig threeSigma() {
        return OutlierConfig.builder().build();
    }
}
