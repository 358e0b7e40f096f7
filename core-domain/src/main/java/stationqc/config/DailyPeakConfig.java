package stationqc.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Ventanas temporales (en horas) de la detección de sobrecalentamiento en el pico diario.
 * Se traducen a retardos dividiendo por el intervalo de muestreo.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class DailyPeakConfig {

    /**
     * Memoria del modelo autorregresivo. 3 h a resolución horaria da un AR(3).
     */
    @Builder.Default
    double autoregressiveWindowHours = 3.0;

    /**
     * Horizonte de la autocorrelación de los residuos.
     */
    @Builder.Default
    double autocorrelationWindowHours = 48.0;

    /**
     * Periodo del pico espurio buscado (un día).
     */
    @Builder.Default
    double targetPeriodHours = 24.0;

    /**
     * Coeficiente de la banda de significación {@code z / sqrt(n)} (1.96 para el 95%).
     */
    @Builder.Default
    double significanceZ = 1.96;

    /**
     * Ajusta los modelos de cada estación en paralelo. No cambia el resultado.
     */
    boolean parallelStationFits;

    public static DailyPeakConfig getDefault() {
        return DailyPeakConfig.builder().build();
    }
}
