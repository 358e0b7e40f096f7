package stationqc.qc.statistics;

import lombok.extern.slf4j.Slf4j;
import stationqc.config.RadiativeErrorConfig;

import java.util.List;

/**
 * Valores críticos inferior y superior para clasificar z-scores robustos.
 *
 * @param lower Cuantil de la distribución de referencia en {@code lowerAlpha}.
 * @param upper Cuantil de la distribución de referencia en {@code upperAlpha}.
 */
@Slf4j
public record CriticalValues(double lower, double upper) {

    /**
     * Número de estaciones a partir del cual se usa la normal en lugar de la t de Student.
     */
    public static final int NORMAL_APPROXIMATION_MIN_STATIONS = 100;

    /**
     * Calcula los valores críticos para una red de {@code stationCount} estaciones.
     * <p>
     * Sin distribución explícita: normal estándar con 100 estaciones o más, t de Student
     * con {@code stationCount - 1} grados de libertad en otro caso. Con menos de dos
     * estaciones la t no está definida y ambos valores son NaN (nada se marcará).
     */
    public static CriticalValues forStations(int stationCount, RadiativeErrorConfig config) {
        final ReferenceDistribution distribution;
        final List<Double> params;

        if (config.getDistribution() != null) {
            distribution = ReferenceDistribution.fromName(config.getDistribution());
            params = config.getShapeParams();
        } else if (stationCount >= NORMAL_APPROXIMATION_MIN_STATIONS) {
            distribution = ReferenceDistribution.NORMAL;
            params = List.of();
        } else {
            int degreesOfFreedom = stationCount - 1;
            if (degreesOfFreedom < 1) {
                log.warn("Critical values undefined for {} station(s): Student's t needs at least one degree of freedom",
                        stationCount);
                return new CriticalValues(Double.NaN, Double.NaN);
            }
            distribution = ReferenceDistribution.STUDENT_T;
            params = List.of((double) degreesOfFreedom);
        }

        CriticalValues values = new CriticalValues(
                distribution.inverseCumulativeProbability(config.getLowerAlpha(), params),
                distribution.inverseCumulativeProbability(config.getUpperAlpha(), params));
        log.debug("Critical values from {} {}: {}", distribution.getCode(), params, values);
        return values;
    }
}
