package stationqc.qc.statistics;

import stationqc.domain.exception.InsufficientDataException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Inferencia de la frecuencia de muestreo de un índice temporal regular.
 */
public final class SamplingFrequency {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private SamplingFrequency() {
    }

    /**
     * Intervalo común entre instantes consecutivos.
     *
     * @throws InsufficientDataException si hay menos de tres instantes o el intervalo no es constante.
     */
    public static Duration infer(List<LocalDateTime> timestamps) {
        if (timestamps.size() < 3) {
            throw new InsufficientDataException("No se puede inferir la frecuencia de muestreo con "
                    + timestamps.size() + " instante(s); se necesitan al menos 3.");
        }
        Duration step = Duration.between(timestamps.get(0), timestamps.get(1));
        for (int i = 2; i < timestamps.size(); i++) {
            Duration current = Duration.between(timestamps.get(i - 1), timestamps.get(i));
            if (!current.equals(step)) {
                throw new InsufficientDataException(String.format(
                        "No se puede inferir la frecuencia de muestreo: el intervalo cambia de %s a %s en %s.",
                        step, current, timestamps.get(i)));
            }
        }
        return step;
    }

    public static double inferHours(List<LocalDateTime> timestamps) {
        return toHours(infer(timestamps));
    }

    public static double toHours(Duration step) {
        return step.getSeconds() / SECONDS_PER_HOUR + step.getNano() / (SECONDS_PER_HOUR * 1e9);
    }
}
