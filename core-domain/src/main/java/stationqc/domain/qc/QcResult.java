package stationqc.domain.qc;

import stationqc.domain.series.MeasurementMatrix;

import java.util.Optional;

/**
 * Resultado de un control de calidad completo.
 *
 * @param report          Estaciones descartadas por etapa.
 * @param replacedMatrix  Solo en modo reemplazo: valores originales (sin ajuste de altitud)
 *                        de las estaciones supervivientes, con las celdas atípicas sustituidas.
 */
public record QcResult(QcReport report, MeasurementMatrix replacedMatrix) {

    public static QcResult excluding(QcReport report) {
        return new QcResult(report, null);
    }

    public Optional<MeasurementMatrix> getReplacedMatrix() {
        return Optional.ofNullable(replacedMatrix);
    }

    public boolean isReplacementMode() {
        return replacedMatrix != null;
    }
}
