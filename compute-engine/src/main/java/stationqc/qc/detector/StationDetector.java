package stationqc.qc.detector;

import stationqc.config.QcConfig;
import stationqc.domain.qc.QcCheck;
import stationqc.domain.series.MeasurementMatrix;

import java.util.List;

/**
 * Etapa del control de calidad que decide, a partir de la matriz de mediciones, qué
 * estaciones descartar.
 * <p>
 * Las implementaciones son puras: no modifican la matriz ni guardan estado entre llamadas.
 */
public interface StationDetector {

    /**
     * Clave con la que la etapa aparece en el informe.
     */
    QcCheck getCheck();

    /**
     * @return Identificadores de las estaciones marcadas, en orden de columna.
     */
    List<String> detect(MeasurementMatrix matrix, QcConfig config);
}
