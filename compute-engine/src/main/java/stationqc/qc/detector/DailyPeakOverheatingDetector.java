package stationqc.qc.detector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import stationqc.config.DailyPeakConfig;
import stationqc.config.QcConfig;
import stationqc.config.RadiativeErrorConfig;
import stationqc.domain.exception.InsufficientDataException;
import stationqc.domain.qc.QcCheck;
import stationqc.domain.series.MeasurementMatrix;
import stationqc.qc.statistics.Autocorrelation;
import stationqc.qc.statistics.AutoRegressiveModel;
import stationqc.qc.statistics.CriticalValues;
import stationqc.qc.statistics.OutlierClassifier;
import stationqc.qc.statistics.SamplingFrequency;
import stationqc.stats.Aggregator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Estaciones con sobrecalentamiento en el pico diario.
 * <p>
 * Algunas carcasas acumulan calor y producen un pico artificial a la misma hora cada día.
 * Una estación se marca solo si supera dos pruebas:
 * <ol>
 *     <li><b>Periodicidad</b>: tras ajustar un AR(p) a su serie de z-scores robustos, la
 *     autocorrelación de los residuos alcanza su máximo exactamente en el retardo de un día
 *     y ese máximo es significativo ({@code acf > z / sqrt(n)}).</li>
 *     <li><b>Amplitud</b>: la media horaria de la estación en su hora pico, dividida por el
 *     divisor de esa hora calculado sobre <i>toda</i> la red, supera el valor crítico
 *     superior.</li>
 * </ol>
 * El divisor de la prueba de amplitud es compartido entre estaciones a propósito: mide la
 * amplitud de la estación respecto a la dispersión de la red a esa hora.
 * <p>
 * Del {@link RadiativeErrorConfig} recibido se ignora {@code maxPropThreshold}: aquí no se
 * cuenta la proporción de atípicos.
 */
@Slf4j
@RequiredArgsConstructor
public class DailyPeakOverheatingDetector implements StationDetector {

    private static final int HOURS_PER_DAY = 24;

    private final RadiativeErrorDetector radiativeErrorDetector;

    public DailyPeakOverheatingDetector() {
        this(new RadiativeErrorDetector());
    }

    @Override
    public QcCheck getCheck() {
        return QcCheck.DAILY_PEAK_OVERHEATING;
    }

    @Override
    public List<String> detect(MeasurementMatrix matrix, QcConfig config) {
        return detect(matrix, config.getDailyPeakOverheating(), config.getDailyPeakWindows());
    }

    public List<String> detect(MeasurementMatrix matrix, RadiativeErrorConfig config) {
        return detect(matrix, config, DailyPeakConfig.getDefault());
    }

    /**
     * @throws InsufficientDataException si el índice temporal no es regular, el intervalo es
     *                                   demasiado grueso para el horizonte de autocorrelación o
     *                                   alguna estación no tiene datos suficientes para el AR(p).
     */
    public List<String> detect(MeasurementMatrix matrix, RadiativeErrorConfig config, DailyPeakConfig windows) {
        final int stations = matrix.getStationCount();
        if (stations == 0) {
            return new ArrayList<>();
        }

        Duration step = SamplingFrequency.infer(matrix.getTimestamps());
        final int arLags = lagsFor(windows.getAutoregressiveWindowHours(), step);
        final int acfLags = lagsFor(windows.getAutocorrelationWindowHours(), step);
        final int targetLag = lagsFor(windows.getTargetPeriodHours(), step);
        if (acfLags < 1 || targetLag < 1) {
            throw new InsufficientDataException(String.format(
                    "El intervalo de muestreo (%s) es demasiado grueso para buscar un pico de %.1f h.",
                    step, windows.getTargetPeriodHours()));
        }
        log.debug("Sampling step {}: AR({}), ACF up to lag {}, target lag {}", step, arLags, acfLags, targetLag);

        CriticalValues critical = CriticalValues.forStations(stations, config);
        MeasurementMatrix scores = radiativeErrorDetector.robustZScores(matrix, config);

        // 1. Prueba de periodicidad, independiente por estación
        boolean[] hasDailyPeak = new boolean[stations];
        if (windows.isParallelStationFits()) {
            IntStream.range(0, stations).parallel().forEach(col ->
                    hasDailyPeak[col] = hasSignificantPeak(scores, col, arLags, acfLags, targetLag, windows));
        } else {
            for (int col = 0; col < stations; col++) {
                hasDailyPeak[col] = hasSignificantPeak(scores, col, arLags, acfLags, targetLag, windows);
            }
        }

        // 2. Prueba de amplitud, con el divisor horario de toda la red
        double[] amplitudes = peakHourAmplitudes(scores, config.getDivisor());
        boolean[] overheated = OutlierClassifier.outlierMask(amplitudes, null, critical.upper());

        List<String> flagged = new ArrayList<>();
        for (int col = 0; col < stations; col++) {
            if (hasDailyPeak[col] && overheated[col]) {
                flagged.add(matrix.getStationIds().get(col));
            }
        }

        log.info("Daily peak overheating stations: {}", flagged);
        return flagged;
    }

    private boolean hasSignificantPeak(MeasurementMatrix scores, int col, int arLags, int acfLags, int targetLag,
                                       DailyPeakConfig windows) {
        String stationId = scores.getStationIds().get(col);
        double[] series = fillGaps(scores.getColumn(col), stationId);

        final AutoRegressiveModel model;
        try {
            model = AutoRegressiveModel.fit(series, arLags);
        } catch (InsufficientDataException e) {
            throw new InsufficientDataException("Estación " + stationId + ": " + e.getMessage(), e);
        }
        double[] residualAcf = Autocorrelation.acf(model.getResiduals(), acfLags);

        int peak = peakLag(residualAcf);
        if (peak != targetLag) {
            return false;
        }
        double bound = windows.getSignificanceZ() / Math.sqrt(series.length);
        log.debug("Station {} residual ACF peaks at lag {} ({} vs bound {})",
                stationId, peak, residualAcf[peak], bound);
        return residualAcf[peak] > bound;
    }

    /**
     * Retardo (>= 1) con la mayor autocorrelación; -1 si no hay ningún valor definido.
     */
    static int peakLag(double[] acf) {
        int peak = -1;
        for (int lag = 1; lag < acf.length; lag++) {
            if (!Double.isNaN(acf[lag]) && (peak < 0 || acf[lag] > acf[peak])) {
                peak = lag;
            }
        }
        return peak;
    }

    /**
     * Relleno hacia delante y después hacia atrás.
     */
    static double[] fillGaps(double[] series, String stationId) {
        double[] filled = series.clone();
        int firstValid = -1;
        for (int t = 0; t < filled.length; t++) {
            if (Double.isNaN(filled[t])) {
                if (t > 0) {
                    filled[t] = filled[t - 1];
                }
            } else if (firstValid < 0) {
                firstValid = t;
            }
        }
        if (firstValid < 0) {
            throw new InsufficientDataException("La estación " + stationId + " no tiene ninguna lectura válida.");
        }
        for (int t = 0; t < firstValid; t++) {
            filled[t] = filled[firstValid];
        }
        return filled;
    }

    /**
     * Para cada estación: media de sus z-scores en su hora pico dividida por el divisor de
     * esa hora sobre todas las estaciones. NaN si la estación no tiene datos.
     */
    static double[] peakHourAmplitudes(MeasurementMatrix scores, Aggregator divisor) {
        final int rows = scores.getTimestampCount();
        final int stations = scores.getStationCount();
        int[] hourOfRow = new int[rows];
        for (int row = 0; row < rows; row++) {
            hourOfRow[row] = scores.getTimestamps().get(row).getHour();
        }

        double[] hourlyDivisor = pooledHourlyDivisor(scores, hourOfRow, divisor);

        double[] amplitudes = new double[stations];
        for (int col = 0; col < stations; col++) {
            double[] sums = new double[HOURS_PER_DAY];
            int[] counts = new int[HOURS_PER_DAY];
            for (int row = 0; row < rows; row++) {
                double z = scores.get(row, col);
                if (!Double.isNaN(z)) {
                    sums[hourOfRow[row]] += z;
                    counts[hourOfRow[row]]++;
                }
            }

            int peakHour = -1;
            double peakMean = Double.NaN;
            for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
                if (counts[hour] == 0) {
                    continue;
                }
                double mean = sums[hour] / counts[hour];
                if (peakHour < 0 || mean > peakMean) {
                    peakHour = hour;
                    peakMean = mean;
                }
            }
            amplitudes[col] = peakHour < 0 ? Double.NaN : peakMean / hourlyDivisor[peakHour];
        }
        return amplitudes;
    }

    private static double[] pooledHourlyDivisor(MeasurementMatrix scores, int[] hourOfRow, Aggregator divisor) {
        List<List<Double>> pooled = new ArrayList<>();
        for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
            pooled.add(new ArrayList<>());
        }
        for (int row = 0; row < scores.getTimestampCount(); row++) {
            for (double z : scores.getPresentValues(row)) {
                pooled.get(hourOfRow[row]).add(z);
            }
        }

        double[] hourly = new double[HOURS_PER_DAY];
        for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
            double[] values = pooled.get(hour).stream().mapToDouble(Double::doubleValue).toArray();
            hourly[hour] = values.length == 0 ? Double.NaN : divisor.aggregate(values);
        }
        return hourly;
    }

    private static int lagsFor(double windowHours, Duration step) {
        return (int) (windowHours / SamplingFrequency.toHours(step));
    }
}
