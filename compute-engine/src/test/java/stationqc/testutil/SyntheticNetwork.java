package stationqc.testutil;

import stationqc.domain.series.MeasurementMatrix;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.IntPredicate;

/**
 * Red sintética de estaciones horarias para los tests.
 * <p>
 * Todas las estaciones siguen el mismo ciclo diario ({@code 15 + 5·sin}, máximo a las 15 h)
 * más ruido gaussiano independiente. Sobre esa base se pueden inyectar los defectos que
 * buscan los detectores.
 */
public final class SyntheticNetwork {

    public static final LocalDateTime START = LocalDateTime.of(2024, 7, 1, 0, 0);

    private final List<LocalDateTime> timestamps = new ArrayList<>();
    private final Map<String, double[]> columns = new LinkedHashMap<>();

    private SyntheticNetwork(int days, int stations, double noise, long seed) {
        Random random = new Random(seed);
        int hours = days * 24;
        for (int t = 0; t < hours; t++) {
            timestamps.add(START.plusHours(t));
        }
        for (int s = 0; s < stations; s++) {
            double[] series = new double[hours];
            for (int t = 0; t < hours; t++) {
                series[t] = diurnalCycle(t) + noise * random.nextGaussian();
            }
            columns.put(stationId(s), series);
        }
    }

    public static SyntheticNetwork hourly(int days, int stations, double noise, long seed) {
        return new SyntheticNetwork(days, stations, noise, seed);
    }

    public static String stationId(int index) {
        return String.format("S%02d", index);
    }

    public static double diurnalCycle(int hourIndex) {
        return 15.0 + 5.0 * Math.sin(2.0 * Math.PI * (hourIndex - 9) / 24.0);
    }

    /** Desplazamiento constante (estación al sol). */
    public SyntheticNetwork withOffset(int station, double offset) {
        double[] series = columns.get(stationId(station));
        for (int t = 0; t < series.length; t++) {
            series[t] += offset;
        }
        return this;
    }

    /** Pico añadido a la misma hora todos los días (carcasa que acumula calor). */
    public SyntheticNetwork withDailySpike(int station, int hourOfDay, double amplitude) {
        double[] series = columns.get(stationId(station));
        for (int t = 0; t < series.length; t++) {
            if (timestamps.get(t).getHour() == hourOfDay) {
                series[t] += amplitude;
            }
        }
        return this;
    }

    /** Borra las lecturas de los índices que cumplan la condición. */
    public SyntheticNetwork withMissing(int station, IntPredicate missingAt) {
        double[] series = columns.get(stationId(station));
        for (int t = 0; t < series.length; t++) {
            if (missingAt.test(t)) {
                series[t] = Double.NaN;
            }
        }
        return this;
    }

    /** Sustituye la serie completa de una estación. */
    public SyntheticNetwork withSeries(int station, double[] series) {
        columns.put(stationId(station), series.clone());
        return this;
    }

    public int size() {
        return timestamps.size();
    }

    public MeasurementMatrix build() {
        return MeasurementMatrix.fromColumns(timestamps, columns);
    }
}
