package stationqc.domain.series;

import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matriz inmutable de mediciones: filas indexadas por instante, columnas por estación.
 * <p>
 * Es la estructura que recorre todo el pipeline de control de calidad. Cada etapa que
 * necesita "modificar" datos construye una matriz nueva; la del llamador nunca se toca.
 * Los valores ausentes se representan con {@link Double#NaN}.
 * <p>
 * Invariantes:
 * <ul>
 *     <li>Los instantes son estrictamente crecientes.</li>
 *     <li>Los identificadores de estación son únicos.</li>
 *     <li>{@code values.length == timestamps.size()} y cada fila tiene una celda por estación.</li>
 * </ul>
 */
@EqualsAndHashCode
public final class MeasurementMatrix {

    private final List<LocalDateTime> timestamps;
    private final List<String> stationIds;
    // [fila = instante][columna = estación]
    private final double[][] values;

    @EqualsAndHashCode.Exclude
    private final Map<String, Integer> columnIndex;

    private MeasurementMatrix(List<LocalDateTime> timestamps, List<String> stationIds, double[][] values) {
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.stationIds = Collections.unmodifiableList(new ArrayList<>(stationIds));
        this.values = values;
        this.columnIndex = new HashMap<>();
        for (int col = 0; col < this.stationIds.size(); col++) {
            this.columnIndex.put(this.stationIds.get(col), col);
        }
    }

    /**
     * Construye una matriz a partir de sus etiquetas y de una tabla de valores por filas.
     * La tabla se copia, por lo que el llamador puede reutilizar su array.
     *
     * @throws IllegalArgumentException si las dimensiones no cuadran, los instantes no son
     *                                  estrictamente crecientes o hay estaciones repetidas.
     */
    public static MeasurementMatrix of(List<LocalDateTime> timestamps, List<String> stationIds, double[][] values) {
        validateLabels(timestamps, stationIds);
        if (values.length != timestamps.size()) {
            throw new IllegalArgumentException("La matriz tiene " + values.length
                    + " filas, pero se han indicado " + timestamps.size() + " instantes.");
        }
        double[][] copy = new double[values.length][];
        for (int row = 0; row < values.length; row++) {
            if (values[row].length != stationIds.size()) {
                throw new IllegalArgumentException("La fila " + row + " tiene " + values[row].length
                        + " celdas, pero hay " + stationIds.size() + " estaciones.");
            }
            copy[row] = values[row].clone();
        }
        return new MeasurementMatrix(timestamps, stationIds, copy);
    }

    /**
     * Construye una matriz a partir de series por estación. El orden de las columnas es el
     * orden de iteración del mapa (usar {@link LinkedHashMap} para fijarlo).
     */
    public static MeasurementMatrix fromColumns(List<LocalDateTime> timestamps, Map<String, double[]> columns) {
        List<String> ids = new ArrayList<>(columns.keySet());
        double[][] rows = new double[timestamps.size()][ids.size()];
        for (int col = 0; col < ids.size(); col++) {
            double[] series = columns.get(ids.get(col));
            if (series.length != timestamps.size()) {
                throw new IllegalArgumentException("La estación " + ids.get(col) + " tiene " + series.length
                        + " valores, pero hay " + timestamps.size() + " instantes.");
            }
            for (int row = 0; row < series.length; row++) {
                rows[row][col] = series[row];
            }
        }
        validateLabels(timestamps, ids);
        return new MeasurementMatrix(timestamps, ids, rows);
    }

    private static void validateLabels(List<LocalDateTime> timestamps, List<String> stationIds) {
        for (int i = 1; i < timestamps.size(); i++) {
            if (!timestamps.get(i).isAfter(timestamps.get(i - 1))) {
                throw new IllegalArgumentException("Los instantes deben ser estrictamente crecientes (posición " + i + ").");
            }
        }
        Set<String> seen = new HashSet<>();
        for (String id : stationIds) {
            if (id == null || !seen.add(id)) {
                throw new IllegalArgumentException("Identificador de estación nulo o repetido: " + id);
            }
        }
    }

    public static boolean isMissing(double value) {
        return Double.isNaN(value);
    }

    public int getTimestampCount() {
        return timestamps.size();
    }

    public int getStationCount() {
        return stationIds.size();
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public List<String> getStationIds() {
        return stationIds;
    }

    public boolean containsStation(String stationId) {
        return columnIndex.containsKey(stationId);
    }

    public int indexOf(String stationId) {
        Integer col = columnIndex.get(stationId);
        if (col == null) {
            throw new IllegalArgumentException("Estación desconocida: " + stationId);
        }
        return col;
    }

    public double get(int row, int col) {
        return values[row][col];
    }

    /**
     * Copia de la serie temporal de una estación.
     */
    public double[] getColumn(int col) {
        double[] column = new double[values.length];
        for (int row = 0; row < values.length; row++) {
            column[row] = values[row][col];
        }
        return column;
    }

    public double[] getColumn(String stationId) {
        return getColumn(indexOf(stationId));
    }

    /**
     * Copia de los valores de todas las estaciones en un instante.
     */
    public double[] getRow(int row) {
        return values[row].clone();
    }

    /**
     * Valores no ausentes de una fila, en orden de columna.
     */
    public double[] getPresentValues(int row) {
        return Arrays.stream(values[row]).filter(v -> !isMissing(v)).toArray();
    }

    /**
     * Copia completa de la tabla de valores, por filas.
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int row = 0; row < values.length; row++) {
            copy[row] = values[row].clone();
        }
        return copy;
    }

    /**
     * Matriz con las mismas etiquetas y valores nuevos.
     */
    public MeasurementMatrix withValues(double[][] newValues) {
        return of(timestamps, stationIds, newValues);
    }

    /**
     * Elimina las columnas indicadas. Los identificadores que no estén presentes se ignoran.
     */
    public MeasurementMatrix dropStations(Collection<String> toDrop) {
        if (toDrop.isEmpty()) {
            return this;
        }
        Set<String> dropSet = new HashSet<>(toDrop);
        List<String> kept = new ArrayList<>();
        for (String id : stationIds) {
            if (!dropSet.contains(id)) {
                kept.add(id);
            }
        }
        return selectStations(kept);
    }

    /**
     * Submatriz con las estaciones indicadas, en el orden indicado.
     *
     * @throws IllegalArgumentException si alguna estación no existe en la matriz.
     */
    public MeasurementMatrix selectStations(List<String> ids) {
        if (new HashSet<>(ids).size() != ids.size()) {
            throw new IllegalArgumentException("La selección contiene estaciones repetidas: " + ids);
        }
        int[] cols = ids.stream().mapToInt(this::indexOf).toArray();
        double[][] selected = new double[values.length][cols.length];
        for (int row = 0; row < values.length; row++) {
            for (int j = 0; j < cols.length; j++) {
                selected[row][j] = values[row][cols[j]];
            }
        }
        return new MeasurementMatrix(timestamps, ids, selected);
    }

    @Override
    public String toString() {
        return "MeasurementMatrix[" + timestamps.size() + " instantes x " + stationIds.size() + " estaciones]";
    }
}
