package stationqc.domain.series;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Máscara booleana con la misma forma y etiquetas que la matriz de la que procede.
 * {@code true} significa "celda marcada como atípica".
 */
public final class OutlierMask {

    private final List<LocalDateTime> timestamps;
    private final List<String> stationIds;
    private final boolean[][] flags;

    public OutlierMask(List<LocalDateTime> timestamps, List<String> stationIds, boolean[][] flags) {
        if (flags.length != timestamps.size()) {
            throw new IllegalArgumentException("La máscara tiene " + flags.length
                    + " filas, pero se han indicado " + timestamps.size() + " instantes.");
        }
        this.timestamps = List.copyOf(timestamps);
        this.stationIds = List.copyOf(stationIds);
        this.flags = new boolean[flags.length][];
        for (int row = 0; row < flags.length; row++) {
            if (flags[row].length != stationIds.size()) {
                throw new IllegalArgumentException("La fila " + row + " de la máscara no tiene "
                        + stationIds.size() + " celdas.");
            }
            this.flags[row] = flags[row].clone();
        }
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public List<String> getStationIds() {
        return stationIds;
    }

    public boolean isFlagged(int row, int col) {
        return flags[row][col];
    }

    /**
     * Número de instantes marcados de cada estación, en orden de columna.
     */
    public int[] countPerStation() {
        int[] counts = new int[stationIds.size()];
        for (boolean[] row : flags) {
            for (int col = 0; col < row.length; col++) {
                if (row[col]) {
                    counts[col]++;
                }
            }
        }
        return counts;
    }

    public int countFlagged() {
        int total = 0;
        for (int count : countPerStation()) {
            total += count;
        }
        return total;
    }

    public boolean isEmpty() {
        return countFlagged() == 0;
    }
}
