package stationqc.qc.statistics;

/**
 * Función de autocorrelación muestral.
 */
public final class Autocorrelation {

    private Autocorrelation() {
    }

    /**
     * Autocorrelación de la serie para los retardos 0..maxLag (estimador sesgado: la
     * autocovarianza de cada retardo se divide por n, no por n - k).
     * <p>
     * Si la serie es más corta que {@code maxLag + 1}, el resultado se trunca a los
     * retardos disponibles. Una serie de varianza nula da NaN en todos los retardos.
     *
     * @param series Serie sin valores ausentes.
     */
    public static double[] acf(double[] series, int maxLag) {
        final int n = series.length;
        if (n == 0) {
            return new double[0];
        }
        double mean = 0.0;
        for (double v : series) {
            mean += v;
        }
        mean /= n;

        double[] centered = new double[n];
        for (int t = 0; t < n; t++) {
            centered[t] = series[t] - mean;
        }

        int lags = Math.min(maxLag, n - 1);
        double[] result = new double[lags + 1];
        double variance = autocovariance(centered, 0);
        for (int k = 0; k <= lags; k++) {
            result[k] = autocovariance(centered, k) / variance;
        }
        return result;
    }

    private static double autocovariance(double[] centered, int lag) {
        double sum = 0.0;
        for (int t = 0; t + lag < centered.length; t++) {
            sum += centered[t] * centered[t + lag];
        }
        return sum / centered.length;
    }
}
