package stationqc.stats;

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.Arrays;

/**
 * Estimador de escala Qn (Rousseeuw &amp; Croux, 1993).
 * <p>
 * Qn es el k-ésimo menor de los |x_i - x_j| (i &lt; j) con k = C(h, 2) y h = ⌊n/2⌋ + 1,
 * multiplicado por una constante de consistencia con la normal y por un factor de
 * corrección para muestras pequeñas. Tolera hasta un 50% de contaminación, que es
 * justo lo que se necesita cuando se buscan las estaciones que contaminan la muestra.
 * <p>
 * En vez de materializar las n(n-1)/2 diferencias, el k-ésimo menor se localiza por
 * bisección sobre el valor, contando en O(n) cuántas diferencias quedan por debajo
 * sobre la muestra ordenada. Así se puede aplicar a grupos grandes (todas las lecturas
 * de una hora del día de toda la red).
 */
public final class QnScaleEstimator {

    /** 1 / (√2 · Φ⁻¹(5/8)) */
    static final double CONSISTENCY_CONSTANT =
            1.0 / (Math.sqrt(2.0) * new NormalDistribution().inverseCumulativeProbability(5.0 / 8.0));

    // Factores de corrección para n <= 9
    private static final double[] SMALL_SAMPLE_FACTORS = {
            Double.NaN, Double.NaN, 0.399356, 0.99365, 0.51321, 0.84401, 0.61220, 0.85877, 0.66993, 0.87344
    };

    private QnScaleEstimator() {
    }

    /**
     * @param values Muestra sin valores ausentes.
     * @return Qn, o NaN con menos de dos valores.
     */
    public static double qnScale(double[] values) {
        int n = values.length;
        if (n < 2) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        int h = n / 2 + 1;
        long k = (long) h * (h - 1) / 2;
        double kth = kthSmallestPairwiseDistance(sorted, k);

        return CONSISTENCY_CONSTANT * kth * correctionFactor(n);
    }

    static double correctionFactor(int n) {
        if (n <= 9) {
            return SMALL_SAMPLE_FACTORS[n];
        }
        return n % 2 == 1 ? n / (n + 1.4) : n / (n + 3.8);
    }

    /**
     * k-ésima menor distancia |x_j - x_i| (i &lt; j) de una muestra ordenada, con k en base 1.
     */
    static double kthSmallestPairwiseDistance(double[] sorted, long k) {
        if (countPairsWithin(sorted, 0.0) >= k) {
            return 0.0;
        }
        // Invariante: count(lo) < k <= count(hi)
        double lo = 0.0;
        double hi = sorted[sorted.length - 1] - sorted[0];
        while (Math.nextUp(lo) < hi) {
            double mid = lo + (hi - lo) / 2.0;
            if (mid <= lo || mid >= hi) {
                break;
            }
            if (countPairsWithin(sorted, mid) >= k) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        return hi;
    }

    /**
     * Número de pares (i &lt; j) con {@code sorted[j] - sorted[i] <= distance}.
     */
    static long countPairsWithin(double[] sorted, double distance) {
        long count = 0;
        int i = 0;
        for (int j = 1; j < sorted.length; j++) {
            while (sorted[j] - sorted[i] > distance) {
                i++;
            }
            count += j - i;
        }
        return count;
    }
}
