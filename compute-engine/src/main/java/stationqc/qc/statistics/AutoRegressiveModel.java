package stationqc.qc.statistics;

import lombok.Getter;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import stationqc.domain.exception.InsufficientDataException;

/**
 * Modelo autorregresivo lineal AR(p) con término independiente, ajustado por mínimos
 * cuadrados ordinarios.
 * <p>
 * {@code y(t) = c + φ1·y(t-1) + ... + φp·y(t-p) + ε(t)}, para t = p .. n-1.
 * <p>
 * El sistema se resuelve con la pseudoinversa (SVD), de modo que una serie constante o
 * con regresores colineales da una solución de norma mínima en vez de fallar.
 */
@Getter
public final class AutoRegressiveModel {

    // Valores singulares relativos por debajo de esto se consideran nulos
    private static final double RCOND = 1e-15;

    private final int order;
    /** [c, φ1, ..., φp] */
    private final double[] coefficients;
    /** Residuos de las n - p observaciones ajustadas. */
    private final double[] residuals;

    private AutoRegressiveModel(int order, double[] coefficients, double[] residuals) {
        this.order = order;
        this.coefficients = coefficients;
        this.residuals = residuals;
    }

    /**
     * @param series Serie completa, sin valores ausentes.
     * @param order  Orden p del modelo (p >= 0).
     * @throws InsufficientDataException si la serie no tiene más observaciones útiles que parámetros.
     */
    public static AutoRegressiveModel fit(double[] series, int order) {
        if (order < 0) {
            throw new IllegalArgumentException("El orden autorregresivo no puede ser negativo: " + order);
        }
        final int observations = series.length - order;
        final int parameters = order + 1;
        if (observations <= parameters) {
            throw new InsufficientDataException(String.format(
                    "Serie demasiado corta para un AR(%d): %d valores, %d observaciones útiles para %d parámetros.",
                    order, series.length, Math.max(observations, 0), parameters));
        }

        RealMatrix design = new Array2DRowRealMatrix(observations, parameters);
        RealVector target = new ArrayRealVector(observations);
        for (int i = 0; i < observations; i++) {
            int t = i + order;
            design.setEntry(i, 0, 1.0);
            for (int lag = 1; lag <= order; lag++) {
                design.setEntry(i, lag, series[t - lag]);
            }
            target.setEntry(i, series[t]);
        }

        RealVector beta = pseudoInverse(design).operate(target);
        RealVector fitted = design.operate(beta);
        double[] residuals = target.subtract(fitted).toArray();

        return new AutoRegressiveModel(order, beta.toArray(), residuals);
    }

    private static RealMatrix pseudoInverse(RealMatrix design) {
        SingularValueDecomposition svd = new SingularValueDecomposition(design);
        double[] singular = svd.getSingularValues();
        double cutoff = RCOND * (singular.length == 0 ? 0.0 : singular[0]);

        double[] inverted = new double[singular.length];
        for (int i = 0; i < singular.length; i++) {
            inverted[i] = singular[i] > cutoff ? 1.0 / singular[i] : 0.0;
        }
        RealMatrix sPlus = new Array2DRowRealMatrix(singular.length, singular.length);
        for (int i = 0; i < singular.length; i++) {
            sPlus.setEntry(i, i, inverted[i]);
        }
        return svd.getV().multiply(sPlus).multiply(svd.getUT());
    }
}
