package stationqc.qc.statistics;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.CauchyDistribution;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.GumbelDistribution;
import org.apache.commons.math3.distribution.LaplaceDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.LogisticDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.distribution.WeibullDistribution;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Distribuciones continuas que se pueden usar como referencia para los valores críticos.
 * <p>
 * Los parámetros se pasan de forma posicional: primero los de forma de la distribución
 * estándar y, opcionalmente, localización y escala ({@code loc + scale * ppf(p)}).
 * Los nombres coinciden con los habituales en las librerías estadísticas ("norm", "t"...).
 */
@Getter
@RequiredArgsConstructor
public enum ReferenceDistribution {

    NORMAL("norm", 0, shapes -> new NormalDistribution(0.0, 1.0)),
    STUDENT_T("t", 1, shapes -> new TDistribution(shapes[0])),
    CAUCHY("cauchy", 0, shapes -> new CauchyDistribution(0.0, 1.0)),
    LOGISTIC("logistic", 0, shapes -> new LogisticDistribution(0.0, 1.0)),
    LAPLACE("laplace", 0, shapes -> new LaplaceDistribution(0.0, 1.0)),
    GUMBEL("gumbel_r", 0, shapes -> new GumbelDistribution(0.0, 1.0)),
    EXPONENTIAL("expon", 0, shapes -> new ExponentialDistribution(1.0)),
    CHI_SQUARED("chi2", 1, shapes -> new ChiSquaredDistribution(shapes[0])),
    GAMMA("gamma", 1, shapes -> new GammaDistribution(shapes[0], 1.0)),
    LOG_NORMAL("lognorm", 1, shapes -> new LogNormalDistribution(0.0, shapes[0])),
    UNIFORM("uniform", 0, shapes -> new UniformRealDistribution(0.0, 1.0)),
    WEIBULL("weibull_min", 1, shapes -> new WeibullDistribution(shapes[0], 1.0)),
    BETA("beta", 2, shapes -> new BetaDistribution(shapes[0], shapes[1])),
    F("f", 2, shapes -> new FDistribution(shapes[0], shapes[1]));

    private final String code;
    private final int shapeCount;
    private final Function<double[], RealDistribution> factory;

    /**
     * @throws IllegalArgumentException si el nombre no corresponde a ninguna distribución.
     */
    public static ReferenceDistribution fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("El nombre de la distribución no puede ser nulo.");
        }
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(dist -> dist.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Distribución desconocida: '" + name + "'"));
    }

    /**
     * Función cuantil (inversa de la función de distribución).
     *
     * @param probability Probabilidad acumulada en [0, 1].
     * @param params      Parámetros de forma y, opcionalmente, localización y escala.
     * @throws IllegalArgumentException si el número de parámetros no es válido o algún
     *                                  parámetro está fuera de su dominio.
     */
    public double inverseCumulativeProbability(double probability, List<Double> params) {
        int count = params == null ? 0 : params.size();
        if (count < shapeCount || count > shapeCount + 2) {
            throw new IllegalArgumentException(String.format(
                    "La distribución '%s' necesita %d parámetro(s) de forma, más localización y escala opcionales; recibidos %d.",
                    code, shapeCount, count));
        }
        double[] shapes = new double[shapeCount];
        for (int i = 0; i < shapeCount; i++) {
            shapes[i] = params.get(i);
        }
        double loc = count > shapeCount ? params.get(shapeCount) : 0.0;
        double scale = count > shapeCount + 1 ? params.get(shapeCount + 1) : 1.0;
        if (!(scale > 0.0)) {
            throw new IllegalArgumentException("La escala de la distribución debe ser positiva: " + scale);
        }

        RealDistribution standard = factory.apply(shapes);
        return loc + scale * standard.inverseCumulativeProbability(probability);
    }
}
