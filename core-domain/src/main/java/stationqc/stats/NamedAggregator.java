package stationqc.stats;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;
import java.util.List;

/**
 * Estadísticos con nombre disponibles para centrar y escalar z-scores.
 */
@Getter
@RequiredArgsConstructor
public enum NamedAggregator implements Aggregator {

    MEAN("mean", List.of()) {
        @Override
        public double aggregate(double[] values) {
            return values.length == 0 ? Double.NaN : StatUtils.mean(values);
        }
    },
    MEDIAN("median", List.of()) {
        @Override
        public double aggregate(double[] values) {
            return values.length == 0 ? Double.NaN : new Median().evaluate(values);
        }
    },
    /** Desviación típica muestral (divisor n - 1). */
    STD("std", List.of()) {
        @Override
        public double aggregate(double[] values) {
            return values.length < 2 ? Double.NaN : new StandardDeviation(true).evaluate(values);
        }
    },
    /** Estimador robusto Qn de Rousseeuw y Croux. */
    QN("qn", List.of("qn_scale")) {
        @Override
        public double aggregate(double[] values) {
            return QnScaleEstimator.qnScale(values);
        }
    },
    /** Desviación absoluta mediana normalizada (consistente con la desviación típica normal). */
    MAD("mad", List.of()) {
        @Override
        public double aggregate(double[] values) {
            if (values.length == 0) {
                return Double.NaN;
            }
            double center = new Median().evaluate(values);
            double[] deviations = Arrays.stream(values).map(v -> Math.abs(v - center)).toArray();
            return new Median().evaluate(deviations) / MAD_NORMAL_CONSISTENCY;
        }
    };

    // Φ⁻¹(3/4)
    private static final double MAD_NORMAL_CONSISTENCY = 0.6744897501960817;

    private final String name;
    private final List<String> aliases;

    @Override
    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NamedAggregator fromName(String text) {
        if (text == null) {
            throw new IllegalArgumentException("El nombre del estadístico no puede ser nulo.");
        }
        String normalized = text.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(agg -> agg.name.equals(normalized) || agg.aliases.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Estadístico desconocido: '" + text
                        + "'. Valores válidos: mean, median, std, qn, mad."));
    }
}
