package stationqc.stats;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.function.ToDoubleFunction;

/**
 * Estadístico que reduce los valores presentes de un instante (o de un grupo) a un número:
 * el centro o el divisor de un z-score.
 * <p>
 * Las implementaciones son un conjunto cerrado de estrategias con nombre
 * ({@link NamedAggregator}) más una variante explícita de función propia
 * ({@link CustomAggregator}). Desde JSON solo se pueden cargar las estrategias con nombre.
 */
@JsonDeserialize(as = NamedAggregator.class)
public interface Aggregator {

    /**
     * @param values Valores presentes (sin NaN). Puede estar vacío.
     * @return El estadístico, o NaN si no está definido para esa muestra.
     */
    double aggregate(double[] values);

    @JsonValue
    String getName();

    /**
     * Resuelve una estrategia por nombre ({@code mean}, {@code median}, {@code std},
     * {@code qn}, {@code mad}).
     *
     * @throws IllegalArgumentException si el nombre no corresponde a ninguna estrategia.
     */
    static Aggregator named(String name) {
        return NamedAggregator.fromName(name);
    }

    static Aggregator custom(String name, ToDoubleFunction<double[]> function) {
        return new CustomAggregator(name, function);
    }
}
