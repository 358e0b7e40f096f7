package stationqc.stats;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Estadístico definido por el usuario. Recibe solo los valores presentes del grupo.
 */
public record CustomAggregator(String name, ToDoubleFunction<double[]> function) implements Aggregator {

    public CustomAggregator {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
    }

    @Override
    public double aggregate(double[] values) {
        return function.applyAsDouble(values);
    }

    @Override
    public String getName() {
        return name;
    }
}
