package stationqc.domain.qc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Informe del control de calidad: estaciones marcadas por cada etapa, en el orden en el
 * que la etapa las devolvió.
 * <p>
 * Se construye de forma incremental con {@link Builder} y es inmutable una vez creado.
 * Una etapa que no se ejecutó (p. ej. {@code mislocated} sin metadatos) no tiene clave.
 */
@EqualsAndHashCode
public final class QcReport {

    private final Map<QcCheck, List<String>> flagged;

    private QcReport(Map<QcCheck, List<String>> flagged) {
        this.flagged = Collections.unmodifiableMap(flagged);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasCheck(QcCheck check) {
        return flagged.containsKey(check);
    }

    /**
     * Estaciones marcadas por una etapa; lista vacía si la etapa no se ejecutó.
     */
    public List<String> get(QcCheck check) {
        return flagged.getOrDefault(check, List.of());
    }

    public Set<QcCheck> getChecks() {
        return flagged.keySet();
    }

    /**
     * Unión de todas las estaciones descartadas, en orden de etapa.
     */
    public Set<String> getAllFlaggedStations() {
        Set<String> all = new LinkedHashSet<>();
        flagged.values().forEach(all::addAll);
        return all;
    }

    @JsonValue
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> byKey = new LinkedHashMap<>();
        flagged.forEach((check, ids) -> byKey.put(check.getKey(), ids));
        return byKey;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static QcReport fromMap(Map<String, List<String>> byKey) {
        Builder builder = builder();
        byKey.forEach((key, ids) -> builder.record(QcCheck.fromKey(key), ids));
        return builder.build();
    }

    @Override
    public String toString() {
        return "QcReport" + toMap();
    }

    public static final class Builder {

        private final Map<QcCheck, List<String>> flagged = new EnumMap<>(QcCheck.class);

        private Builder() {
        }

        public Builder record(QcCheck check, List<String> stationIds) {
            flagged.put(check, List.copyOf(new ArrayList<>(stationIds)));
            return this;
        }

        public QcReport build() {
            return new QcReport(new EnumMap<>(flagged));
        }
    }
}
