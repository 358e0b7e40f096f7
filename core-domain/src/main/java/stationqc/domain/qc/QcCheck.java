package stationqc.domain.qc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Etapas del control de calidad, en el orden en el que se ejecutan.
 * La clave es el nombre con el que aparecen en el informe.
 */
@Getter
@RequiredArgsConstructor
public enum QcCheck {

    MISLOCATED("mislocated"),
    UNRELIABLE("unreliable"),
    RADIATIVE_ERROR("radiative_error"),
    DAILY_PEAK_OVERHEATING("daily_peak_overheating"),
    INDOOR("indoor");

    @JsonValue
    private final String key;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static QcCheck fromKey(String key) {
        return Arrays.stream(values())
                .filter(check -> check.key.equalsIgnoreCase(key.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Etapa de control de calidad desconocida: " + key));
    }
}
