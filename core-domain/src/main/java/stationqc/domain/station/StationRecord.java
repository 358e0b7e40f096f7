package stationqc.domain.station;

import lombok.Builder;

import java.util.Objects;

/**
 * Fila de metadatos de una estación.
 *
 * @param stationId Identificador, el mismo que usa la matriz de mediciones.
 * @param location  Geometría puntual de la estación.
 * @param elevation Altitud en metros. Puede ser nula si el proveedor no la publica.
 */
@Builder
public record StationRecord(String stationId, GeoPoint location, Double elevation) {

    public StationRecord {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(location, "location");
    }
}
