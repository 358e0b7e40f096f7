package stationqc.domain.station;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tabla de metadatos de estaciones, de solo lectura y en el orden en el que se cargó.
 */
public final class StationMetadata {

    private final Map<String, StationRecord> records;

    private StationMetadata(Map<String, StationRecord> records) {
        this.records = Collections.unmodifiableMap(records);
    }

    public static StationMetadata of(Collection<StationRecord> stations) {
        Map<String, StationRecord> ordered = new LinkedHashMap<>();
        for (StationRecord station : stations) {
            if (ordered.putIfAbsent(station.stationId(), station) != null) {
                throw new IllegalArgumentException("Estación repetida en los metadatos: " + station.stationId());
            }
        }
        return new StationMetadata(ordered);
    }

    public static StationMetadata of(StationRecord... stations) {
        return of(List.of(stations));
    }

    public int size() {
        return records.size();
    }

    public Optional<StationRecord> find(String stationId) {
        return Optional.ofNullable(records.get(stationId));
    }

    public Collection<StationRecord> getStations() {
        return records.values();
    }

    /**
     * Geometrías por estación, en el orden de la tabla.
     */
    public Map<String, GeoPoint> getLocations() {
        Map<String, GeoPoint> locations = new LinkedHashMap<>();
        records.forEach((id, station) -> locations.put(id, station.location()));
        return locations;
    }

    /**
     * Altitudes conocidas por estación. Las estaciones sin altitud no aparecen.
     */
    public Map<String, Double> getElevations() {
        Map<String, Double> elevations = new LinkedHashMap<>();
        records.forEach((id, station) -> {
            if (station.elevation() != null) {
                elevations.put(id, station.elevation());
            }
        });
        return elevations;
    }

    public boolean hasElevations() {
        return records.values().stream().anyMatch(station -> station.elevation() != null);
    }
}
