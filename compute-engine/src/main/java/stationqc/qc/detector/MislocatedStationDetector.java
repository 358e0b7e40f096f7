package stationqc.qc.detector;

import lombok.extern.slf4j.Slf4j;
import stationqc.domain.station.GeoPoint;
import stationqc.domain.station.StationMetadata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Estaciones mal ubicadas.
 * <p>
 * Cuando varias estaciones comparten exactamente la misma posición, lo más probable es que
 * el proveedor les haya asignado una ubicación automática (p. ej. a partir de la IP de la
 * red doméstica) y la posición real sea desconocida. Se marcan todas las del grupo.
 */
@Slf4j
public class MislocatedStationDetector {

    public List<String> detect(StationMetadata metadata) {
        return detect(metadata.getLocations());
    }

    /**
     * @param locations Posición de cada estación, en el orden de la tabla de origen.
     * @return Estaciones que comparten posición con al menos otra, en ese mismo orden.
     */
    public List<String> detect(Map<String, GeoPoint> locations) {
        Map<GeoPoint, Integer> occurrences = new HashMap<>();
        locations.values().forEach(point -> occurrences.merge(point, 1, Integer::sum));

        List<String> mislocated = new ArrayList<>();
        locations.forEach((stationId, point) -> {
            if (occurrences.get(point) > 1) {
                mislocated.add(stationId);
            }
        });

        log.info("Mislocated stations: {} of {}", mislocated.size(), locations.size());
        return mislocated;
    }
}
