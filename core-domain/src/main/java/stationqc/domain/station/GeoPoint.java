package stationqc.domain.station;

/**
 * Posición puntual de una estación en el sistema de referencia del proveedor.
 * <p>
 * La igualdad es exacta coordenada a coordenada; no hay tolerancia de distancia.
 *
 * @param x Longitud (o abscisa proyectada).
 * @param y Latitud (o ordenada proyectada).
 */
public record GeoPoint(double x, double y) {
}
