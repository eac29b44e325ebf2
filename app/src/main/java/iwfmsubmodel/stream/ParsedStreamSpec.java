package iwfmsubmodel.stream;

import iwfmsubmodel.domain.model.StreamNetwork;

/**
 * Red de ríos leída y posiciones de sus secciones dentro de la secuencia de líneas.
 * Los índices {@code *End} son exclusivos.
 *
 * @param network        red leída.
 * @param reachCountLine línea del número de tramos (NRH).
 * @param reachesStart   primera línea tras el número de puntos de tabla (NRTB).
 * @param reachesEnd     línea siguiente al último nodo del último tramo.
 * @param ratingStart    primera línea de las tablas de gasto.
 * @param ratingEnd      línea siguiente a la última tabla de gasto.
 */
public record ParsedStreamSpec(StreamNetwork network,
                               int reachCountLine,
                               int reachesStart,
                               int reachesEnd,
                               int ratingStart,
                               int ratingEnd) {
}
