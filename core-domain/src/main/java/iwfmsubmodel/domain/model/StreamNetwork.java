package iwfmsubmodel.domain.model;

import java.util.List;

/**
 * Red de ríos leída de un fichero de especificación.
 *
 * @param version      etiqueta de versión del formato (p. ej. "4.2").
 * @param reaches      tramos en orden de fichero.
 * @param nodeMap      nodo de río → nodo de acuífero.
 * @param ratingTables tablas de gasto en el orden de aparición de los nodos.
 */
public record StreamNetwork(String version,
                            List<ReachDescriptor> reaches,
                            StreamNodeMap nodeMap,
                            List<RatingTable> ratingTables) {

    public StreamNetwork {
        reaches = List.copyOf(reaches);
        ratingTables = List.copyOf(ratingTables);
    }
}
