package iwfmsubmodel.domain.model;

import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Tramo de río.
 *
 * @param id               identificador del tramo.
 * @param outflow          nodo de río de destino del desagüe (0 si sale del modelo).
 * @param name             nombre libre del tramo.
 * @param streamNodes      nodos de río del tramo, en orden aguas abajo.
 * @param groundwaterNodes nodo de acuífero de cada nodo de río (lista paralela).
 */
@Builder
@With
public record ReachDescriptor(int id,
                              int outflow,
                              String name,
                              List<Integer> streamNodes,
                              List<Integer> groundwaterNodes) {

    public ReachDescriptor {
        streamNodes = List.copyOf(streamNodes);
        groundwaterNodes = List.copyOf(groundwaterNodes);
        if (streamNodes.size() != groundwaterNodes.size()) {
            throw new IllegalArgumentException("El tramo " + id
                    + " tiene listas de nodos de distinta longitud.");
        }
        name = name == null ? "" : name;
    }

    public int nodeCount() {
        return streamNodes.size();
    }
}
