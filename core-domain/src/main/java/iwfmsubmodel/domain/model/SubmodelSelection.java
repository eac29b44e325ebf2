package iwfmsubmodel.domain.model;

import lombok.Builder;
import lombok.With;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selección de entidades de un submodelo, inmutable una vez construida. La produce la
 * extracción del preprocesador y la consumen todos los reescritores de la simulación.
 *
 * @param elements             correspondencia de elementos conservados.
 * @param nodes                nodos de acuífero referenciados por los elementos conservados.
 * @param nodeCoordinates      coordenadas de esos nodos.
 * @param elementNodes         nodos de cada elemento conservado.
 * @param streamNodes          nodo de río → nodo de acuífero del modelo completo.
 * @param survivingStreamNodes nodos de río que sobreviven.
 * @param lakes                lagos que sobreviven, ya reducidos.
 */
@Builder
@With
public record SubmodelSelection(ElementMapping elements,
                                Set<Integer> nodes,
                                List<NodeCoordinate> nodeCoordinates,
                                List<ElementNodes> elementNodes,
                                StreamNodeMap streamNodes,
                                Set<Integer> survivingStreamNodes,
                                List<LakeDescriptor> lakes) {

    public SubmodelSelection {
        nodes = Collections.unmodifiableSet(new TreeSet<>(nodes));
        nodeCoordinates = List.copyOf(nodeCoordinates);
        elementNodes = List.copyOf(elementNodes);
        survivingStreamNodes = Collections.unmodifiableSet(new TreeSet<>(survivingStreamNodes));
        lakes = List.copyOf(lakes);
    }

    public Set<Integer> retainedElements() {
        return elements.retainedElements();
    }

    public Set<Integer> lakeIds() {
        Set<Integer> ids = new TreeSet<>();
        lakes.forEach(lake -> ids.add(lake.id()));
        return ids;
    }
}
