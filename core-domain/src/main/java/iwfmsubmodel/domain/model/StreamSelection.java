package iwfmsubmodel.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parte de la red de ríos que sobrevive en el submodelo.
 *
 * @param reaches        tramos con al menos un nodo superviviente, reducidos a esos nodos.
 * @param ratingTables   tablas de gasto de los nodos supervivientes.
 * @param survivingNodes nodos de río supervivientes, en orden original.
 */
public record StreamSelection(List<ReachDescriptor> reaches,
                              List<RatingTable> ratingTables,
                              Set<Integer> survivingNodes) {

    public StreamSelection {
        reaches = List.copyOf(reaches);
        ratingTables = List.copyOf(ratingTables);
        survivingNodes = Collections.unmodifiableSet(new LinkedHashSet<>(survivingNodes));
    }

    public static StreamSelection empty() {
        return new StreamSelection(List.of(), List.of(), Set.of());
    }
}
