package iwfmsubmodel.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Nodo de río → nodo de acuífero, en el orden en que aparecen los nodos de río.
 *
 * @param nodes correspondencia nodo de río → nodo de acuífero.
 */
public record StreamNodeMap(Map<Integer, Integer> nodes) {

    public StreamNodeMap {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public int groundwaterNode(int streamNode) {
        Integer node = nodes.get(streamNode);
        if (node == null) {
            throw new IllegalArgumentException("Nodo de río desconocido: " + streamNode);
        }
        return node;
    }

    /**
     * Nodos de río cuyo nodo de acuífero pertenece al conjunto indicado, en orden original.
     */
    public Set<Integer> survivors(Set<Integer> nodeSet) {
        Set<Integer> survivors = new LinkedHashSet<>();
        nodes.forEach((stream, gw) -> {
            if (nodeSet.contains(gw)) {
                survivors.add(stream);
            }
        });
        return survivors;
    }

    public int size() {
        return nodes.size();
    }
}
