package iwfmsubmodel.domain.model;

import java.util.List;

/**
 * Nodos que definen un elemento, en el orden del fichero. Un cuarto nodo 0 indica triángulo
 * y no se incluye en la lista.
 */
public record ElementNodes(int element, List<Integer> nodes) {

    public ElementNodes {
        nodes = List.copyOf(nodes);
        if (nodes.size() < 3) {
            throw new IllegalArgumentException("El elemento " + element + " tiene menos de 3 nodos.");
        }
    }

    public boolean isTriangle() {
        return nodes.size() == 3;
    }
}
