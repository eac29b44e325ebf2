package iwfmsubmodel.domain.model;

import java.util.List;

/**
 * Tabla de gasto de un nodo de río. Las líneas se copian tal cual.
 */
public record RatingTable(int streamNode, List<String> lines) {

    public RatingTable {
        lines = List.copyOf(lines);
    }
}
