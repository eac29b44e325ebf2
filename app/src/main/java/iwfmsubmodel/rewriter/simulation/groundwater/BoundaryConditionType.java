package iwfmsubmodel.rewriter.simulation.groundwater;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Ficheros de condiciones de contorno por nodo. Todos empiezan con un contador seguido de
 * {@link #getHeaderLines()} líneas de factores y después un registro por nodo con el nodo en
 * la primera columna.
 */
@Getter
@RequiredArgsConstructor
public enum BoundaryConditionType {

    SPECIFIED_FLOW("flujo especificado", 2),
    SPECIFIED_HEAD("nivel especificado", 1),
    GENERAL_HEAD("nivel general", 3),
    CONSTRAINED_GENERAL_HEAD("nivel general restringido", 5);

    private final String description;
    private final int headerLines;
}
