package iwfmsubmodel.domain.model;

import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Lago del fichero de lagos del preprocesador.
 *
 * @param id                 identificador del lago.
 * @param maxElevationColumn columna de cota máxima (0 si el formato no la incluye).
 * @param destinationType    tipo de destino del desbordamiento (0 fuera, 1 nodo de río, 2 lago).
 * @param destination        identificador del destino.
 * @param name               nombre del lago.
 * @param elements           elementos que forman el lago.
 */
@Builder
@With
public record LakeDescriptor(int id,
                             int maxElevationColumn,
                             int destinationType,
                             int destination,
                             String name,
                             List<Integer> elements) {

    public static final int DESTINATION_STREAM_NODE = 1;

    public LakeDescriptor {
        elements = List.copyOf(elements);
        name = name == null ? "" : name;
    }
}
