package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.domain.exception.UnsupportedFormatVersionException;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;

import java.util.Set;

/**
 * Parámetros por nodo y capa precedidos de NGROUP. Solo se admite la definición por nodo
 * (NGROUP = 0); la malla paramétrica no se puede recortar a un submodelo.
 */
final class AquiferParameters {

    private AquiferParameters() {
    }

    /**
     * Filtra la sección cuyo NGROUP está en la línea actual del cursor.
     *
     * @param factorLines líneas de factores entre NGROUP y el primer nodo.
     */
    static SectionResult filter(LineCursor cursor, int factorLines, Set<Integer> nodes) {
        int groups = cursor.count();
        if (groups > 0) {
            throw new UnsupportedFormatVersionException(cursor.source(), "NGROUP=" + groups,
                    "Los parámetros por malla paramétrica no se pueden extraer a un submodelo.");
        }
        return RecordFilter.layeredById(cursor, nodes, factorLines + 1);
    }
}
