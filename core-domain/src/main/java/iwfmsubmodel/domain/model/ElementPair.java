package iwfmsubmodel.domain.model;

/**
 * Fila del fichero de pares de elementos.
 *
 * @param oldId     identificador del elemento en el modelo completo.
 * @param newId     identificador asignado en el submodelo.
 * @param subregion subregión del elemento en el submodelo.
 */
public record ElementPair(int oldId, int newId, int subregion) {
}
