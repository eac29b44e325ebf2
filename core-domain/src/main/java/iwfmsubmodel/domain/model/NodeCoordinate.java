package iwfmsubmodel.domain.model;

/**
 * Coordenadas de un nodo de acuífero, ya multiplicadas por el factor del fichero.
 */
public record NodeCoordinate(int id, double x, double y) {
}
