package iwfmsubmodel.geometry;

import iwfmsubmodel.domain.model.ElementNodes;
import iwfmsubmodel.domain.model.NodeCoordinate;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Contorno del submodelo: unión de los polígonos de sus elementos.
 * <p>
 * Se usa para decidir qué hidrogramas y pozos definidos por coordenadas caen dentro del
 * submodelo. Solo cuentan los puntos interiores: un punto sobre el contorno exterior queda
 * fuera, mientras que uno sobre una arista compartida entre elementos conservados está en el
 * interior de la unión.
 */
@Slf4j
public final class SubmodelBoundary {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final Geometry geometry;
    private final PreparedGeometry prepared;

    private SubmodelBoundary(Geometry geometry) {
        this.geometry = geometry;
        this.prepared = PreparedGeometryFactory.prepare(geometry);
    }

    /**
     * Construye el contorno a partir de los nodos de cada elemento y sus coordenadas.
     *
     * @throws IllegalArgumentException si un elemento referencia un nodo sin coordenadas.
     */
    public static SubmodelBoundary of(List<ElementNodes> elements, List<NodeCoordinate> coordinates) {
        Map<Integer, NodeCoordinate> byId = new HashMap<>();
        coordinates.forEach(c -> byId.put(c.id(), c));

        List<Polygon> polygons = new ArrayList<>(elements.size());
        for (ElementNodes element : elements) {
            Coordinate[] ring = new Coordinate[element.nodes().size() + 1];
            for (int i = 0; i < element.nodes().size(); i++) {
                NodeCoordinate node = byId.get(element.nodes().get(i));
                if (node == null) {
                    throw new IllegalArgumentException("El nodo " + element.nodes().get(i)
                            + " del elemento " + element.element() + " no tiene coordenadas.");
                }
                ring[i] = new Coordinate(node.x(), node.y());
            }
            ring[ring.length - 1] = new Coordinate(ring[0]);
            polygons.add(GEOMETRY_FACTORY.createPolygon(ring));
        }

        Geometry union = polygons.isEmpty()
                ? GEOMETRY_FACTORY.createPolygon()
                : UnaryUnionOp.union(polygons);
        log.debug("Contorno del submodelo: {} elementos, área {}", polygons.size(), union.getArea());
        return new SubmodelBoundary(union);
    }

    public boolean contains(double x, double y) {
        return prepared.contains(GEOMETRY_FACTORY.createPoint(new Coordinate(x, y)));
    }

    public Geometry geometry() {
        return geometry;
    }
}
