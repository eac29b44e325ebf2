package iwfmsubmodel.geometry;

import iwfmsubmodel.domain.model.ElementNodes;
import iwfmsubmodel.domain.model.NodeCoordinate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubmodelBoundaryTest {

    // Malla de 2x1 cuadrados de lado 10: nodos 1-2-3 abajo y 4-5-6 arriba.
    private static final List<NodeCoordinate> COORDINATES = List.of(
            new NodeCoordinate(1, 0.0, 0.0),
            new NodeCoordinate(2, 10.0, 0.0),
            new NodeCoordinate(3, 20.0, 0.0),
            new NodeCoordinate(4, 0.0, 10.0),
            new NodeCoordinate(5, 10.0, 10.0),
            new NodeCoordinate(6, 20.0, 10.0));

    private static final List<ElementNodes> ELEMENTS = List.of(
            new ElementNodes(1, List.of(1, 2, 5, 4)),
            new ElementNodes(2, List.of(2, 3, 6, 5)));

    @Test
    @DisplayName("Un punto interior de cualquier elemento está dentro del contorno")
    void contains_interiorPoint_shouldBeTrue() {
        SubmodelBoundary boundary = SubmodelBoundary.of(ELEMENTS, COORDINATES);

        assertTrue(boundary.contains(5.0, 5.0));
        assertTrue(boundary.contains(15.0, 2.0));
        assertEquals(200.0, boundary.geometry().getArea(), 1e-9);
    }

    @Test
    @DisplayName("Un punto sobre la arista compartida por dos elementos está dentro de la unión")
    void contains_pointOnSharedEdge_shouldBeTrue() {
        SubmodelBoundary boundary = SubmodelBoundary.of(ELEMENTS, COORDINATES);

        assertTrue(boundary.contains(10.0, 5.0));
    }

    @Test
    @DisplayName("Los puntos sobre el contorno exterior y sus vértices quedan fuera")
    void contains_pointOnOuterBoundary_shouldBeFalse() {
        SubmodelBoundary boundary = SubmodelBoundary.of(ELEMENTS, COORDINATES);

        assertFalse(boundary.contains(0.0, 5.0));
        assertFalse(boundary.contains(20.0, 10.0));
        assertFalse(boundary.contains(10.0, 0.0));
    }

    @Test
    @DisplayName("En un único elemento sus aristas y vértices son contorno")
    void contains_singleElementEdge_shouldBeFalse() {
        SubmodelBoundary boundary = SubmodelBoundary.of(List.of(ELEMENTS.get(0)), COORDINATES);

        assertFalse(boundary.contains(0.0, 5.0));
        assertFalse(boundary.contains(10.0, 10.0));
        assertTrue(boundary.contains(0.1, 5.0));
    }

    @Test
    @DisplayName("Un punto exterior queda fuera")
    void contains_exteriorPoint_shouldBeFalse() {
        SubmodelBoundary boundary = SubmodelBoundary.of(List.of(ELEMENTS.get(0)), COORDINATES);

        assertFalse(boundary.contains(15.0, 5.0));
        assertFalse(boundary.contains(-0.1, 5.0));
    }

    @Test
    @DisplayName("Un triángulo genera un polígono de tres vértices")
    void of_triangle_shouldBuildPolygon() {
        SubmodelBoundary boundary = SubmodelBoundary.of(
                List.of(new ElementNodes(7, List.of(1, 2, 4))), COORDINATES);

        assertEquals(50.0, boundary.geometry().getArea(), 1e-9);
        assertTrue(boundary.contains(2.0, 2.0));
        assertFalse(boundary.contains(8.0, 8.0));
    }

    @Test
    @DisplayName("Un nodo sin coordenadas impide construir el contorno")
    void of_missingCoordinate_shouldThrow() {
        List<ElementNodes> elements = List.of(new ElementNodes(3, List.of(1, 2, 99)));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> SubmodelBoundary.of(elements, COORDINATES));

        assertTrue(ex.getMessage().contains("99"));
    }

    @Test
    @DisplayName("Sin elementos ningún punto está dentro")
    void of_empty_shouldContainNothing() {
        SubmodelBoundary boundary = SubmodelBoundary.of(List.of(), COORDINATES);

        assertFalse(boundary.contains(5.0, 5.0));
    }
}
