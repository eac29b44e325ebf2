package iwfmsubmodel.selection;

import iwfmsubmodel.domain.exception.MalformedRecordException;
import iwfmsubmodel.domain.exception.MissingInputFileException;
import iwfmsubmodel.domain.model.ElementMapping;
import iwfmsubmodel.domain.model.ElementNodes;
import iwfmsubmodel.domain.model.NodeCoordinate;
import iwfmsubmodel.io.ModelFileHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EntitySelectorTest {

    private static final Logger log = LoggerFactory.getLogger(EntitySelectorTest.class);

    private static final String ELEMENTS = """
            C Configuración de elementos
                4                  / NE
                2                  / NREGN
                1   Norte
                2   Sur
            C   IE  N1 N2 N3 N4 IRGE
                1   1  2  5  4  1
                2   2  3  6  5  1
                3   4  5  8  7  2
                4   5  6  9  0  2
            """;

    private static final String NODES = """
            C Coordenadas de nodos
                9        / ND
                2.0      / FACT
                1    0.0    0.0
                2   10.0    0.0
                3   20.0    0.0
                4    0.0   10.0
                5   10.0   10.0
                6   20.0   10.0
                7    0.0   20.0
                8   10.0   20.0
                9   20.0   20.0
            """;

    @TempDir
    Path tempDir;

    private EntitySelector selector;

    @BeforeEach
    void setUp() {
        selector = new EntitySelector(new ModelFileHandler());
    }

    @Test
    @DisplayName("El fichero de pares produce la correspondencia directa, la inversa y las subregiones")
    void selectElements_shouldBuildBijection() throws IOException {
        // --- 1. Arrange ---
        Path pairs = Files.writeString(tempDir.resolve("pairs.txt"), """
                C viejo nuevo subregión
                5,1,2

                7 2 2
                9;3;5
                """);

        // --- 2. Act ---
        ElementMapping mapping = selector.selectElements(pairs);

        // --- 3. Assert ---
        assertEquals(Map.of(5, 1, 7, 2, 9, 3), mapping.forward());
        assertEquals(Map.of(1, 5, 2, 7, 3, 9), mapping.reverse());
        assertEquals(List.of(2, 5), mapping.subregions());
        assertEquals(Set.of(5, 7, 9), mapping.retainedElements());
        log.info("Correspondencia leída: {}", mapping.forward());
    }

    @Test
    @DisplayName("Una fila con menos de tres enteros indica fichero y línea")
    void selectElements_shortRow_shouldThrow() throws IOException {
        Path pairs = Files.writeString(tempDir.resolve("pairs.txt"), "5 1 2\n7 2\n");

        MalformedRecordException ex = assertThrows(MalformedRecordException.class,
                () -> selector.selectElements(pairs));

        assertEquals("pairs.txt", ex.getSource());
        assertEquals(2, ex.getLineNumber());
    }

    @Test
    @DisplayName("Un elemento nuevo repetido rompe la biyección")
    void selectElements_duplicateNewId_shouldThrow() throws IOException {
        Path pairs = Files.writeString(tempDir.resolve("pairs.txt"), "5 1 2\n7 1 2\n");

        MalformedRecordException ex = assertThrows(MalformedRecordException.class,
                () -> selector.selectElements(pairs));

        assertEquals(2, ex.getLineNumber());
    }

    @Test
    @DisplayName("Sin fichero de pares la selección falla antes de parsear")
    void selectElements_missingFile_shouldThrow() {
        assertThrows(MissingInputFileException.class,
                () -> selector.selectElements(tempDir.resolve("no_existe.txt")));
    }

    @Test
    @DisplayName("Los nodos son los de los elementos conservados, sin el cuarto nodo de los triángulos")
    void selectNodes_shouldCollectNodesOfRetainedElements() throws IOException {
        // --- 1. Arrange ---
        Path elements = Files.writeString(tempDir.resolve("Elements.dat"), ELEMENTS);

        // --- 2. Act ---
        EntitySelector.NodeSelection selection = selector.selectNodes(elements, Set.of(2, 4));

        // --- 3. Assert ---
        assertThat(selection.nodes()).containsExactly(2, 3, 5, 6, 9);
        assertEquals(List.of(new ElementNodes(2, List.of(2, 3, 6, 5)), new ElementNodes(4, List.of(5, 6, 9))),
                selection.elementNodes());
        assertTrue(selection.elementNodes().get(1).isTriangle());
    }

    @Test
    @DisplayName("Las coordenadas se multiplican por el factor del fichero de nodos")
    void selectNodeCoordinates_shouldApplyFactor() throws IOException {
        Path nodes = Files.writeString(tempDir.resolve("Nodes.dat"), NODES);

        List<NodeCoordinate> coordinates = selector.selectNodeCoordinates(nodes, Set.of(5, 9));

        assertEquals(List.of(new NodeCoordinate(5, 20.0, 20.0), new NodeCoordinate(9, 40.0, 40.0)), coordinates);
    }
}
