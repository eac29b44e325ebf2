package iwfmsubmodel.selection;

import iwfmsubmodel.domain.exception.MalformedRecordException;
import iwfmsubmodel.domain.model.ElementMapping;
import iwfmsubmodel.domain.model.ElementNodes;
import iwfmsubmodel.domain.model.ElementPair;
import iwfmsubmodel.domain.model.NodeCoordinate;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.io.ModelFileHandler;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Construye los conjuntos de pertenencia del submodelo: elementos conservados (a partir del
 * fichero de pares), nodos que esos elementos referencian y sus coordenadas.
 */
@Slf4j
public class EntitySelector {

    /** Separadores admitidos en el fichero de pares. */
    private static final Pattern PAIR_DELIMITERS = Pattern.compile("[,;*\\s]+");

    private final ModelFileHandler files;

    public EntitySelector(ModelFileHandler files) {
        this.files = files;
    }

    /**
     * Lee el fichero de pares de elementos (elemento original, elemento nuevo, subregión).
     * Se ignoran líneas en blanco y de comentario.
     *
     * @param pairsFile ruta del fichero de pares.
     * @return la correspondencia directa e inversa y las subregiones.
     * @throws MalformedRecordException si una fila no tiene tres enteros o repite un elemento.
     */
    public ElementMapping selectElements(Path pairsFile) {
        ModelFileHandler.requireExists(pairsFile, "de pares de elementos");
        List<String> lines = files.read(pairsFile);
        String source = pairsFile.getFileName().toString();

        List<ElementPair> pairs = new ArrayList<>();
        Set<Integer> oldIds = new HashSet<>();
        Set<Integer> newIds = new HashSet<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || LineCursor.isComment(line)) {
                continue;
            }
            ElementPair pair = parsePair(line, source, i + 1);
            if (!oldIds.add(pair.oldId())) {
                throw new MalformedRecordException(source, i + 1,
                        "un elemento original no repetido", line);
            }
            if (!newIds.add(pair.newId())) {
                throw new MalformedRecordException(source, i + 1,
                        "un elemento de submodelo no repetido", line);
            }
            pairs.add(pair);
        }
        ElementMapping mapping = ElementMapping.of(pairs);
        log.info("Elementos seleccionados: {} en {} subregiones", pairs.size(), mapping.subregions().size());
        return mapping;
    }

    private static ElementPair parsePair(String line, String source, int lineNumber) {
        String[] tokens = PAIR_DELIMITERS.split(line.strip());
        if (tokens.length < 3) {
            throw new MalformedRecordException(source, lineNumber,
                    "tres enteros (elemento original, nuevo, subregión)", line);
        }
        try {
            return new ElementPair(Integer.parseInt(tokens[0]),
                    Integer.parseInt(tokens[1]),
                    Integer.parseInt(tokens[2]));
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(source, lineNumber,
                    "tres enteros (elemento original, nuevo, subregión)", line);
        }
    }

    /**
     * Lee el fichero de elementos y devuelve los nodos de los elementos conservados.
     * Los identificadores de nodo no se renumeran.
     *
     * @param elementFile fichero de configuración de elementos.
     * @param elements    elementos conservados.
     */
    public NodeSelection selectNodes(Path elementFile, Set<Integer> elements) {
        List<String> lines = files.read(elementFile);
        LineCursor cursor = LineCursor.over(lines, elementFile.getFileName().toString());

        cursor.seekData();
        int elementCount = cursor.count();
        cursor.nextData();
        int subregionCount = cursor.count();
        cursor.nextData(subregionCount);

        Set<Integer> nodes = new TreeSet<>();
        List<ElementNodes> elementNodes = new ArrayList<>();
        for (int read = 0; read < elementCount; read++) {
            if (read > 0) {
                cursor.nextData();
            }
            int element = cursor.intAt(0);
            if (!elements.contains(element)) {
                continue;
            }
            String[] tokens = cursor.tokens();
            if (tokens.length < 5) {
                throw cursor.malformed("IE y al menos 3 nodos y subregión");
            }
            List<Integer> ids = new ArrayList<>();
            // la última columna es la subregión
            for (int c = 1; c < Math.min(tokens.length - 1, 5); c++) {
                int node = cursor.intAt(c);
                if (node > 0) {
                    ids.add(node);
                }
            }
            nodes.addAll(ids);
            elementNodes.add(new ElementNodes(element, ids));
        }
        log.info("Nodos seleccionados: {} (de {} elementos)", nodes.size(), elementNodes.size());
        return new NodeSelection(nodes, elementNodes);
    }

    /**
     * Coordenadas de los nodos indicados, multiplicadas por el factor del fichero de nodos.
     */
    public List<NodeCoordinate> selectNodeCoordinates(Path nodeFile, Set<Integer> nodes) {
        List<String> lines = files.read(nodeFile);
        LineCursor cursor = LineCursor.over(lines, nodeFile.getFileName().toString());

        cursor.seekData();
        int nodeCount = cursor.count();
        cursor.nextData();
        double factor = cursor.doubleAt(0);

        List<NodeCoordinate> coordinates = new ArrayList<>();
        for (int read = 0; read < nodeCount; read++) {
            cursor.nextData();
            int id = cursor.intAt(0);
            if (nodes.contains(id)) {
                coordinates.add(new NodeCoordinate(id, cursor.doubleAt(1) * factor, cursor.doubleAt(2) * factor));
            }
        }
        log.debug("Coordenadas leídas para {} nodos", coordinates.size());
        return coordinates;
    }

    /**
     * Nodos del submodelo y tabla elemento → nodos.
     */
    public record NodeSelection(Set<Integer> nodes, List<ElementNodes> elementNodes) {
    }
}
