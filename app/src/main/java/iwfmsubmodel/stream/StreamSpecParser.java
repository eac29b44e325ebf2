package iwfmsubmodel.stream;

import iwfmsubmodel.domain.exception.MalformedRecordException;
import iwfmsubmodel.domain.exception.UnsupportedFormatVersionException;
import iwfmsubmodel.domain.model.RatingTable;
import iwfmsubmodel.domain.model.ReachDescriptor;
import iwfmsubmodel.domain.model.StreamNetwork;
import iwfmsubmodel.domain.model.StreamNodeMap;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lector del fichero de especificación de ríos en formato 4.2.
 * <p>
 * Estructura: NRH (tramos), NRTB (puntos por tabla de gasto), para cada tramo una cabecera
 * {@code ID NRD IDWN NOMBRE} y NRD pares {@code IRV IGW}; después un preámbulo de factores
 * (tres líneas de datos entre comentarios), NRTB líneas de tabla por nodo de río en el
 * orden en que aparecieron los nodos y, al final, el bloque de interacción río-acuífero,
 * que no se interpreta.
 */
@Slf4j
public class StreamSpecParser {

    public static final String SUPPORTED_VERSION = "4.2";

    /** Líneas de factores entre los tramos y las tablas de gasto. */
    private static final int RATING_PREAMBLE_LINES = 3;

    /**
     * Versión declarada en la primera línea ({@code #4.2}).
     */
    public static String version(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        String first = lines.get(0).strip();
        if (LineCursor.isComment(first)) {
            first = first.substring(1);
        }
        String[] tokens = FixedFormat.tokens(first);
        return tokens.length == 0 ? "" : tokens[0];
    }

    /**
     * Lee un fichero completo de especificación de ríos.
     *
     * @throws UnsupportedFormatVersionException si la versión no es 4.2.
     */
    public ParsedStreamSpec parse(List<String> lines, String source) {
        String version = version(lines);
        if (!SUPPORTED_VERSION.equals(version)) {
            throw new UnsupportedFormatVersionException(source, version,
                    "Solo se admite la especificación de ríos 4.2; las versiones 4.0 y 4.1 no están implementadas.");
        }
        LineCursor cursor = LineCursor.over(lines, source);
        int reachCountLine = cursor.seekData();
        int reachCount = cursor.count();
        int ratingCountLine = cursor.nextData();
        int ratingPoints = cursor.count();
        return parse(cursor, reachCount, ratingPoints, version, reachCountLine, ratingCountLine + 1);
    }

    /**
     * Lee los tramos y las tablas de gasto a partir de la posición del cursor (la línea
     * NRTB).
     *
     * @param cursor       cursor situado en la línea anterior al primer tramo.
     * @param reachCount   número de tramos (NRH).
     * @param ratingPoints líneas por tabla de gasto (NRTB).
     */
    public ParsedStreamSpec parse(LineCursor cursor, int reachCount, int ratingPoints, String version,
                                  int reachCountLine, int reachesStart) {
        List<ReachDescriptor> reaches = new ArrayList<>();
        Map<Integer, Integer> nodeMap = new LinkedHashMap<>();

        for (int r = 0; r < reachCount; r++) {
            cursor.nextData();
            String[] header = cursor.tokens();
            int id = cursor.intAt(0);
            int nodeCount = cursor.intAt(1);
            int outflow = cursor.intAt(2);
            String name = header.length > 3 ? String.join(" ", Arrays.copyOfRange(header, 3, header.length)) : "";

            List<Integer> streamNodes = new ArrayList<>();
            List<Integer> gwNodes = new ArrayList<>();
            for (int n = 0; n < nodeCount; n++) {
                cursor.nextData();
                int streamNode = cursor.intAt(0);
                int gwNode = cursor.intAt(1);
                if (nodeMap.put(streamNode, gwNode) != null) {
                    throw cursor.malformed("un nodo de río no repetido");
                }
                streamNodes.add(streamNode);
                gwNodes.add(gwNode);
            }
            reaches.add(new ReachDescriptor(id, outflow, name, streamNodes, gwNodes));
        }
        int reachesEnd = reachCount == 0 ? reachesStart : cursor.position() + 1;

        List<RatingTable> tables = new ArrayList<>();
        int ratingStart = reachesEnd;
        int ratingEnd = reachesEnd;
        if (!nodeMap.isEmpty() && ratingPoints > 0) {
            ratingStart = cursor.nextData(RATING_PREAMBLE_LINES);
            boolean first = true;
            for (int streamNode : nodeMap.keySet()) {
                List<String> table = new ArrayList<>(ratingPoints);
                for (int p = 0; p < ratingPoints; p++) {
                    if (!first) {
                        cursor.nextData();
                    }
                    first = false;
                    if (p == 0 && cursor.intAt(0) != streamNode) {
                        throw new MalformedRecordException(cursor.source(), cursor.lineNumber(),
                                "la tabla de gasto del nodo de río " + streamNode, cursor.current());
                    }
                    table.add(cursor.current());
                }
                tables.add(new RatingTable(streamNode, table));
            }
            ratingEnd = cursor.position() + 1;
        }

        log.debug("{}: {} tramos, {} nodos de río, {} tablas de gasto",
                cursor.source(), reaches.size(), nodeMap.size(), tables.size());
        StreamNetwork network = new StreamNetwork(version, reaches, new StreamNodeMap(nodeMap), tables);
        return new ParsedStreamSpec(network, reachCountLine, reachesStart, reachesEnd, ratingStart, ratingEnd);
    }
}
