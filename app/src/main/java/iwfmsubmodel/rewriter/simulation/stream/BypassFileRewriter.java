package iwfmsubmodel.rewriter.simulation.stream;

import iwfmsubmodel.domain.exception.MalformedRecordException;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Fichero de especificación de derivaciones (bypass).
 * <p>
 * NBYPASS y cuatro factores; por derivación una línea
 * {@code ID IA TYPEDEST DEST IDIVC ...}, seguida de |IDIVC| líneas de tabla si IDIVC es
 * negativo. Después, en el mismo orden, un grupo de elementos de infiltración por derivación
 * ({@code ID NERELS IERELS FERELS} y NERELS-1 líneas más). Entre registros puede haber
 * comentarios.
 * <p>
 * Una derivación se conserva si su nodo de origen IA sobrevive. Si desaguaba en un nodo de
 * río que desaparece, TYPEDEST y DEST pasan a 0. Los grupos de infiltración se reducen a los
 * elementos conservados.
 */
@Slf4j
public class BypassFileRewriter extends AbstractFileRewriter {

    private static final int HEADER_LINES = 4;
    private static final int ORIGIN_COLUMN = 1;
    private static final int DESTINATION_TYPE_COLUMN = 2;
    private static final int RATING_COLUMN = 4;
    private static final int STREAM_NODE_DESTINATION = 1;

    public BypassFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "derivaciones";
    }

    /**
     * @return número de derivaciones conservadas; con 0 el fichero no se escribe.
     */
    public int rewrite(Path source, Path target, SimulationContext context) {
        return rewriteFileIf(source, target, cursor -> {
            int countLine = cursor.seekData();
            int total = cursor.count();
            cursor.nextData(HEADER_LINES - 1);

            List<String> lines = cursor.lines();
            String name = cursor.source();
            int start = cursor.position() + 1;
            List<String> rebuilt = new ArrayList<>();
            List<Boolean> kept = new ArrayList<>();
            int i = start;
            for (int j = 0; j < total; j++) {
                i = copyBreaks(lines, i, rebuilt, name);
                int length = bypassLength(lines, i, name);
                List<String> block = block(lines, i, length, name);
                int origin = FixedFormat.parseInt(block.get(0), ORIGIN_COLUMN, name, i + 1);
                boolean keep = context.streamNodes().contains(origin);
                if (keep) {
                    block.set(0, clearDeadDestination(block.get(0), context, name, i + 1));
                    rebuilt.addAll(block);
                }
                kept.add(keep);
                i += length;
            }
            for (int j = 0; j < total; j++) {
                i = copyBreaks(lines, i, rebuilt, name);
                int length = Math.max(1, FixedFormat.parseInt(lines.get(i), 1, name, i + 1));
                List<String> group = block(lines, i, length, name);
                if (kept.get(j)) {
                    rebuilt.addAll(seepageGroup(group, context, name));
                }
                i += length;
            }
            cursor.moveTo(RecordFilter.splice(lines, start, i, rebuilt));

            int survivors = (int) kept.stream().filter(Boolean::booleanValue).count();
            cursor.replaceCountAt(countLine, survivors);
            log.info("Derivaciones conservadas: {} de {}", survivors, total);
            return survivors;
        }, survivors -> survivors > 0);
    }

    private static int bypassLength(List<String> lines, int head, String source) {
        int rating = FixedFormat.parseInt(lines.get(head), RATING_COLUMN, source, head + 1);
        return rating > 0 ? 1 : 1 + Math.abs(rating);
    }

    /**
     * Un destino en un nodo de río que no sobrevive pasa a TYPEDEST 0 y DEST 0.
     */
    private static String clearDeadDestination(String head, SimulationContext context, String source, int lineNumber) {
        int type = FixedFormat.parseInt(head, DESTINATION_TYPE_COLUMN, source, lineNumber);
        int destination = FixedFormat.parseInt(head, DESTINATION_TYPE_COLUMN + 1, source, lineNumber);
        if (type != STREAM_NODE_DESTINATION || context.streamNodes().contains(destination)) {
            return head;
        }
        String line = FixedFormat.replaceToken(head, DESTINATION_TYPE_COLUMN, "0");
        return FixedFormat.replaceToken(line, DESTINATION_TYPE_COLUMN + 1, "0");
    }

    private static List<String> seepageGroup(List<String> group, SimulationContext context, String source) {
        List<String> reduced = RecordFilter.reduceGroup(group, context.elements(), source);
        if (reduced.isEmpty()) {
            return List.of(FixedFormat.replaceTail(group.get(0), 1, new String[]{"0"}));
        }
        return reduced;
    }

    /**
     * Copia los comentarios y líneas en blanco que preceden al siguiente registro.
     *
     * @return índice del registro.
     */
    private static int copyBreaks(List<String> lines, int index, List<String> rebuilt, String source) {
        int i = index;
        while (i < lines.size() && LineCursor.isSectionBreak(lines.get(i))) {
            rebuilt.add(lines.get(i));
            i++;
        }
        if (i >= lines.size()) {
            throw new MalformedRecordException(source, lines.size(), "un registro de derivación", "fin de fichero");
        }
        return i;
    }

    private static List<String> block(List<String> lines, int head, int length, String source) {
        if (head + length > lines.size()) {
            throw new MalformedRecordException(source, head + 1, length + " líneas de registro", lines.get(head));
        }
        return new ArrayList<>(lines.subList(head, head + length));
    }
}
