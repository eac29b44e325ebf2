package iwfmsubmodel.rewriter.simulation;

import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fichero de pequeñas cuencas.
 * <p>
 * Dos ficheros de salida, NSW con tres factores y una descripción por cuenca:
 * {@code ID AREA IWBTS NWB IWB1 QMAXWB1} seguida de NWB-1 líneas {@code IWB QMAXWB} con los
 * nodos de acuífero que reciben su caudal base. Una cuenca se conserva si alguno de esos
 * nodos se conserva; la lista se reduce a ellos. Si el nodo de río receptor IWBTS no
 * sobrevive pasa a 0. Después vienen, por cuenca, los parámetros de zona radicular (tras
 * seis líneas), los de acuífero (tras tres) y las condiciones iniciales (tras una).
 */
@Slf4j
public class SmallWatershedFileRewriter extends AbstractFileRewriter {

    private static final int OUTPUT_LINES = 2;
    private static final int HEADER_LINES = 3;
    private static final int STREAM_NODE_COLUMN = 2;
    private static final int NODE_COUNT_COLUMN = 3;
    private static final int[] PARAMETER_SECTION_SKIPS = {6, 3, 1};

    public SmallWatershedFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "pequeñas cuencas";
    }

    public void rewrite(Path source, Path target, SimulationContext context) {
        rewriteFile(source, target, cursor -> {
            cursor.seekData();
            context.passThroughLines(cursor, OUTPUT_LINES);
            cursor.nextData();

            Set<Integer> kept = new LinkedHashSet<>();
            String name = cursor.source();
            SectionResult watersheds = RecordFilter.counted(cursor, HEADER_LINES, (c, n) -> RecordFilter.blocks(c, 0, n,
                    (lines, head) -> FixedFormat.parseInt(lines.get(head), NODE_COUNT_COLUMN, name, head + 1),
                    block -> reduce(block, context, kept, name)));
            if (watersheds.read() > 0) {
                for (int skip : PARAMETER_SECTION_SKIPS) {
                    RecordFilter.byId(cursor, kept, skip);
                }
            }
            log.info("Pequeñas cuencas conservadas: {} de {}", watersheds.kept(), watersheds.read());
            return watersheds;
        });
    }

    private static List<String> reduce(List<String> block, SimulationContext context, Set<Integer> kept,
                                       String source) {
        List<String> reduced = RecordFilter.reduceGroup(block, NODE_COUNT_COLUMN, context.nodes(), source);
        if (reduced.isEmpty()) {
            return Collections.emptyList();
        }
        String head = reduced.get(0);
        kept.add(FixedFormat.parseInt(head, 0, source, 0));
        int streamNode = FixedFormat.parseInt(head, STREAM_NODE_COLUMN, source, 0);
        if (streamNode > 0 && !context.streamNodes().contains(streamNode)) {
            reduced.set(0, FixedFormat.replaceToken(head, STREAM_NODE_COLUMN, "0"));
        }
        return reduced;
    }
}
