package iwfmsubmodel.rewriter.preprocessor;

import iwfmsubmodel.domain.model.RatingTable;
import iwfmsubmodel.domain.model.ReachDescriptor;
import iwfmsubmodel.domain.model.StreamNetwork;
import iwfmsubmodel.domain.model.StreamSelection;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import iwfmsubmodel.stream.ParsedStreamSpec;
import iwfmsubmodel.stream.StreamNetworkFilter;
import iwfmsubmodel.stream.StreamSpecParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Fichero de especificación de ríos (formato 4.2).
 * <p>
 * Los tramos se regeneran a partir de la selección filtrada, con sus bloques de
 * comentarios; el preámbulo de factores y el bloque río-acuífero se copian tal cual y las
 * tablas de gasto se reducen a los nodos supervivientes.
 */
public class StreamSpecFileRewriter extends AbstractFileRewriter {

    private static final String RULE = "C" + "*".repeat(79);
    private static final String DASHES = "C" + "-".repeat(79);

    private static final List<String> REACHES_HEADER = List.of(
            RULE,
            "C                     STREAM REACH SPECIFICATIONS",
            "C",
            "C   ID    ; Reach number",
            "C   NRD   ; Number of stream nodes in the reach",
            "C   IDWN  ; Stream node receiving the reach outflow (0: leaves the model)",
            "C   NAME  ; Reach name",
            "C   IRV   ; Stream node",
            "C   IGW   ; Groundwater node associated with the stream node",
            RULE);

    private final StreamSpecParser parser;
    private final StreamNetworkFilter filter;

    public StreamSpecFileRewriter(ModelFileHandler files, StreamSpecParser parser, StreamNetworkFilter filter) {
        super(files);
        this.parser = parser;
        this.filter = filter;
    }

    @Override
    protected String componentName() {
        return "especificación de ríos";
    }

    /**
     * Lee la red de ríos y calcula la parte que sobrevive sin escribir nada.
     */
    public Result select(Path source, Set<Integer> nodes) {
        return scanFile(source, cursor -> {
            ParsedStreamSpec parsed = parser.parse(cursor.lines(), cursor.source());
            return new Result(parsed.network(), filter.filter(parsed.network(), nodes));
        });
    }

    /**
     * Reescribe el fichero y devuelve la red original junto con la parte que sobrevive.
     */
    public Result rewrite(Path source, Path target, Set<Integer> nodes) {
        return rewriteFile(source, target, cursor -> {
            List<String> lines = cursor.lines();
            ParsedStreamSpec parsed = parser.parse(lines, cursor.source());
            StreamSelection selection = filter.filter(parsed.network(), nodes);

            List<String> rebuilt = new ArrayList<>(lines.subList(0, parsed.reachesStart()));
            rebuilt.set(parsed.reachCountLine(),
                    FixedFormat.replaceFirstToken(rebuilt.get(parsed.reachCountLine()), selection.reaches().size()));
            rebuilt.addAll(reachBlock(selection.reaches()));
            rebuilt.addAll(lines.subList(parsed.reachesEnd(), parsed.ratingStart()));
            for (RatingTable table : selection.ratingTables()) {
                rebuilt.addAll(table.lines());
            }
            rebuilt.addAll(lines.subList(parsed.ratingEnd(), lines.size()));

            lines.clear();
            lines.addAll(rebuilt);
            return new Result(parsed.network(), selection);
        });
    }

    /**
     * Bloque de tramos en forma canónica.
     */
    static List<String> reachBlock(List<ReachDescriptor> reaches) {
        List<String> block = new ArrayList<>(REACHES_HEADER);
        for (ReachDescriptor reach : reaches) {
            block.add(DASHES);
            block.add("C        ID      NRD     IDWN     NAME");
            block.add(String.format("%10d%9d%9d     %s", reach.id(), reach.nodeCount(), reach.outflow(), reach.name())
                    .stripTrailing());
            block.add("C       IRV      IGW");
            for (int i = 0; i < reach.nodeCount(); i++) {
                block.add(String.format("%10d%9d", reach.streamNodes().get(i), reach.groundwaterNodes().get(i)));
            }
        }
        return block;
    }

    /**
     * Red leída y selección resultante.
     */
    public record Result(StreamNetwork network, StreamSelection selection) {
    }
}
