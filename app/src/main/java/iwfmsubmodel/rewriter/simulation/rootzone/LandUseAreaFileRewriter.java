package iwfmsubmodel.rewriter.simulation.rootzone;

import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Serie de superficies por elemento de un uso del suelo.
 * <p>
 * Tras cuatro líneas de cabecera, bloques por fecha: la primera fila lleva la fecha delante
 * del elemento ({@code FECHA IE A1 A2 ...}) y el resto solo {@code IE A1 A2 ...}. Se eliminan
 * las filas de elementos que no se conservan; si la eliminada es la de la fecha, la fecha
 * pasa a la primera fila conservada del bloque.
 */
@Slf4j
public class LandUseAreaFileRewriter extends AbstractFileRewriter {

    private static final int HEADER_LINES = 4;

    public LandUseAreaFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "superficies de uso del suelo";
    }

    public void rewrite(Path source, Path target, Set<Integer> elements) {
        rewriteFile(source, target, cursor -> {
            int start = cursor.seekData(HEADER_LINES);
            List<String> lines = cursor.lines();
            List<String> rebuilt = new ArrayList<>();
            String pendingDate = null;
            int blocks = 0;
            for (int i = start; i < lines.size(); i++) {
                String line = lines.get(i);
                if (LineCursor.isSectionBreak(line)) {
                    pendingDate = null;
                    rebuilt.add(line);
                    continue;
                }
                String[] tokens = FixedFormat.tokens(line);
                boolean dated = !isInteger(tokens[0]);
                int elementColumn = dated ? 1 : 0;
                int element = FixedFormat.parseInt(line, elementColumn, cursor.source(), i + 1);
                if (dated) {
                    blocks++;
                    pendingDate = tokens[0];
                }
                if (!elements.contains(element)) {
                    continue;
                }
                if (dated) {
                    rebuilt.add(line);
                    pendingDate = null;
                } else if (pendingDate != null) {
                    rebuilt.add(pendingDate + "\t" + String.join("\t", Arrays.asList(tokens)));
                    pendingDate = null;
                } else {
                    rebuilt.add(line);
                }
            }
            lines.subList(start, lines.size()).clear();
            lines.addAll(rebuilt);
            log.debug("{}: {} bloques de fecha", cursor.source(), blocks);
            return blocks;
        });
    }

    private static boolean isInteger(String token) {
        try {
            Integer.parseInt(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
