package iwfmsubmodel.rewriter.simulation;

import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Fichero de zona no saturada: nueve líneas de opciones (la séptima es NGROUP) y parámetros
 * por elemento.
 */
@Slf4j
public class UnsaturatedZoneFileRewriter extends AbstractFileRewriter {

    private static final int OPTION_LINES = 9;
    private static final int GROUP_LINE = 6;

    public UnsaturatedZoneFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "zona no saturada";
    }

    public void rewrite(Path source, Path target, SimulationContext context) {
        rewriteFile(source, target, cursor -> {
            cursor.seekData();
            int groupLine = cursor.peekData(GROUP_LINE);
            int groups = FixedFormat.parseInt(cursor.lines().get(groupLine), 0, cursor.source(), groupLine + 1);
            context.passThroughLines(cursor, OPTION_LINES);
            if (groups > 0) {
                log.warn("{}: parámetros por malla paramétrica (NGROUP={}); se copian sin filtrar",
                        cursor.source(), groups);
                return null;
            }
            SectionResult result = RecordFilter.layeredById(cursor, context.elements(), 1);
            log.info("Zona no saturada: {} de {} elementos conservados", result.kept(), result.read());
            return result;
        });
    }
}
