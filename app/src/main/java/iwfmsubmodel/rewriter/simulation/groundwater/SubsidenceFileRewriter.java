package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Fichero de subsidencia: cinco líneas de opciones y ficheros, hidrogramas de subsidencia,
 * parámetros por nodo y capa y, opcionalmente, condiciones iniciales por nodo.
 */
@Slf4j
public class SubsidenceFileRewriter extends AbstractFileRewriter {

    private static final int OPTION_LINES = 5;

    public SubsidenceFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "subsidencia";
    }

    public void rewrite(Path source, Path target, SimulationContext context) {
        rewriteFile(source, target, cursor -> {
            cursor.seekData();
            context.passThroughLines(cursor, OPTION_LINES);

            cursor.nextData();
            SectionResult hydrographs = HydrographFilter.filter(cursor, context);

            cursor.seekData();
            SectionResult parameters = AquiferParameters.filter(cursor, 1, context.nodes());

            if (cursor.peekData(0) != LineCursor.END_OF_SEQUENCE) {
                RecordFilter.byId(cursor, context.nodes(), 1);
            }
            log.info("Subsidencia: {} hidrogramas y {} nodos conservados", hydrographs.kept(), parameters.kept());
            return parameters;
        });
    }
}
