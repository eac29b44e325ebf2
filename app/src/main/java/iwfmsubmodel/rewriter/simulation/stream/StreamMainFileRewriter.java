package iwfmsubmodel.rewriter.simulation.stream;

import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.simulation.AbstractSimulationRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero principal de ríos de la simulación.
 * <p>
 * Tras la línea de versión nombra los ficheros de entradas, especificación de derivaciones,
 * bypass y series de derivación. Siguen los hidrogramas por nodo de río (NOUTR y seis líneas
 * de cabecera), los presupuestos por nodo (NBUDR y el fichero de salida) y, tras tres
 * factores, los parámetros del lecho por nodo. El resto se copia sin cambios.
 */
@Slf4j
public class StreamMainFileRewriter extends AbstractSimulationRewriter {

    private static final int HYDROGRAPH_HEADER_LINES = 6;
    private static final int BUDGET_HEADER_LINES = 1;
    private static final int STREAMBED_FACTOR_LINES = 3;

    private final StreamInflowFileRewriter inflows;
    private final BypassFileRewriter bypasses;

    public StreamMainFileRewriter(ModelFileHandler files) {
        this(files, new StreamInflowFileRewriter(files), new BypassFileRewriter(files));
    }

    public StreamMainFileRewriter(ModelFileHandler files, StreamInflowFileRewriter inflows,
                                  BypassFileRewriter bypasses) {
        super(files);
        this.inflows = inflows;
        this.bypasses = bypasses;
    }

    @Override
    protected String componentName() {
        return "ríos";
    }

    public void rewrite(Path source, SimulationContext context) {
        SimulationFiles submodel = context.submodel();
        Set<Integer> streamNodes = context.streamNodes();
        rewriteFile(source, submodel.getStreamFile(), cursor -> {
            // la primera línea es la versión del formato
            cursor.moveTo(1);
            cursor.seekData();
            child(cursor, context, "entradas a ríos", submodel.getStreamInflowFile(), path -> {
                inflows.rewrite(path, submodel.getStreamInflowFile(), streamNodes);
                return true;
            });

            cursor.nextData();
            if (FixedFormat.fileName(cursor.current()).isPresent()) {
                log.warn("{}: la especificación de derivaciones se copia sin filtrar", cursor.source());
            }
            context.passThrough(cursor);

            cursor.nextData();
            child(cursor, context, "derivaciones", submodel.getBypassFile(),
                    path -> bypasses.rewrite(path, submodel.getBypassFile(), context) > 0);

            cursor.nextData();
            context.passThrough(cursor);

            cursor.nextData(2);
            SectionResult hydrographs = RecordFilter.counted(cursor, HYDROGRAPH_HEADER_LINES,
                    (c, n) -> RecordFilter.byIdCounted(c, streamNodes, 0, n));

            cursor.seekData();
            SectionResult budgets = RecordFilter.counted(cursor, BUDGET_HEADER_LINES,
                    (c, n) -> RecordFilter.byIdCounted(c, streamNodes, 0, n));

            SectionResult streambed = RecordFilter.byId(cursor, streamNodes, STREAMBED_FACTOR_LINES);
            log.info("Ríos: {} hidrogramas, {} presupuestos y {} nodos de lecho conservados",
                    hydrographs.kept(), budgets.kept(), streambed.kept());
            return streambed;
        });
    }
}
