package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.simulation.AbstractSimulationRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;

import java.nio.file.Path;

/**
 * Fichero principal de bombeo: pozos, bombeo por elemento y series de bombeo. Las series se
 * copian sin filtrar.
 */
public class PumpingFileRewriter extends AbstractSimulationRewriter {

    private final WellSpecFileRewriter wells;
    private final ElementPumpingFileRewriter elementPumping;

    public PumpingFileRewriter(ModelFileHandler files) {
        this(files, new WellSpecFileRewriter(files), new ElementPumpingFileRewriter(files));
    }

    public PumpingFileRewriter(ModelFileHandler files, WellSpecFileRewriter wells,
                               ElementPumpingFileRewriter elementPumping) {
        super(files);
        this.wells = wells;
        this.elementPumping = elementPumping;
    }

    @Override
    protected String componentName() {
        return "bombeo";
    }

    /**
     * @return si queda algún pozo o sumidero; si no, no se escribe el fichero.
     */
    public boolean rewrite(Path source, SimulationContext context) {
        SimulationFiles submodel = context.submodel();
        return rewriteFileIf(source, submodel.getPumpingFile(), cursor -> {
            cursor.seekData();
            boolean hasWells = child(cursor, context, "especificación de pozos", submodel.getWellSpecFile(),
                    path -> wells.rewrite(path, submodel.getWellSpecFile(), context));
            cursor.nextData();
            boolean hasSinks = child(cursor, context, "bombeo por elemento", submodel.getElementPumpingFile(),
                    path -> elementPumping.rewrite(path, submodel.getElementPumpingFile(), context.elements()));
            cursor.nextData();
            context.passThrough(cursor);
            return hasWells || hasSinks;
        }, any -> any);
    }
}
