package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.simulation.AbstractSimulationRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero principal de acuífero.
 * <p>
 * Orden de secciones: ficheros de condiciones de contorno, drenes, bombeo y subsidencia;
 * dieciséis líneas de opciones de salida; hidrogramas de nivel; hidrogramas de flujo entre
 * nodos; parámetros por nodo y capa; anomalías por elemento y niveles iniciales por nodo.
 */
@Slf4j
public class GroundwaterMainFileRewriter extends AbstractSimulationRewriter {

    private static final int OUTPUT_OPTION_LINES = 16;
    private static final int PARAMETER_FACTOR_LINES = 4;
    private static final int ANOMALY_HEADER_LINES = 2;
    private static final int ANOMALY_ELEMENT_COLUMN = 1;

    private final BoundaryConditionFileRewriter boundaryConditions;
    private final TileDrainFileRewriter tileDrains;
    private final PumpingFileRewriter pumping;
    private final SubsidenceFileRewriter subsidence;

    public GroundwaterMainFileRewriter(ModelFileHandler files) {
        this(files, new BoundaryConditionFileRewriter(files), new TileDrainFileRewriter(files),
                new PumpingFileRewriter(files), new SubsidenceFileRewriter(files));
    }

    public GroundwaterMainFileRewriter(ModelFileHandler files,
                                       BoundaryConditionFileRewriter boundaryConditions,
                                       TileDrainFileRewriter tileDrains,
                                       PumpingFileRewriter pumping,
                                       SubsidenceFileRewriter subsidence) {
        super(files);
        this.boundaryConditions = boundaryConditions;
        this.tileDrains = tileDrains;
        this.pumping = pumping;
        this.subsidence = subsidence;
    }

    @Override
    protected String componentName() {
        return "acuífero";
    }

    public void rewrite(Path source, SimulationContext context) {
        SimulationFiles submodel = context.submodel();
        Set<Integer> nodes = context.nodes();
        rewriteFile(source, submodel.getGroundwaterFile(), cursor -> {
            cursor.seekData();
            child(cursor, context, "condiciones de contorno", submodel.getBoundaryConditionFile(),
                    path -> boundaryConditions.rewrite(path, context));
            cursor.nextData();
            child(cursor, context, "drenes", submodel.getTileDrainFile(),
                    path -> tileDrains.rewrite(path, submodel.getTileDrainFile(), nodes, context.streamNodes()));
            cursor.nextData();
            child(cursor, context, "bombeo", submodel.getPumpingFile(),
                    path -> pumping.rewrite(path, context));
            cursor.nextData();
            child(cursor, context, "subsidencia", submodel.getSubsidenceFile(), path -> {
                subsidence.rewrite(path, submodel.getSubsidenceFile(), context);
                return true;
            });

            cursor.nextData();
            context.passThroughLines(cursor, OUTPUT_OPTION_LINES);

            cursor.nextData();
            SectionResult hydrographs = HydrographFilter.filter(cursor, context);

            cursor.seekData();
            SectionResult faceFlows = RecordFilter.counted(cursor, 1, (c, n) -> RecordFilter.where(c, 0, n,
                    tokens -> nodes.contains(Integer.parseInt(tokens[2]))
                            && nodes.contains(Integer.parseInt(tokens[3]))));

            cursor.seekData();
            SectionResult parameters = AquiferParameters.filter(cursor, PARAMETER_FACTOR_LINES, nodes);

            cursor.seekData();
            RecordFilter.counted(cursor, ANOMALY_HEADER_LINES,
                    (c, n) -> RecordFilter.byColumn(c, ANOMALY_ELEMENT_COLUMN, context.elements(), 0, n));

            SectionResult heads = RecordFilter.byId(cursor, nodes, 1);
            log.info("Acuífero: {} hidrogramas, {} flujos entre nodos, {} nodos con parámetros, {} niveles iniciales",
                    hydrographs.kept(), faceFlows.kept(), parameters.kept(), heads.kept());
            return heads;
        });
    }
}
