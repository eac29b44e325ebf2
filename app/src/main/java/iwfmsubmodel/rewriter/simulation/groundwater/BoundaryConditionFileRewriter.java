package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.simulation.AbstractSimulationRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Fichero principal de condiciones de contorno.
 * <p>
 * Nombra los cuatro ficheros de condiciones por nodo y el de series temporales, que se copia
 * sin filtrar. Le siguen los hidrogramas de flujo de contorno: NOUTB, el fichero de salida y
 * registros {@code ID LAYER NODE NOMBRE}.
 */
@Slf4j
public class BoundaryConditionFileRewriter extends AbstractSimulationRewriter {

    /** Columna del nodo en los hidrogramas de flujo de contorno. */
    private static final int HYDROGRAPH_NODE_COLUMN = 2;

    private final Map<BoundaryConditionType, NodeBoundaryConditionFileRewriter> children =
            new EnumMap<>(BoundaryConditionType.class);

    public BoundaryConditionFileRewriter(ModelFileHandler files) {
        super(files);
        for (BoundaryConditionType type : BoundaryConditionType.values()) {
            children.put(type, new NodeBoundaryConditionFileRewriter(files, type));
        }
    }

    @Override
    protected String componentName() {
        return "condiciones de contorno";
    }

    /**
     * @return si alguna condición de contorno sobrevive; si no, no se escribe el fichero.
     */
    public boolean rewrite(Path source, SimulationContext context) {
        SimulationFiles submodel = context.submodel();
        Map<BoundaryConditionType, Function<SimulationFiles, Path>> targets = Map.of(
                BoundaryConditionType.SPECIFIED_FLOW, SimulationFiles::getSpecifiedFlowFile,
                BoundaryConditionType.SPECIFIED_HEAD, SimulationFiles::getSpecifiedHeadFile,
                BoundaryConditionType.GENERAL_HEAD, SimulationFiles::getGeneralHeadFile,
                BoundaryConditionType.CONSTRAINED_GENERAL_HEAD, SimulationFiles::getConstrainedGeneralHeadFile);

        return rewriteFileIf(source, submodel.getBoundaryConditionFile(), cursor -> {
            boolean any = false;
            cursor.seekData();
            for (BoundaryConditionType type : BoundaryConditionType.values()) {
                if (type != BoundaryConditionType.SPECIFIED_FLOW) {
                    cursor.nextData();
                }
                NodeBoundaryConditionFileRewriter child = children.get(type);
                Path target = targets.get(type).apply(submodel);
                any |= child(cursor, context, type.getDescription(), target,
                        path -> child.rewrite(path, target, context.nodes()));
            }
            cursor.nextData();
            context.passThrough(cursor);

            cursor.nextData();
            RecordFilter.counted(cursor, 1,
                    (c, n) -> RecordFilter.byColumn(c, HYDROGRAPH_NODE_COLUMN, context.nodes(), 0, n));
            return any;
        }, any -> any);
    }
}
