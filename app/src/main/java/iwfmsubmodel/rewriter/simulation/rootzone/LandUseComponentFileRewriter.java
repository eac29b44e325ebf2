package iwfmsubmodel.rewriter.simulation.rootzone;

import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.simulation.AbstractSimulationRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de un uso del suelo de la zona radicular. La disposición la fija
 * {@link LandUseComponent}; el fichero de superficies que nombra se reescribe con
 * {@link LandUseAreaFileRewriter}.
 */
@Slf4j
public class LandUseComponentFileRewriter extends AbstractSimulationRewriter {

    private final LandUseComponent component;
    private final LandUseAreaFileRewriter areas;

    public LandUseComponentFileRewriter(ModelFileHandler files, LandUseComponent component) {
        this(files, component, new LandUseAreaFileRewriter(files));
    }

    public LandUseComponentFileRewriter(ModelFileHandler files, LandUseComponent component,
                                        LandUseAreaFileRewriter areas) {
        super(files);
        this.component = component;
        this.areas = areas;
    }

    @Override
    protected String componentName() {
        return component.getDescription();
    }

    public void rewrite(Path source, SimulationContext context) {
        Set<Integer> elements = context.elements();
        Path areaTarget = component.areaFile(context.submodel());
        rewriteFile(source, component.componentFile(context.submodel()), cursor -> {
            cursor.seekData();
            int crops = component.getFixedCrops();
            if (component.isCropCountFirst()) {
                crops = cursor.count();
                cursor.nextData(crops + 1);
            }
            child(cursor, context, "superficies de " + component.getDescription(), areaTarget, path -> {
                areas.rewrite(path, areaTarget, elements);
                return true;
            });

            int header = component.getHeaderLines();
            if (component.isBudgetSection()) {
                cursor.nextData();
                header += cursor.count() + crops;
            }
            cursor.nextData();
            context.passThroughLines(cursor, header);
            cursor.nextData();

            int kept = 0;
            for (int skip : component.getSectionSkips()) {
                kept = section(cursor, context, elements, skip).kept();
            }
            RecordFilter.byId(cursor, elements, component.getInitialConditionSkip());
            log.info("{}: {} elementos conservados", component.getDescription(), kept);
            return kept;
        });
    }

    /**
     * Filtra una sección por elemento precedida de {@code skip} líneas de datos, reubicando
     * las que nombran ficheros del modelo.
     */
    private static SectionResult section(LineCursor cursor, SimulationContext context,
                                         Set<Integer> elements, int skip) {
        if (skip == 0) {
            return RecordFilter.byId(cursor, elements, 0);
        }
        cursor.seekData();
        context.passThroughLines(cursor, skip);
        return RecordFilter.byId(cursor, elements, 1);
    }
}
