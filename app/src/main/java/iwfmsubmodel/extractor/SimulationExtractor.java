package iwfmsubmodel.extractor;

import iwfmsubmodel.config.ExtractionConfig;
import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.domain.model.SubmodelSelection;
import iwfmsubmodel.geometry.SubmodelBoundary;
import iwfmsubmodel.io.HandoffArtifactStore;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import iwfmsubmodel.rewriter.simulation.SimulationMainFileRewriter;
import iwfmsubmodel.rewriter.simulation.SmallWatershedFileRewriter;
import iwfmsubmodel.rewriter.simulation.UnsaturatedZoneFileRewriter;
import iwfmsubmodel.rewriter.simulation.groundwater.GroundwaterMainFileRewriter;
import iwfmsubmodel.rewriter.simulation.rootzone.RootZoneMainFileRewriter;
import iwfmsubmodel.rewriter.simulation.stream.StreamMainFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Orquesta la extracción de los ficheros de la simulación a partir de la selección que
 * produjo la extracción del preprocesador.
 * <p>
 * Orden: manifiesto original → pequeñas cuencas → zona no saturada → acuífero → ríos →
 * zona radicular → manifiesto nuevo. Cada fichero padre procesa sus hijos antes de
 * escribirse.
 */
@Slf4j
public class SimulationExtractor {

    private final HandoffArtifactStore artifacts;
    private final SimulationMainFileRewriter mainRewriter;
    private final SmallWatershedFileRewriter smallWatersheds;
    private final UnsaturatedZoneFileRewriter unsaturatedZone;
    private final GroundwaterMainFileRewriter groundwater;
    private final StreamMainFileRewriter streams;
    private final RootZoneMainFileRewriter rootZone;

    public SimulationExtractor(ModelFileHandler files, HandoffArtifactStore artifacts) {
        this.artifacts = artifacts;
        this.mainRewriter = new SimulationMainFileRewriter(files);
        this.smallWatersheds = new SmallWatershedFileRewriter(files);
        this.unsaturatedZone = new UnsaturatedZoneFileRewriter(files);
        this.groundwater = new GroundwaterMainFileRewriter(files);
        this.streams = new StreamMainFileRewriter(files);
        this.rootZone = new RootZoneMainFileRewriter(files);
    }

    public SimulationExtractor() {
        this(new ModelFileHandler(), new HandoffArtifactStore());
    }

    /**
     * Extrae la simulación leyendo la selección de los artefactos guardados por una
     * extracción del preprocesador con la misma ruta base.
     */
    public SimulationExtraction extract(Path simulationMain, ExtractionConfig config) {
        return extract(simulationMain, artifacts.load(config), config);
    }

    /**
     * Extrae la simulación con una selección ya calculada.
     *
     * @param simulationMain fichero principal de la simulación del modelo completo.
     * @param selection      entidades conservadas por el preprocesador.
     * @param config         ruta base de salida.
     */
    public SimulationExtraction extract(Path simulationMain, SubmodelSelection selection, ExtractionConfig config) {
        log.info("Extrayendo submodelo de la simulación {} con base {}", simulationMain, config.getOutputBase());

        SimulationFiles original = mainRewriter.readManifest(simulationMain);
        SimulationFiles submodel = SimulationFiles.forSubmodel(config);
        SimulationContext context = SimulationContext.builder()
                .modelDirectory(SimulationMainFileRewriter.directoryOf(simulationMain))
                .outputDirectory(config.outputDirectory())
                .submodel(submodel)
                .selection(selection)
                .boundary(SubmodelBoundary.of(selection.elementNodes(), selection.nodeCoordinates()))
                .relocatePassThrough(config.isRelocatePassThrough())
                .build();

        smallWatersheds.rewrite(original.getSmallWatershedFile(), submodel.getSmallWatershedFile(), context);
        unsaturatedZone.rewrite(original.getUnsaturatedZoneFile(), submodel.getUnsaturatedZoneFile(), context);
        groundwater.rewrite(original.getGroundwaterFile(), context);

        if (original.getStreamFile() != null && selection.streamNodes().size() > 0) {
            streams.rewrite(original.getStreamFile(), context);
        } else {
            log.info("El submodelo no tiene red de ríos");
            submodel = submodel.withStreamFile(null);
        }

        if (original.getRootZoneFile() != null) {
            rootZone.rewrite(original.getRootZoneFile(), context);
        } else {
            submodel = submodel.withRootZoneFile(null);
        }

        mainRewriter.rewrite(simulationMain, submodel, context);
        log.info("Submodelo de la simulación escrito en {}", submodel.getMainFile());
        return new SimulationExtraction(submodel, selection);
    }
}
