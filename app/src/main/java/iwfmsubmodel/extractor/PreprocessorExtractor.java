package iwfmsubmodel.extractor;

import iwfmsubmodel.config.ExtractionConfig;
import iwfmsubmodel.config.PreprocessorFiles;
import iwfmsubmodel.domain.model.ElementMapping;
import iwfmsubmodel.domain.model.LakeDescriptor;
import iwfmsubmodel.domain.model.NodeCoordinate;
import iwfmsubmodel.domain.model.StreamNodeMap;
import iwfmsubmodel.domain.model.StreamSelection;
import iwfmsubmodel.domain.model.SubmodelSelection;
import iwfmsubmodel.io.HandoffArtifactStore;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.preprocessor.ElementFileRewriter;
import iwfmsubmodel.rewriter.preprocessor.LakeFileRewriter;
import iwfmsubmodel.rewriter.preprocessor.NodeFileRewriter;
import iwfmsubmodel.rewriter.preprocessor.PreprocessorMainFileRewriter;
import iwfmsubmodel.rewriter.preprocessor.StratigraphyFileRewriter;
import iwfmsubmodel.rewriter.preprocessor.StreamSpecFileRewriter;
import iwfmsubmodel.selection.EntitySelector;
import iwfmsubmodel.stream.StreamNetworkFilter;
import iwfmsubmodel.stream.StreamSpecParser;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orquesta la extracción de los ficheros del preprocesador.
 * <p>
 * Orden: manifiesto original → selección de elementos, nodos, ríos y lagos → artefactos
 * intermedios → nodos → elementos → estratigrafía → ríos → lagos → manifiesto nuevo.
 * Los artefactos se guardan antes de reescribir ningún fichero, de modo que un fallo en un
 * fichero concreto no impide reanudar la parte de simulación con la selección ya calculada.
 */
@Slf4j
public class PreprocessorExtractor {

    private final EntitySelector selector;
    private final HandoffArtifactStore artifacts;
    private final PreprocessorMainFileRewriter mainRewriter;
    private final NodeFileRewriter nodeRewriter;
    private final ElementFileRewriter elementRewriter;
    private final StratigraphyFileRewriter stratigraphyRewriter;
    private final StreamSpecFileRewriter streamRewriter;
    private final LakeFileRewriter lakeRewriter;

    public PreprocessorExtractor(ModelFileHandler files, EntitySelector selector, HandoffArtifactStore artifacts) {
        this.selector = selector;
        this.artifacts = artifacts;
        this.mainRewriter = new PreprocessorMainFileRewriter(files);
        this.nodeRewriter = new NodeFileRewriter(files);
        this.elementRewriter = new ElementFileRewriter(files);
        this.stratigraphyRewriter = new StratigraphyFileRewriter(files);
        this.streamRewriter = new StreamSpecFileRewriter(files, new StreamSpecParser(), new StreamNetworkFilter());
        this.lakeRewriter = new LakeFileRewriter(files);
    }

    public PreprocessorExtractor() {
        this(new ModelFileHandler(), new EntitySelector(new ModelFileHandler()), new HandoffArtifactStore());
    }

    /**
     * Extrae el submodelo del preprocesador.
     *
     * @param manifestFile fichero principal del preprocesador del modelo completo.
     * @param config       fichero de pares y ruta base de salida.
     * @return manifiesto nuevo y selección de entidades.
     */
    public PreprocessorExtraction extract(Path manifestFile, ExtractionConfig config) {
        Objects.requireNonNull(config.getElementPairsFile(), "El fichero de pares de elementos es obligatorio.");
        log.info("Extrayendo submodelo del preprocesador {} con base {}", manifestFile, config.getOutputBase());

        PreprocessorFiles original = mainRewriter.readManifest(manifestFile);
        PreprocessorFiles submodel = PreprocessorFiles.forSubmodel(config);

        ElementMapping mapping = selector.selectElements(config.getElementPairsFile());
        EntitySelector.NodeSelection nodes = selector.selectNodes(original.getElementFile(), mapping.retainedElements());
        List<NodeCoordinate> coordinates = selector.selectNodeCoordinates(original.getNodeFile(), nodes.nodes());

        StreamNodeMap streamNodes = new StreamNodeMap(Map.of());
        StreamSelection streams = StreamSelection.empty();
        if (original.hasStreams()) {
            StreamSpecFileRewriter.Result result = streamRewriter.select(original.getStreamFile(), nodes.nodes());
            streamNodes = result.network().nodeMap();
            streams = result.selection();
        }
        List<LakeDescriptor> lakes = List.of();
        if (original.hasLakes()) {
            lakes = lakeRewriter.select(original.getLakeFile(), mapping.retainedElements(), streams.survivingNodes());
        }

        SubmodelSelection selection = SubmodelSelection.builder()
                .elements(mapping)
                .nodes(nodes.nodes())
                .nodeCoordinates(coordinates)
                .elementNodes(nodes.elementNodes())
                .streamNodes(streamNodes)
                .survivingStreamNodes(streams.survivingNodes())
                .lakes(lakes)
                .build();
        if (config.isPersistArtifacts()) {
            artifacts.save(selection, config);
        }

        nodeRewriter.rewrite(original.getNodeFile(), submodel.getNodeFile(), nodes.nodes());
        elementRewriter.rewrite(original.getElementFile(), submodel.getElementFile(),
                mapping.retainedElements(), mapping.subregionSet());
        stratigraphyRewriter.rewrite(original.getStratigraphyFile(), submodel.getStratigraphyFile(), nodes.nodes());

        if (original.hasStreams()) {
            streamRewriter.rewrite(original.getStreamFile(), submodel.getStreamFile(), nodes.nodes());
        } else {
            submodel = submodel.withStreamFile(null);
        }
        if (original.hasLakes() && !lakes.isEmpty()) {
            lakeRewriter.rewrite(original.getLakeFile(), submodel.getLakeFile(),
                    mapping.retainedElements(), streams.survivingNodes());
        } else {
            submodel = submodel.withLakeFile(null);
        }

        mainRewriter.rewrite(manifestFile, submodel);

        log.info("Submodelo del preprocesador: {} elementos, {} nodos, {} nodos de río, {} tramos, {} lagos",
                mapping.retainedElements().size(), nodes.nodes().size(), streams.survivingNodes().size(),
                streams.reaches().size(), lakes.size());
        return new PreprocessorExtraction(submodel, selection);
    }
}
