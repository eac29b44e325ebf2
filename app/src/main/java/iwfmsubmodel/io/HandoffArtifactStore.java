package iwfmsubmodel.io;

import com.fasterxml.jackson.core.type.TypeReference;
import iwfmsubmodel.config.ExtractionConfig;
import iwfmsubmodel.domain.exception.ArtifactException;
import iwfmsubmodel.domain.model.ElementMapping;
import iwfmsubmodel.domain.model.ElementNodes;
import iwfmsubmodel.domain.model.LakeDescriptor;
import iwfmsubmodel.domain.model.NodeCoordinate;
import iwfmsubmodel.domain.model.StreamNodeMap;
import iwfmsubmodel.domain.model.SubmodelSelection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Artefactos intermedios que la extracción del preprocesador deja junto a la salida
 * ({@code {base}_nodes.json}, {@code {base}_elems.json}...) para que la extracción de la
 * simulación reutilice la misma selección.
 */
@Slf4j
public class HandoffArtifactStore {

    static final String ELEMENTS = "elems";
    static final String NODES = "nodes";
    static final String NODE_COORDINATES = "node_coords";
    static final String ELEMENT_NODES = "elemnodes";
    static final String STREAM_NODES = "snodes";
    static final String SURVIVING_STREAM_NODES = "sub_snodes";
    static final String LAKES = "lakes";

    private final JsonFileHandler json;

    public HandoffArtifactStore(JsonFileHandler json) {
        this.json = json;
    }

    public HandoffArtifactStore() {
        this(new JsonFileHandler());
    }

    /**
     * Guarda cada parte de la selección en su propio fichero JSON.
     */
    public void save(SubmodelSelection selection, ExtractionConfig config) {
        write(selection.elements(), config.artifactFile(ELEMENTS));
        write(selection.nodes(), config.artifactFile(NODES));
        write(selection.nodeCoordinates(), config.artifactFile(NODE_COORDINATES));
        write(selection.elementNodes(), config.artifactFile(ELEMENT_NODES));
        write(selection.streamNodes(), config.artifactFile(STREAM_NODES));
        write(selection.survivingStreamNodes(), config.artifactFile(SURVIVING_STREAM_NODES));
        write(selection.lakes(), config.artifactFile(LAKES));
        log.info("Artefactos intermedios guardados con base {}", config.getOutputBase());
    }

    /**
     * Reconstruye la selección a partir de los artefactos de una extracción anterior.
     *
     * @throws ArtifactException si falta alguno o no se puede leer.
     */
    public SubmodelSelection load(ExtractionConfig config) {
        try {
            return SubmodelSelection.builder()
                    .elements(json.readFromFile(config.artifactFile(ELEMENTS), ElementMapping.class))
                    .nodes(json.readFromFile(config.artifactFile(NODES), new TypeReference<Set<Integer>>() {
                    }))
                    .nodeCoordinates(json.readFromFile(config.artifactFile(NODE_COORDINATES),
                            new TypeReference<List<NodeCoordinate>>() {
                            }))
                    .elementNodes(json.readFromFile(config.artifactFile(ELEMENT_NODES),
                            new TypeReference<List<ElementNodes>>() {
                            }))
                    .streamNodes(json.readFromFile(config.artifactFile(STREAM_NODES), StreamNodeMap.class))
                    .survivingStreamNodes(json.readFromFile(config.artifactFile(SURVIVING_STREAM_NODES),
                            new TypeReference<Set<Integer>>() {
                            }))
                    .lakes(json.readFromFile(config.artifactFile(LAKES),
                            new TypeReference<List<LakeDescriptor>>() {
                            }))
                    .build();
        } catch (IOException e) {
            throw new ArtifactException("No se pudieron leer los artefactos del preprocesador con base "
                    + config.getOutputBase(), e);
        }
    }

    private void write(Object data, Path path) {
        try {
            json.writeToFile(data, path);
        } catch (IOException e) {
            throw new ArtifactException("No se pudo guardar el artefacto " + path, e);
        }
    }
}
