package iwfmsubmodel.extractor;

import iwfmsubmodel.config.PreprocessorFiles;
import iwfmsubmodel.domain.model.ElementMapping;
import iwfmsubmodel.domain.model.LakeDescriptor;
import iwfmsubmodel.domain.model.StreamNodeMap;
import iwfmsubmodel.domain.model.SubmodelSelection;

import java.util.List;
import java.util.Set;

/**
 * Resultado de la extracción del preprocesador: el manifiesto nuevo y la selección que
 * reutiliza la extracción de la simulación.
 */
public record PreprocessorExtraction(PreprocessorFiles files, SubmodelSelection selection) {

    public ElementMapping elementMapping() {
        return selection.elements();
    }

    public Set<Integer> nodeSet() {
        return selection.nodes();
    }

    public StreamNodeMap streamNodes() {
        return selection.streamNodes();
    }

    public List<LakeDescriptor> lakes() {
        return selection.lakes();
    }
}
