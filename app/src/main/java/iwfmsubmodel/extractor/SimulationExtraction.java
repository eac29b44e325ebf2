package iwfmsubmodel.extractor;

import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.domain.model.SubmodelSelection;

/**
 * Resultado de la extracción de la simulación: los nombres de fichero del submodelo (ríos y
 * zona radicular quedan a {@code null} si el submodelo no los tiene) y la selección usada.
 */
public record SimulationExtraction(SimulationFiles files, SubmodelSelection selection) {
}
