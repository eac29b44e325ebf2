package iwfmsubmodel.cli;

import iwfmsubmodel.extractor.SimulationExtractor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

@Command(name = "simulation", mixinStandardHelpOptions = true,
        description = "Extrae los ficheros de la simulación a partir de los artefactos de una extracción "
                + "del preprocesador con la misma ruta base")
class SimulationCommand extends AbstractExtractionCommand {

    private final SimulationExtractor extractor;

    @Parameters(index = "0", paramLabel = "<simulación>", description = "Fichero principal de la simulación")
    Path simulationMain;

    SimulationCommand(SimulationExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    protected void execute() {
        extractor.extract(simulationMain, config(null));
    }
}
