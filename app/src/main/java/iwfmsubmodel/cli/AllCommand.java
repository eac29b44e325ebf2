package iwfmsubmodel.cli;

import iwfmsubmodel.extractor.PreprocessorExtraction;
import iwfmsubmodel.extractor.PreprocessorExtractor;
import iwfmsubmodel.extractor.SimulationExtractor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

@Command(name = "all", mixinStandardHelpOptions = true,
        description = "Extrae preprocesador y simulación en una sola ejecución")
class AllCommand extends AbstractExtractionCommand {

    private final PreprocessorExtractor preprocessor;
    private final SimulationExtractor simulation;

    @Option(names = {"-p", "--preprocessor"}, required = true, paramLabel = "<preprocesador>",
            description = "Fichero principal del preprocesador")
    Path manifest;

    @Option(names = {"-s", "--simulation"}, required = true, paramLabel = "<simulación>",
            description = "Fichero principal de la simulación")
    Path simulationMain;

    @Option(names = {"-e", "--elements"}, required = true, paramLabel = "<pares>",
            description = "Fichero de pares (elemento original, elemento nuevo, subregión)")
    Path elementPairs;

    AllCommand(PreprocessorExtractor preprocessor, SimulationExtractor simulation) {
        this.preprocessor = preprocessor;
        this.simulation = simulation;
    }

    @Override
    protected void execute() {
        PreprocessorExtraction extraction = preprocessor.extract(manifest, config(elementPairs));
        simulation.extract(simulationMain, extraction.selection(), config(elementPairs));
    }
}
