package iwfmsubmodel.cli;

import iwfmsubmodel.extractor.PreprocessorExtractor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

@Command(name = "preprocessor", mixinStandardHelpOptions = true,
        description = "Extrae los ficheros del preprocesador de un submodelo")
class PreprocessorCommand extends AbstractExtractionCommand {

    private final PreprocessorExtractor extractor;

    @Parameters(index = "0", paramLabel = "<preprocesador>", description = "Fichero principal del preprocesador")
    Path manifest;

    @Option(names = {"-e", "--elements"}, required = true, paramLabel = "<pares>",
            description = "Fichero de pares (elemento original, elemento nuevo, subregión)")
    Path elementPairs;

    PreprocessorCommand(PreprocessorExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    protected void execute() {
        extractor.extract(manifest, config(elementPairs));
    }
}
