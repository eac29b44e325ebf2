package iwfmsubmodel.cli;

import ch.qos.logback.classic.Level;
import iwfmsubmodel.config.ExtractionConfig;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Opciones comunes a los subcomandos de extracción.
 */
abstract class AbstractExtractionCommand implements Callable<Integer> {

    static final String BASE_LOGGER = "iwfmsubmodel";

    @Option(names = {"-o", "--output-base"}, required = true, paramLabel = "<base>",
            description = "Ruta base de los ficheros del submodelo; cada componente se escribe como <base>_<Componente>.dat")
    Path outputBase;

    @Option(names = "--no-artifacts", description = "No guardar los artefactos intermedios JSON")
    boolean noArtifacts;

    @Option(names = "--no-relocate",
            description = "Copiar tal cual las referencias a series temporales en lugar de hacerlas absolutas")
    boolean noRelocate;

    @Option(names = {"-v", "--verbose"}, description = "Mostrar el detalle de cada sección procesada")
    boolean verbose;

    ExtractionConfig config(Path elementPairsFile) {
        return ExtractionConfig.builder()
                .outputBase(outputBase)
                .elementPairsFile(elementPairsFile)
                .persistArtifacts(!noArtifacts)
                .relocatePassThrough(!noRelocate)
                .build();
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(BASE_LOGGER)).setLevel(Level.DEBUG);
        }
        execute();
        return SubmodelApplication.EXIT_OK;
    }

    protected abstract void execute();
}
