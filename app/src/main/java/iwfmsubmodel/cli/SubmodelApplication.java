package iwfmsubmodel.cli;

import iwfmsubmodel.domain.exception.SubmodelException;
import iwfmsubmodel.domain.exception.UnsupportedFormatVersionException;
import iwfmsubmodel.extractor.PreprocessorExtractor;
import iwfmsubmodel.extractor.SimulationExtractor;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.UncheckedIOException;

/**
 * Punto de entrada.
 * <p>
 * Códigos de salida: 0 correcto, 1 error de datos o de E/S, 2 formato no soportado y 64 uso
 * incorrecto de la línea de comandos.
 */
@Slf4j
public final class SubmodelApplication {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_UNSUPPORTED = 2;
    public static final int EXIT_USAGE = 64;

    private SubmodelApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(new PreprocessorExtractor(), new SimulationExtractor(), args));
    }

    /**
     * Ejecuta la línea de comandos sin terminar el proceso.
     *
     * @return código de salida.
     */
    public static int run(PreprocessorExtractor preprocessor, SimulationExtractor simulation, String... args) {
        CommandLine commandLine = SubmodelCommand.commandLine(preprocessor, simulation);
        commandLine.getCommandSpec().exitCodeOnInvalidInput(EXIT_USAGE);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof UnsupportedFormatVersionException) {
                log.error("Formato no soportado: {}", ex.getMessage());
                return EXIT_UNSUPPORTED;
            }
            if (ex instanceof SubmodelException || ex instanceof UncheckedIOException) {
                log.error("La extracción ha fallado: {}", ex.getMessage());
                log.debug("Detalle del error", ex);
                return EXIT_FAILURE;
            }
            log.error("Error inesperado durante la extracción", ex);
            return EXIT_FAILURE;
        });
        return commandLine.execute(args);
    }
}
