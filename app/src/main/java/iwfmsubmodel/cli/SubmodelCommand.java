package iwfmsubmodel.cli;

import iwfmsubmodel.extractor.PreprocessorExtractor;
import iwfmsubmodel.extractor.SimulationExtractor;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model;
import picocli.CommandLine.Spec;

/**
 * Comando raíz. Sin subcomando muestra la ayuda.
 */
@Command(name = "iwfm-submodel", mixinStandardHelpOptions = true, version = "iwfm-submodel 1.0.0",
        description = "Extrae un submodelo de un modelo IWFM a partir de una lista de elementos",
        usageHelpAutoWidth = true)
public class SubmodelCommand implements Runnable {

    @Spec
    Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    /**
     * Línea de comandos con los subcomandos conectados a los extractores dados.
     */
    public static CommandLine commandLine(PreprocessorExtractor preprocessor, SimulationExtractor simulation) {
        return new CommandLine(new SubmodelCommand())
                .addSubcommand(new PreprocessorCommand(preprocessor))
                .addSubcommand(new SimulationCommand(simulation))
                .addSubcommand(new AllCommand(preprocessor, simulation));
    }
}
