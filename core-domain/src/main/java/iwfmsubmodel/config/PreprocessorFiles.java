package iwfmsubmodel.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.nio.file.Path;

/**
 * Manifiesto del preprocesador: el fichero principal y los ficheros que referencia.
 * Un campo nulo significa que el modelo no tiene ese componente.
 */
@Value
@Builder
@With
public class PreprocessorFiles {

    Path mainFile;
    /** Salida binaria del preprocesador, leída después por la simulación. */
    Path binaryOutput;
    Path elementFile;
    Path nodeFile;
    Path stratigraphyFile;
    Path streamFile;
    Path lakeFile;

    /**
     * Nombres de los ficheros del submodelo para una ruta base.
     */
    public static PreprocessorFiles forSubmodel(ExtractionConfig config) {
        return PreprocessorFiles.builder()
                .mainFile(config.outputFile("_Preprocessor.in"))
                .binaryOutput(config.outputFile("_Preprocessor.bin"))
                .elementFile(config.componentFile("Elements"))
                .nodeFile(config.componentFile("Nodes"))
                .stratigraphyFile(config.componentFile("Stratigraphy"))
                .streamFile(config.componentFile("StreamSpec"))
                .lakeFile(config.componentFile("Lake"))
                .build();
    }

    public boolean hasStreams() {
        return streamFile != null;
    }

    public boolean hasLakes() {
        return lakeFile != null;
    }
}
