package iwfmsubmodel.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parámetros de una ejecución de extracción de submodelo.
 */
@Value
@Builder
@With
public class ExtractionConfig {

    /**
     * Ruta base de los ficheros generados. Cada componente se escribe como
     * {@code {base}_{Componente}.dat}.
     */
    Path outputBase;

    /**
     * Fichero de pares (elemento original, elemento nuevo, subregión).
     * Solo lo necesita la extracción del preprocesador.
     */
    Path elementPairsFile;

    /**
     * Guarda los artefactos intermedios junto a la salida para una extracción de
     * simulación posterior.
     */
    @Builder.Default
    boolean persistArtifacts = true;

    /**
     * Reescribe como rutas absolutas las referencias a ficheros que se copian sin filtrar
     * (series temporales, precipitación...) cuando la salida va a otro directorio.
     */
    @Builder.Default
    boolean relocatePassThrough = true;

    /**
     * Ruta del fichero de un componente: {@code {base}_{component}.dat}.
     */
    public Path componentFile(String component) {
        return outputFile("_" + component + ".dat");
    }

    /**
     * Ruta de un artefacto intermedio: {@code {base}_{name}.json}.
     */
    public Path artifactFile(String name) {
        return outputFile("_" + name + ".json");
    }

    public Path outputDirectory() {
        Path parent = Objects.requireNonNull(outputBase, "La ruta base de salida es obligatoria.")
                .toAbsolutePath().getParent();
        return parent == null ? Path.of("").toAbsolutePath() : parent;
    }

    /**
     * Ruta {@code {base}{suffix}} junto a la base de salida.
     */
    public Path outputFile(String suffix) {
        Objects.requireNonNull(outputBase, "La ruta base de salida es obligatoria.");
        return outputBase.resolveSibling(outputBase.getFileName() + suffix);
    }
}
