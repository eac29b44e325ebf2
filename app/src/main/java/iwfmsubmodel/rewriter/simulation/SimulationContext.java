package iwfmsubmodel.rewriter.simulation;

import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.domain.model.SubmodelSelection;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.geometry.SubmodelBoundary;
import iwfmsubmodel.rewriter.ChildReference;
import lombok.Builder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Estado compartido por los reescritores de la simulación.
 *
 * @param modelDirectory      directorio respecto al que se resuelven los ficheros del modelo.
 * @param outputDirectory     directorio de los ficheros del submodelo.
 * @param submodel            nombres de los ficheros del submodelo.
 * @param selection           entidades conservadas.
 * @param boundary            contorno del submodelo.
 * @param relocatePassThrough si las referencias que se copian sin filtrar pasan a ruta absoluta.
 */
@Builder
public record SimulationContext(Path modelDirectory,
                                Path outputDirectory,
                                SimulationFiles submodel,
                                SubmodelSelection selection,
                                SubmodelBoundary boundary,
                                boolean relocatePassThrough) {

    public Set<Integer> nodes() {
        return selection.nodes();
    }

    public Set<Integer> elements() {
        return selection.retainedElements();
    }

    /** Nodos de río que sobreviven en el submodelo. */
    public Set<Integer> streamNodes() {
        return selection.survivingStreamNodes();
    }

    public Set<Integer> lakes() {
        return selection.lakeIds();
    }

    public Optional<Path> child(LineCursor cursor, String role) {
        return ChildReference.resolve(cursor, modelDirectory, role);
    }

    public void passThrough(LineCursor cursor) {
        ChildReference.relocate(cursor, modelDirectory, outputDirectory, relocatePassThrough);
    }

    /**
     * Recorre {@code count} líneas de datos a partir de la actual y reubica las que nombran un
     * fichero existente del modelo. Las demás (factores, ficheros de salida) no cambian. Deja
     * el cursor en la última línea recorrida.
     */
    public void passThroughLines(LineCursor cursor, int count) {
        for (int n = 0; n < count; n++) {
            if (n > 0) {
                cursor.nextData();
            }
            boolean existing = FixedFormat.fileName(cursor.current())
                    .map(name -> Files.isRegularFile(modelDirectory.resolve(name.replace('\\', '/'))))
                    .orElse(false);
            if (existing) {
                passThrough(cursor);
            }
        }
    }
}
