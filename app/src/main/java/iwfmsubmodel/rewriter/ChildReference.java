package iwfmsubmodel.rewriter;

import iwfmsubmodel.domain.exception.MissingInputFileException;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Campo de un fichero padre que nombra otro fichero del modelo.
 * <p>
 * Los nombres se resuelven respecto al directorio del modelo; las barras invertidas se
 * normalizan. Un campo que empieza por {@code /} significa que el componente no existe.
 */
public final class ChildReference {

    private ChildReference() {
    }

    /**
     * Fichero referenciado en la línea actual del cursor, si lo hay.
     *
     * @throws MissingInputFileException si está referenciado pero no existe.
     */
    public static Optional<Path> resolve(LineCursor cursor, Path modelDirectory, String role) {
        Optional<Path> path = FixedFormat.fileName(cursor.current())
                .map(name -> modelDirectory.resolve(name.replace('\\', '/')).normalize());
        path.ifPresent(p -> {
            if (!Files.isRegularFile(p)) {
                throw new MissingInputFileException(role, p);
            }
        });
        return path;
    }

    /**
     * Apunta la línea actual al fichero del submodelo. Se escribe solo el nombre: el
     * submodelo se lee desde el directorio de salida.
     */
    public static void redirect(LineCursor cursor, Path target) {
        cursor.setCurrent(FixedFormat.withFileName(cursor.current(), target.getFileName().toString()));
    }

    public static void blank(LineCursor cursor) {
        cursor.setCurrent(FixedFormat.blankFileName(cursor.current()));
    }

    /**
     * Referencia que se copia sin filtrar (series temporales, precipitación...). Si el
     * submodelo se escribe en otro directorio, la ruta pasa a ser absoluta para que siga
     * apuntando al fichero original.
     */
    public static void relocate(LineCursor cursor, Path modelDirectory, Path outputDirectory, boolean enabled) {
        Optional<String> name = FixedFormat.fileName(cursor.current());
        if (!enabled || name.isEmpty()) {
            return;
        }
        Path original = Path.of(name.get().replace('\\', '/'));
        if (original.isAbsolute()
                || modelDirectory.toAbsolutePath().normalize().equals(outputDirectory.toAbsolutePath().normalize())) {
            return;
        }
        Path absolute = modelDirectory.resolve(original).toAbsolutePath().normalize();
        cursor.setCurrent(FixedFormat.withFileName(cursor.current(), absolute.toString()));
    }
}
