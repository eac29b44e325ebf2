package iwfmsubmodel.domain.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Un fichero requerido (manifiesto o fichero hijo referenciado) no existe.
 * Se detecta antes de empezar a parsear.
 */
@Getter
public class MissingInputFileException extends SubmodelException {

    private final Path path;

    public MissingInputFileException(String role, Path path) {
        super(String.format("No existe el fichero %s: %s", role, path.toAbsolutePath()));
        this.path = path;
    }
}
