package iwfmsubmodel.rewriter;

import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.io.ModelFileHandler;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Plantilla común de los reescritores: leer el fichero original con una línea en blanco
 * final como centinela, recorrerlo con un {@link LineCursor} aplicando los filtros de cada
 * sección y escribir el resultado.
 */
@Slf4j
public abstract class AbstractFileRewriter {

    protected final ModelFileHandler files;

    protected AbstractFileRewriter(ModelFileHandler files) {
        this.files = files;
    }

    /**
     * Nombre del componente para los mensajes de registro.
     */
    protected abstract String componentName();

    protected <R> R rewriteFile(Path source, Path target, Function<LineCursor, R> body) {
        return rewriteFileIf(source, target, body, result -> true);
    }

    /**
     * Igual que {@link #rewriteFile(Path, Path, Function)} pero solo escribe si
     * {@code write} acepta el resultado del recorrido.
     */
    protected <R> R rewriteFileIf(Path source, Path target, Function<LineCursor, R> body, Predicate<R> write) {
        LineCursor cursor = open(source);
        R result = body.apply(cursor);
        if (write.test(result)) {
            files.write(cursor.lines(), target);
            log.info("Escrito fichero de submodelo {}: {}", componentName(), target);
        } else {
            log.warn("Fichero {} sin registros en el submodelo; no se escribe {}", componentName(), target);
        }
        return result;
    }

    /**
     * Recorre el fichero con el mismo cursor que {@link #rewriteFile(Path, Path, Function)}
     * pero sin escribir nada: sirve para calcular la selección antes de reescribir.
     */
    protected <R> R scanFile(Path source, Function<LineCursor, R> body) {
        return body.apply(open(source));
    }

    private LineCursor open(Path source) {
        ModelFileHandler.requireExists(source, componentName());
        List<String> lines = files.readWithSentinel(source);
        return LineCursor.over(lines, source.getFileName().toString());
    }
}
