package iwfmsubmodel.io;

import iwfmsubmodel.domain.exception.MissingInputFileException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lectura y escritura de los ficheros de texto de formato fijo del modelo.
 * <p>
 * Se usa ISO-8859-1 para que cualquier secuencia de bytes (comentarios con acentos en
 * cualquier codificación) se conserve sin alteraciones al reescribir.
 */
@Slf4j
public class ModelFileHandler {

    private static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    /**
     * Comprueba que un fichero requerido existe antes de parsearlo.
     *
     * @param path ruta del fichero.
     * @param role descripción del fichero para el mensaje de error.
     * @throws MissingInputFileException si no existe.
     */
    public static void requireExists(Path path, String role) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new MissingInputFileException(role, path == null ? Path.of("") : path);
        }
    }

    /**
     * Lee todas las líneas de un fichero en una lista mutable.
     */
    public List<String> read(Path path) {
        requireExists(path, "de entrada");
        log.debug("Leyendo fichero {}", path.toAbsolutePath());
        try {
            return new ArrayList<>(Files.readAllLines(path, CHARSET));
        } catch (IOException e) {
            log.error("Error al leer el fichero {}", path.toAbsolutePath(), e);
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Lee un fichero y añade una línea en blanco final que cierra la última sección.
     */
    public List<String> readWithSentinel(Path path) {
        List<String> lines = read(path);
        lines.add("");
        return lines;
    }

    /**
     * Escribe las líneas separadas por saltos de línea. Las líneas en blanco finales se
     * descartan y el fichero termina siempre en un único salto de línea.
     */
    public void write(List<String> lines, Path path) {
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) {
            end--;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, String.join("\n", lines.subList(0, end)) + "\n", CHARSET);
            log.debug("Escritas {} líneas en {}", end, path.toAbsolutePath());
        } catch (IOException e) {
            log.error("Error al escribir el fichero {}", path.toAbsolutePath(), e);
            throw new UncheckedIOException(e);
        }
    }
}
