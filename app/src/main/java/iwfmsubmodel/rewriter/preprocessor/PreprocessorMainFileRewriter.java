package iwfmsubmodel.rewriter.preprocessor;

import iwfmsubmodel.config.PreprocessorFiles;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import iwfmsubmodel.rewriter.ChildReference;

import java.nio.file.Path;
import java.util.List;

/**
 * Fichero principal del preprocesador.
 * <p>
 * Tras tres líneas de título vienen, en este orden, la salida binaria, los ficheros de
 * elementos, nodos, estratigrafía, ríos y lagos. El resto del fichero se copia tal cual.
 */
public class PreprocessorMainFileRewriter extends AbstractFileRewriter {

    private static final int TITLE_LINES = 3;

    public PreprocessorMainFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "principal del preprocesador";
    }

    /**
     * Lee los nombres de fichero del manifiesto. Los ficheros de elementos, nodos y
     * estratigrafía son obligatorios; ríos y lagos pueden faltar ({@code /}).
     */
    public PreprocessorFiles readManifest(Path mainFile) {
        ModelFileHandler.requireExists(mainFile, componentName());
        List<String> lines = files.read(mainFile);
        LineCursor cursor = LineCursor.over(lines, mainFile.getFileName().toString());
        Path directory = directoryOf(mainFile);

        cursor.seekCountingBlanks(TITLE_LINES);
        Path binary = cursor.tokens().length > 0 && !cursor.tokens()[0].startsWith("/")
                ? directory.resolve(cursor.tokens()[0].replace('\\', '/'))
                : null;
        cursor.nextData();
        Path elements = ChildReference.resolve(cursor, directory, "de elementos")
                .orElseThrow(() -> cursor.malformed("el fichero de elementos"));
        cursor.nextData();
        Path nodes = ChildReference.resolve(cursor, directory, "de nodos")
                .orElseThrow(() -> cursor.malformed("el fichero de nodos"));
        cursor.nextData();
        Path stratigraphy = ChildReference.resolve(cursor, directory, "de estratigrafía")
                .orElseThrow(() -> cursor.malformed("el fichero de estratigrafía"));
        cursor.nextData();
        Path streams = ChildReference.resolve(cursor, directory, "de ríos").orElse(null);
        cursor.nextData();
        Path lakes = ChildReference.resolve(cursor, directory, "de lagos").orElse(null);

        return PreprocessorFiles.builder()
                .mainFile(mainFile)
                .binaryOutput(binary)
                .elementFile(elements)
                .nodeFile(nodes)
                .stratigraphyFile(stratigraphy)
                .streamFile(streams)
                .lakeFile(lakes)
                .build();
    }

    /**
     * Escribe el manifiesto del submodelo. Las referencias a ríos o lagos se vacían cuando
     * el submodelo no los tiene.
     */
    public void rewrite(Path source, PreprocessorFiles submodel) {
        rewriteFile(source, submodel.getMainFile(), cursor -> {
            cursor.seekCountingBlanks(TITLE_LINES);
            ChildReference.redirect(cursor, submodel.getBinaryOutput());
            cursor.nextData();
            ChildReference.redirect(cursor, submodel.getElementFile());
            cursor.nextData();
            ChildReference.redirect(cursor, submodel.getNodeFile());
            cursor.nextData();
            ChildReference.redirect(cursor, submodel.getStratigraphyFile());
            cursor.nextData();
            redirectOrBlank(cursor, submodel.getStreamFile());
            cursor.nextData();
            redirectOrBlank(cursor, submodel.getLakeFile());
            return null;
        });
    }

    private static void redirectOrBlank(LineCursor cursor, Path target) {
        if (target == null) {
            ChildReference.blank(cursor);
        } else {
            ChildReference.redirect(cursor, target);
        }
    }

    static Path directoryOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent == null ? Path.of("").toAbsolutePath() : parent;
    }
}
