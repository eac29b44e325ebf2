package iwfmsubmodel.rewriter.simulation.stream;

import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de caudales de entrada a la red de ríos.
 * <p>
 * NCOLSTRM, cuatro líneas de cabecera (FACTSTRM, NSPSTRM, NFQSTRM, DSSFL) y una línea por
 * columna de la serie con el nodo de río receptor IRST. Las columnas cuyo nodo no sobrevive
 * pasan a nodo 0; la serie temporal se copia tal cual para no desalinear sus columnas.
 */
@Slf4j
public class StreamInflowFileRewriter extends AbstractFileRewriter {

    private static final int HEADER_LINES = 4;

    public StreamInflowFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "entradas a ríos";
    }

    public void rewrite(Path source, Path target, Set<Integer> streamNodes) {
        rewriteFile(source, target, cursor -> {
            cursor.seekData();
            int columns = cursor.count();
            if (columns <= 0) {
                return 0;
            }
            cursor.nextData(HEADER_LINES);
            SectionResult result = RecordFilter.zeroMissing(cursor, 0, streamNodes, 0);
            log.info("Entradas a ríos: {} de {} columnas siguen apuntando a un nodo del submodelo",
                    result.kept(), result.read());
            return result.kept();
        });
    }
}
