package iwfmsubmodel.rewriter.preprocessor;

import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de configuración de elementos.
 * <p>
 * Estructura: NE, NREGN, NREGN líneas {@code ID NOMBRE} de subregión y después los
 * elementos {@code IE N1 N2 N3 N4 IRGE}. Se conservan las subregiones referenciadas y los
 * elementos del submodelo con su identificador original.
 */
@Slf4j
public class ElementFileRewriter extends AbstractFileRewriter {

    public ElementFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "elementos";
    }

    public SectionResult rewrite(Path source, Path target, Set<Integer> elements, Set<Integer> subregions) {
        return rewriteFile(source, target, cursor -> {
            int elementCountLine = cursor.seekData();
            int subregionCountLine = cursor.nextData();
            int subregionCount = cursor.count();
            cursor.nextData();

            SectionResult regions = RecordFilter.byIdCounted(cursor, subregions, 0, subregionCount);
            cursor.replaceCountAt(subregionCountLine, regions.kept());
            log.debug("Subregiones conservadas: {} de {}", regions.kept(), regions.read());

            cursor.seekData();
            SectionResult result = RecordFilter.byId(cursor, elements, 0);
            cursor.replaceCountAt(elementCountLine, result.kept());
            return result;
        });
    }
}
