package iwfmsubmodel.rewriter.preprocessor;

import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de estratigrafía: NL, FACT y registros {@code ID ELV W1 W2...} por nodo.
 */
public class StratigraphyFileRewriter extends AbstractFileRewriter {

    public StratigraphyFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "estratigrafía";
    }

    public SectionResult rewrite(Path source, Path target, Set<Integer> nodes) {
        return rewriteFile(source, target, cursor -> {
            cursor.seekData();
            cursor.nextData();
            cursor.nextData();
            return RecordFilter.byId(cursor, nodes, 0);
        });
    }
}
