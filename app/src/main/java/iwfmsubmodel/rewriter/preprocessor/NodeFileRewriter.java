package iwfmsubmodel.rewriter.preprocessor;

import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de coordenadas de nodos: ND, FACT y registros {@code ID X Y}.
 * Se conservan los nodos del submodelo y ND pasa a ser su número.
 */
public class NodeFileRewriter extends AbstractFileRewriter {

    public NodeFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "nodos";
    }

    public SectionResult rewrite(Path source, Path target, Set<Integer> nodes) {
        return rewriteFile(source, target, cursor -> {
            int countLine = cursor.seekData();
            cursor.nextData();
            cursor.nextData();
            SectionResult result = RecordFilter.byId(cursor, nodes, 0);
            cursor.replaceCountAt(countLine, result.kept());
            return result;
        });
    }
}
