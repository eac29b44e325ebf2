package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de condiciones de contorno de un {@link BoundaryConditionType}: conserva los nodos
 * del submodelo y actualiza el contador.
 */
@Slf4j
public class NodeBoundaryConditionFileRewriter extends AbstractFileRewriter {

    private final BoundaryConditionType type;

    public NodeBoundaryConditionFileRewriter(ModelFileHandler files, BoundaryConditionType type) {
        super(files);
        this.type = type;
    }

    @Override
    protected String componentName() {
        return "contorno de " + type.getDescription();
    }

    /**
     * @return si algún nodo conserva la condición; si no, el fichero no se escribe.
     */
    public boolean rewrite(Path source, Path target, Set<Integer> nodes) {
        SectionResult result = rewriteFileIf(source, target, cursor -> {
            cursor.seekData();
            return RecordFilter.counted(cursor, type.getHeaderLines(), (c, n) -> RecordFilter.byIdCounted(c, nodes, 0, n));
        }, section -> section.kept() > 0);
        log.debug("Condiciones de {}: {} de {}", type.getDescription(), result.kept(), result.read());
        return result.kept() > 0;
    }
}
