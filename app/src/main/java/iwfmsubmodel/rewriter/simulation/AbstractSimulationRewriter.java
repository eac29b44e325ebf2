package iwfmsubmodel.rewriter.simulation;

import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import iwfmsubmodel.rewriter.ChildReference;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Reescritor de un fichero de la simulación que puede nombrar ficheros hijos.
 */
@Slf4j
public abstract class AbstractSimulationRewriter extends AbstractFileRewriter {

    protected AbstractSimulationRewriter(ModelFileHandler files) {
        super(files);
    }

    /**
     * Procesa el fichero hijo nombrado en la línea actual. Si {@code rewrite} lo escribe, la
     * línea pasa a apuntar a {@code target}; si no queda nada del componente, la referencia
     * se deja en blanco.
     *
     * @return si el hijo existe en el submodelo.
     */
    protected boolean child(LineCursor cursor, SimulationContext context, String role, Path target,
                            Predicate<Path> rewrite) {
        Optional<Path> source = context.child(cursor, role);
        if (source.isEmpty()) {
            log.debug("{}: sin fichero de {}", cursor.source(), role);
            return false;
        }
        if (rewrite.test(source.get())) {
            ChildReference.redirect(cursor, target);
            return true;
        }
        ChildReference.blank(cursor);
        return false;
    }
}
