package iwfmsubmodel.domain.exception;

/**
 * Excepción base de la extracción de submodelos.
 * <p>
 * Cualquier error estructural aborta la ejecución completa: no hay recuperación
 * parcial. La capa de línea de comandos es la única que decide el código de salida.
 */
public class SubmodelException extends RuntimeException {

    public SubmodelException(String message) {
        super(message);
    }

    public SubmodelException(String message, Throwable cause) {
        super(message, cause);
    }
}
