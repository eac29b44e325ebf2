package iwfmsubmodel.domain.exception;

/**
 * Error al persistir o recuperar los artefactos intermedios que comparten
 * la extracción del preprocesador y la de la simulación.
 */
public class ArtifactException extends SubmodelException {

    public ArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
