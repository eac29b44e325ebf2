package iwfmsubmodel.domain.exception;

import lombok.Getter;

/**
 * Se lanza cuando un registro de un fichero de formato fijo no tiene la forma esperada
 * (número de columnas incorrecto, clave no numérica donde se espera un entero...).
 */
@Getter
public class MalformedRecordException extends SubmodelException {

    /** Nombre del fichero de origen, o una descripción si no se conoce. */
    private final String source;
    /** Número de línea, empezando en 1. */
    private final int lineNumber;
    private final String expected;
    private final String actual;

    public MalformedRecordException(String source, int lineNumber, String expected, String actual) {
        super(String.format("%s, línea %d: se esperaba %s pero se encontró '%s'",
                source, lineNumber, expected, actual));
        this.source = source;
        this.lineNumber = lineNumber;
        this.expected = expected;
        this.actual = actual;
    }
}
