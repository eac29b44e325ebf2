package iwfmsubmodel.domain.exception;

import lombok.Getter;

/**
 * Versión o variante de formato que la extracción no sabe interpretar.
 * Es fatal: no se intenta adivinar el formato.
 */
@Getter
public class UnsupportedFormatVersionException extends SubmodelException {

    private final String source;
    private final String version;

    public UnsupportedFormatVersionException(String source, String version, String detail) {
        super(String.format("%s: formato '%s' no soportado. %s", source, version, detail));
        this.source = source;
        this.version = version;
    }
}
