package iwfmsubmodel.format;

/**
 * Resultado de filtrar una sección de registros.
 *
 * @param start    índice del primer registro de la sección.
 * @param end      índice de la línea que cierra la sección tras el filtrado.
 * @param read     registros (o bloques) leídos.
 * @param kept     registros (o bloques) conservados.
 * @param sentinel la sección empezaba por una clave &lt;= 0 y no se tocó.
 */
public record SectionResult(int start, int end, int read, int kept, boolean sentinel) {

    public int dropped() {
        return read - kept;
    }
}
