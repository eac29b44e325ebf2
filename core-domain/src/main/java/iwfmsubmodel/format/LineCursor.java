package iwfmsubmodel.format;

import iwfmsubmodel.domain.exception.MalformedRecordException;

import java.util.List;
import java.util.Objects;

/**
 * Cursor sobre la secuencia de líneas de un fichero de formato fijo.
 * <p>
 * Las líneas cuyo primer carácter es {@code C}, {@code c}, {@code *} o {@code #} son
 * comentarios; el resto son líneas de datos (también las vacías). Las secciones de
 * registros quedan delimitadas por las líneas de comentario.
 * <p>
 * La clase ofrece la primitiva estática {@link #advance(List, int, int)} y una instancia
 * mutable que mantiene la posición actual, la secuencia subyacente y el nombre del
 * fichero para los mensajes de error. Todos los reescritores avanzan con ella.
 */
public final class LineCursor {

    /** Valor devuelto por {@link #advance(List, int, int)} al sobrepasar la última línea. */
    public static final int END_OF_SEQUENCE = -1;

    private static final String COMMENT_MARKERS = "Cc*#";

    private final List<String> lines;
    private final String source;
    private int position;

    private LineCursor(List<String> lines, String source) {
        this.lines = Objects.requireNonNull(lines, "La secuencia de líneas no puede ser nula.");
        this.source = Objects.requireNonNull(source, "El nombre del origen no puede ser nulo.");
        this.position = 0;
    }

    /**
     * Crea un cursor al principio de la secuencia. La lista debe ser mutable si se va a
     * reescribir.
     */
    public static LineCursor over(List<String> lines, String source) {
        return new LineCursor(lines, source);
    }

    // --- Primitivas estáticas ---

    public static boolean isComment(String line) {
        return !line.isEmpty() && COMMENT_MARKERS.indexOf(line.charAt(0)) >= 0;
    }

    /**
     * Comentario o línea en blanco: cualquiera de las dos cierra una sección de registros.
     */
    public static boolean isSectionBreak(String line) {
        return isComment(line) || line.isBlank();
    }

    /**
     * Avanza desde {@code index} saltando comentarios y después exactamente {@code skip}
     * líneas de datos, pasando por encima de los comentarios intercalados.
     *
     * @param lines secuencia de líneas.
     * @param index posición de partida (incluida).
     * @param skip  número de líneas de datos a saltar.
     * @return índice de la siguiente línea de datos o {@link #END_OF_SEQUENCE}.
     * @throws IllegalArgumentException si {@code index} o {@code skip} son negativos.
     */
    public static int advance(List<String> lines, int index, int skip) {
        Objects.requireNonNull(lines, "La secuencia de líneas no puede ser nula.");
        if (index < 0) {
            throw new IllegalArgumentException("El índice de línea no puede ser negativo: " + index);
        }
        if (skip < 0) {
            throw new IllegalArgumentException("El número de líneas a saltar no puede ser negativo: " + skip);
        }
        int i = skipComments(lines, index);
        for (int n = 0; n < skip && i != END_OF_SEQUENCE; n++) {
            i = skipComments(lines, i + 1);
        }
        return i;
    }

    private static int skipComments(List<String> lines, int index) {
        int i = index;
        while (i < lines.size() && isComment(lines.get(i))) {
            i++;
        }
        return i < lines.size() ? i : END_OF_SEQUENCE;
    }

    // --- Cursor mutable ---

    public List<String> lines() {
        return lines;
    }

    public String source() {
        return source;
    }

    public int position() {
        return position;
    }

    /** Número de línea (base 1) de la posición actual, para mensajes. */
    public int lineNumber() {
        return position + 1;
    }

    public void moveTo(int index) {
        if (index < 0 || index > lines.size()) {
            throw new IllegalArgumentException("Posición fuera de rango: " + index);
        }
        this.position = index;
    }

    public boolean atEnd() {
        return position >= lines.size();
    }

    /**
     * Sitúa el cursor en la primera línea de datos a partir de la posición actual
     * (incluida) saltando {@code skip} líneas de datos. A diferencia de
     * {@link #advance(List, int, int)}, el cursor también pasa por encima de las líneas en
     * blanco, que solo sirven para cerrar secciones.
     *
     * @return la nueva posición.
     * @throws MalformedRecordException si se alcanza el final del fichero.
     */
    public int seekData(int skip) {
        int i = peekData(skip);
        if (i == END_OF_SEQUENCE) {
            throw new MalformedRecordException(source, lines.size(),
                    "más líneas de datos", "fin de fichero");
        }
        this.position = i;
        return i;
    }

    /**
     * Como {@link #seekData(int)} pero contando las líneas en blanco como datos, igual que
     * {@link #advance(List, int, int)}. Sirve para saltar títulos, que pueden estar vacíos.
     */
    public int seekCountingBlanks(int skip) {
        int next = atEnd() ? END_OF_SEQUENCE : advance(lines, position, skip);
        if (next == END_OF_SEQUENCE) {
            throw new MalformedRecordException(source, lines.size(), "más líneas de datos", "fin de fichero");
        }
        this.position = next;
        return next;
    }

    /**
     * Posición que alcanzaría {@link #seekData(int)}, sin mover el cursor.
     *
     * @return índice de la línea de datos o {@link #END_OF_SEQUENCE}.
     */
    public int peekData(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("El número de líneas a saltar no puede ser negativo: " + skip);
        }
        int i = skipBreaks(position);
        for (int n = 0; n < skip && i < lines.size(); n++) {
            i = skipBreaks(i + 1);
        }
        return i < lines.size() ? i : END_OF_SEQUENCE;
    }

    private int skipBreaks(int index) {
        int i = index;
        while (i < lines.size() && isSectionBreak(lines.get(i))) {
            i++;
        }
        return i;
    }

    public int seekData() {
        return seekData(0);
    }

    /**
     * Avanza a la siguiente línea de datos posterior a la actual, saltando {@code skip}
     * líneas de datos más.
     */
    public int nextData(int skip) {
        position++;
        return seekData(skip);
    }

    public int nextData() {
        return nextData(0);
    }

    public String current() {
        if (atEnd()) {
            throw new MalformedRecordException(source, lines.size(), "una línea", "fin de fichero");
        }
        return lines.get(position);
    }

    public void setCurrent(String line) {
        lines.set(position, line);
    }

    public String[] tokens() {
        return FixedFormat.tokens(current());
    }

    public int intAt(int column) {
        return FixedFormat.parseInt(current(), column, source, lineNumber());
    }

    public double doubleAt(int column) {
        return FixedFormat.parseDouble(current(), column, source, lineNumber());
    }

    /**
     * Lee el contador entero de la primera columna de la línea actual.
     */
    public int count() {
        return intAt(0);
    }

    /**
     * Sustituye el contador de la primera columna de la línea actual.
     */
    public void replaceCount(int value) {
        setCurrent(FixedFormat.replaceFirstToken(current(), value));
    }

    /**
     * Sustituye el contador de la primera columna de una línea anterior (cabecera de
     * sección ya recorrida).
     */
    public void replaceCountAt(int index, int value) {
        lines.set(index, FixedFormat.replaceFirstToken(lines.get(index), value));
    }

    /**
     * Comprueba que el cursor está en el cierre de una sección (comentario, línea en blanco
     * o fin de fichero).
     *
     * @throws MalformedRecordException si aún hay registros de datos.
     */
    public void assertSectionEnd() {
        if (!atEnd() && !isSectionBreak(lines.get(position))) {
            throw new MalformedRecordException(source, lineNumber(),
                    "el final de la sección", lines.get(position));
        }
    }

    public MalformedRecordException malformed(String expected) {
        return new MalformedRecordException(source, lineNumber(), expected, atEnd() ? "fin de fichero" : current());
    }
}
