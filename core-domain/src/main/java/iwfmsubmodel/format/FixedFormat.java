package iwfmsubmodel.format;

import iwfmsubmodel.domain.exception.MalformedRecordException;

import java.util.Arrays;
import java.util.Optional;

/**
 * Utilidades para manipular campos de los ficheros de formato fijo sin romper
 * la disposición de columnas que esperan los lectores del modelo.
 * <p>
 * Los campos se delimitan por espacios en blanco. Un campo de nombre de fichero que
 * empieza por {@code /} significa "sin fichero"; lo que sigue a la barra es la
 * etiqueta descriptiva del campo.
 */
public final class FixedFormat {

    /** Sangría de los campos de nombre de fichero. */
    public static final int NAME_INDENT = 4;
    /** Anchura total del campo de nombre de fichero, sangría incluida. */
    public static final int NAME_WIDTH = 53;

    private static final String[] NO_TOKENS = new String[0];

    private FixedFormat() {
    }

    /**
     * Divide una línea en tokens separados por espacios o tabuladores.
     * Una línea en blanco devuelve un array vacío.
     */
    public static String[] tokens(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return NO_TOKENS;
        }
        return trimmed.split("\\s+");
    }

    /**
     * Sustituye el token de la columna indicada manteniendo el resto de la línea intacto.
     * El nuevo valor se alinea a la derecha dentro del hueco que ocupaba el antiguo; si no
     * cabe, la línea se ensancha.
     *
     * @param line   línea original.
     * @param column índice del token, empezando en 0.
     * @param value  nuevo texto del campo.
     * @return la línea modificada.
     * @throws IllegalArgumentException si la línea no tiene tantas columnas.
     */
    public static String replaceToken(String line, int column, String value) {
        int[] span = tokenSpan(line, column);
        if (span == null) {
            throw new IllegalArgumentException(
                    "La línea no tiene columna " + column + ": '" + line + "'");
        }
        int width = span[1] - span[0];
        String field = value.length() >= width ? value : " ".repeat(width - value.length()) + value;
        return line.substring(0, span[0]) + field + line.substring(span[1]);
    }

    /**
     * Sustituye el primer token (típicamente un contador de registros de una cabecera).
     */
    public static String replaceFirstToken(String line, int value) {
        return replaceToken(line, 0, String.valueOf(value));
    }

    /**
     * Sustituye todos los tokens a partir de {@code fromColumn} por los indicados,
     * separados por un tabulador. El prefijo de la línea se conserva tal cual.
     */
    public static String replaceTail(String line, int fromColumn, String[] newTokens) {
        int[] span = tokenSpan(line, fromColumn);
        String prefix = span == null ? line.stripTrailing() + "\t" : line.substring(0, span[0]);
        return prefix + String.join("\t", newTokens);
    }

    /**
     * Sangra el texto {@code front} espacios y lo rellena por la derecha hasta {@code width}.
     */
    public static String padBoth(String text, int front, int width) {
        String indented = " ".repeat(front) + text;
        if (indented.length() >= width) {
            return indented + " ";
        }
        return indented + " ".repeat(width - indented.length());
    }

    /**
     * Reescribe un campo de nombre de fichero conservando la etiqueta {@code / LABEL}.
     */
    public static String withFileName(String line, String fileName) {
        String label = label(line);
        return padBoth(fileName, NAME_INDENT, NAME_WIDTH) + (label.isEmpty() ? "" : "/ " + label);
    }

    /**
     * Deja vacío un campo de nombre de fichero. El resultado se lee como "sin fichero".
     */
    public static String blankFileName(String line) {
        return padBoth("", NAME_INDENT, NAME_WIDTH) + "/ " + label(line);
    }

    /**
     * Nombre de fichero del primer campo, o vacío si el campo empieza por {@code /}.
     */
    public static Optional<String> fileName(String line) {
        String[] tokens = tokens(line);
        if (tokens.length == 0 || tokens[0].startsWith("/")) {
            return Optional.empty();
        }
        return Optional.of(tokens[0]);
    }

    /**
     * Etiqueta descriptiva del campo: lo que sigue a la barra, sin ella.
     */
    static String label(String line) {
        String[] tokens = tokens(line);
        if (tokens.length == 0) {
            return "";
        }
        int from = tokens[0].startsWith("/") ? 0 : 1;
        String joined = String.join(" ", Arrays.copyOfRange(tokens, from, tokens.length));
        return joined.startsWith("/") ? joined.substring(1).strip() : joined;
    }

    /**
     * Interpreta un token como entero.
     *
     * @throws MalformedRecordException con fichero, línea y forma esperada si no es numérico
     *                                  o falta la columna.
     */
    public static int parseInt(String line, int column, String source, int lineNumber) {
        String[] tokens = tokens(line);
        if (column >= tokens.length) {
            throw new MalformedRecordException(source, lineNumber,
                    "al menos " + (column + 1) + " columnas", line);
        }
        try {
            return Integer.parseInt(tokens[column]);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(source, lineNumber,
                    "un entero en la columna " + (column + 1), line);
        }
    }

    /**
     * Interpreta un token como número real. Admite el exponente {@code D} de Fortran.
     */
    public static double parseDouble(String line, int column, String source, int lineNumber) {
        String[] tokens = tokens(line);
        if (column >= tokens.length) {
            throw new MalformedRecordException(source, lineNumber,
                    "al menos " + (column + 1) + " columnas", line);
        }
        try {
            return toDouble(tokens[column]);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(source, lineNumber,
                    "un número real en la columna " + (column + 1), line);
        }
    }

    /**
     * Convierte un token ya separado, admitiendo el exponente {@code D}.
     *
     * @throws NumberFormatException si no es numérico.
     */
    public static double toDouble(String token) {
        return Double.parseDouble(token.replace('D', 'E').replace('d', 'e'));
    }

    /**
     * Posición [inicio, fin) del token {@code column} dentro de la línea, o {@code null}.
     */
    static int[] tokenSpan(String line, int column) {
        int i = 0;
        int n = line.length();
        int current = -1;
        while (i < n) {
            while (i < n && Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            if (i >= n) {
                break;
            }
            int start = i;
            while (i < n && !Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            current++;
            if (current == column) {
                return new int[]{start, i};
            }
        }
        return null;
    }
}
