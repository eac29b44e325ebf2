package iwfmsubmodel.format;

import iwfmsubmodel.domain.exception.MalformedRecordException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Filtrado de secciones de registros de datos.
 * <p>
 * Una sección empieza en la primera línea de datos tras el cursor y termina en el primer
 * comentario o línea en blanco. Los registros conservados se construyen en una lista nueva
 * que después sustituye el tramo original, de modo que nunca se borra sobre la misma lista
 * que se está recorriendo.
 */
@Slf4j
public final class RecordFilter {

    private RecordFilter() {
    }

    /**
     * Longitud en líneas de un bloque de registro que empieza en {@code head}.
     */
    @FunctionalInterface
    public interface BlockLength {
        int at(List<String> lines, int head);
    }

    /**
     * Filtro de una sección cuyo tamaño fija un contador de cabecera: no debe leer más de
     * {@code limit} registros (o bloques), porque la sección siguiente puede empezar sin
     * comentario intermedio.
     */
    @FunctionalInterface
    public interface SectionFilter {
        SectionResult apply(LineCursor cursor, int limit);
    }

    /**
     * Bloque formado por una línea de cabecera y las líneas siguientes con menos columnas
     * (parámetros por capa: la primera capa lleva el identificador, el resto no).
     */
    public static final BlockLength LAYERED = (lines, head) -> {
        int width = FixedFormat.tokens(lines.get(head)).length;
        int i = head + 1;
        while (i < lines.size()
                && !LineCursor.isSectionBreak(lines.get(i))
                && FixedFormat.tokens(lines.get(i)).length < width) {
            i++;
        }
        return i - head;
    };

    /**
     * Filtra la sección que sigue a {@code index} conservando los registros cuya primera
     * columna está en {@code retained}. Modifica {@code lines}.
     * <p>
     * Si la primera clave es &lt;= 0 la sección no tiene registros por entidad: no se toca y
     * se devuelve la posición siguiente.
     *
     * @return índice de la línea que cierra la sección.
     */
    public static int filterById(List<String> lines, int index, Set<Integer> retained, int skip) {
        return filterById(lines, index, retained, skip, "<líneas>").end();
    }

    public static SectionResult filterById(List<String> lines, int index, Set<Integer> retained,
                                           int skip, String source) {
        return filterIdsFrom(lines, LineCursor.advance(lines, index, skip), retained, source);
    }

    /**
     * Versión con cursor de {@link #filterById(List, int, Set, int)}: deja el cursor en la
     * línea que cierra la sección.
     */
    public static SectionResult byId(LineCursor cursor, Set<Integer> retained, int skip) {
        return finish(cursor, filterIdsFrom(cursor.lines(), cursor.peekData(skip), retained, cursor.source()));
    }

    private static SectionResult filterIdsFrom(List<String> lines, int start, Set<Integer> retained, String source) {
        if (start == LineCursor.END_OF_SEQUENCE) {
            return new SectionResult(lines.size(), lines.size(), 0, 0, false);
        }
        if (!lines.get(start).isBlank()
                && FixedFormat.parseInt(lines.get(start), 0, source, start + 1) <= 0) {
            return new SectionResult(start, start + 1, 0, 0, true);
        }
        return retain(lines, start, source, tokens -> retained.contains(Integer.parseInt(tokens[0])), 0,
                Integer.MAX_VALUE);
    }

    /**
     * Conserva los registros cuya columna {@code column} está en {@code retained}.
     */
    public static SectionResult byColumn(LineCursor cursor, int column, Set<Integer> retained, int skip) {
        return byColumn(cursor, column, retained, skip, Integer.MAX_VALUE);
    }

    public static SectionResult byColumn(LineCursor cursor, int column, Set<Integer> retained, int skip,
                                         int limit) {
        int start = firstRecord(cursor, skip);
        if (start < 0) {
            return finish(cursor, new SectionResult(cursor.lines().size(), cursor.lines().size(), 0, 0, false));
        }
        return finish(cursor, retain(cursor.lines(), start, cursor.source(),
                tokens -> retained.contains(Integer.parseInt(tokens[column])), column, limit));
    }

    /**
     * Conserva los registros que cumplen el predicado sobre sus columnas.
     */
    public static SectionResult where(LineCursor cursor, int skip, Predicate<String[]> keep) {
        return where(cursor, skip, Integer.MAX_VALUE, keep);
    }

    public static SectionResult where(LineCursor cursor, int skip, int limit, Predicate<String[]> keep) {
        int start = firstRecord(cursor, skip);
        if (start < 0) {
            return finish(cursor, new SectionResult(cursor.lines().size(), cursor.lines().size(), 0, 0, false));
        }
        return finish(cursor, retain(cursor.lines(), start, cursor.source(), keep, -1, limit));
    }

    /**
     * Como {@link #byId(LineCursor, Set, int)} pero lee como máximo {@code count} registros,
     * para secciones cuyo tamaño fija un contador de cabecera y que no terminan en comentario.
     */
    public static SectionResult byIdCounted(LineCursor cursor, Set<Integer> retained, int skip, int count) {
        int start = firstRecord(cursor, skip);
        if (start < 0 || count <= 0) {
            int at = start < 0 ? cursor.lines().size() : start;
            return finish(cursor, new SectionResult(at, at, 0, 0, false));
        }
        return finish(cursor, retain(cursor.lines(), start, cursor.source(),
                tokens -> retained.contains(Integer.parseInt(tokens[0])), 0, count));
    }

    /**
     * Pone a 0 la columna {@code column} de cada registro cuyo valor positivo no está en
     * {@code retained}. No elimina líneas, así que la alineación de columnas se conserva.
     *
     * @return resultado en el que {@code kept} cuenta los valores que sobreviven.
     */
    public static SectionResult zeroMissing(LineCursor cursor, int column, Set<Integer> retained, int skip) {
        List<String> lines = cursor.lines();
        int start = firstRecord(cursor, skip);
        if (start < 0) {
            return finish(cursor, new SectionResult(lines.size(), lines.size(), 0, 0, false));
        }
        int i = start;
        int survivors = 0;
        while (i < lines.size() && !LineCursor.isSectionBreak(lines.get(i))) {
            int value = FixedFormat.parseInt(lines.get(i), column, cursor.source(), i + 1);
            if (value > 0 && !retained.contains(value)) {
                lines.set(i, FixedFormat.replaceToken(lines.get(i), column, "0"));
            } else if (value > 0) {
                survivors++;
            }
            i++;
        }
        return finish(cursor, new SectionResult(start, i, i - start, survivors, false));
    }

    /**
     * Filtra una sección de bloques multilínea. {@code transform} recibe las líneas de cada
     * bloque y devuelve las que lo sustituyen; una lista vacía elimina el bloque.
     */
    public static SectionResult blocks(LineCursor cursor, int skip, BlockLength length,
                                       Function<List<String>, List<String>> transform) {
        return blocks(cursor, skip, Integer.MAX_VALUE, length, transform);
    }

    /**
     * Como {@link #blocks(LineCursor, int, BlockLength, Function)} pero procesa como máximo
     * {@code limit} bloques.
     */
    public static SectionResult blocks(LineCursor cursor, int skip, int limit, BlockLength length,
                                       Function<List<String>, List<String>> transform) {
        List<String> lines = cursor.lines();
        int start = firstRecord(cursor, skip);
        if (start < 0) {
            return finish(cursor, new SectionResult(lines.size(), lines.size(), 0, 0, false));
        }
        List<String> rebuilt = new ArrayList<>();
        int i = start;
        int read = 0;
        int kept = 0;
        while (i < lines.size() && read < limit && !LineCursor.isSectionBreak(lines.get(i))) {
            int n = Math.max(1, length.at(lines, i));
            if (i + n > lines.size()) {
                throw new MalformedRecordException(cursor.source(), i + 1,
                        n + " líneas de bloque", lines.get(i));
            }
            List<String> replacement = transform.apply(new ArrayList<>(lines.subList(i, i + n)));
            read++;
            if (!replacement.isEmpty()) {
                kept++;
                rebuilt.addAll(replacement);
            }
            i += n;
        }
        int end = splice(lines, start, i, rebuilt);
        log.debug("{}: bloques leídos {}, conservados {}", cursor.source(), read, kept);
        return finish(cursor, new SectionResult(start, end, read, kept, false));
    }

    /**
     * Parámetros por capa indexados por el identificador de la primera línea del bloque.
     */
    public static SectionResult layeredById(LineCursor cursor, Set<Integer> retained, int skip) {
        String source = cursor.source();
        return blocks(cursor, skip, LAYERED, block -> {
            int key = FixedFormat.parseInt(block.get(0), 0, source, 0);
            return retained.contains(key) ? block : Collections.emptyList();
        });
    }

    /**
     * Grupos de elementos {@code ID NELEM IELEM [resto]} seguidos de NELEM-1 líneas
     * {@code IELEM [resto]}. Cada grupo se reduce a los elementos conservados, su contador se
     * actualiza y los grupos sin elementos desaparecen.
     */
    public static SectionResult elementGroups(LineCursor cursor, Set<Integer> retained, int skip) {
        return elementGroups(cursor, retained, skip, Integer.MAX_VALUE);
    }

    public static SectionResult elementGroups(LineCursor cursor, Set<Integer> retained, int skip, int limit) {
        String source = cursor.source();
        return blocks(cursor, skip, limit,
                (lines, head) -> FixedFormat.parseInt(lines.get(head), 1, source, head + 1),
                block -> reduceGroup(block, retained, source));
    }

    /**
     * Reduce un único grupo de elementos (véase {@link #elementGroups}).
     *
     * @return el grupo reducido, o una lista vacía si no queda ningún elemento.
     */
    public static List<String> reduceGroup(List<String> block, Set<Integer> retained, String source) {
        return reduceGroup(block, 1, retained, source);
    }

    /**
     * Reduce un grupo cuyo contador está en la columna {@code countColumn} de la cabecera y
     * cuya primera entrada empieza en la columna siguiente. Las líneas de continuación
     * empiezan por su entrada.
     */
    public static List<String> reduceGroup(List<String> block, int countColumn, Set<Integer> retained,
                                           String source) {
        String head = block.get(0);
        String[] headTokens = FixedFormat.tokens(head);
        if (FixedFormat.parseInt(head, countColumn, source, 0) <= 0) {
            return block;
        }
        List<String[]> entries = new ArrayList<>();
        entries.add(Arrays.copyOfRange(headTokens, countColumn + 1, headTokens.length));
        for (int i = 1; i < block.size(); i++) {
            entries.add(FixedFormat.tokens(block.get(i)));
        }
        List<Integer> keptIdx = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).length > 0 && retained.contains(Integer.parseInt(entries.get(i)[0]))) {
                keptIdx.add(i);
            }
        }
        if (keptIdx.isEmpty()) {
            return Collections.emptyList();
        }
        String newHead = FixedFormat.replaceToken(head, countColumn, String.valueOf(keptIdx.size()));
        if (keptIdx.get(0) != 0) {
            newHead = FixedFormat.replaceTail(newHead, countColumn + 1, entries.get(keptIdx.get(0)));
        }
        List<String> result = new ArrayList<>();
        result.add(newHead);
        for (int k = 1; k < keptIdx.size(); k++) {
            result.add(block.get(keptIdx.get(k)));
        }
        return result;
    }

    /**
     * Sección precedida por un contador en la línea actual del cursor y por
     * {@code headerLines} líneas de datos de cabecera (factores, ficheros de salida).
     * <p>
     * Si el contador es positivo el cursor se sitúa en el primer registro y se aplica
     * {@code filter} limitado a ese número de registros; después el contador se sustituye
     * por los registros conservados. Con contador 0 el cursor queda en la línea siguiente a
     * la cabecera.
     *
     * @throws MalformedRecordException si la sección tiene menos registros que su contador.
     */
    public static SectionResult counted(LineCursor cursor, int headerLines, SectionFilter filter) {
        int countIndex = cursor.position();
        int count = cursor.count();
        if (headerLines > 0) {
            cursor.nextData(headerLines - 1);
        }
        if (count <= 0) {
            int after = cursor.position() + 1;
            cursor.moveTo(Math.min(after, cursor.lines().size()));
            return new SectionResult(cursor.position(), cursor.position(), 0, 0, false);
        }
        cursor.nextData();
        SectionResult result = filter.apply(cursor, count);
        if (result.read() < count) {
            throw new MalformedRecordException(cursor.source(), countIndex + 1,
                    count + " registros", result.read() + " registros");
        }
        cursor.replaceCountAt(countIndex, result.kept());
        return result;
    }

    /**
     * Valores enteros de la columna {@code column} en las líneas conservadas de una sección
     * ya filtrada de registros de una línea.
     */
    public static Set<Integer> keys(LineCursor cursor, SectionResult result, int column) {
        Set<Integer> keys = new LinkedHashSet<>();
        for (int i = result.start(); i < result.end(); i++) {
            keys.add(FixedFormat.parseInt(cursor.lines().get(i), column, cursor.source(), i + 1));
        }
        return keys;
    }

    // --- internos ---

    private static int firstRecord(LineCursor cursor, int skip) {
        return cursor.peekData(skip);
    }

    private static SectionResult retain(List<String> lines, int start, String source,
                                        Predicate<String[]> keep, int keyColumn, int limit) {
        List<String> kept = new ArrayList<>();
        int i = start;
        while (i < lines.size() && i - start < limit && !LineCursor.isSectionBreak(lines.get(i))) {
            String line = lines.get(i);
            // valida la clave antes de evaluar el predicado
            FixedFormat.parseInt(line, Math.max(keyColumn, 0), source, i + 1);
            boolean keeps;
            try {
                keeps = keep.test(FixedFormat.tokens(line));
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                throw new MalformedRecordException(source, i + 1, "un registro numérico completo", line);
            }
            if (keeps) {
                kept.add(line);
            }
            i++;
        }
        int read = i - start;
        int end = splice(lines, start, i, kept);
        log.debug("{}: registros leídos {}, conservados {}", source, read, kept.size());
        return new SectionResult(start, end, read, kept.size(), false);
    }

    /**
     * Sustituye el tramo {@code [start, end)} por {@code replacement} de una sola vez.
     *
     * @return índice de la línea que sigue al tramo sustituido.
     */
    public static int splice(List<String> lines, int start, int end, List<String> replacement) {
        List<String> section = lines.subList(start, end);
        section.clear();
        lines.addAll(start, replacement);
        return start + replacement.size();
    }

    private static SectionResult finish(LineCursor cursor, SectionResult result) {
        cursor.moveTo(Math.min(result.end(), cursor.lines().size()));
        return result;
    }
}
