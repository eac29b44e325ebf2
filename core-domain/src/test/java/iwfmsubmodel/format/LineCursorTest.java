package iwfmsubmodel.format;

import iwfmsubmodel.domain.exception.MalformedRecordException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas unitarias para {@link LineCursor}.
 */
class LineCursorTest {

    private static final Logger log = LoggerFactory.getLogger(LineCursorTest.class);

    private static List<String> sample() {
        return new ArrayList<>(List.of(
                "C cabecera",
                "* otra cabecera",
                "    10                / NREC",
                "C intermedio",
                "1 a",
                "",
                "2 b",
                "#fin"));
    }

    @Test
    @DisplayName("advance salta comentarios y cuenta las líneas en blanco como datos")
    void advance_shouldSkipCommentsAndCountBlankLines() {
        List<String> lines = sample();

        assertEquals(2, LineCursor.advance(lines, 0, 0));
        assertEquals(4, LineCursor.advance(lines, 0, 1), "Debe pasar por encima del comentario intercalado.");
        assertEquals(5, LineCursor.advance(lines, 0, 2), "La línea en blanco es una línea de datos.");
        assertEquals(6, LineCursor.advance(lines, 0, 3));
        assertEquals(4, LineCursor.advance(lines, 3, 0));
    }

    @Test
    @DisplayName("advance devuelve el centinela al sobrepasar la última línea")
    void advance_pastEnd_shouldReturnSentinel() {
        List<String> lines = sample();

        assertEquals(LineCursor.END_OF_SEQUENCE, LineCursor.advance(lines, 0, 4));
        assertEquals(LineCursor.END_OF_SEQUENCE, LineCursor.advance(lines, 7, 0));
        assertEquals(LineCursor.END_OF_SEQUENCE, LineCursor.advance(lines, 8, 0));
    }

    @Test
    @DisplayName("advance rechaza índices y saltos negativos")
    void advance_negativeArguments_shouldFailFast() {
        List<String> lines = sample();

        IllegalArgumentException index = assertThrows(IllegalArgumentException.class,
                () -> LineCursor.advance(lines, -1, 0));
        IllegalArgumentException skip = assertThrows(IllegalArgumentException.class,
                () -> LineCursor.advance(lines, 0, -2));

        assertThat(index.getMessage()).contains("-1");
        assertThat(skip.getMessage()).contains("-2");
    }

    @Test
    @DisplayName("El cursor pasa por encima de las líneas en blanco al buscar datos")
    void cursor_shouldNavigateDataLines() {
        // --- 1. Arrange ---
        LineCursor cursor = LineCursor.over(sample(), "muestra.dat");

        // --- 2. Act & 3. Assert ---
        assertEquals(2, cursor.seekData());
        assertEquals(10, cursor.count());
        assertEquals(4, cursor.peekData(1), "peekData no debe mover el cursor.");
        assertEquals(2, cursor.position());

        assertEquals(4, cursor.nextData());
        assertEquals(6, cursor.nextData(), "nextData salta la línea en blanco.");
        assertArrayEquals(new String[]{"2", "b"}, cursor.tokens());
        assertEquals(LineCursor.END_OF_SEQUENCE, cursor.peekData(1));
        log.debug("Cursor en la línea {}", cursor.lineNumber());
    }

    @Test
    @DisplayName("seekCountingBlanks trata las líneas en blanco como títulos")
    void seekCountingBlanks_shouldStopOnBlankLine() {
        LineCursor cursor = LineCursor.over(sample(), "muestra.dat");
        cursor.moveTo(4);

        assertEquals(5, cursor.seekCountingBlanks(1));
        assertTrue(cursor.current().isEmpty());
    }

    @Test
    @DisplayName("replaceCount conserva la anchura del campo")
    void replaceCount_shouldKeepColumnLayout() {
        List<String> lines = sample();
        LineCursor cursor = LineCursor.over(lines, "muestra.dat");
        cursor.seekData();
        String before = cursor.current();

        cursor.replaceCount(3);

        assertEquals(before.length(), lines.get(2).length());
        assertEquals("3", FixedFormat.tokens(lines.get(2))[0]);
        assertTrue(lines.get(2).endsWith("/ NREC"));
    }

    @Test
    @DisplayName("assertSectionEnd falla si quedan registros en la sección")
    void assertSectionEnd_shouldRejectDataLine() {
        LineCursor cursor = LineCursor.over(sample(), "muestra.dat");
        cursor.moveTo(3);
        assertDoesNotThrow(cursor::assertSectionEnd);

        cursor.moveTo(4);
        MalformedRecordException ex = assertThrows(MalformedRecordException.class, cursor::assertSectionEnd);
        assertEquals("muestra.dat", ex.getSource());
        assertEquals(5, ex.getLineNumber());
    }

    @Test
    @DisplayName("Buscar datos más allá del final del fichero es un registro mal formado")
    void seekData_pastEnd_shouldThrow() {
        LineCursor cursor = LineCursor.over(sample(), "muestra.dat");
        cursor.moveTo(6);

        MalformedRecordException ex = assertThrows(MalformedRecordException.class, () -> cursor.nextData());

        assertThat(ex.getMessage()).contains("muestra.dat").contains("fin de fichero");
    }
}
