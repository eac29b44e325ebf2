package iwfmsubmodel.format;

import iwfmsubmodel.domain.exception.MalformedRecordException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas unitarias para {@link FixedFormat}.
 */
class FixedFormatTest {

    @Test
    @DisplayName("tokens separa por espacios y tabuladores")
    void tokens_shouldSplitOnWhitespace() {
        assertArrayEquals(new String[]{"1", "2", "3"}, FixedFormat.tokens("  1\t2   3 "));
        assertEquals(0, FixedFormat.tokens("   ").length);
    }

    @Test
    @DisplayName("replaceToken alinea el valor nuevo a la derecha del hueco original")
    void replaceToken_shouldRightAlignWithinOldSpan() {
        assertEquals("   12     7  abc", FixedFormat.replaceToken("   12   345  abc", 1, "7"));
        assertEquals("100 2", FixedFormat.replaceToken("1 2", 0, "100"));
        assertThrows(IllegalArgumentException.class, () -> FixedFormat.replaceToken("1 2", 5, "0"));
    }

    @Test
    @DisplayName("replaceTail sustituye las columnas finales")
    void replaceTail_shouldReplaceTrailingColumns() {
        assertEquals("1  3  9\t0.25", FixedFormat.replaceTail("1  3  7  0.5", 2, new String[]{"9", "0.25"}));
    }

    @Test
    @DisplayName("Los campos de fichero conservan su etiqueta al redirigirse o vaciarse")
    void fileNameFields_shouldKeepLabel() {
        String line = "   ..\\Preprocessor\\Nodes.dat          / NODFL";

        assertEquals("..\\Preprocessor\\Nodes.dat", FixedFormat.fileName(line).orElseThrow());

        String redirected = FixedFormat.withFileName(line, "Sub_Nodes.dat");
        assertTrue(redirected.startsWith("    Sub_Nodes.dat"));
        assertEquals(FixedFormat.NAME_WIDTH, redirected.indexOf("/ NODFL"));

        String blank = FixedFormat.blankFileName(line);
        assertTrue(FixedFormat.fileName(blank).isEmpty());
        assertThat(blank).endsWith("/ NODFL");
    }

    @Test
    @DisplayName("parseDouble admite el exponente D de Fortran")
    void parseDouble_shouldAcceptFortranExponent() {
        assertEquals(150.0, FixedFormat.parseDouble("1.5D2 x", 0, "f.dat", 1), 1e-9);
        assertEquals(0.0025, FixedFormat.toDouble("2.5d-3"), 1e-12);
    }

    @Test
    @DisplayName("parseInt informa del fichero, la línea y la forma esperada")
    void parseInt_shouldDescribeMalformedRecord() {
        MalformedRecordException notNumeric = assertThrows(MalformedRecordException.class,
                () -> FixedFormat.parseInt("abc 2", 0, "Elements.dat", 14));
        MalformedRecordException missing = assertThrows(MalformedRecordException.class,
                () -> FixedFormat.parseInt("1 2", 4, "Elements.dat", 15));

        assertEquals(14, notNumeric.getLineNumber());
        assertThat(notNumeric.getMessage()).contains("Elements.dat").contains("abc 2");
        assertThat(missing.getExpected()).contains("5 columnas");
    }
}
