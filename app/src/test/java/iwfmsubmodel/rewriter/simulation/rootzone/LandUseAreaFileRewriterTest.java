package iwfmsubmodel.rewriter.simulation.rootzone;

import iwfmsubmodel.domain.exception.MissingInputFileException;
import iwfmsubmodel.io.ModelFileHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LandUseAreaFileRewriterTest {

    private static final String AREAS = """
            C  Superficies de cultivos no inundados
                2                  / NSPLU
                1                  / NFQLU
                1.0                / FACTLN
                                   / DSSFL
            C  Serie temporal
            10/31/1990_24:00    1    10.0    5.0
                                2    20.0    5.0
                                3    30.0    5.0
            09/30/1991_24:00    1    11.0    6.0
                                2    21.0    6.0
                                3    31.0    6.0
            """;

    @TempDir
    Path tempDir;

    private LandUseAreaFileRewriter rewriter;

    @BeforeEach
    void setUp() {
        rewriter = new LandUseAreaFileRewriter(new ModelFileHandler());
    }

    @Test
    @DisplayName("Si se elimina la fila con fecha, la fecha pasa a la primera fila conservada del bloque")
    void rewrite_shouldMoveDateToFirstKeptRow() throws IOException {
        // --- 1. Arrange ---
        Path source = Files.writeString(tempDir.resolve("NPArea.dat"), AREAS);
        Path target = tempDir.resolve("Sub_NPArea.dat");

        // --- 2. Act ---
        rewriter.rewrite(source, target, Set.of(2, 3));

        // --- 3. Assert ---
        List<String> lines = Files.readAllLines(target);
        assertThat(lines).contains(
                "10/31/1990_24:00\t2\t20.0\t5.0",
                "                    3    30.0    5.0",
                "09/30/1991_24:00\t2\t21.0\t6.0",
                "                    3    31.0    6.0");
        assertThat(lines).noneMatch(l -> l.contains("    1    10.0") || l.contains("    1    11.0"));
        assertThat(lines).contains("    2                  / NSPLU", "C  Serie temporal");
    }

    @Test
    @DisplayName("Las filas con fecha de elementos conservados se copian tal cual")
    void rewrite_shouldKeepDatedRowOfRetainedElement() throws IOException {
        // --- 1. Arrange ---
        Path source = Files.writeString(tempDir.resolve("NPArea.dat"), AREAS);
        Path target = tempDir.resolve("Sub_NPArea.dat");

        // --- 2. Act ---
        rewriter.rewrite(source, target, Set.of(1));

        // --- 3. Assert ---
        List<String> lines = Files.readAllLines(target);
        assertThat(lines).contains(
                "10/31/1990_24:00    1    10.0    5.0",
                "09/30/1991_24:00    1    11.0    6.0");
        assertThat(lines).noneMatch(l -> l.contains("20.0") || l.contains("31.0"));
    }

    @Test
    @DisplayName("Un fichero de superficies inexistente se notifica como entrada ausente")
    void rewrite_withMissingSource_shouldThrow() {
        Path source = tempDir.resolve("NoExiste.dat");

        assertThrows(MissingInputFileException.class,
                () -> rewriter.rewrite(source, tempDir.resolve("Sub.dat"), Set.of(1)));
    }
}
