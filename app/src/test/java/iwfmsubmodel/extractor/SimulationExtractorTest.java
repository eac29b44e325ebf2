package iwfmsubmodel.extractor;

import iwfmsubmodel.config.ExtractionConfig;
import iwfmsubmodel.domain.exception.ArtifactException;
import iwfmsubmodel.domain.exception.UnsupportedFormatVersionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SimulationExtractorTest {

    private static final Logger log = LoggerFactory.getLogger(SimulationExtractorTest.class);

    @TempDir
    Path tempDir;

    private Path modelDir;
    private Path simulationMain;
    private ExtractionConfig config;
    private SimulationExtractor extractor;

    @BeforeEach
    void setUp() {
        modelDir = tempDir.resolve("model");
        Path manifest = SampleModel.writePreprocessor(modelDir);
        simulationMain = SampleModel.writeSimulation(modelDir);
        config = ExtractionConfig.builder()
                .outputBase(tempDir.resolve("out").resolve("Sub"))
                .elementPairsFile(modelDir.resolve("pairs.txt"))
                .build();
        new PreprocessorExtractor().extract(manifest, config);
        extractor = new SimulationExtractor();
    }

    /** Primer token de la línea de cabecera con la etiqueta indicada. */
    private static String header(Path file, String label) {
        return SampleModel.dataLines(file).stream()
                .filter(line -> line.endsWith("/ " + label))
                .findFirst()
                .map(line -> line.split("\\s+")[0])
                .orElseThrow(() -> new AssertionError("sin cabecera " + label + " en " + file));
    }

    private String absolute(String name) {
        return modelDir.resolve(name).toAbsolutePath().normalize().toString();
    }

    private List<String> lines(String component) throws IOException {
        return Files.readAllLines(config.componentFile(component));
    }

    @Test
    @DisplayName("El fichero principal apunta a los componentes del submodelo y reubica las series")
    void extract_shouldRewriteMainFile() throws IOException {
        // --- 1. Arrange & 2. Act ---
        SimulationExtraction extraction = extractor.extract(simulationMain, config);

        // --- 3. Assert ---
        Path main = config.outputFile("_Simulation.in");
        assertEquals(main, extraction.files().getMainFile());
        assertThat(Files.readString(main))
                .contains("    Sub_Preprocessor.bin", "    Sub_Groundwater.dat", "    Sub_Streams.dat",
                        "    Sub_RootZone.dat", "    Sub_SmallWatersheds.dat", "    Sub_Unsat.dat")
                .contains(absolute("LakeSim.dat"), absolute("IrigFrac.dat"), absolute("Precip.dat"),
                        absolute("ET.dat"))
                .contains("/ 9: SUPPLYADJ", "10/01/1990_24:00");
        assertEquals(Set.of(1, 2), extraction.selection().retainedElements());
    }

    @Test
    @DisplayName("El acuífero conserva hidrogramas, flujos, parámetros y niveles de los nodos del submodelo")
    void extract_shouldFilterGroundwater() throws IOException {
        // --- 1. Arrange & 2. Act ---
        extractor.extract(simulationMain, config);

        // --- 3. Assert ---
        Path groundwater = config.componentFile("Groundwater");
        List<String> lines = Files.readAllLines(groundwater);
        assertThat(String.join("\n", lines))
                .contains("Sub_BC.dat", "Sub_TileDrain.dat", "Sub_Pumping.dat", "Sub_Subsidence.dat")
                .contains("Hyd_Node5", "Hyd_XY_In", "Face1_2")
                .doesNotContain("Hyd_Node8", "Hyd_XY_Out", "Face5_8");
        assertEquals("2", header(groundwater, "NOUTH"));
        assertEquals("1", header(groundwater, "NOUTF"));
        assertEquals("1", header(groundwater, "NEBK"));

        assertThat(lines).contains("    6   10.0   1e-6   0.1   0.01   0.5", "    6   100.0   90.0",
                "    1    1    0.5");
        assertThat(lines).noneMatch(l -> l.startsWith("    7   ") || l.startsWith("    9   "));
        assertThat(lines).doesNotContain("    2    3    0.5");
        // segunda capa de cada nodo conservado
        assertEquals(6, lines.stream().filter(l -> l.equals("         10.0   1e-6   0.1   0.01   0.5")).count());
    }

    @Test
    @DisplayName("Las condiciones de contorno y los drenes se reducen a los nodos del submodelo")
    void extract_shouldFilterBoundaryConditionsAndDrains() throws IOException {
        // --- 1. Arrange & 2. Act ---
        extractor.extract(simulationMain, config);

        // --- 3. Assert ---
        Path bc = config.componentFile("BC");
        assertThat(Files.readString(bc))
                .contains("Sub_SpecFlowBC.dat", absolute("BCTS.dat"), "BC3")
                .doesNotContain("BC9");
        assertEquals("1", header(bc, "NOUTB"));

        Path specifiedFlow = config.componentFile("SpecFlowBC");
        assertEquals("2", header(specifiedFlow, "NQB"));
        assertEquals(List.of("3", "6"), SampleModel.recordKeys(specifiedFlow));
        assertFalse(Files.exists(config.componentFile("SpecHeadBC")));

        Path drains = config.componentFile("TileDrain");
        assertThat(Files.readAllLines(drains)).contains("    1    2    10.0    1.0    0    0");
        assertEquals("1", header(drains, "NTD"));
        assertEquals("0", header(drains, "NSI"));
        assertEquals("1", header(drains, "NOUTTD"));
        assertThat(Files.readString(drains)).contains("Drain1").doesNotContain("SubIrr1");
    }

    @Test
    @DisplayName("Pozos, bombeo por elemento y subsidencia se reducen al submodelo")
    void extract_shouldFilterPumpingAndSubsidence() throws IOException {
        // --- 1. Arrange & 2. Act ---
        extractor.extract(simulationMain, config);

        // --- 3. Assert ---
        assertThat(Files.readString(config.componentFile("Pumping")))
                .contains("Sub_WellSpec.dat", "Sub_ElemPump.dat", absolute("PumpRates.dat"));

        Path wells = config.componentFile("WellSpec");
        assertEquals("1", header(wells, "NWELL"));
        assertThat(Files.readString(wells)).contains("Well1").doesNotContain("Well2");
        assertThat(SampleModel.dataLines(wells)).noneMatch(l -> l.startsWith("2    2    1.0"));
        assertThat(Files.readAllLines(wells)).contains("    1    1    1");

        Path sinks = config.componentFile("ElemPump");
        assertEquals("1", header(sinks, "NSINK"));
        assertThat(SampleModel.dataLines(sinks)).noneMatch(l -> l.startsWith("4    2"));

        Path subsidence = config.componentFile("Subsidence");
        assertEquals("0", header(subsidence, "NOUTS"));
        assertThat(Files.readString(subsidence)).doesNotContain("Subs9");
        assertEquals(List.of("1", "2", "3", "4", "5", "6"), SampleModel.recordKeys(subsidence));
    }

    @Test
    @DisplayName("Los ríos conservan solo los nodos supervivientes y las derivaciones con origen en ellos")
    void extract_shouldFilterStreams() throws IOException {
        // --- 1. Arrange & 2. Act ---
        SimulationExtraction extraction = extractor.extract(simulationMain, config);

        // --- 3. Assert ---
        assertNotNull(extraction.files().getStreamFile());
        Path streams = config.componentFile("Streams");
        assertThat(Files.readString(streams))
                .contains("Sub_StreamInflow.dat", "Sub_Bypass.dat", "Hyd1")
                .doesNotContain("Hyd4");
        assertEquals("1", header(streams, "NOUTR"));
        assertEquals("1", header(streams, "NBUDR"));
        assertThat(SampleModel.dataLines(streams)).contains("2").doesNotContain("3");
        assertEquals(List.of("1", "2", "5"), SampleModel.recordKeys(streams).subList(2, 5));

        assertThat(lines("StreamInflow")).containsSubsequence("    1", "    0", "    5")
                .doesNotContain("    3");

        List<String> bypass = lines("Bypass");
        assertThat(bypass)
                .contains("    1    2    0    0    -2    0.1    0.0    Bypass1", "    1    1    2    0.5")
                .doesNotContain("    2    1    4    1.0", "                          3    0.5");
        assertThat(String.join("\n", bypass)).doesNotContain("Bypass2");
        assertEquals("1", header(config.componentFile("Bypass"), "NDIVS"));
    }

    @Test
    @DisplayName("La zona radicular filtra suelos, usos del suelo y superficies por elemento")
    void extract_shouldFilterRootZone() throws IOException {
        // --- 1. Arrange & 2. Act ---
        extractor.extract(simulationMain, config);

        // --- 3. Assert ---
        List<String> rootZone = lines("RootZone");
        assertThat(rootZone)
                .contains("    1   0.1   0.3   0.4   0.5   1.0   -1   2   0.0   1   0   3",
                        "    2   0.1   0.3   0.4   0.5   1.0   -1   2   0.0   1   1   1")
                .noneMatch(l -> l.startsWith("    3   0.1") || l.startsWith("    4   0.1"));
        assertThat(String.join("\n", rootZone))
                .contains("Sub_NonPondedCrops.dat", "Sub_Urban.dat", absolute("ReturnFlow.dat"));

        List<String> crops = lines("NonPondedCrops");
        assertThat(String.join("\n", crops)).contains("Sub_NPArea.dat", absolute("MinSM.dat"));
        assertEquals(9, crops.stream().filter(l -> l.equals("    1   1   2")).count());
        assertThat(crops).noneMatch(l -> l.startsWith("    3   1") || l.startsWith("    4   1"));

        assertThat(lines("NPArea"))
                .contains("    10/01/1990_24:00    1    10.0    20.0", "10/01/1991_24:00\t1\t11.0\t21.0")
                .noneMatch(l -> l.contains("    3    1"));

        List<String> urban = lines("Urban");
        assertEquals(2, urban.stream().filter(l -> l.equals("    1   0.3   60   1")).count());
        assertThat(String.join("\n", urban)).contains("Sub_UrbanArea.dat", absolute("UrbDemand.dat"));

        for (String absent : List.of("PondedCrops", "NativeVeg", "PCArea", "NVArea")) {
            assertFalse(Files.exists(config.componentFile(absent)), absent);
        }
    }

    @Test
    @DisplayName("Pequeñas cuencas y zona no saturada se reducen al submodelo")
    void extract_shouldFilterSmallWatershedsAndUnsaturatedZone() throws IOException {
        // --- 1. Arrange & 2. Act ---
        extractor.extract(simulationMain, config);

        // --- 3. Assert ---
        Path watersheds = config.componentFile("SmallWatersheds");
        assertThat(Files.readAllLines(watersheds)).contains("    1   100.0    0    1    2\t0.0");
        assertEquals("1", header(watersheds, "NSW"));
        assertThat(SampleModel.dataLines(watersheds)).noneMatch(l -> l.startsWith("2 "));

        assertEquals(List.of("1", "2"), SampleModel.recordKeys(config.componentFile("Unsat")));
    }

    @Test
    @DisplayName("Sin reubicación las referencias que se copian sin filtrar mantienen su nombre relativo")
    void extract_withoutRelocation_shouldKeepRelativeNames() throws IOException {
        // --- 1. Arrange ---
        ExtractionConfig relative = config.withRelocatePassThrough(false);

        // --- 2. Act ---
        extractor.extract(simulationMain, relative);

        // --- 3. Assert ---
        String main = Files.readString(relative.outputFile("_Simulation.in"));
        assertThat(main).contains("    Precip.dat", "    LakeSim.dat").doesNotContain(absolute("Precip.dat"));
    }

    @Test
    @DisplayName("Con la selección en memoria no hacen falta los artefactos")
    void extract_withSelection_shouldNotNeedArtifacts() {
        // --- 1. Arrange ---
        ExtractionConfig other = config.withOutputBase(tempDir.resolve("other").resolve("Sub"))
                .withPersistArtifacts(false);
        PreprocessorExtraction preprocessor = new PreprocessorExtractor()
                .extract(modelDir.resolve("Preprocessor.in"), other);

        // --- 2. Act ---
        SimulationExtraction extraction = extractor.extract(simulationMain, preprocessor.selection(), other);

        // --- 3. Assert ---
        assertTrue(Files.exists(other.componentFile("Groundwater")));
        assertEquals(preprocessor.selection(), extraction.selection());
        log.info("Simulación extraída sin artefactos en {}", other.getOutputBase());
    }

    @Test
    @DisplayName("Sin artefactos de una extracción previa la simulación no puede extraerse")
    void extract_withoutArtifacts_shouldThrow() {
        // --- 1. Arrange ---
        ExtractionConfig missing = config.withOutputBase(tempDir.resolve("empty").resolve("Sub"));

        // --- 2. Act & 3. Assert ---
        assertThrows(ArtifactException.class, () -> extractor.extract(simulationMain, missing));
    }

    @Test
    @DisplayName("Los parámetros de acuífero por malla paramétrica se rechazan")
    void extract_withParametricGrid_shouldThrow() throws IOException {
        // --- 1. Arrange ---
        Files.writeString(modelDir.resolve("Groundwater.dat"), SampleModel.GROUNDWATER.replace(
                "    0                                       / NGROUP",
                "    2                                       / NGROUP"));

        // --- 2. Act & 3. Assert ---
        UnsupportedFormatVersionException ex = assertThrows(UnsupportedFormatVersionException.class,
                () -> extractor.extract(simulationMain, config));
        assertEquals("NGROUP=2", ex.getVersion());
    }

    @Test
    @DisplayName("Con todos los elementos seleccionados los ficheros sin nombres de fichero conservan sus datos")
    void extract_withAllElements_shouldReproduceInputData() throws IOException {
        // --- 1. Arrange ---
        Files.writeString(modelDir.resolve("pairs.txt"), "1 1 1\n2 2 1\n3 3 2\n4 4 2\n");
        ExtractionConfig full = ExtractionConfig.builder()
                .outputBase(tempDir.resolve("full").resolve("Sub"))
                .elementPairsFile(modelDir.resolve("pairs.txt"))
                .build();
        new PreprocessorExtractor().extract(modelDir.resolve("Preprocessor.in"), full);

        // --- 2. Act ---
        extractor.extract(simulationMain, full);

        // --- 3. Assert ---
        for (String component : List.of("SpecFlowBC", "ElemPump", "StreamInflow", "Bypass")) {
            assertEquals(PreprocessorExtractorTest.tokens(modelDir.resolve(component + ".dat")),
                    PreprocessorExtractorTest.tokens(full.componentFile(component)), component);
        }
    }
}
