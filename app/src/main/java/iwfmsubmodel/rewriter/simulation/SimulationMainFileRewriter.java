package iwfmsubmodel.rewriter.simulation;

import iwfmsubmodel.config.SimulationFiles;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.ChildReference;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Fichero principal de la simulación.
 * <p>
 * Tras tres líneas de título nombra la salida binaria del preprocesador y los ficheros de
 * acuífero, ríos, lagos, zona radicular, pequeñas cuencas y zona no saturada. Le siguen
 * cuatro series que se copian sin filtrar (fracciones de riego, ajuste de suministro,
 * precipitación y evapotranspiración).
 */
@Slf4j
public class SimulationMainFileRewriter extends AbstractSimulationRewriter {

    private static final int TITLE_LINES = 3;
    private static final int PASS_THROUGH_LINES = 4;

    public SimulationMainFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "principal de la simulación";
    }

    /**
     * Lee los ficheros que nombra el fichero principal. Acuífero, pequeñas cuencas y zona no
     * saturada son obligatorios.
     */
    public SimulationFiles readManifest(Path mainFile) {
        ModelFileHandler.requireExists(mainFile, componentName());
        List<String> lines = files.read(mainFile);
        LineCursor cursor = LineCursor.over(lines, mainFile.getFileName().toString());
        Path directory = directoryOf(mainFile);

        cursor.seekCountingBlanks(TITLE_LINES);
        Path binary = FixedFormat.fileName(cursor.current())
                .map(name -> directory.resolve(name.replace('\\', '/')).normalize())
                .orElse(null);
        cursor.nextData();
        Path groundwater = ChildReference.resolve(cursor, directory, "de acuífero")
                .orElseThrow(() -> cursor.malformed("el fichero de acuífero"));
        cursor.nextData();
        Path streams = ChildReference.resolve(cursor, directory, "de ríos").orElse(null);
        cursor.nextData();
        Path lakes = ChildReference.resolve(cursor, directory, "de lagos").orElse(null);
        cursor.nextData();
        Path rootZone = ChildReference.resolve(cursor, directory, "de zona radicular").orElse(null);
        cursor.nextData();
        Path smallWatersheds = ChildReference.resolve(cursor, directory, "de pequeñas cuencas")
                .orElseThrow(() -> cursor.malformed("el fichero de pequeñas cuencas"));
        cursor.nextData();
        Path unsaturated = ChildReference.resolve(cursor, directory, "de zona no saturada")
                .orElseThrow(() -> cursor.malformed("el fichero de zona no saturada"));

        return SimulationFiles.builder()
                .mainFile(mainFile)
                .preprocessorBinary(binary)
                .groundwaterFile(groundwater)
                .streamFile(streams)
                .lakeFile(lakes)
                .rootZoneFile(rootZone)
                .smallWatershedFile(smallWatersheds)
                .unsaturatedZoneFile(unsaturated)
                .build();
    }

    /**
     * Escribe el fichero principal del submodelo. Los componentes ausentes en
     * {@code submodel} se dejan en blanco; el de lagos se mantiene apuntando al original
     * mientras quede algún lago.
     */
    public void rewrite(Path source, SimulationFiles submodel, SimulationContext context) {
        rewriteFile(source, submodel.getMainFile(), cursor -> {
            cursor.seekCountingBlanks(TITLE_LINES);
            ChildReference.redirect(cursor, submodel.getPreprocessorBinary());
            cursor.nextData();
            ChildReference.redirect(cursor, submodel.getGroundwaterFile());
            cursor.nextData();
            redirectOrBlank(cursor, submodel.getStreamFile());
            cursor.nextData();
            if (FixedFormat.fileName(cursor.current()).isPresent() && !context.lakes().isEmpty()) {
                log.warn("{}: el fichero de lagos de la simulación se copia sin filtrar", cursor.source());
                context.passThrough(cursor);
            } else {
                ChildReference.blank(cursor);
            }
            cursor.nextData();
            redirectOrBlank(cursor, submodel.getRootZoneFile());
            cursor.nextData();
            ChildReference.redirect(cursor, submodel.getSmallWatershedFile());
            cursor.nextData();
            ChildReference.redirect(cursor, submodel.getUnsaturatedZoneFile());
            cursor.nextData();
            context.passThroughLines(cursor, PASS_THROUGH_LINES);
            return null;
        });
    }

    private static void redirectOrBlank(LineCursor cursor, Path target) {
        if (target == null) {
            ChildReference.blank(cursor);
        } else {
            ChildReference.redirect(cursor, target);
        }
    }

    public static Path directoryOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent == null ? Path.of("").toAbsolutePath() : parent;
    }
}
