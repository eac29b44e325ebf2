package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de drenes y de riego subsuperficial.
 * <p>
 * Tres secciones con contador y tres líneas de cabecera: drenes
 * {@code ID IGW ELEV COND TYPDST DST}, puntos de riego subsuperficial {@code ID IGW ...} e
 * hidrogramas {@code ID IDTYP NOMBRE}. Drenes y puntos se conservan por su nodo; los
 * hidrogramas, si su dren (IDTYP=1) o punto (IDTYP=2) se conserva.
 */
@Slf4j
public class TileDrainFileRewriter extends AbstractFileRewriter {

    private static final int HEADER_LINES = 3;
    private static final int NODE_COLUMN = 1;
    private static final int DESTINATION_TYPE_COLUMN = 4;
    private static final int STREAM_NODE_DESTINATION = 1;
    private static final int DRAIN_HYDROGRAPH = 1;
    private static final int SUBSURFACE_IRRIGATION_HYDROGRAPH = 2;

    public TileDrainFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "drenes";
    }

    /**
     * @return si algún dren o punto de riego sobrevive; si no, el fichero no se escribe.
     */
    public boolean rewrite(Path source, Path target, Set<Integer> nodes, Set<Integer> streamNodes) {
        int survivors = rewriteFileIf(source, target, cursor -> {
            cursor.seekData();
            SectionResult drains = RecordFilter.counted(cursor, HEADER_LINES,
                    (c, n) -> RecordFilter.byColumn(c, NODE_COLUMN, nodes, 0, n));
            Set<Integer> drainIds = RecordFilter.keys(cursor, drains, 0);
            redirectDeadDestinations(cursor, drains, streamNodes);

            cursor.seekData();
            SectionResult irrigation = RecordFilter.counted(cursor, HEADER_LINES,
                    (c, n) -> RecordFilter.byColumn(c, NODE_COLUMN, nodes, 0, n));
            Set<Integer> irrigationIds = RecordFilter.keys(cursor, irrigation, 0);

            cursor.seekData();
            SectionResult hydrographs = RecordFilter.counted(cursor, HEADER_LINES,
                    (c, n) -> RecordFilter.where(c, 0, n, tokens -> {
                        int id = Integer.parseInt(tokens[0]);
                        int type = Integer.parseInt(tokens[1]);
                        return type == DRAIN_HYDROGRAPH && drainIds.contains(id)
                                || type == SUBSURFACE_IRRIGATION_HYDROGRAPH && irrigationIds.contains(id);
                    }));
            log.info("Drenes conservados: {}, riego subsuperficial: {}, hidrogramas: {}",
                    drains.kept(), irrigation.kept(), hydrographs.kept());
            return drains.kept() + irrigation.kept();
        }, kept -> kept > 0);
        return survivors > 0;
    }

    private static void redirectDeadDestinations(LineCursor cursor, SectionResult drains, Set<Integer> streamNodes) {
        for (int i = drains.start(); i < drains.end(); i++) {
            String line = cursor.lines().get(i);
            String[] tokens = FixedFormat.tokens(line);
            if (tokens.length <= DESTINATION_TYPE_COLUMN + 1) {
                continue;
            }
            int type = FixedFormat.parseInt(line, DESTINATION_TYPE_COLUMN, cursor.source(), i + 1);
            int destination = FixedFormat.parseInt(line, DESTINATION_TYPE_COLUMN + 1, cursor.source(), i + 1);
            if (type == STREAM_NODE_DESTINATION && !streamNodes.contains(destination)) {
                line = FixedFormat.replaceToken(line, DESTINATION_TYPE_COLUMN, "0");
                cursor.lines().set(i, FixedFormat.replaceToken(line, DESTINATION_TYPE_COLUMN + 1, "0"));
            }
        }
    }
}
