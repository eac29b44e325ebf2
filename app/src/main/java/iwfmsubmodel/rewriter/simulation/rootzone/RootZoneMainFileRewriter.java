package iwfmsubmodel.rewriter.simulation.rootzone;

import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.simulation.AbstractSimulationRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fichero principal de la zona radicular.
 * <p>
 * Tras la versión y cuatro líneas de opciones nombra los ficheros de cultivos no inundados,
 * cultivos inundados, urbano y vegetación nativa. Trece líneas más adelante empiezan los
 * parámetros de suelo por elemento, hasta el final del fichero. Si la escorrentía de un
 * elemento iba a un nodo de río que no sobrevive (TYPDEST=1), pasa a salir del modelo.
 */
@Slf4j
public class RootZoneMainFileRewriter extends AbstractSimulationRewriter {

    private static final int OPTION_LINES = 4;
    private static final int LINES_BEFORE_SOILS = 13;
    private static final int DESTINATION_TYPE_COLUMN = 10;
    private static final int STREAM_NODE_DESTINATION = 1;

    private final Map<LandUseComponent, LandUseComponentFileRewriter> components =
            new EnumMap<>(LandUseComponent.class);

    public RootZoneMainFileRewriter(ModelFileHandler files) {
        super(files);
        for (LandUseComponent component : LandUseComponent.values()) {
            components.put(component, new LandUseComponentFileRewriter(files, component));
        }
    }

    @Override
    protected String componentName() {
        return "zona radicular";
    }

    public void rewrite(Path source, SimulationContext context) {
        Set<Integer> elements = context.elements();
        Set<Integer> streamNodes = context.streamNodes();
        rewriteFile(source, context.submodel().getRootZoneFile(), cursor -> {
            // la primera línea es la versión del formato
            cursor.moveTo(1);
            cursor.seekData();
            context.passThroughLines(cursor, OPTION_LINES);
            for (LandUseComponent component : LandUseComponent.values()) {
                cursor.nextData();
                LandUseComponentFileRewriter rewriter = components.get(component);
                child(cursor, context, component.getDescription(), component.componentFile(context.submodel()),
                        path -> {
                            rewriter.rewrite(path, context);
                            return true;
                        });
            }

            cursor.nextData();
            context.passThroughLines(cursor, LINES_BEFORE_SOILS);
            cursor.nextData();
            String name = cursor.source();
            SectionResult soils = RecordFilter.blocks(cursor, 0, (lines, head) -> 1, block -> {
                String line = block.get(0);
                int element = FixedFormat.parseInt(line, 0, name, 0);
                if (!elements.contains(element)) {
                    return Collections.emptyList();
                }
                if (FixedFormat.tokens(line).length > DESTINATION_TYPE_COLUMN + 1
                        && FixedFormat.parseInt(line, DESTINATION_TYPE_COLUMN, name, 0) == STREAM_NODE_DESTINATION
                        && !streamNodes.contains(FixedFormat.parseInt(line, DESTINATION_TYPE_COLUMN + 1, name, 0))) {
                    return List.of(FixedFormat.replaceToken(line, DESTINATION_TYPE_COLUMN, "0"));
                }
                return block;
            });
            log.info("Zona radicular: {} de {} elementos con parámetros de suelo", soils.kept(), soils.read());
            return soils;
        });
    }
}
