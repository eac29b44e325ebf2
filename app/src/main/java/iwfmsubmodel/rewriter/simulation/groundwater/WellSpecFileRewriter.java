package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import iwfmsubmodel.rewriter.simulation.SimulationContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de especificación de pozos.
 * <p>
 * NWELL con tres factores (FACTXY, FACTR, FACTLT) y un registro {@code ID X Y RWELL ...} por
 * pozo; a continuación, sin contador, las características de bombeo de cada pozo; por último
 * NGRP y los grupos de elementos de reparto. Un pozo se conserva si sus coordenadas,
 * escaladas por FACTXY, caen dentro del submodelo.
 */
@Slf4j
public class WellSpecFileRewriter extends AbstractFileRewriter {

    private static final int HEADER_LINES = 3;

    public WellSpecFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "especificación de pozos";
    }

    /**
     * @return si algún pozo sobrevive; si no, el fichero no se escribe.
     */
    public boolean rewrite(Path source, Path target, SimulationContext context) {
        int wells = rewriteFileIf(source, target, cursor -> {
            cursor.seekData();
            double factor = FixedFormat.parseDouble(cursor.lines().get(cursor.peekData(1)), 0,
                    cursor.source(), cursor.peekData(1) + 1);
            SectionResult specs = RecordFilter.counted(cursor, HEADER_LINES,
                    (c, n) -> RecordFilter.where(c, 0, n, tokens -> context.boundary().contains(
                            FixedFormat.toDouble(tokens[1]) * factor,
                            FixedFormat.toDouble(tokens[2]) * factor)));
            Set<Integer> keptWells = RecordFilter.keys(cursor, specs, 0);
            if (specs.read() > 0) {
                RecordFilter.byId(cursor, keptWells, 0);
            }

            cursor.seekData();
            RecordFilter.counted(cursor, 0, (c, n) -> RecordFilter.elementGroups(c, context.elements(), 0, n));
            log.info("Pozos conservados: {} de {}", specs.kept(), specs.read());
            return specs.kept();
        }, kept -> kept > 0);
        return wells > 0;
    }
}
