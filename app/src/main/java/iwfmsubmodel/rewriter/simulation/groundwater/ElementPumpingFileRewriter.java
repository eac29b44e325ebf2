package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fichero de bombeo por elemento: NSINK registros por elemento seguidos de NGRP grupos de
 * elementos.
 */
@Slf4j
public class ElementPumpingFileRewriter extends AbstractFileRewriter {

    public ElementPumpingFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "bombeo por elemento";
    }

    /**
     * @return si algún sumidero sobrevive; si no, el fichero no se escribe.
     */
    public boolean rewrite(Path source, Path target, Set<Integer> elements) {
        int sinks = rewriteFileIf(source, target, cursor -> {
            cursor.seekData();
            SectionResult sinkRecords = RecordFilter.counted(cursor, 0, (c, n) -> RecordFilter.byIdCounted(c, elements, 0, n));
            cursor.seekData();
            RecordFilter.counted(cursor, 0, (c, n) -> RecordFilter.elementGroups(c, elements, 0, n));
            log.info("Sumideros por elemento conservados: {} de {}", sinkRecords.kept(), sinkRecords.read());
            return sinkRecords.kept();
        }, kept -> kept > 0);
        return sinks > 0;
    }
}
