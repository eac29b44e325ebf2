package iwfmsubmodel.rewriter.preprocessor;

import iwfmsubmodel.domain.model.LakeDescriptor;
import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.io.ModelFileHandler;
import iwfmsubmodel.rewriter.AbstractFileRewriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Fichero de lagos del preprocesador.
 * <p>
 * Estructura: NLAKE y, por lago, una línea {@code ID [ICHLMAX] TYPDST DST NELAKE IELAKE1 / NOMBRE}
 * seguida de NELAKE-1 líneas con un elemento cada una. Un lago sobrevive si conserva algún
 * elemento; su lista se reduce a los elementos conservados. Si desaguaba a un nodo de río que
 * no sobrevive, el destino pasa a 0.
 */
@Slf4j
public class LakeFileRewriter extends AbstractFileRewriter {

    /** Columnas numéricas de la cabecera de lago sin ICHLMAX. */
    private static final int SHORT_HEADER = 5;

    public LakeFileRewriter(ModelFileHandler files) {
        super(files);
    }

    @Override
    protected String componentName() {
        return "lagos";
    }

    /**
     * Calcula los lagos que sobreviven sin escribir el fichero.
     */
    public List<LakeDescriptor> select(Path source, Set<Integer> elements, Set<Integer> survivingStreamNodes) {
        return scanFile(source, cursor -> reduce(cursor, elements, survivingStreamNodes));
    }

    /**
     * Reescribe el fichero. No se escribe nada si ningún lago sobrevive.
     *
     * @return lagos supervivientes, ya reducidos.
     */
    public List<LakeDescriptor> rewrite(Path source, Path target, Set<Integer> elements,
                                        Set<Integer> survivingStreamNodes) {
        return rewriteFileIf(source, target, cursor -> reduce(cursor, elements, survivingStreamNodes),
                lakes -> !lakes.isEmpty());
    }

    private static List<LakeDescriptor> reduce(LineCursor cursor, Set<Integer> elements,
                                               Set<Integer> survivingStreamNodes) {
        cursor.seekData();
        List<LakeDescriptor> lakes = new ArrayList<>();
        String name = cursor.source();
        SectionResult result = RecordFilter.counted(cursor, 0, (c, n) -> RecordFilter.blocks(c, 0, n,
                (lines, head) -> FixedFormat.parseInt(lines.get(head), elementCountColumn(lines.get(head)),
                        name, head + 1),
                block -> reduceLake(block, elements, survivingStreamNodes, lakes, name)));
        log.info("Lagos conservados: {} de {}", result.kept(), result.read());
        return lakes;
    }

    private static List<String> reduceLake(List<String> block, Set<Integer> elements,
                                           Set<Integer> survivingStreamNodes,
                                           List<LakeDescriptor> lakes, String source) {
        String head = block.get(0);
        int countColumn = elementCountColumn(head);
        int offset = countColumn - (SHORT_HEADER - 2);
        String[] tokens = FixedFormat.tokens(head);

        List<Integer> members = new ArrayList<>();
        members.add(FixedFormat.parseInt(head, countColumn + 1, source, 0));
        for (int i = 1; i < block.size(); i++) {
            members.add(FixedFormat.parseInt(block.get(i), 0, source, 0));
        }
        List<Integer> keptIndex = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            if (elements.contains(members.get(i))) {
                keptIndex.add(i);
            }
        }
        if (keptIndex.isEmpty()) {
            return Collections.emptyList();
        }

        int id = FixedFormat.parseInt(head, 0, source, 0);
        int typeColumn = 1 + offset;
        int destinationType = FixedFormat.parseInt(head, typeColumn, source, 0);
        int destination = FixedFormat.parseInt(head, typeColumn + 1, source, 0);
        String newHead = head;
        if (destinationType == LakeDescriptor.DESTINATION_STREAM_NODE && !survivingStreamNodes.contains(destination)) {
            newHead = FixedFormat.replaceToken(newHead, typeColumn, "0");
            newHead = FixedFormat.replaceToken(newHead, typeColumn + 1, "0");
            destinationType = 0;
            destination = 0;
        }
        newHead = FixedFormat.replaceToken(newHead, countColumn, String.valueOf(keptIndex.size()));
        int firstKept = keptIndex.get(0);
        if (firstKept != 0) {
            newHead = FixedFormat.replaceToken(newHead, countColumn + 1, String.valueOf(members.get(firstKept)));
        }

        List<String> reduced = new ArrayList<>();
        reduced.add(newHead);
        for (int k = 1; k < keptIndex.size(); k++) {
            reduced.add(block.get(keptIndex.get(k)));
        }

        lakes.add(LakeDescriptor.builder()
                .id(id)
                .maxElevationColumn(offset > 0 ? FixedFormat.parseInt(head, 1, source, 0) : 0)
                .destinationType(destinationType)
                .destination(destination)
                .name(lakeName(tokens, countColumn + 2))
                .elements(keptIndex.stream().map(members::get).toList())
                .build());
        return reduced;
    }

    /**
     * Columna de NELAKE: 3, o 4 si la cabecera incluye ICHLMAX.
     */
    static int elementCountColumn(String head) {
        String[] tokens = FixedFormat.tokens(head);
        int numeric = 0;
        while (numeric < tokens.length && isNumber(tokens[numeric])) {
            numeric++;
        }
        return numeric > SHORT_HEADER ? SHORT_HEADER - 1 : SHORT_HEADER - 2;
    }

    private static String lakeName(String[] tokens, int from) {
        if (from >= tokens.length) {
            return "";
        }
        String name = String.join(" ", Arrays.copyOfRange(tokens, from, tokens.length));
        return name.startsWith("/") ? name.substring(1).strip() : name;
    }

    private static boolean isNumber(String token) {
        try {
            Double.parseDouble(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
