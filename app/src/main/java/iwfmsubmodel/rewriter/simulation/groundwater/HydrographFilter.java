package iwfmsubmodel.rewriter.simulation.groundwater;

import iwfmsubmodel.format.FixedFormat;
import iwfmsubmodel.format.LineCursor;
import iwfmsubmodel.format.RecordFilter;
import iwfmsubmodel.format.SectionResult;
import iwfmsubmodel.rewriter.simulation.SimulationContext;

/**
 * Sección de hidrogramas de acuífero o de subsidencia.
 * <p>
 * Cabecera: NOUTH, FACTXY y el fichero de salida. Registros
 * {@code ID HYDTYP IOUTHL X Y IOUTH NOMBRE}. Con HYDTYP=1 el hidrograma se define por el nodo
 * IOUTH y se conserva si el nodo se conserva; en otro caso se define por coordenadas, que se
 * escalan por FACTXY y se comprueban contra el contorno del submodelo.
 */
final class HydrographFilter {

    static final int BY_NODE = 1;

    private static final int HEADER_LINES = 2;

    private HydrographFilter() {
    }

    /**
     * Filtra la sección cuyo contador está en la línea actual del cursor.
     */
    static SectionResult filter(LineCursor cursor, SimulationContext context) {
        int factorLine = cursor.peekData(1);
        if (factorLine == LineCursor.END_OF_SEQUENCE) {
            throw cursor.malformed("FACTXY tras el número de hidrogramas");
        }
        double factor = FixedFormat.parseDouble(cursor.lines().get(factorLine), 0, cursor.source(), factorLine + 1);
        return RecordFilter.counted(cursor, HEADER_LINES,
                (c, n) -> RecordFilter.where(c, 0, n, tokens -> keep(tokens, factor, context)));
    }

    static boolean keep(String[] tokens, double factor, SimulationContext context) {
        if (Integer.parseInt(tokens[1]) == BY_NODE) {
            return context.nodes().contains(Integer.parseInt(tokens[5]));
        }
        double x = FixedFormat.toDouble(tokens[3]) * factor;
        double y = FixedFormat.toDouble(tokens[4]) * factor;
        return context.boundary().contains(x, y);
    }
}
