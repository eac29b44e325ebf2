package iwfmsubmodel.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Biyección entre identificadores de elemento del modelo completo y del submodelo.
 * <p>
 * El dominio de {@code forward} es exactamente el conjunto de elementos conservados y
 * {@code reverse} es su inversa. {@code subregions} es la lista ordenada de subregiones
 * distintas de cero a las que pertenecen los elementos conservados.
 *
 * @param pairs      filas originales, en orden de lectura.
 * @param forward    identificador antiguo → nuevo.
 * @param reverse    identificador nuevo → antiguo.
 * @param subregions subregiones referenciadas, ordenadas.
 */
public record ElementMapping(List<ElementPair> pairs,
                             Map<Integer, Integer> forward,
                             Map<Integer, Integer> reverse,
                             List<Integer> subregions) {

    public ElementMapping {
        pairs = List.copyOf(pairs);
        forward = Collections.unmodifiableMap(new TreeMap<>(forward));
        reverse = Collections.unmodifiableMap(new TreeMap<>(reverse));
        subregions = List.copyOf(subregions);
    }

    /**
     * Construye la correspondencia a partir de las filas leídas.
     *
     * @throws IllegalArgumentException si un identificador antiguo o nuevo aparece dos veces.
     */
    public static ElementMapping of(List<ElementPair> pairs) {
        Map<Integer, Integer> forward = new TreeMap<>();
        Map<Integer, Integer> reverse = new TreeMap<>();
        for (ElementPair pair : pairs) {
            if (forward.put(pair.oldId(), pair.newId()) != null) {
                throw new IllegalArgumentException("Elemento original duplicado: " + pair.oldId());
            }
            if (reverse.put(pair.newId(), pair.oldId()) != null) {
                throw new IllegalArgumentException("Elemento de submodelo duplicado: " + pair.newId());
            }
        }
        List<Integer> subregions = pairs.stream()
                .map(ElementPair::subregion)
                .filter(sr -> sr != 0)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .toList();
        return new ElementMapping(pairs, forward, reverse, subregions);
    }

    /** Elementos del modelo completo que pasan al submodelo. */
    public Set<Integer> retainedElements() {
        return forward.keySet();
    }

    public Set<Integer> subregionSet() {
        return new TreeSet<>(subregions);
    }
}
