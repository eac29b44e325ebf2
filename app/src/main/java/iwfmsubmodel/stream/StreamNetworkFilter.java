package iwfmsubmodel.stream;

import iwfmsubmodel.domain.model.RatingTable;
import iwfmsubmodel.domain.model.ReachDescriptor;
import iwfmsubmodel.domain.model.StreamNetwork;
import iwfmsubmodel.domain.model.StreamSelection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Calcula qué parte de la red de ríos sobrevive en el submodelo.
 * <p>
 * Un nodo de río sobrevive si su nodo de acuífero está en el conjunto de nodos del
 * submodelo. Un tramo sobrevive si conserva al menos un nodo y se emite solo con esos
 * nodos, en el orden original. Si el nodo de desagüe de un tramo no sobrevive, el desagüe
 * pasa a 0 (sale del submodelo).
 */
@Slf4j
public class StreamNetworkFilter {

    public StreamSelection filter(StreamNetwork network, Set<Integer> nodeSet) {
        Set<Integer> survivors = network.nodeMap().survivors(nodeSet);

        List<ReachDescriptor> reaches = new ArrayList<>();
        for (ReachDescriptor reach : network.reaches()) {
            List<Integer> streamNodes = new ArrayList<>();
            List<Integer> gwNodes = new ArrayList<>();
            for (int i = 0; i < reach.nodeCount(); i++) {
                if (survivors.contains(reach.streamNodes().get(i))) {
                    streamNodes.add(reach.streamNodes().get(i));
                    gwNodes.add(reach.groundwaterNodes().get(i));
                }
            }
            if (streamNodes.isEmpty()) {
                continue;
            }
            int outflow = reach.outflow() > 0 && !survivors.contains(reach.outflow()) ? 0 : reach.outflow();
            reaches.add(ReachDescriptor.builder()
                    .id(reach.id())
                    .outflow(outflow)
                    .name(reach.name())
                    .streamNodes(streamNodes)
                    .groundwaterNodes(gwNodes)
                    .build());
        }

        List<RatingTable> tables = network.ratingTables().stream()
                .filter(table -> survivors.contains(table.streamNode()))
                .toList();

        log.info("Red de ríos: {} de {} tramos y {} de {} nodos sobreviven",
                reaches.size(), network.reaches().size(), survivors.size(), network.nodeMap().size());
        return new StreamSelection(reaches, tables, survivors);
    }
}
