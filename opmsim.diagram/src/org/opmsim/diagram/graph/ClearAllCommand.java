package org.opmsim.diagram.graph;

import java.util.ArrayList;
import java.util.List;

import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.NotFoundException;

/**
 * Empties the diagram. Undo brings every node and link back.
 */
public class ClearAllCommand extends DeleteElementsCommand {

    public ClearAllCommand(DiagramGraph graph) throws NotFoundException {
        super("Clear all", graph, rootNodes(graph));
    }

    private static List<String> rootNodes(DiagramGraph graph) {
        List<String> ids = new ArrayList<>();
        for (Node node : graph.childrenOf(null)) {
            if (!node.isState()) {
                ids.add(node.getId());
            }
        }
        return ids;
    }
}
