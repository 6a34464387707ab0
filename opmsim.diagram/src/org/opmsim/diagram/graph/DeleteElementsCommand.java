package org.opmsim.diagram.graph;

import java.util.*;

import org.opmsim.exceptions.NotFoundException;

/**
 * Deletes a selection of nodes and links together with everything that depends on them.
 *
 * The removal plan is fixed when the command is built: first every link touching a removed
 * node (plus selected links), then the nodes deepest first. Undo restores them in reverse.
 */
public class DeleteElementsCommand extends CompositeCommand {

    public DeleteElementsCommand(DiagramGraph graph, Collection<String> elementIds) throws NotFoundException {
        this("Delete " + elementIds.size() + " element(s)", graph, elementIds);
    }

    protected DeleteElementsCommand(String description, DiagramGraph graph, Collection<String> elementIds)
            throws NotFoundException {
        super(description, plan(graph, elementIds));
    }

    private static List<DiagramCommand> plan(DiagramGraph graph, Collection<String> elementIds)
            throws NotFoundException {
        Set<String> linkIds = new LinkedHashSet<>();
        Set<String> nodeIds = new LinkedHashSet<>();
        for (String id : elementIds) {
            if (graph.containsLink(id)) {
                linkIds.add(id);
                continue;
            }
            DeletionCascade cascade = graph.collectCascade(id);
            linkIds.addAll(cascade.getLinkIds());
            nodeIds.addAll(cascade.getNodeIds());
        }

        List<DiagramCommand> steps = new ArrayList<>();
        for (String linkId : linkIds) {
            steps.add(new RemoveLinkCommand(graph, linkId));
        }
        for (String nodeId : nodeIds) {
            steps.add(new RemoveNodeCommand(graph, nodeId));
        }
        return steps;
    }
}
