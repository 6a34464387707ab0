package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.DiagramException;

/**
 * Removes a single node record. Links, states and nested nodes must already be gone;
 * use {@link DeleteElementsCommand} for the full cascade.
 */
public class RemoveNodeCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String nodeId;
    private Node removed;

    public RemoveNodeCommand(DiagramGraph graph, String nodeId) {
        super("Remove node " + nodeId);
        this.graph = graph;
        this.nodeId = nodeId;
    }

    @Override
    protected void apply() throws DiagramException {
        removed = graph.removeNode(nodeId);
    }

    @Override
    protected void revert() throws DiagramException {
        graph.insertNode(removed);
    }
}
