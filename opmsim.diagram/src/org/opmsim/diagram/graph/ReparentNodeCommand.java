package org.opmsim.diagram.graph;

import org.opmsim.exceptions.DiagramException;

/**
 * Moves a node into another process's zoom-in view, or to the root view with a null owner.
 */
public class ReparentNodeCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String nodeId;
    private final String newOwnerId;
    private String oldOwnerId;

    public ReparentNodeCommand(DiagramGraph graph, String nodeId, String newOwnerId) {
        super("Move " + nodeId + " under " + (newOwnerId == null ? "root" : newOwnerId));
        this.graph = graph;
        this.nodeId = nodeId;
        this.newOwnerId = newOwnerId;
    }

    @Override
    protected void apply() throws DiagramException {
        String previous = graph.getNode(nodeId).getOwningProcessId();
        graph.reparent(nodeId, newOwnerId);
        oldOwnerId = previous;
    }

    @Override
    protected void revert() throws DiagramException {
        graph.reparent(nodeId, oldOwnerId);
    }
}
