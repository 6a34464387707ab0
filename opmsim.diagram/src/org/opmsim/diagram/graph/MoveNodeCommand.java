package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.DiagramException;

/**
 * Sets the node's position. For states the position is relative to the parent object.
 */
public class MoveNodeCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String nodeId;
    private final double x;
    private final double y;
    private Node before;

    public MoveNodeCommand(DiagramGraph graph, String nodeId, double x, double y) {
        super("Move " + nodeId + " to (" + x + ", " + y + ")");
        this.graph = graph;
        this.nodeId = nodeId;
        this.x = x;
        this.y = y;
    }

    @Override
    protected void apply() throws DiagramException {
        Node current = graph.getNode(nodeId);
        graph.replaceNode(current.withGeometry(current.getGeometry().withPosition(x, y)));
        before = current;
    }

    @Override
    protected void revert() throws DiagramException {
        graph.replaceNode(before);
    }
}
