package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.DiagramException;

public class ResizeNodeCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String nodeId;
    private final double width;
    private final double height;
    private Node before;

    public ResizeNodeCommand(DiagramGraph graph, String nodeId, double width, double height) {
        super("Resize " + nodeId + " to " + width + "x" + height);
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Node size must be positive: " + width + "x" + height);
        }
        this.graph = graph;
        this.nodeId = nodeId;
        this.width = width;
        this.height = height;
    }

    @Override
    protected void apply() throws DiagramException {
        Node current = graph.getNode(nodeId);
        graph.replaceNode(current.withGeometry(current.getGeometry().withSize(width, height)));
        before = current;
    }

    @Override
    protected void revert() throws DiagramException {
        graph.replaceNode(before);
    }
}
