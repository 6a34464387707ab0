package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.DiagramException;

public class AddNodeCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final Node node;

    public AddNodeCommand(DiagramGraph graph, Node node) {
        super("Add " + node.getKind().getWireName() + " " + node.getId());
        this.graph = graph;
        this.node = node;
    }

    @Override
    protected void apply() throws DiagramException {
        graph.insertNode(node);
    }

    @Override
    protected void revert() throws DiagramException {
        graph.removeNode(node.getId());
    }

    public Node getNode() {
        return node;
    }
}
