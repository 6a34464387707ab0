package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Link;
import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.DiagramException;
import org.opmsim.exceptions.NotFoundException;

/**
 * Changes the label of a node or of a link.
 */
public class RelabelCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String elementId;
    private final String label;
    private Node nodeBefore;
    private Link linkBefore;

    public RelabelCommand(DiagramGraph graph, String elementId, String label) {
        super("Relabel " + elementId + " to '" + label + "'");
        this.graph = graph;
        this.elementId = elementId;
        this.label = label;
    }

    @Override
    protected void apply() throws DiagramException {
        Node node = graph.findNode(elementId);
        if (node != null) {
            graph.replaceNode(node.withLabel(label));
            nodeBefore = node;
            linkBefore = null;
            return;
        }
        Link link = graph.findLink(elementId);
        if (link == null) {
            throw new NotFoundException("No node or link with id " + elementId, elementId);
        }
        graph.replaceLink(link.withLabel(label));
        linkBefore = link;
        nodeBefore = null;
    }

    @Override
    protected void revert() throws DiagramException {
        if (nodeBefore != null) {
            graph.replaceNode(nodeBefore);
        } else {
            graph.replaceLink(linkBefore);
        }
    }
}
