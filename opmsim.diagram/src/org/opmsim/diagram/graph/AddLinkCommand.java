package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Link;
import org.opmsim.exceptions.DiagramException;

public class AddLinkCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final Link link;

    public AddLinkCommand(DiagramGraph graph, Link link) {
        super("Add " + link.getKind().getWireName() + " link " + link.getId());
        this.graph = graph;
        this.link = link;
    }

    @Override
    protected void apply() throws DiagramException {
        graph.insertLink(link);
    }

    @Override
    protected void revert() throws DiagramException {
        graph.removeLink(link.getId());
    }

    public Link getLink() {
        return link;
    }
}
