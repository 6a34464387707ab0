package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Link;
import org.opmsim.exceptions.DiagramException;

public class RemoveLinkCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String linkId;
    private Link removed;

    public RemoveLinkCommand(DiagramGraph graph, String linkId) {
        super("Remove link " + linkId);
        this.graph = graph;
        this.linkId = linkId;
    }

    @Override
    protected void apply() throws DiagramException {
        removed = graph.removeLink(linkId);
    }

    @Override
    protected void revert() throws DiagramException {
        graph.insertLink(removed);
    }
}
