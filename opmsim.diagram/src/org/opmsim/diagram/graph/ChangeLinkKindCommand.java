package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Link;
import org.opmsim.diagram.model.LinkKind;
import org.opmsim.exceptions.DiagramException;

/**
 * Retypes a link in place. The new kind must accept the existing endpoints.
 */
public class ChangeLinkKindCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String linkId;
    private final LinkKind newKind;
    private Link before;

    public ChangeLinkKindCommand(DiagramGraph graph, String linkId, LinkKind newKind) {
        super("Change " + linkId + " to " + newKind.getWireName());
        this.graph = graph;
        this.linkId = linkId;
        this.newKind = newKind;
    }

    @Override
    protected void apply() throws DiagramException {
        Link current = graph.getLink(linkId);
        graph.replaceLink(current.withKind(newKind));
        before = current;
    }

    @Override
    protected void revert() throws DiagramException {
        graph.replaceLink(before);
    }
}
