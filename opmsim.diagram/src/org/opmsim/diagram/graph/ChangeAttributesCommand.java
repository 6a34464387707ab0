package org.opmsim.diagram.graph;

import org.opmsim.diagram.model.Affiliation;
import org.opmsim.diagram.model.Essence;
import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.DiagramException;

/**
 * Updates essence, affiliation and the initial-state flag. A null argument leaves that
 * attribute as it is.
 */
public class ChangeAttributesCommand extends AbstractDiagramCommand {
    private final DiagramGraph graph;
    private final String nodeId;
    private final Essence essence;
    private final Affiliation affiliation;
    private final Boolean initial;
    private Node before;

    public ChangeAttributesCommand(DiagramGraph graph, String nodeId, Essence essence,
                                   Affiliation affiliation, Boolean initial) {
        super("Change attributes of " + nodeId);
        this.graph = graph;
        this.nodeId = nodeId;
        this.essence = essence;
        this.affiliation = affiliation;
        this.initial = initial;
    }

    @Override
    protected void apply() throws DiagramException {
        Node current = graph.getNode(nodeId);
        Node updated = current;
        if (essence != null) {
            updated = updated.withEssence(essence);
        }
        if (affiliation != null) {
            updated = updated.withAffiliation(affiliation);
        }
        if (initial != null) {
            if (!current.isState()) {
                throw new IllegalArgumentException("Only states carry an initial flag: " + nodeId);
            }
            updated = updated.withInitial(initial);
        }
        graph.replaceNode(updated);
        before = current;
    }

    @Override
    protected void revert() throws DiagramException {
        graph.replaceNode(before);
    }
}
