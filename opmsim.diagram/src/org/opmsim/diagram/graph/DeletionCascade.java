package org.opmsim.diagram.graph;

import java.util.Collections;
import java.util.List;

/**
 * Everything that disappears together with one node: the links touching any removed node,
 * and the nodes themselves ordered so that states and nested content come before their
 * owners.
 */
public class DeletionCascade {
    private final List<String> linkIds;
    private final List<String> nodeIds;

    DeletionCascade(List<String> linkIds, List<String> nodeIds) {
        this.linkIds = Collections.unmodifiableList(linkIds);
        this.nodeIds = Collections.unmodifiableList(nodeIds);
    }

    public List<String> getLinkIds() {
        return linkIds;
    }

    /** Deepest first; the root of the cascade is last. */
    public List<String> getNodeIds() {
        return nodeIds;
    }
}
