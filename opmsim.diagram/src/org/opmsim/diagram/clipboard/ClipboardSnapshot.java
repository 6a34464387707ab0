package org.opmsim.diagram.clipboard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.opmsim.diagram.model.Link;
import org.opmsim.diagram.model.Node;

/**
 * Frozen copy of a selection. Holds immutable node and link values, so later edits of the
 * diagram never show through.
 */
public final class ClipboardSnapshot {
    public static final ClipboardSnapshot EMPTY =
            new ClipboardSnapshot(Collections.<Node>emptyList(), Collections.<Link>emptyList());

    private final List<Node> nodes;
    private final List<Link> links;

    public ClipboardSnapshot(List<Node> nodes, List<Link> links) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Link> getLinks() {
        return links;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return "ClipboardSnapshot[" + nodes.size() + " nodes, " + links.size() + " links]";
    }
}
