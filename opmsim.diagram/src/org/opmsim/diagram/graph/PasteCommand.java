package org.opmsim.diagram.graph;

import java.util.*;

import org.opmsim.diagram.model.Link;
import org.opmsim.diagram.model.Node;

/**
 * Inserts already-remapped nodes and links. Identifiers are allocated before the command
 * is built, so redo after undo restores exactly the same ids.
 *
 * Nodes must be given in insertion order: owners before owned nodes, objects before
 * their states.
 */
public class PasteCommand extends CompositeCommand {
    private final Map<String, String> idMapping;
    private final List<String> createdNodeIds;
    private final List<String> createdLinkIds;

    public PasteCommand(DiagramGraph graph, List<Node> nodes, List<Link> links, Map<String, String> idMapping) {
        super("Paste " + nodes.size() + " node(s), " + links.size() + " link(s)", steps(graph, nodes, links));
        this.idMapping = Collections.unmodifiableMap(new LinkedHashMap<>(idMapping));
        List<String> nodeIds = new ArrayList<>();
        for (Node node : nodes) {
            nodeIds.add(node.getId());
        }
        List<String> linkIds = new ArrayList<>();
        for (Link link : links) {
            linkIds.add(link.getId());
        }
        this.createdNodeIds = Collections.unmodifiableList(nodeIds);
        this.createdLinkIds = Collections.unmodifiableList(linkIds);
    }

    private static List<DiagramCommand> steps(DiagramGraph graph, List<Node> nodes, List<Link> links) {
        List<DiagramCommand> steps = new ArrayList<>();
        for (Node node : nodes) {
            steps.add(new AddNodeCommand(graph, node));
        }
        for (Link link : links) {
            steps.add(new AddLinkCommand(graph, link));
        }
        return steps;
    }

    /** Original id to pasted id, for nodes and links. */
    public Map<String, String> getIdMapping() {
        return idMapping;
    }

    public List<String> getCreatedNodeIds() {
        return createdNodeIds;
    }

    public List<String> getCreatedLinkIds() {
        return createdLinkIds;
    }
}
