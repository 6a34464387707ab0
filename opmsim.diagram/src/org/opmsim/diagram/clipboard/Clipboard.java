package org.opmsim.diagram.clipboard;

import java.util.*;

import org.apache.log4j.Logger;
import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.diagram.graph.PasteCommand;
import org.opmsim.diagram.model.IdAllocator;
import org.opmsim.diagram.model.IdKind;
import org.opmsim.diagram.model.Link;
import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.NotFoundException;

/**
 * Copy and paste of diagram fragments with identity remapping.
 */
public final class Clipboard {
    private static final Logger logger = Logger.getLogger(Clipboard.class);

    private Clipboard() {
    }

    /**
     * Snapshot the selected nodes. Every state of a selected object comes along; a state
     * selected without its object is left out. Links are kept when both ends are copied.
     *
     * @throws NotFoundException if a selected id names no live node or link
     */
    public static ClipboardSnapshot copy(DiagramGraph graph, Collection<String> selectedIds)
            throws NotFoundException {
        Set<String> expanded = new HashSet<>();
        for (String id : selectedIds) {
            if (graph.containsLink(id)) {
                continue;
            }
            Node node = graph.getNode(id);
            if (node.isState()) {
                if (selectedIds.contains(node.getParentObjectId())) {
                    expanded.add(id);
                } else {
                    logger.debug("Skipping state " + id + " copied without its object");
                }
                continue;
            }
            expanded.add(id);
            if (node.isObject()) {
                for (Node state : graph.statesOf(id)) {
                    expanded.add(state.getId());
                }
            }
        }

        List<Node> nodes = new ArrayList<>();
        for (Node node : graph.nodes()) {
            if (expanded.contains(node.getId())) {
                nodes.add(node);
            }
        }
        List<Link> links = graph.linksBetween(expanded);
        logger.debug("Copied " + nodes.size() + " nodes and " + links.size() + " links");
        return new ClipboardSnapshot(nodes, links);
    }

    /**
     * Build the command that inserts a fresh copy of the snapshot. Every node and link gets
     * a new identifier now; the command itself never allocates.
     */
    public static PasteCommand paste(DiagramGraph graph, IdAllocator allocator,
                                     ClipboardSnapshot snapshot, double offset) {
        Map<String, String> mapping = new LinkedHashMap<>();
        List<Node> ordered = insertionOrder(snapshot.getNodes());
        for (Node node : ordered) {
            mapping.put(node.getId(), allocator.next(node.getKind()));
        }

        Map<String, Node> pasted = new LinkedHashMap<>();
        for (Node node : ordered) {
            Node copy = node.withId(mapping.get(node.getId()));
            if (node.isState()) {
                Node parent = pasted.get(mapping.get(node.getParentObjectId()));
                copy = copy.withParentObject(parent.getId()).withOwningProcess(parent.getOwningProcessId());
            } else {
                copy = copy.withGeometry(node.getGeometry().translate(offset, offset));
                String owner = node.getOwningProcessId();
                if (owner != null && mapping.containsKey(owner)) {
                    copy = copy.withOwningProcess(mapping.get(owner));
                } else if (owner != null && graph.findNode(owner) == null) {
                    copy = copy.withOwningProcess(null);
                }
            }
            pasted.put(copy.getId(), copy);
        }

        List<Link> links = new ArrayList<>();
        for (Link link : snapshot.getLinks()) {
            String source = mapping.get(link.getSourceId());
            String target = mapping.get(link.getTargetId());
            if (source == null || target == null) {
                continue;
            }
            String newId = allocator.next(IdKind.LINK);
            mapping.put(link.getId(), newId);
            links.add(link.withId(newId).withEndpoints(source, target));
        }

        return new PasteCommand(graph, new ArrayList<>(pasted.values()), links, mapping);
    }

    /**
     * Owners before the nodes they own, objects before their states.
     */
    private static List<Node> insertionOrder(List<Node> nodes) {
        Set<String> inSnapshot = new HashSet<>();
        for (Node node : nodes) {
            inSnapshot.add(node.getId());
        }
        List<Node> ordered = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<Node> remaining = new ArrayList<>();
        for (Node node : nodes) {
            if (!node.isState()) {
                remaining.add(node);
            }
        }
        while (!remaining.isEmpty()) {
            boolean progress = false;
            Iterator<Node> it = remaining.iterator();
            while (it.hasNext()) {
                Node node = it.next();
                String owner = node.getOwningProcessId();
                if (owner == null || !inSnapshot.contains(owner) || placed.contains(owner)) {
                    ordered.add(node);
                    placed.add(node.getId());
                    it.remove();
                    progress = true;
                }
            }
            if (!progress) {
                throw new IllegalStateException("Owning-process cycle in clipboard snapshot");
            }
        }
        for (Node node : nodes) {
            if (node.isState() && placed.contains(node.getParentObjectId())) {
                ordered.add(node);
            }
        }
        return ordered;
    }
}
