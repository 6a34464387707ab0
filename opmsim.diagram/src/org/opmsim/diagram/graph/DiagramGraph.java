package org.opmsim.diagram.graph;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.log4j.Logger;
import org.opmsim.diagram.model.LinkKind;
import org.opmsim.diagram.model.Link;
import org.opmsim.diagram.model.Node;
import org.opmsim.diagram.model.NodeKind;
import org.opmsim.exceptions.*;

/**
 * Flat store of every node and link of one diagram, addressed by identifier.
 *
 * Reads are public. Mutators are package-private so the only way to change a diagram is
 * through a {@link DiagramCommand}. Every mutator validates first and applies second:
 * when it throws, the graph is unchanged.
 */
public class DiagramGraph {
    private static final Logger logger = Logger.getLogger(DiagramGraph.class);

    public static final String DUPLICATE_ID = "DUPLICATE_ID";

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Link> links = new LinkedHashMap<>();
    private final List<DiagramChangeListener> listeners = new CopyOnWriteArrayList<>();

    // === LISTENERS ===

    public void addChangeListener(DiagramChangeListener listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(DiagramChangeListener listener) {
        listeners.remove(listener);
    }

    private void fire(DiagramChange.Type type, String elementId) {
        DiagramChange change = new DiagramChange(type, elementId);
        for (DiagramChangeListener listener : listeners) {
            listener.diagramChanged(change);
        }
    }

    // === READS ===

    public Node getNode(String id) throws NotFoundException {
        Node node = nodes.get(id);
        if (node == null) {
            throw new NotFoundException("No node with id " + id, id);
        }
        return node;
    }

    public Link getLink(String id) throws NotFoundException {
        Link link = links.get(id);
        if (link == null) {
            throw new NotFoundException("No link with id " + id, id);
        }
        return link;
    }

    /**
     * Get node by id, or null when absent
     */
    public Node findNode(String id) {
        return nodes.get(id);
    }

    public Link findLink(String id) {
        return links.get(id);
    }

    /**
     * Get the link with exactly this kind and these endpoints, or null
     */
    public Link findLink(LinkKind kind, String sourceId, String targetId) {
        for (Link link : links.values()) {
            if (link.getKind() == kind && link.getSourceId().equals(sourceId)
                    && link.getTargetId().equals(targetId)) {
                return link;
            }
        }
        return null;
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public boolean containsLink(String id) {
        return links.containsKey(id);
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && links.isEmpty();
    }

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<Link> links() {
        return Collections.unmodifiableCollection(links.values());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getLinkCount() {
        return links.size();
    }

    /** Copy of the node table, for structural comparison. */
    public Map<String, Node> nodeMap() {
        return new HashMap<>(nodes);
    }

    /** Copy of the link table, for structural comparison. */
    public Map<String, Link> linkMap() {
        return new HashMap<>(links);
    }

    /**
     * Nodes whose owning process is {@code processId}; null selects the root view.
     */
    public List<Node> childrenOf(String processId) {
        List<Node> children = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (Objects.equals(node.getOwningProcessId(), processId)) {
                children.add(node);
            }
        }
        return children;
    }

    public List<Node> statesOf(String objectId) {
        List<Node> states = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.isState() && objectId.equals(node.getParentObjectId())) {
                states.add(node);
            }
        }
        return states;
    }

    public List<Link> linksOf(String nodeId) {
        List<Link> touching = new ArrayList<>();
        for (Link link : links.values()) {
            if (link.touches(nodeId)) {
                touching.add(link);
            }
        }
        return touching;
    }

    /**
     * Links whose source and target are both in {@code nodeIds}.
     */
    public List<Link> linksBetween(Set<String> nodeIds) {
        List<Link> inside = new ArrayList<>();
        for (Link link : links.values()) {
            if (nodeIds.contains(link.getSourceId()) && nodeIds.contains(link.getTargetId())) {
                inside.add(link);
            }
        }
        return inside;
    }

    /**
     * Every node transitively owned by the process, including the states of owned objects.
     */
    public List<Node> descendantsOf(String processId) {
        List<Node> result = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(processId);
        while (!pending.isEmpty()) {
            String owner = pending.pop();
            for (Node child : childrenOf(owner)) {
                result.add(child);
                if (child.isProcess()) {
                    pending.push(child.getId());
                }
            }
        }
        return result;
    }

    /**
     * True when {@code ancestorId} appears on the owning-process chain of {@code nodeId}.
     */
    public boolean isAncestor(String ancestorId, String nodeId) {
        Node current = nodes.get(nodeId);
        Set<String> seen = new HashSet<>();
        while (current != null && current.getOwningProcessId() != null) {
            String owner = current.getOwningProcessId();
            if (owner.equals(ancestorId)) {
                return true;
            }
            if (!seen.add(owner)) {
                return false;
            }
            current = nodes.get(owner);
        }
        return false;
    }

    /**
     * Computes what deleting {@code nodeId} removes: its states, for a process every nested
     * node, and all links touching any of them.
     */
    public DeletionCascade collectCascade(String nodeId) throws NotFoundException {
        Node root = getNode(nodeId);
        List<String> nodeOrder = new ArrayList<>();
        appendDeepestFirst(root, nodeOrder);

        Set<String> removed = new HashSet<>(nodeOrder);
        List<String> linkIds = new ArrayList<>();
        for (Link link : links.values()) {
            if (removed.contains(link.getSourceId()) || removed.contains(link.getTargetId())) {
                linkIds.add(link.getId());
            }
        }
        return new DeletionCascade(linkIds, nodeOrder);
    }

    private void appendDeepestFirst(Node node, List<String> order) {
        if (node.isProcess()) {
            for (Node child : childrenOf(node.getId())) {
                if (!child.isState()) {
                    appendDeepestFirst(child, order);
                }
            }
        }
        if (node.isObject()) {
            for (Node state : statesOf(node.getId())) {
                order.add(state.getId());
            }
        }
        order.add(node.getId());
    }

    // === MUTATIONS (commands only) ===

    void insertNode(Node node) throws DiagramException {
        checkIdFree(node.getId());
        checkOwner(node.getId(), node.getOwningProcessId());
        if (node.isState()) {
            Node parent = nodes.get(node.getParentObjectId());
            if (parent == null || !parent.isObject()) {
                throw new InvalidParentException("State " + node.getId() + " needs a live parent object, got "
                        + node.getParentObjectId(), node.getId());
            }
            if (!Objects.equals(parent.getOwningProcessId(), node.getOwningProcessId())) {
                throw new InvalidParentException("State " + node.getId() + " must share the owning process of "
                        + parent.getId(), node.getId());
            }
        }
        nodes.put(node.getId(), node);
        logger.debug("Inserted " + node);
        fire(DiagramChange.Type.NODE_ADDED, node.getId());
    }

    void insertLink(Link link) throws DiagramException {
        checkIdFree(link.getId());
        validateLink(link, null);
        links.put(link.getId(), link);
        logger.debug("Inserted " + link);
        fire(DiagramChange.Type.LINK_ADDED, link.getId());
    }

    /**
     * Removes one node record. Fails while links, states or nested nodes still refer to it.
     */
    Node removeNode(String id) throws DiagramException {
        Node node = getNode(id);
        for (Link link : links.values()) {
            if (link.touches(id)) {
                throw new DanglingReferenceException("Node " + id + " is still referenced by " + link.getId(), id);
            }
        }
        for (Node other : nodes.values()) {
            if (id.equals(other.getParentObjectId()) || id.equals(other.getOwningProcessId())) {
                throw new DanglingReferenceException("Node " + id + " still contains " + other.getId(), id);
            }
        }
        nodes.remove(id);
        logger.debug("Removed " + node);
        fire(DiagramChange.Type.NODE_REMOVED, id);
        return node;
    }

    Link removeLink(String id) throws NotFoundException {
        Link link = getLink(id);
        links.remove(id);
        logger.debug("Removed " + link);
        fire(DiagramChange.Type.LINK_REMOVED, id);
        return link;
    }

    /**
     * Swaps in a new value for an existing node. Kind, parent object and owning process
     * are fixed here; ownership changes go through {@link #reparent(String, String)}.
     */
    void replaceNode(Node node) throws DiagramException {
        Node current = getNode(node.getId());
        if (current.getKind() != node.getKind()
                || !Objects.equals(current.getParentObjectId(), node.getParentObjectId())
                || !Objects.equals(current.getOwningProcessId(), node.getOwningProcessId())) {
            throw new IllegalArgumentException("Replacement of " + node.getId()
                    + " may not change its kind, parent object or owning process");
        }
        nodes.put(node.getId(), node);
        fire(DiagramChange.Type.NODE_CHANGED, node.getId());
    }

    void replaceLink(Link link) throws DiagramException {
        Link current = getLink(link.getId());
        validateLink(link, current.getId());
        links.put(link.getId(), link);
        fire(DiagramChange.Type.LINK_CHANGED, link.getId());
    }

    /**
     * Moves an object or process under a new owning process (null = root). The states of
     * an object follow it.
     */
    void reparent(String nodeId, String newOwnerId) throws DiagramException {
        Node node = getNode(nodeId);
        if (node.isState()) {
            throw new InvalidParentException("States follow their parent object and cannot be re-parented", nodeId);
        }
        if (newOwnerId != null && (newOwnerId.equals(nodeId) || isAncestor(nodeId, newOwnerId))) {
            throw new CycleDetectedException("Placing " + nodeId + " under " + newOwnerId
                    + " would make it its own ancestor", nodeId);
        }
        checkOwner(nodeId, newOwnerId);

        nodes.put(nodeId, node.withOwningProcess(newOwnerId));
        fire(DiagramChange.Type.NODE_CHANGED, nodeId);
        if (node.isObject()) {
            for (Node state : statesOf(nodeId)) {
                nodes.put(state.getId(), state.withOwningProcess(newOwnerId));
                fire(DiagramChange.Type.NODE_CHANGED, state.getId());
            }
        }
    }

    // === VALIDATION ===

    private void checkIdFree(String id) throws DiagramException {
        if (nodes.containsKey(id) || links.containsKey(id)) {
            throw new DiagramException("Identifier already in use: " + id, DUPLICATE_ID, id);
        }
    }

    private void checkOwner(String nodeId, String ownerId) throws InvalidParentException {
        if (ownerId == null) {
            return;
        }
        Node owner = nodes.get(ownerId);
        if (owner == null || !owner.isProcess()) {
            throw new InvalidParentException("Owning process " + ownerId + " of " + nodeId
                    + " is not a live process", nodeId);
        }
    }

    private void validateLink(Link link, String replacing) throws DiagramException {
        Node source = nodes.get(link.getSourceId());
        Node target = nodes.get(link.getTargetId());
        if (source == null || target == null) {
            String missing = source == null ? link.getSourceId() : link.getTargetId();
            throw new DanglingReferenceException("Link " + link.getId() + " refers to missing node " + missing,
                    link.getId());
        }
        NodeKind sourceKind = source.getKind();
        NodeKind targetKind = target.getKind();
        if (!link.getKind().allows(sourceKind, targetKind)) {
            throw new IncompatibleEndpointsException(link.getKind().getWireName() + " link "
                    + link.getId() + " cannot connect " + sourceKind + " to " + targetKind
                    + " (expected " + link.getKind().describeEndpoints() + ")", link.getId());
        }
        Link parallel = findLink(link.getKind(), link.getSourceId(), link.getTargetId());
        if (parallel != null && !parallel.getId().equals(replacing)) {
            throw new DuplicateLinkException("A " + link.getKind().getWireName() + " link from "
                    + link.getSourceId() + " to " + link.getTargetId() + " already exists: " + parallel.getId(),
                    link.getId());
        }
    }
}
