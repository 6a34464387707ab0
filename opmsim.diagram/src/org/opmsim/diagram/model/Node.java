package org.opmsim.diagram.model;

import java.util.Objects;

/**
 * One diagram entity: an Object, a Process or a State.
 *
 * Nodes are immutable; every edit produces a new value through one of the {@code with...}
 * methods and is installed in the graph by a command. A State always names its parent
 * object and shares that object's owning process.
 */
public final class Node {
    private final String id;
    private final NodeKind kind;
    private final String label;
    private final Geometry geometry;
    private final Essence essence;
    private final Affiliation affiliation;
    private final String owningProcessId;
    private final String parentObjectId;
    private final boolean initial;

    private Node(String id, NodeKind kind, String label, Geometry geometry, Essence essence,
                 Affiliation affiliation, String owningProcessId, String parentObjectId, boolean initial) {
        this.id = Objects.requireNonNull(id, "Node id cannot be null");
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
        this.label = label == null ? "" : label;
        this.geometry = Objects.requireNonNull(geometry, "Node geometry cannot be null");
        this.essence = essence == null ? Essence.PHYSICAL : essence;
        this.affiliation = affiliation == null ? Affiliation.SYSTEMIC : affiliation;
        this.owningProcessId = owningProcessId;
        if (kind == NodeKind.STATE && parentObjectId == null) {
            throw new IllegalArgumentException("State " + id + " must name its parent object");
        }
        if (kind != NodeKind.STATE && parentObjectId != null) {
            throw new IllegalArgumentException("Only states have a parent object: " + id);
        }
        this.parentObjectId = parentObjectId;
        this.initial = kind == NodeKind.STATE && initial;
    }

    public static Node object(String id, String label, Geometry geometry, String owningProcessId) {
        return new Node(id, NodeKind.OBJECT, label, geometry, Essence.PHYSICAL, Affiliation.SYSTEMIC,
                owningProcessId, null, false);
    }

    public static Node process(String id, String label, Geometry geometry, String owningProcessId) {
        return new Node(id, NodeKind.PROCESS, label, geometry, Essence.PHYSICAL, Affiliation.SYSTEMIC,
                owningProcessId, null, false);
    }

    public static Node state(String id, String label, Geometry geometry, String parentObjectId,
                             String owningProcessId, boolean initial) {
        return new Node(id, NodeKind.STATE, label, geometry, Essence.PHYSICAL, Affiliation.SYSTEMIC,
                owningProcessId, parentObjectId, initial);
    }

    public static Node of(NodeKind kind, String id, String label, Geometry geometry, String owningProcessId) {
        switch (kind) {
            case OBJECT:
                return object(id, label, geometry, owningProcessId);
            case PROCESS:
                return process(id, label, geometry, owningProcessId);
            default:
                throw new IllegalArgumentException("States are created with Node.state(...)");
        }
    }

    public String getId() { return id; }
    public NodeKind getKind() { return kind; }
    public String getLabel() { return label; }
    public Geometry getGeometry() { return geometry; }
    public Essence getEssence() { return essence; }
    public Affiliation getAffiliation() { return affiliation; }
    public String getOwningProcessId() { return owningProcessId; }
    public String getParentObjectId() { return parentObjectId; }
    public boolean isInitial() { return initial; }

    public boolean isObject() { return kind == NodeKind.OBJECT; }
    public boolean isProcess() { return kind == NodeKind.PROCESS; }
    public boolean isState() { return kind == NodeKind.STATE; }

    public Node withId(String newId) {
        return new Node(newId, kind, label, geometry, essence, affiliation, owningProcessId, parentObjectId, initial);
    }

    public Node withLabel(String newLabel) {
        return new Node(id, kind, newLabel, geometry, essence, affiliation, owningProcessId, parentObjectId, initial);
    }

    public Node withGeometry(Geometry newGeometry) {
        return new Node(id, kind, label, newGeometry, essence, affiliation, owningProcessId, parentObjectId, initial);
    }

    public Node withOwningProcess(String newOwner) {
        return new Node(id, kind, label, geometry, essence, affiliation, newOwner, parentObjectId, initial);
    }

    public Node withParentObject(String newParent) {
        return new Node(id, kind, label, geometry, essence, affiliation, owningProcessId, newParent, initial);
    }

    public Node withEssence(Essence newEssence) {
        return new Node(id, kind, label, geometry, newEssence, affiliation, owningProcessId, parentObjectId, initial);
    }

    public Node withAffiliation(Affiliation newAffiliation) {
        return new Node(id, kind, label, geometry, essence, newAffiliation, owningProcessId, parentObjectId, initial);
    }

    public Node withInitial(boolean newInitial) {
        return new Node(id, kind, label, geometry, essence, affiliation, owningProcessId, parentObjectId, newInitial);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node other = (Node) o;
        return initial == other.initial
                && id.equals(other.id)
                && kind == other.kind
                && label.equals(other.label)
                && geometry.equals(other.geometry)
                && essence == other.essence
                && affiliation == other.affiliation
                && Objects.equals(owningProcessId, other.owningProcessId)
                && Objects.equals(parentObjectId, other.parentObjectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, label, geometry, essence, affiliation, owningProcessId, parentObjectId, initial);
    }

    @Override
    public String toString() {
        return String.format("%s[%s '%s' %s owner=%s]", kind, id, label, geometry, owningProcessId);
    }
}
