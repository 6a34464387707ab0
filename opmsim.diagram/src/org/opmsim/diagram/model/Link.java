package org.opmsim.diagram.model;

import java.util.Objects;

/**
 * Directed, typed connection between two nodes. Immutable.
 */
public final class Link {
    private final String id;
    private final LinkKind kind;
    private final String sourceId;
    private final String targetId;
    private final String label;
    private final Cardinality sourceCardinality;
    private final Cardinality targetCardinality;

    public Link(String id, LinkKind kind, String sourceId, String targetId) {
        this(id, kind, sourceId, targetId, "", null, null);
    }

    public Link(String id, LinkKind kind, String sourceId, String targetId, String label,
                Cardinality sourceCardinality, Cardinality targetCardinality) {
        this.id = Objects.requireNonNull(id, "Link id cannot be null");
        this.kind = Objects.requireNonNull(kind, "Link kind cannot be null");
        this.sourceId = Objects.requireNonNull(sourceId, "Link source cannot be null");
        this.targetId = Objects.requireNonNull(targetId, "Link target cannot be null");
        this.label = label == null ? "" : label;
        this.sourceCardinality = sourceCardinality;
        this.targetCardinality = targetCardinality;
    }

    public String getId() { return id; }
    public LinkKind getKind() { return kind; }
    public String getSourceId() { return sourceId; }
    public String getTargetId() { return targetId; }
    public String getLabel() { return label; }
    public Cardinality getSourceCardinality() { return sourceCardinality; }
    public Cardinality getTargetCardinality() { return targetCardinality; }

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }

    public Link withId(String newId) {
        return new Link(newId, kind, sourceId, targetId, label, sourceCardinality, targetCardinality);
    }

    public Link withKind(LinkKind newKind) {
        return new Link(id, newKind, sourceId, targetId, label, sourceCardinality, targetCardinality);
    }

    public Link withLabel(String newLabel) {
        return new Link(id, kind, sourceId, targetId, newLabel, sourceCardinality, targetCardinality);
    }

    public Link withEndpoints(String newSource, String newTarget) {
        return new Link(id, kind, newSource, newTarget, label, sourceCardinality, targetCardinality);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Link)) return false;
        Link other = (Link) o;
        return id.equals(other.id)
                && kind == other.kind
                && sourceId.equals(other.sourceId)
                && targetId.equals(other.targetId)
                && label.equals(other.label)
                && Objects.equals(sourceCardinality, other.sourceCardinality)
                && Objects.equals(targetCardinality, other.targetCardinality);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, sourceId, targetId, label, sourceCardinality, targetCardinality);
    }

    @Override
    public String toString() {
        return String.format("%s[%s %s -> %s]", kind, id, sourceId, targetId);
    }
}
