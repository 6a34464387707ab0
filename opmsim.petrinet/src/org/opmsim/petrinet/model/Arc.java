package org.opmsim.petrinet.model;

import java.util.Objects;

/**
 * Weighted connection between a place and a transition. Direction follows the type.
 */
public final class Arc {
    private final String placeId;
    private final String transitionId;
    private final ArcType type;
    private final int weight;

    public Arc(String placeId, String transitionId, ArcType type, int weight) {
        this.placeId = Objects.requireNonNull(placeId, "Arc place cannot be null");
        this.transitionId = Objects.requireNonNull(transitionId, "Arc transition cannot be null");
        this.type = Objects.requireNonNull(type, "Arc type cannot be null");
        if (weight < 1) {
            throw new IllegalArgumentException("Arc weight must be at least 1, got " + weight);
        }
        this.weight = weight;
    }

    public String getPlaceId() { return placeId; }
    public String getTransitionId() { return transitionId; }
    public ArcType getType() { return type; }
    public int getWeight() { return weight; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arc)) return false;
        Arc other = (Arc) o;
        return weight == other.weight && type == other.type
                && placeId.equals(other.placeId) && transitionId.equals(other.transitionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(placeId, transitionId, type, weight);
    }

    @Override
    public String toString() {
        return type == ArcType.OUTPUT
                ? transitionId + " -" + weight + "-> " + placeId
                : placeId + " -" + weight + (type == ArcType.TEST ? "-o " : "-> ") + transitionId;
    }
}
