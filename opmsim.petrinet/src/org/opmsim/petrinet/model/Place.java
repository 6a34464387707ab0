package org.opmsim.petrinet.model;

import java.util.Objects;

/**
 * Token holder derived from an object, or from one state of an object.
 */
public final class Place {
    private final String id;
    private final String label;
    private final String objectId;
    private final String stateId;

    public Place(String id, String label, String objectId, String stateId) {
        this.id = Objects.requireNonNull(id, "Place id cannot be null");
        this.label = label == null ? id : label;
        this.objectId = objectId;
        this.stateId = stateId;
    }

    public String getId() { return id; }
    public String getLabel() { return label; }
    public String getObjectId() { return objectId; }

    /** State this place stands for; null for a stateless object or the "no state" place. */
    public String getStateId() { return stateId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Place)) return false;
        Place other = (Place) o;
        return id.equals(other.id) && label.equals(other.label)
                && Objects.equals(objectId, other.objectId) && Objects.equals(stateId, other.stateId);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Place[" + id + " '" + label + "']";
    }
}
