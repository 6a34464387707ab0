package org.opmsim.diagram.graph;

/**
 * Notification payload for a single applied mutation.
 */
public class DiagramChange {

    public enum Type {
        NODE_ADDED,
        NODE_REMOVED,
        NODE_CHANGED,
        LINK_ADDED,
        LINK_REMOVED,
        LINK_CHANGED
    }

    private final Type type;
    private final String elementId;

    public DiagramChange(Type type, String elementId) {
        this.type = type;
        this.elementId = elementId;
    }

    public Type getType() {
        return type;
    }

    public String getElementId() {
        return elementId;
    }

    @Override
    public String toString() {
        return type + "(" + elementId + ")";
    }
}
