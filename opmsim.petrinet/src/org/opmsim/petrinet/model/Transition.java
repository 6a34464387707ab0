package org.opmsim.petrinet.model;

import java.util.Objects;

public final class Transition {
    private final String id;
    private final String label;
    private final String processId;

    public Transition(String id, String label, String processId) {
        this.id = Objects.requireNonNull(id, "Transition id cannot be null");
        this.label = label == null ? id : label;
        this.processId = processId;
    }

    public String getId() { return id; }
    public String getLabel() { return label; }
    public String getProcessId() { return processId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition other = (Transition) o;
        return id.equals(other.id) && label.equals(other.label) && Objects.equals(processId, other.processId);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Transition[" + id + " '" + label + "']";
    }
}
