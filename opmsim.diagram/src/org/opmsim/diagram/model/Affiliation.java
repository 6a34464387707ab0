package org.opmsim.diagram.model;

public enum Affiliation {
    SYSTEMIC,
    ENVIRONMENTAL;

    public String getWireName() {
        return name().toLowerCase();
    }

    public static Affiliation fromWireName(String name) {
        for (Affiliation affiliation : values()) {
            if (affiliation.name().equalsIgnoreCase(name)) {
                return affiliation;
            }
        }
        return null;
    }
}
