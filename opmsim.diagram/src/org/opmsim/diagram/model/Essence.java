package org.opmsim.diagram.model;

public enum Essence {
    PHYSICAL,
    INFORMATICAL;

    public String getWireName() {
        return name().toLowerCase();
    }

    public static Essence fromWireName(String name) {
        for (Essence essence : values()) {
            if (essence.name().equalsIgnoreCase(name)) {
                return essence;
            }
        }
        return null;
    }
}
