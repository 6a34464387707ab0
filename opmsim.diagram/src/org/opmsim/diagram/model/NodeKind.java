package org.opmsim.diagram.model;

public enum NodeKind {
    OBJECT("object", IdKind.OBJECT),
    PROCESS("process", IdKind.PROCESS),
    STATE("state", IdKind.STATE);

    private final String wireName;
    private final IdKind idKind;

    NodeKind(String wireName, IdKind idKind) {
        this.wireName = wireName;
        this.idKind = idKind;
    }

    public String getWireName() {
        return wireName;
    }

    public IdKind getIdKind() {
        return idKind;
    }

    public static NodeKind fromWireName(String name) {
        for (NodeKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        return null;
    }
}
