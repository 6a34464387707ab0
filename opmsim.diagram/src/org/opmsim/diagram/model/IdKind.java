package org.opmsim.diagram.model;

/**
 * Identifier namespaces. Each kind keeps its own counter so identifiers stay readable per entity type.
 */
public enum IdKind {
    OBJECT("object"),
    PROCESS("process"),
    STATE("state"),
    LINK("link");

    private final String prefix;

    IdKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static IdKind fromPrefix(String prefix) {
        for (IdKind kind : values()) {
            if (kind.prefix.equals(prefix)) {
                return kind;
            }
        }
        return null;
    }
}
