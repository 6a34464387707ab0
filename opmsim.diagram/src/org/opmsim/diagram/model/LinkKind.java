package org.opmsim.diagram.model;

/**
 * OPM link kinds and the endpoint kinds each one admits.
 */
public enum LinkKind {
    AGGREGATION("aggregation", LinkFamily.STRUCTURAL),
    EXHIBITION("exhibition", LinkFamily.STRUCTURAL),
    GENERALIZATION("generalization", LinkFamily.STRUCTURAL),
    INSTANTIATION("instantiation", LinkFamily.STRUCTURAL),
    CONSUMPTION("consumption", LinkFamily.PROCEDURAL),
    RESULT("result", LinkFamily.PROCEDURAL),
    EFFECT("effect", LinkFamily.PROCEDURAL),
    AGENT("agent", LinkFamily.PROCEDURAL),
    INSTRUMENT("instrument", LinkFamily.PROCEDURAL);

    private final String wireName;
    private final LinkFamily family;

    LinkKind(String wireName, LinkFamily family) {
        this.wireName = wireName;
        this.family = family;
    }

    public String getWireName() {
        return wireName;
    }

    public LinkFamily getFamily() {
        return family;
    }

    public boolean isStructural() {
        return family == LinkFamily.STRUCTURAL;
    }

    public boolean isProcedural() {
        return family == LinkFamily.PROCEDURAL;
    }

    /**
     * Endpoint rule for this kind. States count as stateful object ends of procedural links.
     */
    public boolean allows(NodeKind source, NodeKind target) {
        switch (this) {
            case AGGREGATION:
            case EXHIBITION:
            case GENERALIZATION:
            case INSTANTIATION:
                return (source == NodeKind.OBJECT && target == NodeKind.OBJECT)
                        || (source == NodeKind.PROCESS && target == NodeKind.PROCESS);
            case CONSUMPTION:
            case AGENT:
            case INSTRUMENT:
                return isObjectEnd(source) && target == NodeKind.PROCESS;
            case RESULT:
                return source == NodeKind.PROCESS && isObjectEnd(target);
            case EFFECT:
                return (isObjectEnd(source) && target == NodeKind.PROCESS)
                        || (source == NodeKind.PROCESS && isObjectEnd(target));
            default:
                return false;
        }
    }

    public String describeEndpoints() {
        switch (this) {
            case CONSUMPTION:
            case AGENT:
            case INSTRUMENT:
                return "object or state -> process";
            case RESULT:
                return "process -> object or state";
            case EFFECT:
                return "between object or state and process";
            default:
                return "object -> object or process -> process";
        }
    }

    private static boolean isObjectEnd(NodeKind kind) {
        return kind == NodeKind.OBJECT || kind == NodeKind.STATE;
    }

    public static LinkKind fromWireName(String name) {
        for (LinkKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        return null;
    }
}
