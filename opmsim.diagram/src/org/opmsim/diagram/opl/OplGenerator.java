package org.opmsim.diagram.opl;

import java.util.*;

import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.diagram.model.*;

/**
 * Renders a diagram, or one element of it, as OPL sentences that {@link OplParser} reads back.
 */
public class OplGenerator {

    public static final String EMPTY_DIAGRAM = "-- OPL preview has no content yet --";

    /**
     * Whole-diagram OPL, one sentence per line: definitions, state lists, the procedural
     * sentences of each process in id order, then structural sentences.
     */
    public String generate(DiagramGraph graph) {
        List<String> lines = new ArrayList<>();

        for (Node node : graph.nodes()) {
            if (!node.isState()) {
                lines.add(definition(node));
            }
        }
        for (Node node : graph.nodes()) {
            if (node.isObject()) {
                List<String> states = new ArrayList<>();
                for (Node state : graph.statesOf(node.getId())) {
                    states.add(state.getLabel());
                }
                if (!states.isEmpty()) {
                    lines.add(node.getLabel() + " can be " + joinStates(states) + ".");
                }
            }
        }

        List<Node> processes = new ArrayList<>();
        for (Node node : graph.nodes()) {
            if (node.isProcess()) {
                processes.add(node);
            }
        }
        processes.sort((a, b) -> Identifiers.ORDER.compare(a.getId(), b.getId()));
        for (Node process : processes) {
            appendProcessSentences(graph, process, lines);
        }

        appendStructural(graph, lines);
        return lines.isEmpty() ? EMPTY_DIAGRAM : String.join("\n", lines);
    }

    /**
     * Single sentence for a node: its definition, or for a state the state itself.
     */
    public String describe(DiagramGraph graph, Node node) {
        if (node.isState()) {
            Node parent = graph.findNode(node.getParentObjectId());
            String owner = parent == null ? "?" : parent.getLabel();
            return owner + " can be " + node.getLabel() + ".";
        }
        return definition(node);
    }

    /**
     * Single sentence for a link.
     */
    public String describe(DiagramGraph graph, Link link) {
        String source = name(graph, link.getSourceId());
        String target = name(graph, link.getTargetId());
        switch (link.getKind()) {
            case CONSUMPTION:
                return target + " consumes " + source + ".";
            case RESULT:
                return source + " yields " + target + ".";
            case EFFECT:
                Node sourceNode = graph.findNode(link.getSourceId());
                return sourceNode != null && sourceNode.isProcess()
                        ? source + " affects " + target + "."
                        : target + " affects " + source + ".";
            case AGENT:
                return source + " handles " + target + ".";
            case INSTRUMENT:
                return target + " requires " + source + ".";
            case AGGREGATION:
                return target + " consists of " + source + ".";
            case EXHIBITION:
                return target + " exhibits " + source + ".";
            case GENERALIZATION:
                return target + " generalizes " + source + ".";
            case INSTANTIATION:
                return target + " has instances " + source + ".";
            default:
                throw new IllegalArgumentException("Unhandled link kind " + link.getKind());
        }
    }

    private void appendProcessSentences(DiagramGraph graph, Node process, List<String> lines) {
        String name = process.getLabel();
        List<String> consumes = new ArrayList<>();
        List<String> yields = new ArrayList<>();
        List<String> affects = new ArrayList<>();
        List<String> agents = new ArrayList<>();
        List<String> instruments = new ArrayList<>();
        List<String> stateSentences = new ArrayList<>();
        // object label -> [from state, to state]
        Map<String, String[]> changes = new LinkedHashMap<>();

        for (Link link : graph.linksOf(process.getId())) {
            boolean incoming = link.getTargetId().equals(process.getId());
            Node other = graph.findNode(incoming ? link.getSourceId() : link.getTargetId());
            if (other == null || other.isProcess()) {
                continue;
            }
            switch (link.getKind()) {
                case CONSUMPTION:
                    if (other.isState()) {
                        changes.computeIfAbsent(parentLabel(graph, other), k -> new String[2])[0] = other.getLabel();
                    } else {
                        consumes.add(other.getLabel());
                    }
                    break;
                case RESULT:
                    if (other.isState()) {
                        changes.computeIfAbsent(parentLabel(graph, other), k -> new String[2])[1] = other.getLabel();
                    } else {
                        yields.add(other.getLabel());
                    }
                    break;
                case EFFECT:
                    affects.add(name(graph, other.getId()));
                    break;
                case AGENT:
                    agents.add(name(graph, other.getId()));
                    break;
                case INSTRUMENT:
                    instruments.add(name(graph, other.getId()));
                    break;
                default:
                    break;
            }
        }

        for (Map.Entry<String, String[]> entry : changes.entrySet()) {
            String from = entry.getValue()[0];
            String to = entry.getValue()[1];
            if (from != null && to != null) {
                stateSentences.add(name + " changes " + entry.getKey() + " from " + from + " to " + to + ".");
            } else if (from != null) {
                stateSentences.add(name + " consumes " + entry.getKey() + " at state " + from + ".");
            } else {
                stateSentences.add(name + " yields " + entry.getKey() + " at state " + to + ".");
            }
        }

        lines.addAll(stateSentences);
        if (!consumes.isEmpty()) {
            lines.add(name + " takes " + join(consumes) + " as input.");
        }
        if (!yields.isEmpty()) {
            lines.add(name + " yields " + join(yields) + ".");
        }
        if (!affects.isEmpty()) {
            lines.add(name + " affects " + join(affects) + ".");
        }
        if (!agents.isEmpty()) {
            lines.add(join(agents) + " handles " + name + ".");
        }
        if (!instruments.isEmpty()) {
            lines.add(name + " requires " + join(instruments) + ".");
        }
    }

    private void appendStructural(DiagramGraph graph, List<String> lines) {
        Map<LinkKind, Map<String, List<String>>> byKind = new EnumMap<>(LinkKind.class);
        for (Link link : graph.links()) {
            if (!link.getKind().isStructural()) {
                continue;
            }
            byKind.computeIfAbsent(link.getKind(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(name(graph, link.getTargetId()), k -> new ArrayList<>())
                    .add(name(graph, link.getSourceId()));
        }
        for (Map.Entry<LinkKind, Map<String, List<String>>> kindEntry : byKind.entrySet()) {
            String verb = structuralVerb(kindEntry.getKey());
            for (Map.Entry<String, List<String>> entry : kindEntry.getValue().entrySet()) {
                List<String> refinements = new ArrayList<>(entry.getValue());
                Collections.sort(refinements);
                lines.add(entry.getKey() + " " + verb + " " + join(refinements) + ".");
            }
        }
    }

    private static String structuralVerb(LinkKind kind) {
        switch (kind) {
            case AGGREGATION:
                return "consists of";
            case EXHIBITION:
                return "exhibits";
            case GENERALIZATION:
                return "generalizes";
            default:
                return "has instances";
        }
    }

    private static String definition(Node node) {
        String essence = node.getEssence().getWireName();
        String article = essence.startsWith("i") ? "an" : "a";
        return node.getLabel() + " is " + article + " " + essence + " and "
                + node.getAffiliation().getWireName() + " " + node.getKind().getWireName() + ".";
    }

    /** Label of the node; states read as "Object at state s". */
    private static String name(DiagramGraph graph, String nodeId) {
        Node node = graph.findNode(nodeId);
        if (node == null) {
            return "?";
        }
        if (node.isState()) {
            return parentLabel(graph, node) + " at state " + node.getLabel();
        }
        return node.getLabel();
    }

    private static String parentLabel(DiagramGraph graph, Node state) {
        Node parent = graph.findNode(state.getParentObjectId());
        return parent == null ? "?" : parent.getLabel();
    }

    /** 'A, B and C' */
    static String join(List<String> names) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(names));
        if (unique.isEmpty()) {
            return "";
        }
        if (unique.size() == 1) {
            return unique.get(0);
        }
        return String.join(", ", unique.subList(0, unique.size() - 1)) + " and " + unique.get(unique.size() - 1);
    }

    /** 'A, B or C' */
    static String joinStates(List<String> names) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(names));
        if (unique.size() == 1) {
            return unique.get(0);
        }
        return String.join(", ", unique.subList(0, unique.size() - 1)) + " or " + unique.get(unique.size() - 1);
    }
}
