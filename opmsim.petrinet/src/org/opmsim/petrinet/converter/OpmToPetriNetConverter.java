package org.opmsim.petrinet.converter;

import java.util.*;

import org.apache.log4j.Logger;
import org.opmsim.constants.EngineConstants;
import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.diagram.model.*;
import org.opmsim.exceptions.UnsupportedTopologyException;
import org.opmsim.petrinet.model.ArcType;
import org.opmsim.petrinet.model.PetriNet;
import org.opmsim.petrinet.model.Place;
import org.opmsim.petrinet.model.Transition;

/**
 * Derives a Petri net from a diagram, or from one zoom-in view of it.
 *
 * <ul>
 * <li>stateless object: one place {@code place_<object>}</li>
 * <li>object with states: {@code place_<object>_<state>} per state plus the "no state"
 *     place {@code place_<object>} for links attached to the object itself</li>
 * <li>process: transition {@code transition_<process>}</li>
 * <li>consumption: input arc; result: output arc; effect: input and output arc;
 *     agent and instrument: test arcs, or input arcs under {@link ArcPolicy#CONSUME}</li>
 * </ul>
 *
 * Structural links are ignored. Initial marking: one token per stateless object that no
 * result link produces, one per state flagged initial, none elsewhere.
 *
 * An object with an initial state always sits in exactly one of its places. When a process
 * yields such an object into one of its places without taking its token, the process becomes
 * one transition per place the token can come from, {@code transition_<process>_from_<place>},
 * each moving the token. A process that puts the same object into two places at once is
 * rejected. An object with no initial state is created by the first result into it.
 *
 * The converter only reads the graph; the returned net is a snapshot.
 */
public class OpmToPetriNetConverter {
    private static final Logger logger = Logger.getLogger(OpmToPetriNetConverter.class);

    public static final String PLACE_PREFIX = "place_";
    public static final String TRANSITION_PREFIX = "transition_";

    private final ArcPolicy arcPolicy;

    public OpmToPetriNetConverter() {
        this(ArcPolicy.fromName(EngineConstants.ENABLER_ARCS));
    }

    public OpmToPetriNetConverter(ArcPolicy arcPolicy) {
        this.arcPolicy = arcPolicy;
    }

    public ArcPolicy getArcPolicy() {
        return arcPolicy;
    }

    /**
     * Converts the whole diagram, every view included.
     */
    public PetriNet convert(DiagramGraph graph) throws UnsupportedTopologyException {
        return build(graph, new ArrayList<>(graph.nodes()), "whole diagram");
    }

    /**
     * Converts a single view: the nodes whose owning process is {@code viewProcessId}
     * (null for the root view). Links leaving the view are left out.
     */
    public PetriNet convert(DiagramGraph graph, String viewProcessId) throws UnsupportedTopologyException {
        return build(graph, graph.childrenOf(viewProcessId),
                viewProcessId == null ? "root view" : "view of " + viewProcessId);
    }

    public static String placeId(String objectId) {
        return PLACE_PREFIX + objectId;
    }

    public static String placeId(String objectId, String stateId) {
        return PLACE_PREFIX + objectId + "_" + stateId;
    }

    public static String transitionId(String processId) {
        return TRANSITION_PREFIX + processId;
    }

    private PetriNet build(DiagramGraph graph, List<Node> scope, String scopeName)
            throws UnsupportedTopologyException {
        Map<String, Node> inScope = new HashMap<>();
        for (Node node : scope) {
            inScope.put(node.getId(), node);
        }

        List<Node> objects = new ArrayList<>();
        List<Node> processes = new ArrayList<>();
        for (Node node : scope) {
            if (node.isObject()) {
                objects.add(node);
            } else if (node.isProcess()) {
                processes.add(node);
            }
        }
        Comparator<Node> byId = (a, b) -> Identifiers.ORDER.compare(a.getId(), b.getId());
        objects.sort(byId);
        processes.sort(byId);

        Set<String> produced = new HashSet<>();
        for (Link link : graph.links()) {
            if (link.getKind() == LinkKind.RESULT && inScope.containsKey(link.getSourceId())
                    && inScope.containsKey(link.getTargetId())) {
                produced.add(link.getTargetId());
            }
        }

        PetriNet.Builder builder = PetriNet.builder();
        Map<String, List<String>> objectPlaces = new LinkedHashMap<>();
        Set<String> markedObjects = new HashSet<>();
        for (Node object : objects) {
            List<Node> states = new ArrayList<>();
            for (Node state : graph.statesOf(object.getId())) {
                if (inScope.containsKey(state.getId())) {
                    states.add(state);
                }
            }
            String plainPlace = placeId(object.getId());
            builder.addPlace(new Place(plainPlace, object.getLabel(), object.getId(), null));
            if (states.isEmpty()) {
                builder.setInitialTokens(plainPlace, produced.contains(object.getId()) ? 0 : 1);
                continue;
            }
            states.sort(byId);
            List<String> places = new ArrayList<>();
            places.add(plainPlace);
            for (Node state : states) {
                String statePlace = placeId(object.getId(), state.getId());
                places.add(statePlace);
                if (state.isInitial()) {
                    markedObjects.add(object.getId());
                }
                builder.addPlace(new Place(statePlace, object.getLabel() + " (" + state.getLabel() + ")",
                        object.getId(), state.getId()));
                builder.setInitialTokens(statePlace, state.isInitial() ? 1 : 0);
            }
            objectPlaces.put(object.getId(), places);
        }
        Map<String, List<PendingArc>> arcsByProcess = new HashMap<>();
        for (Node process : processes) {
            arcsByProcess.put(process.getId(), new ArrayList<PendingArc>());
        }
        for (Link link : graph.links()) {
            if (!link.getKind().isProcedural()) {
                continue;
            }
            Node source = inScope.get(link.getSourceId());
            Node target = inScope.get(link.getTargetId());
            if (source == null || target == null) {
                logger.debug("Link " + link.getId() + " crosses the " + scopeName + " boundary, skipped");
                continue;
            }
            collectArcs(arcsByProcess, graph, inScope, link, source, target);
        }

        int arcCount = 0;
        for (Node process : processes) {
            arcCount += addTransitions(builder, process, arcsByProcess.get(process.getId()),
                    objectPlaces, markedObjects);
        }

        PetriNet net = builder.build();
        logger.info("Built Petri net for " + scopeName + ": " + net.getPlaces().size() + " places, "
                + net.getTransitions().size() + " transitions, " + arcCount + " arcs (" + arcPolicy + " enablers)");
        return net;
    }

    /**
     * Adds the transitions of one process with their arcs.
     *
     * @return number of arcs added
     */
    private int addTransitions(PetriNet.Builder builder, Node process, List<PendingArc> arcs,
                               Map<String, List<String>> objectPlaces, Set<String> markedObjects)
            throws UnsupportedTopologyException {
        List<List<String>> sourceChoices = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : objectPlaces.entrySet()) {
            List<String> places = entry.getValue();
            Set<String> taken = new TreeSet<>();
            Set<String> given = new TreeSet<>();
            for (PendingArc arc : arcs) {
                if (!places.contains(arc.placeId)) {
                    continue;
                }
                if (arc.type == ArcType.INPUT) {
                    taken.add(arc.placeId);
                } else if (arc.type == ArcType.OUTPUT) {
                    given.add(arc.placeId);
                }
            }
            if (given.size() > Math.max(1, taken.size())) {
                throw new UnsupportedTopologyException("Process " + process.getId() + " puts object " + entry.getKey()
                        + " into " + given.size() + " places at once: " + given, process.getId());
            }
            if (given.isEmpty() || !taken.isEmpty() || !markedObjects.contains(entry.getKey())) {
                continue;
            }
            List<String> sources = new ArrayList<>(places);
            sources.removeAll(given);
            sourceChoices.add(sources);
        }

        if (sourceChoices.isEmpty()) {
            String transition = transitionId(process.getId());
            builder.addTransition(new Transition(transition, process.getLabel(), process.getId()));
            return addPendingArcs(builder, transition, arcs);
        }

        List<List<String>> variants = combinations(sourceChoices);
        int count = 0;
        for (List<String> sources : variants) {
            StringBuilder id = new StringBuilder(transitionId(process.getId()));
            for (String source : sources) {
                id.append("_from_").append(source);
            }
            String transition = id.toString();
            builder.addTransition(new Transition(transition, process.getLabel(), process.getId()));
            for (String source : sources) {
                builder.addArc(source, transition, ArcType.INPUT, 1);
                count++;
            }
            count += addPendingArcs(builder, transition, arcs);
        }
        logger.debug("Process " + process.getId() + " moves a stateful object, split into " + variants.size()
                + " transitions");
        return count;
    }

    private static int addPendingArcs(PetriNet.Builder builder, String transition, List<PendingArc> arcs) {
        for (PendingArc arc : arcs) {
            builder.addArc(arc.placeId, transition, arc.type, arc.weight);
        }
        return arcs.size();
    }

    /** Every way of picking one entry from each list, in list order. */
    private static List<List<String>> combinations(List<List<String>> choices) {
        List<List<String>> result = new ArrayList<>();
        result.add(new ArrayList<String>());
        for (List<String> options : choices) {
            List<List<String>> next = new ArrayList<>();
            for (List<String> prefix : result) {
                for (String option : options) {
                    List<String> extended = new ArrayList<>(prefix);
                    extended.add(option);
                    next.add(extended);
                }
            }
            result = next;
        }
        return result;
    }

    private void collectArcs(Map<String, List<PendingArc>> arcsByProcess, DiagramGraph graph,
                             Map<String, Node> inScope, Link link, Node source, Node target)
            throws UnsupportedTopologyException {
        boolean processIsTarget = target.isProcess() && !source.isProcess();
        boolean processIsSource = source.isProcess() && !target.isProcess();
        if (!processIsTarget && !processIsSource) {
            throw new UnsupportedTopologyException("Procedural link " + link.getId() + " needs exactly one process end, "
                    + "got " + source.getKind() + " -> " + target.getKind(), link.getId());
        }
        Node process = processIsTarget ? target : source;
        Node thing = processIsTarget ? source : target;
        String place = placeFor(graph, inScope, link, thing);
        List<PendingArc> arcs = arcsByProcess.get(process.getId());
        Cardinality cardinality = processIsTarget ? link.getSourceCardinality() : link.getTargetCardinality();
        int weight = cardinality != null && cardinality.isExact() && cardinality.getLower() >= 1
                ? cardinality.getLower() : 1;

        switch (link.getKind()) {
            case CONSUMPTION:
                arcs.add(new PendingArc(place, ArcType.INPUT, weight));
                break;
            case RESULT:
                arcs.add(new PendingArc(place, ArcType.OUTPUT, weight));
                break;
            case EFFECT:
                arcs.add(new PendingArc(place, ArcType.INPUT, weight));
                arcs.add(new PendingArc(place, ArcType.OUTPUT, weight));
                break;
            case AGENT:
            case INSTRUMENT:
                arcs.add(new PendingArc(place, arcPolicy == ArcPolicy.TEST ? ArcType.TEST : ArcType.INPUT, weight));
                break;
            default:
                throw new UnsupportedTopologyException("Unsupported procedural link kind " + link.getKind(), link.getId());
        }
    }

    private String placeFor(DiagramGraph graph, Map<String, Node> inScope, Link link, Node thing)
            throws UnsupportedTopologyException {
        if (thing.isObject()) {
            return placeId(thing.getId());
        }
        String parentId = thing.getParentObjectId();
        Node parent = parentId == null ? null : graph.findNode(parentId);
        if (parent == null || !parent.isObject() || !inScope.containsKey(parentId)) {
            throw new UnsupportedTopologyException("State " + thing.getId() + " of link " + link.getId()
                    + " has no parent object to place it in", link.getId());
        }
        return placeId(parentId, thing.getId());
    }

    private static final class PendingArc {
        private final String placeId;
        private final ArcType type;
        private final int weight;

        PendingArc(String placeId, ArcType type, int weight) {
            this.placeId = placeId;
            this.type = type;
            this.weight = weight;
        }
    }
}
