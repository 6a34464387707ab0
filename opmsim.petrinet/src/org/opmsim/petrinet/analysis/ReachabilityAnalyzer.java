package org.opmsim.petrinet.analysis;

import java.util.*;

import org.apache.log4j.Logger;
import org.opmsim.constants.EngineConstants;
import org.opmsim.exceptions.NotEnabledException;
import org.opmsim.exceptions.StateSpaceTooLargeException;
import org.opmsim.petrinet.model.Marking;
import org.opmsim.petrinet.model.PetriNet;
import org.opmsim.petrinet.model.Transition;
import org.opmsim.petrinet.simulator.PetriNetSemantics;
import org.opmsim.petrinet.simulator.PlaceCapacity;

/**
 * Breadth-first exploration of the markings a net can reach.
 */
public final class ReachabilityAnalyzer {
    private static final Logger logger = Logger.getLogger(ReachabilityAnalyzer.class);

    private ReachabilityAnalyzer() {
    }

    public static ReachabilityGraph analyze(PetriNet net, Marking initial) throws StateSpaceTooLargeException {
        return analyze(net, initial, EngineConstants.REACHABILITY_NODE_CAP);
    }

    /**
     * Explores under {@link PlaceCapacity#conditions}, the same rule the simulator uses.
     */
    public static ReachabilityGraph analyze(PetriNet net, Marking initial, int nodeCap)
            throws StateSpaceTooLargeException {
        return analyze(net, initial, nodeCap, PlaceCapacity.conditions(net));
    }

    /**
     * Explores every marking reachable from {@code initial}, firing enabled transitions in
     * identifier order. Pass {@link PlaceCapacity#UNBOUNDED} for plain place/transition
     * semantics.
     *
     * @throws StateSpaceTooLargeException once more than {@code nodeCap} distinct markings are found
     */
    public static ReachabilityGraph analyze(PetriNet net, Marking initial, int nodeCap, PlaceCapacity capacity)
            throws StateSpaceTooLargeException {
        if (nodeCap < 1) {
            throw new IllegalArgumentException("Node cap must be positive: " + nodeCap);
        }
        List<Marking> discovered = new ArrayList<>();
        Set<Marking> seen = new HashSet<>();
        List<ReachabilityGraph.Edge> edges = new ArrayList<>();
        Deque<Marking> queue = new ArrayDeque<>();

        discovered.add(initial);
        seen.add(initial);
        queue.add(initial);

        while (!queue.isEmpty()) {
            Marking current = queue.poll();
            for (Transition transition : PetriNetSemantics.enabledTransitions(net, current, capacity)) {
                Marking next;
                try {
                    next = PetriNetSemantics.fire(net, current, transition.getId(), capacity);
                } catch (NotEnabledException e) {
                    throw new IllegalStateException("Transition reported enabled could not fire", e);
                }
                edges.add(new ReachabilityGraph.Edge(current, transition.getId(), next));
                if (seen.add(next)) {
                    if (discovered.size() >= nodeCap) {
                        logger.warn("Reachability exploration stopped at " + nodeCap + " markings");
                        throw new StateSpaceTooLargeException(nodeCap);
                    }
                    discovered.add(next);
                    queue.add(next);
                }
            }
        }

        ReachabilityGraph graph = new ReachabilityGraph(discovered, edges);
        logger.info("Reachability analysis of " + net + ": " + graph);
        return graph;
    }
}
