package org.opmsim.petrinet;

import java.util.List;

import org.apache.log4j.Logger;
import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.exceptions.NotEnabledException;
import org.opmsim.exceptions.StateSpaceTooLargeException;
import org.opmsim.exceptions.UnsupportedTopologyException;
import org.opmsim.petrinet.analysis.ReachabilityAnalyzer;
import org.opmsim.petrinet.analysis.ReachabilityGraph;
import org.opmsim.petrinet.converter.OpmToPetriNetConverter;
import org.opmsim.petrinet.model.Marking;
import org.opmsim.petrinet.model.PetriNet;
import org.opmsim.petrinet.model.Transition;
import org.opmsim.petrinet.simulator.PetriNetSemantics;
import org.opmsim.petrinet.simulator.PlaceCapacity;
import org.opmsim.petrinet.simulator.TransitionSelector;

/**
 * Stateless entry points for building, stepping and analysing the net of a diagram.
 * For a stateful session with history and listeners use
 * {@link org.opmsim.petrinet.simulator.PetriNetSimulator}.
 */
public final class Simulation {
    private static final Logger logger = Logger.getLogger(Simulation.class);

    private Simulation() {
    }

    /**
     * Net of one view; a null view id converts the whole diagram.
     */
    public static PetriNet buildPetriNet(DiagramGraph graph, String viewProcessId)
            throws UnsupportedTopologyException {
        OpmToPetriNetConverter converter = new OpmToPetriNetConverter();
        return viewProcessId == null ? converter.convert(graph) : converter.convert(graph, viewProcessId);
    }

    public static Marking step(PetriNet net, Marking marking) throws NotEnabledException {
        return step(net, marking, TransitionSelector.LOWEST_ID);
    }

    public static Marking step(PetriNet net, Marking marking, TransitionSelector selector)
            throws NotEnabledException {
        return step(net, marking, selector, PlaceCapacity.conditions(net));
    }

    /**
     * Fires one enabled transition chosen by {@code selector}.
     *
     * @throws NotEnabledException if no transition is enabled
     */
    public static Marking step(PetriNet net, Marking marking, TransitionSelector selector, PlaceCapacity capacity)
            throws NotEnabledException {
        List<Transition> enabled = PetriNetSemantics.enabledTransitions(net, marking, capacity);
        if (enabled.isEmpty()) {
            throw new NotEnabledException("No transition is enabled in " + marking, null);
        }
        Transition chosen = selector.select(enabled, marking);
        logger.debug("Stepping " + chosen.getId() + " from " + marking);
        return PetriNetSemantics.fire(net, marking, chosen.getId(), capacity);
    }

    public static Marking reset(PetriNet net) {
        return net.getInitialMarking();
    }

    public static ReachabilityGraph reachability(PetriNet net, Marking initial, int nodeCap)
            throws StateSpaceTooLargeException {
        return ReachabilityAnalyzer.analyze(net, initial, nodeCap);
    }

    public static ReachabilityGraph reachability(PetriNet net, Marking initial, int nodeCap, PlaceCapacity capacity)
            throws StateSpaceTooLargeException {
        return ReachabilityAnalyzer.analyze(net, initial, nodeCap, capacity);
    }
}
