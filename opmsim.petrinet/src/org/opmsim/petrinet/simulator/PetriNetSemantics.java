package org.opmsim.petrinet.simulator;

import java.util.*;

import org.opmsim.exceptions.NotEnabledException;
import org.opmsim.petrinet.model.*;

/**
 * Firing rule of the derived nets, as pure functions over immutable markings.
 *
 * A transition is enabled when every input and test place holds at least the arc weight.
 * A transition with neither input nor test arcs is never enabled, so a process that only
 * produces does not fire forever.
 */
public final class PetriNetSemantics {

    private PetriNetSemantics() {
    }

    public static boolean isEnabled(PetriNet net, Marking marking, String transitionId) {
        Map<String, Integer> required = requirements(net, transitionId);
        if (required.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, Integer> entry : required.entrySet()) {
            if (marking.get(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Enabled and no output place would go over its capacity.
     */
    public static boolean isEnabled(PetriNet net, Marking marking, String transitionId, PlaceCapacity capacity) {
        return isEnabled(net, marking, transitionId) && !exceedsCapacity(net, marking, transitionId, capacity);
    }

    /**
     * Inputs are satisfied but firing would overfill an output place.
     */
    public static boolean isBlocked(PetriNet net, Marking marking, String transitionId, PlaceCapacity capacity) {
        return isEnabled(net, marking, transitionId) && exceedsCapacity(net, marking, transitionId, capacity);
    }

    /**
     * Has inputs, but they are not all satisfied yet.
     */
    public static boolean isWaiting(PetriNet net, Marking marking, String transitionId) {
        return !requirements(net, transitionId).isEmpty() && !isEnabled(net, marking, transitionId);
    }

    public static List<Transition> enabledTransitions(PetriNet net, Marking marking) {
        return enabledTransitions(net, marking, PlaceCapacity.UNBOUNDED);
    }

    /** Enabled transitions in tie-break order. */
    public static List<Transition> enabledTransitions(PetriNet net, Marking marking, PlaceCapacity capacity) {
        List<Transition> enabled = new ArrayList<>();
        for (Transition transition : net.getTransitions()) {
            if (isEnabled(net, marking, transition.getId(), capacity)) {
                enabled.add(transition);
            }
        }
        return enabled;
    }

    public static Marking fire(PetriNet net, Marking marking, String transitionId) throws NotEnabledException {
        return fire(net, marking, transitionId, PlaceCapacity.UNBOUNDED);
    }

    /**
     * Removes input tokens and adds output tokens in one step. Test places keep their tokens.
     *
     * @throws NotEnabledException if the transition is unknown or not enabled; nothing changes
     */
    public static Marking fire(PetriNet net, Marking marking, String transitionId, PlaceCapacity capacity)
            throws NotEnabledException {
        if (net.getTransition(transitionId) == null) {
            throw new NotEnabledException("Unknown transition " + transitionId, transitionId);
        }
        if (!isEnabled(net, marking, transitionId, capacity)) {
            throw new NotEnabledException("Transition " + transitionId + " is not enabled in " + marking, transitionId);
        }
        Marking next = marking;
        for (Arc arc : net.arcsOf(transitionId, ArcType.INPUT)) {
            next = next.add(arc.getPlaceId(), -arc.getWeight());
        }
        for (Arc arc : net.arcsOf(transitionId, ArcType.OUTPUT)) {
            next = next.add(arc.getPlaceId(), arc.getWeight());
        }
        return next;
    }

    /** Tokens each place must hold for the transition to fire. */
    private static Map<String, Integer> requirements(PetriNet net, String transitionId) {
        Map<String, Integer> inputs = new HashMap<>();
        Map<String, Integer> tests = new HashMap<>();
        for (Arc arc : net.arcsOf(transitionId)) {
            if (arc.getType() == ArcType.INPUT) {
                inputs.merge(arc.getPlaceId(), arc.getWeight(), Integer::sum);
            } else if (arc.getType() == ArcType.TEST) {
                tests.merge(arc.getPlaceId(), arc.getWeight(), Math::max);
            }
        }
        Map<String, Integer> required = new HashMap<>(inputs);
        for (Map.Entry<String, Integer> entry : tests.entrySet()) {
            required.merge(entry.getKey(), entry.getValue(), Math::max);
        }
        return required;
    }

    private static boolean exceedsCapacity(PetriNet net, Marking marking, String transitionId,
                                           PlaceCapacity capacity) {
        Map<String, Integer> delta = new HashMap<>();
        for (Arc arc : net.arcsOf(transitionId)) {
            if (arc.getType() == ArcType.INPUT) {
                delta.merge(arc.getPlaceId(), -arc.getWeight(), Integer::sum);
            } else if (arc.getType() == ArcType.OUTPUT) {
                delta.merge(arc.getPlaceId(), arc.getWeight(), Integer::sum);
            }
        }
        for (Map.Entry<String, Integer> entry : delta.entrySet()) {
            if (entry.getValue() > 0
                    && (long) marking.get(entry.getKey()) + entry.getValue() > capacity.capacityOf(entry.getKey())) {
                return true;
            }
        }
        return false;
    }
}
