package org.opmsim.petrinet.simulator;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.log4j.Logger;
import org.opmsim.constants.EngineConstants;
import org.opmsim.exceptions.NotEnabledException;
import org.opmsim.exceptions.StepLimitExceededException;
import org.opmsim.petrinet.model.Marking;
import org.opmsim.petrinet.model.PetriNet;
import org.opmsim.petrinet.model.Transition;

/**
 * Steps one net snapshot. Holds the current marking and the history of firings; the net
 * itself never changes, so later diagram edits do not affect a running simulation.
 *
 * Unless a capacity is given, places follow {@link PlaceCapacity#conditions}: a transition
 * whose output place is already marked does not fire. Firing, reset and token edits are
 * serialized, so a {@link SimulationPlayer} may step while other threads read.
 */
public class PetriNetSimulator {
    private static final Logger logger = Logger.getLogger(PetriNetSimulator.class);

    private final PetriNet net;
    private final PlaceCapacity capacity;
    private final List<FiringEvent> history = new ArrayList<>();
    private final List<SimulationListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Marking marking;

    public PetriNetSimulator(PetriNet net) {
        this(net, PlaceCapacity.conditions(net));
    }

    public PetriNetSimulator(PetriNet net, PlaceCapacity capacity) {
        this.net = Objects.requireNonNull(net, "Net cannot be null");
        this.capacity = Objects.requireNonNull(capacity, "Capacity cannot be null");
        this.marking = net.getInitialMarking();
    }

    public void addListener(SimulationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SimulationListener listener) {
        listeners.remove(listener);
    }

    public PetriNet getNet() {
        return net;
    }

    public PlaceCapacity getCapacity() {
        return capacity;
    }

    public Marking getMarking() {
        return marking;
    }

    public int getTokens(String placeId) {
        return marking.get(placeId);
    }

    /** Enabled transitions in tie-break order. */
    public List<Transition> enabled() {
        return PetriNetSemantics.enabledTransitions(net, marking, capacity);
    }

    public boolean isEnabled(String transitionId) {
        return PetriNetSemantics.isEnabled(net, marking, transitionId, capacity);
    }

    /** Transitions whose inputs are ready but whose outputs are full. */
    public List<Transition> blocked() {
        List<Transition> blocked = new ArrayList<>();
        for (Transition transition : net.getTransitions()) {
            if (PetriNetSemantics.isBlocked(net, marking, transition.getId(), capacity)) {
                blocked.add(transition);
            }
        }
        return blocked;
    }

    /** Transitions still waiting for input tokens. */
    public List<Transition> waiting() {
        List<Transition> waiting = new ArrayList<>();
        for (Transition transition : net.getTransitions()) {
            if (PetriNetSemantics.isWaiting(net, marking, transition.getId())) {
                waiting.add(transition);
            }
        }
        return waiting;
    }

    /**
     * Fires the transition. All-or-nothing: on failure the marking is unchanged.
     */
    public synchronized Marking fire(String transitionId) throws NotEnabledException {
        Marking before = marking;
        Marking after = PetriNetSemantics.fire(net, before, transitionId, capacity);
        marking = after;
        FiringEvent event = new FiringEvent(history.size() + 1, transitionId, before, after);
        history.add(event);
        logger.debug("Fired " + event);
        for (SimulationListener listener : listeners) {
            listener.transitionFired(event);
        }
        return after;
    }

    /**
     * Fires the enabled transition with the lowest identifier.
     *
     * @throws NotEnabledException if nothing can fire
     */
    public Marking step() throws NotEnabledException {
        return step(TransitionSelector.LOWEST_ID);
    }

    public Marking step(String transitionId) throws NotEnabledException {
        return fire(transitionId);
    }

    public synchronized Marking step(TransitionSelector selector) throws NotEnabledException {
        List<Transition> enabled = enabled();
        if (enabled.isEmpty()) {
            throw new NotEnabledException("No transition is enabled in " + marking, null);
        }
        Transition chosen = selector.select(Collections.unmodifiableList(enabled), marking);
        return fire(chosen.getId());
    }

    public int runToFixpoint() throws StepLimitExceededException {
        return runToFixpoint(EngineConstants.MAX_SIMULATION_STEPS);
    }

    /**
     * Steps until nothing is enabled.
     *
     * @return number of transitions fired
     * @throws StepLimitExceededException if transitions are still enabled after {@code maxSteps}
     *         firings; the marking is left as reached
     */
    public synchronized int runToFixpoint(int maxSteps) throws StepLimitExceededException {
        int fired = 0;
        while (true) {
            List<Transition> enabled = enabled();
            if (enabled.isEmpty()) {
                logger.info("Fixpoint reached after " + fired + " step(s): " + marking);
                return fired;
            }
            if (fired >= maxSteps) {
                logger.warn("Step limit " + maxSteps + " reached with " + enabled.size() + " transition(s) still enabled");
                throw new StepLimitExceededException(maxSteps);
            }
            try {
                fire(TransitionSelector.LOWEST_ID.select(enabled, marking).getId());
            } catch (NotEnabledException e) {
                throw new IllegalStateException("Transition reported enabled could not fire", e);
            }
            fired++;
        }
    }

    /**
     * Back to the initial marking; the firing history is cleared.
     */
    public synchronized void reset() {
        marking = net.getInitialMarking();
        history.clear();
        logger.info("Simulation reset: " + marking);
        for (SimulationListener listener : listeners) {
            listener.markingChanged(marking, "reset");
        }
    }

    /**
     * Manual marking edit.
     */
    public synchronized void setTokens(String placeId, int count) {
        if (!net.hasPlace(placeId)) {
            throw new IllegalArgumentException("Unknown place " + placeId);
        }
        marking = marking.with(placeId, count);
        for (SimulationListener listener : listeners) {
            listener.markingChanged(marking, "set " + placeId + "=" + count);
        }
    }

    /** Copy of the firings since construction or the last reset. */
    public synchronized List<FiringEvent> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
}
