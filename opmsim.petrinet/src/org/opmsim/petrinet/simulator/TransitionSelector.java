package org.opmsim.petrinet.simulator;

import java.util.List;
import java.util.Random;

import org.opmsim.petrinet.model.Marking;
import org.opmsim.petrinet.model.Transition;

/**
 * Picks which of several enabled transitions fires next.
 */
public interface TransitionSelector {

    /** First enabled transition in identifier order. */
    TransitionSelector LOWEST_ID = (enabled, marking) -> enabled.get(0);

    /**
     * @param enabled non-empty, in identifier order
     */
    Transition select(List<Transition> enabled, Marking marking);

    static TransitionSelector random(Random random) {
        return (enabled, marking) -> enabled.get(random.nextInt(enabled.size()));
    }
}
