package org.opmsim.petrinet.simulator;

import org.opmsim.petrinet.model.Marking;

public interface SimulationListener {

    void transitionFired(FiringEvent event);

    /** Marking replaced by reset or a manual token edit. */
    default void markingChanged(Marking marking, String reason) {
    }
}
