package org.opmsim.exceptions;

/**
 * Thrown when a transition is fired (or a step requested) while its preconditions do not hold.
 * The element id is the transition id, or null when no transition at all was fireable.
 */
public class NotEnabledException extends SimulationException {

    public static final String ERROR_CODE = "NOT_ENABLED";

    public NotEnabledException(String message, String transitionId) {
        super(message, ERROR_CODE, transitionId);
    }
}
