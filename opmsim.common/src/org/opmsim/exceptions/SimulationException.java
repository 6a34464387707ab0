package org.opmsim.exceptions;

/**
 * Simulation domain error raised while building, firing or analysing a Petri net.
 */
public class SimulationException extends OpmProcessingException {

    public SimulationException(String message, String errorCode, String elementId) {
        super(message, errorCode, elementId);
    }
}
