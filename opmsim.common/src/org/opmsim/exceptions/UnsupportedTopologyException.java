package org.opmsim.exceptions;

/**
 * Thrown when a procedural link cannot be mapped onto a place/transition pair.
 */
public class UnsupportedTopologyException extends SimulationException {

    public static final String ERROR_CODE = "UNSUPPORTED_TOPOLOGY";

    public UnsupportedTopologyException(String message, String linkId) {
        super(message, ERROR_CODE, linkId);
    }
}
