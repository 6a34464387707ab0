package org.opmsim.exceptions;

/**
 * Thrown when reachability exploration discovers more distinct markings than the node cap allows.
 * Expected for nets with unbounded token growth.
 */
public class StateSpaceTooLargeException extends SimulationException {

    public static final String ERROR_CODE = "STATE_SPACE_TOO_LARGE";

    private final int nodeCap;

    public StateSpaceTooLargeException(int nodeCap) {
        super("Reachability graph exceeds " + nodeCap + " markings", ERROR_CODE, null);
        this.nodeCap = nodeCap;
    }

    public int getNodeCap() {
        return nodeCap;
    }
}
