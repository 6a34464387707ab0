package org.opmsim.exceptions;

/**
 * Re-parenting would nest a process inside itself or one of its descendants.
 */
public class CycleDetectedException extends DiagramException {

    public static final String ERROR_CODE = "CYCLE_DETECTED";

    public CycleDetectedException(String message, String elementId) {
        super(message, ERROR_CODE, elementId);
    }
}
