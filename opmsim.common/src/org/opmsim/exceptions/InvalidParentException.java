package org.opmsim.exceptions;

/**
 * Owning process or parent object does not resolve to a live node of the right kind.
 */
public class InvalidParentException extends DiagramException {

    public static final String ERROR_CODE = "INVALID_PARENT";

    public InvalidParentException(String message, String elementId) {
        super(message, ERROR_CODE, elementId);
    }
}
