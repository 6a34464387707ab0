package org.opmsim.exceptions;

/**
 * No live element carries the given identifier.
 */
public class NotFoundException extends DiagramException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String message, String elementId) {
        super(message, ERROR_CODE, elementId);
    }
}
