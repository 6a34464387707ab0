package org.opmsim.exceptions;

/**
 * A link or state refers to a node that does not exist.
 */
public class DanglingReferenceException extends DiagramException {

    public static final String ERROR_CODE = "DANGLING_REFERENCE";

    public DanglingReferenceException(String message, String elementId) {
        super(message, ERROR_CODE, elementId);
    }
}
