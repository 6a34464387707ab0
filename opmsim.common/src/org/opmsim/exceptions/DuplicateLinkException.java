package org.opmsim.exceptions;

/**
 * A link of the same kind between the same source and target already exists.
 */
public class DuplicateLinkException extends DiagramException {

    public static final String ERROR_CODE = "DUPLICATE_LINK";

    public DuplicateLinkException(String message, String elementId) {
        super(message, ERROR_CODE, elementId);
    }
}
