package org.opmsim.exceptions;

/**
 * The kinds of a link's endpoints are not allowed for the link's kind.
 */
public class IncompatibleEndpointsException extends DiagramException {

    public static final String ERROR_CODE = "INCOMPATIBLE_ENDPOINTS";

    public IncompatibleEndpointsException(String message, String elementId) {
        super(message, ERROR_CODE, elementId);
    }
}
