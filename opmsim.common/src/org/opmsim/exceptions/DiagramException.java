package org.opmsim.exceptions;

/**
 * Malformed or illegal edit of the diagram graph. Always recoverable at the call site:
 * the graph is left exactly as it was before the failed operation.
 */
public class DiagramException extends OpmProcessingException {

    public DiagramException(String message, String errorCode, String elementId) {
        super(message, errorCode, elementId);
    }

    public DiagramException(String message, Throwable cause, String errorCode, String elementId) {
        super(message, cause, errorCode, elementId);
    }
}
