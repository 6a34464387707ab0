package org.opmsim.exceptions;

/**
 * Base exception for all diagram engine errors.
 * Carries a machine readable error code and, where known, the identifier of the
 * element the operation was applied to.
 */
public class OpmProcessingException extends Exception {

    private final String errorCode;
    private final String elementId;

    public OpmProcessingException(String message, String errorCode, String elementId) {
        super(message);
        this.errorCode = errorCode;
        this.elementId = elementId;
    }

    public OpmProcessingException(String message, Throwable cause, String errorCode, String elementId) {
        super(message, cause);
        this.errorCode = errorCode;
        this.elementId = elementId;
    }

    public OpmProcessingException(String message) {
        super(message);
        this.errorCode = "GENERAL_ERROR";
        this.elementId = null;
    }

    public OpmProcessingException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "GENERAL_ERROR";
        this.elementId = null;
    }

    // Getters
    public String getErrorCode() {
        return errorCode;
    }

    public String getElementId() {
        return elementId;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        if (errorCode != null) {
            sb.append(" [").append(errorCode);
            if (elementId != null) {
                sb.append(":").append(elementId);
            }
            sb.append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
