package org.opmsim.exceptions;

import org.opmsim.validation.ValidationError;
import org.opmsim.validation.ValidationResult;

/**
 * Raised by strict imports when one or more records were rejected.
 * Lists every rejected record, not only the first.
 */
public class DiagramImportException extends DiagramException {

    public static final String ERROR_CODE = "IMPORT_FAILED";

    private final ValidationResult validationResult;

    public DiagramImportException(String message, ValidationResult validationResult) {
        super(message, ERROR_CODE, null);
        this.validationResult = validationResult;
    }

    public DiagramImportException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE, null);
        this.validationResult = new ValidationResult();
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    /**
     * Create a detailed error message for logging/debugging
     */
    public String getDetailedErrorMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Diagram import error: ").append(getMessage()).append("\n");
        for (ValidationError error : validationResult.getErrors()) {
            sb.append("  ").append(error).append("\n");
        }
        if (getCause() != null) {
            sb.append("Underlying Cause: ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
