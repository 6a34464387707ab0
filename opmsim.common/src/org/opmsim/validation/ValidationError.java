package org.opmsim.validation;

import java.util.Objects;

/**
 * One rejected record of an import batch.
 */
public class ValidationError {
    public final String type;
    public final String message;
    public final String elementId;
    public final String context;

    public ValidationError(String type, String message, String elementId, String context) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.message = Objects.requireNonNull(message, "message cannot be null");
        this.elementId = elementId; // Can be null
        this.context = context; // Can be null
    }

    @Override
    public String toString() {
        return String.format("[Element %s] %s: %s (Context: %s)",
                           elementId != null ? elementId : "UNKNOWN", type, message,
                           context != null ? context : "N/A");
    }
}
