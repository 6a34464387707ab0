package org.opmsim.validation;

import java.util.*;
import org.apache.log4j.Logger;

/**
 * Collects every malformed record of an import instead of stopping at the first one.
 */
public class ValidationResult {
    private static final Logger logger = Logger.getLogger(ValidationResult.class);

    private final List<ValidationError> errors = new ArrayList<>();

    public void addError(String type, String message, String elementId, String context) {
        errors.add(new ValidationError(type, message, elementId, context));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationError> getErrors(String type) {
        List<ValidationError> matching = new ArrayList<>();
        for (ValidationError error : errors) {
            if (error.type.equals(type)) {
                matching.add(error);
            }
        }
        return matching;
    }

    public void reportErrors() {
        if (errors.isEmpty()) {
            return;
        }

        logger.warn("=== DIAGRAM VALIDATION ERRORS ===");
        logger.warn("Found " + errors.size() + " validation errors:");

        // Group errors by type
        Map<String, List<ValidationError>> errorsByType = new TreeMap<>();
        for (ValidationError error : errors) {
            errorsByType.computeIfAbsent(error.type, k -> new ArrayList<>()).add(error);
        }

        for (Map.Entry<String, List<ValidationError>> entry : errorsByType.entrySet()) {
            logger.warn("--- " + entry.getKey() + " (" + entry.getValue().size() + " errors) ---");
            for (ValidationError error : entry.getValue()) {
                logger.warn("  " + error);
            }
        }

        logger.warn("=== END DIAGRAM VALIDATION ERRORS ===");
    }

    public void clear() {
        errors.clear();
    }
}
