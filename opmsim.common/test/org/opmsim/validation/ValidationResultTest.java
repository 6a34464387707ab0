package org.opmsim.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ValidationResultTest {

    @Test
    void emptyResultHasNoErrors() {
        ValidationResult result = new ValidationResult();
        assertFalse(result.hasErrors());
        assertEquals(0, result.getErrorCount());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void errorsAreFilteredByType() {
        ValidationResult result = new ValidationResult();
        result.addError("MISSING_FIELD", "Node has no id", null, "nodes[0]");
        result.addError("UNKNOWN_KIND", "Unknown node kind 'blob'", "object_4", "nodes[1]");
        result.addError("MISSING_FIELD", "Link has no source", "link_2", "links[0]");

        assertTrue(result.hasErrors());
        assertEquals(3, result.getErrorCount());
        assertEquals(2, result.getErrors("MISSING_FIELD").size());
        assertEquals("object_4", result.getErrors("UNKNOWN_KIND").get(0).elementId);
        assertTrue(result.getErrors("BAD_VALUE").isEmpty());
    }

    @Test
    void clearDropsEveryError() {
        ValidationResult result = new ValidationResult();
        result.addError("BAD_VALUE", "Width is not a number", "process_1", "nodes[3]");
        result.reportErrors();
        result.clear();
        assertFalse(result.hasErrors());
    }

    @Test
    void errorTextNamesTypeAndElement() {
        ValidationError error = new ValidationError("BAD_CARDINALITY", "Malformed cardinality 'x'", "link_9", "links[2]");
        String text = error.toString();
        assertTrue(text.contains("BAD_CARDINALITY"), text);
        assertTrue(text.contains("link_9"), text);
    }
}
