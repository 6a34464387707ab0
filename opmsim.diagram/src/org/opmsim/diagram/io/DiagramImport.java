package org.opmsim.diagram.io;

import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.diagram.model.IdAllocator;
import org.opmsim.validation.ValidationResult;

/**
 * Outcome of a lenient import: the graph built from every valid record, an allocator
 * positioned after the highest imported id of each kind, and the rejected records.
 */
public class DiagramImport {
    private final DiagramGraph graph;
    private final IdAllocator allocator;
    private final ValidationResult validationResult;

    DiagramImport(DiagramGraph graph, IdAllocator allocator, ValidationResult validationResult) {
        this.graph = graph;
        this.allocator = allocator;
        this.validationResult = validationResult;
    }

    public DiagramGraph getGraph() {
        return graph;
    }

    public IdAllocator getAllocator() {
        return allocator;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    public boolean isClean() {
        return !validationResult.hasErrors();
    }
}
