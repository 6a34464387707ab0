package org.opmsim.diagram.graph;

/**
 * Outcome of {@link CommandEngine#undo()} and {@link CommandEngine#redo()}.
 * The two NOTHING values are normal results, not errors.
 */
public enum CommandResult {
    UNDONE,
    REDONE,
    NOTHING_TO_UNDO,
    NOTHING_TO_REDO
}
