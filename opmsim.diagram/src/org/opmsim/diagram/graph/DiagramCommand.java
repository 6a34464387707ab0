package org.opmsim.diagram.graph;

import org.opmsim.exceptions.DiagramException;

/**
 * A reversible edit of a {@link DiagramGraph}.
 *
 * A command starts PENDING. {@link #redo()} applies it and moves it to APPLIED,
 * {@link #undo()} reverts it back to PENDING. Calling either in the wrong state is a
 * programming error and throws {@link IllegalStateException}. A failed {@code redo()}
 * leaves the command PENDING and the graph untouched.
 */
public interface DiagramCommand {

    void redo() throws DiagramException;

    void undo() throws DiagramException;

    CommandState getState();

    String getDescription();
}
