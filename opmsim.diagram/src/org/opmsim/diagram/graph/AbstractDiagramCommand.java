package org.opmsim.diagram.graph;

import org.apache.log4j.Logger;
import org.opmsim.exceptions.DiagramException;

/**
 * Holds the PENDING/APPLIED state machine so concrete commands only describe
 * the forward and backward graph edits.
 */
public abstract class AbstractDiagramCommand implements DiagramCommand {
    private static final Logger logger = Logger.getLogger(AbstractDiagramCommand.class);

    private final String description;
    private CommandState state = CommandState.PENDING;

    protected AbstractDiagramCommand(String description) {
        this.description = description;
    }

    @Override
    public final void redo() throws DiagramException {
        if (state != CommandState.PENDING) {
            throw new IllegalStateException("Cannot apply '" + description + "': already applied");
        }
        apply();
        state = CommandState.APPLIED;
        logger.debug("Applied: " + description);
    }

    @Override
    public final void undo() throws DiagramException {
        if (state != CommandState.APPLIED) {
            throw new IllegalStateException("Cannot revert '" + description + "': not applied");
        }
        revert();
        state = CommandState.PENDING;
        logger.debug("Reverted: " + description);
    }

    /** Forward edit. Must leave the graph unchanged when it throws. */
    protected abstract void apply() throws DiagramException;

    protected abstract void revert() throws DiagramException;

    @Override
    public CommandState getState() {
        return state;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + description + ", " + state + "]";
    }
}
