package org.opmsim.diagram.graph;

import java.util.Stack;

import org.apache.log4j.Logger;
import org.opmsim.constants.EngineConstants;
import org.opmsim.exceptions.DiagramException;

/**
 * Linear undo/redo history of applied commands.
 */
public class CommandEngine {
    private static final Logger logger = Logger.getLogger(CommandEngine.class);

    private final Stack<DiagramCommand> doneStack = new Stack<>();
    private final Stack<DiagramCommand> undoneStack = new Stack<>();
    private final int historyLimit;

    public CommandEngine() {
        this(EngineConstants.HISTORY_LIMIT);
    }

    /**
     * @param historyLimit maximum number of undoable commands; 0 or less keeps all of them
     */
    public CommandEngine(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    /**
     * Apply a command and make it the most recent undoable one. Clears the redo history.
     * If the command fails nothing is recorded and the history is unchanged.
     */
    public void execute(DiagramCommand command) throws DiagramException {
        command.redo();
        doneStack.push(command);
        undoneStack.clear();

        // Limit stack size
        if (historyLimit > 0 && doneStack.size() > historyLimit) {
            DiagramCommand dropped = doneStack.remove(0);
            logger.debug("History limit " + historyLimit + " reached, dropped: " + dropped.getDescription());
        }
    }

    /**
     * Undo last command
     */
    public CommandResult undo() throws DiagramException {
        if (!canUndo()) {
            return CommandResult.NOTHING_TO_UNDO;
        }
        DiagramCommand command = doneStack.peek();
        command.undo();
        doneStack.pop();
        undoneStack.push(command);
        logger.info("Undone: " + command.getDescription());
        return CommandResult.UNDONE;
    }

    /**
     * Redo last undone command
     */
    public CommandResult redo() throws DiagramException {
        if (!canRedo()) {
            return CommandResult.NOTHING_TO_REDO;
        }
        DiagramCommand command = undoneStack.peek();
        command.redo();
        undoneStack.pop();
        doneStack.push(command);
        logger.info("Redone: " + command.getDescription());
        return CommandResult.REDONE;
    }

    public boolean canUndo() {
        return !doneStack.isEmpty();
    }

    public boolean canRedo() {
        return !undoneStack.isEmpty();
    }

    /**
     * Clear all undo/redo history
     */
    public void clear() {
        doneStack.clear();
        undoneStack.clear();
    }

    public int getUndoCount() {
        return doneStack.size();
    }

    public int getRedoCount() {
        return undoneStack.size();
    }

    public String peekUndoDescription() {
        return doneStack.isEmpty() ? null : doneStack.peek().getDescription();
    }

    public String peekRedoDescription() {
        return undoneStack.isEmpty() ? null : undoneStack.peek().getDescription();
    }
}
