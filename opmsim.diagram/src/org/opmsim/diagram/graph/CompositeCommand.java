package org.opmsim.diagram.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.opmsim.exceptions.DiagramException;

/**
 * Ordered group of commands that is applied and reverted as one unit.
 *
 * Children are applied first to last and reverted last to first. When child {@code i}
 * fails, children {@code i-1 .. 0} are reverted before the failure is rethrown, so a
 * composite never leaves a partial edit behind.
 */
public class CompositeCommand extends AbstractDiagramCommand {
    private static final Logger logger = Logger.getLogger(CompositeCommand.class);

    private final List<DiagramCommand> children;

    public CompositeCommand(String description, List<? extends DiagramCommand> children) {
        super(description);
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    protected void apply() throws DiagramException {
        for (int i = 0; i < children.size(); i++) {
            try {
                children.get(i).redo();
            } catch (DiagramException | RuntimeException e) {
                logger.debug("Step " + (i + 1) + " of '" + getDescription() + "' failed, rolling back: "
                        + e.getMessage());
                rollBack(i - 1, e);
                throw e;
            }
        }
    }

    @Override
    protected void revert() throws DiagramException {
        for (int i = children.size() - 1; i >= 0; i--) {
            children.get(i).undo();
        }
    }

    private void rollBack(int lastApplied, Exception failure) {
        for (int j = lastApplied; j >= 0; j--) {
            try {
                children.get(j).undo();
            } catch (DiagramException e) {
                failure.addSuppressed(e);
                logger.error("Rollback of '" + children.get(j).getDescription() + "' failed", e);
            }
        }
    }

    public List<DiagramCommand> getChildren() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}
