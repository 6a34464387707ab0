package org.opmsim.diagram.opl;

import java.util.Collections;
import java.util.List;

import org.opmsim.diagram.graph.CompositeCommand;

/**
 * What a batch of OPL sentences turns into: one command to execute, the lines that matched
 * no sentence form, and the links that were left out.
 */
public class OplImportResult {
    private final CompositeCommand command;
    private final List<String> ignoredLines;
    private final List<String> skippedLinks;

    OplImportResult(CompositeCommand command, List<String> ignoredLines, List<String> skippedLinks) {
        this.command = command;
        this.ignoredLines = Collections.unmodifiableList(ignoredLines);
        this.skippedLinks = Collections.unmodifiableList(skippedLinks);
    }

    public CompositeCommand getCommand() {
        return command;
    }

    public List<String> getIgnoredLines() {
        return ignoredLines;
    }

    /** One message per link that already existed or broke an endpoint rule. */
    public List<String> getSkippedLinks() {
        return skippedLinks;
    }

    public boolean hasChanges() {
        return !command.isEmpty();
    }
}
