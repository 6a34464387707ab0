package org.opmsim.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opmsim.diagram.graph.CommandResult;
import org.opmsim.diagram.model.*;
import org.opmsim.exceptions.*;

class DiagramEditorTest {

    private DiagramEditor editor;

    @BeforeEach
    void setUp() {
        editor = new DiagramEditor();
    }

    @Test
    void idsKeepGrowingAfterDeletion() throws DiagramException {
        String first = editor.addObject("Book", 0, 0, null);
        editor.removeNode(first);
        String second = editor.addObject("Book", 0, 0, null);
        assertEquals("object_1", first);
        assertEquals("object_2", second);
    }

    @Test
    void statesStackInsideTheirObject() throws DiagramException {
        String book = editor.addObject("Book", 50, 50, null);
        String open = editor.addState(book, "Open", null, true);
        String closed = editor.addState(book, "Closed", null, false);

        Geometry openBox = editor.getGraph().getNode(open).getGeometry();
        Geometry closedBox = editor.getGraph().getNode(closed).getGeometry();
        assertEquals(openBox.getX(), closedBox.getX());
        assertTrue(closedBox.getY() > openBox.getY());
        assertTrue(editor.getGraph().getNode(open).isInitial());
    }

    @Test
    void statesOnlyBelongToObjects() throws DiagramException {
        String reading = editor.addProcess("Reading", 0, 0, null);
        assertThrows(InvalidParentException.class, () -> editor.addState(reading, "busy", null, false));
        assertThrows(IllegalArgumentException.class,
                () -> editor.addNode(NodeKind.STATE, "x", new Geometry(0, 0, 10, 10), null));
    }

    @Test
    void nestingCycleIsRejectedAndNothingChanges() throws DiagramException {
        String outer = editor.addProcess("Outer", 0, 0, null);
        String inner = editor.addProcess("Inner", 0, 0, outer);
        int undoCount = editor.getCommandEngine().getUndoCount();

        assertThrows(CycleDetectedException.class, () -> editor.setOwningProcess(outer, inner));
        assertEquals(undoCount, editor.getCommandEngine().getUndoCount());
        assertNull(editor.getGraph().getNode(outer).getOwningProcessId());
        assertEquals(Collections.singletonList(editor.getGraph().getNode(inner)), editor.childrenOf(outer));
    }

    @Test
    void editsAreUndoneInReverse() throws DiagramException {
        Map<String, Node> empty = editor.getGraph().nodeMap();
        String book = editor.addObject("Book", 0, 0, null);
        String reading = editor.addProcess("Reading", 200, 0, null);
        String link = editor.addLink(LinkKind.CONSUMPTION, book, reading, Cardinality.exactly(2), null);
        editor.moveNode(book, 25, 75);
        editor.resizeNode(reading, 160, 80);
        editor.relabel(link, "uses up");
        editor.changeLinkKind(link, LinkKind.INSTRUMENT);

        for (int i = 0; i < 7; i++) {
            assertEquals(CommandResult.UNDONE, editor.undo());
        }
        assertEquals(CommandResult.NOTHING_TO_UNDO, editor.undo());
        assertEquals(empty, editor.getGraph().nodeMap());
        assertTrue(editor.getGraph().linkMap().isEmpty());
    }

    @Test
    void resizeRejectsNonPositiveSize() throws DiagramException {
        String book = editor.addObject("Book", 0, 0, null);
        assertThrows(IllegalArgumentException.class, () -> editor.resizeNode(book, 0, 40));
    }

    @Test
    void deleteSelectionAcceptsLinks() throws DiagramException {
        String book = editor.addObject("Book", 0, 0, null);
        String reading = editor.addProcess("Reading", 200, 0, null);
        String link = editor.addLink(LinkKind.CONSUMPTION, book, reading);
        editor.deleteSelection(Collections.singletonList(link));
        assertFalse(editor.getGraph().containsLink(link));
        assertEquals(2, editor.getGraph().getNodeCount());
        assertEquals(0, editor.linksBetween(new HashSet<>(Arrays.asList(book, reading))).size());
    }

    @Test
    void clearAllThenUndo() throws DiagramException {
        String reading = editor.addProcess("Reading", 0, 0, null);
        editor.addObject("Page", 0, 0, reading);
        editor.clearAll();
        assertTrue(editor.getGraph().isEmpty());
        editor.undo();
        assertEquals(2, editor.getGraph().getNodeCount());
    }

    @Test
    void linkErrorsSurfaceAsDiagramExceptions() throws DiagramException {
        String book = editor.addObject("Book", 0, 0, null);
        String reading = editor.addProcess("Reading", 200, 0, null);
        assertThrows(IncompatibleEndpointsException.class, () -> editor.addLink(LinkKind.RESULT, book, reading));
        assertThrows(DanglingReferenceException.class, () -> editor.addLink(LinkKind.RESULT, reading, "object_9"));
        editor.addLink(LinkKind.RESULT, reading, book);
        assertThrows(DuplicateLinkException.class, () -> editor.addLink(LinkKind.RESULT, reading, book));
    }
}
