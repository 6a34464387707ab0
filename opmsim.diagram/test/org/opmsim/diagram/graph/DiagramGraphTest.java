package org.opmsim.diagram.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opmsim.diagram.model.Geometry;
import org.opmsim.diagram.model.Link;
import org.opmsim.diagram.model.LinkKind;
import org.opmsim.diagram.model.Node;
import org.opmsim.exceptions.*;

class DiagramGraphTest {

    private static final Geometry BOX = new Geometry(0, 0, 140, 70);

    private DiagramGraph graph;

    @BeforeEach
    void setUp() throws DiagramException {
        graph = new DiagramGraph();
        graph.insertNode(Node.object("object_1", "Book", BOX, null));
        graph.insertNode(Node.process("process_1", "Reading", BOX, null));
        graph.insertNode(Node.object("object_2", "Knowledge", BOX, null));
    }

    @Test
    void duplicateIdentifierIsRejected() {
        DiagramException e = assertThrows(DiagramException.class,
                () -> graph.insertNode(Node.process("object_1", "Clash", BOX, null)));
        assertEquals(DiagramGraph.DUPLICATE_ID, e.getErrorCode());
        assertEquals(3, graph.getNodeCount());
    }

    @Test
    void ownerMustBeLiveProcess() {
        assertThrows(InvalidParentException.class,
                () -> graph.insertNode(Node.object("object_3", "Page", BOX, "object_1")));
        assertThrows(InvalidParentException.class,
                () -> graph.insertNode(Node.object("object_3", "Page", BOX, "process_99")));
    }

    @Test
    void stateNeedsLiveObjectWithSameOwner() throws DiagramException {
        assertThrows(InvalidParentException.class,
                () -> graph.insertNode(Node.state("state_1", "open", BOX, "process_1", null, false)));
        graph.insertNode(Node.process("process_2", "Sub", BOX, "process_1"));
        assertThrows(InvalidParentException.class,
                () -> graph.insertNode(Node.state("state_1", "open", BOX, "object_1", "process_2", false)));
        graph.insertNode(Node.state("state_1", "open", BOX, "object_1", null, true));
        assertEquals(1, graph.statesOf("object_1").size());
    }

    @Test
    void linkValidation() throws DiagramException {
        assertThrows(DanglingReferenceException.class,
                () -> graph.insertLink(new Link("link_1", LinkKind.CONSUMPTION, "object_9", "process_1")));
        assertThrows(IncompatibleEndpointsException.class,
                () -> graph.insertLink(new Link("link_1", LinkKind.CONSUMPTION, "process_1", "object_1")));
        assertThrows(IncompatibleEndpointsException.class,
                () -> graph.insertLink(new Link("link_1", LinkKind.AGGREGATION, "object_1", "process_1")));

        graph.insertLink(new Link("link_1", LinkKind.CONSUMPTION, "object_1", "process_1"));
        assertThrows(DuplicateLinkException.class,
                () -> graph.insertLink(new Link("link_2", LinkKind.CONSUMPTION, "object_1", "process_1")));
        graph.insertLink(new Link("link_2", LinkKind.AGENT, "object_1", "process_1"));
        assertEquals(2, graph.linksOf("object_1").size());
    }

    @Test
    void nodeWithLinksCannotBeRemovedAlone() throws DiagramException {
        graph.insertLink(new Link("link_1", LinkKind.RESULT, "process_1", "object_2"));
        assertThrows(DanglingReferenceException.class, () -> graph.removeNode("object_2"));
        graph.removeLink("link_1");
        graph.removeNode("object_2");
        assertFalse(graph.containsNode("object_2"));
        assertThrows(NotFoundException.class, () -> graph.getNode("object_2"));
        assertNull(graph.findNode("object_2"));
    }

    @Test
    void reparentRejectsCycles() throws DiagramException {
        graph.insertNode(Node.process("process_2", "Inner", BOX, "process_1"));
        graph.insertNode(Node.process("process_3", "Innermost", BOX, "process_2"));

        assertThrows(CycleDetectedException.class, () -> graph.reparent("process_1", "process_1"));
        assertThrows(CycleDetectedException.class, () -> graph.reparent("process_1", "process_3"));
        assertThrows(InvalidParentException.class, () -> graph.reparent("process_3", "object_1"));
        assertTrue(graph.isAncestor("process_1", "process_3"));
        assertEquals("process_2", graph.getNode("process_3").getOwningProcessId());
    }

    @Test
    void reparentedObjectTakesItsStates() throws DiagramException {
        graph.insertNode(Node.state("state_1", "open", BOX, "object_1", null, true));
        graph.reparent("object_1", "process_1");
        assertEquals("process_1", graph.getNode("state_1").getOwningProcessId());
        assertEquals(2, graph.childrenOf("process_1").size());
    }

    @Test
    void cascadeListsDeepestNodesFirst() throws DiagramException {
        graph.insertNode(Node.process("process_2", "Inner", BOX, "process_1"));
        graph.insertNode(Node.object("object_3", "Page", BOX, "process_2"));
        graph.insertNode(Node.state("state_1", "torn", BOX, "object_3", "process_2", false));
        graph.insertLink(new Link("link_1", LinkKind.CONSUMPTION, "object_3", "process_2"));
        graph.insertLink(new Link("link_2", LinkKind.CONSUMPTION, "object_1", "process_1"));

        DeletionCascade cascade = graph.collectCascade("process_1");
        assertEquals(Arrays.asList("state_1", "object_3", "process_2", "process_1"), cascade.getNodeIds());
        assertEquals(new HashSet<>(Arrays.asList("link_1", "link_2")), new HashSet<>(cascade.getLinkIds()));
    }

    @Test
    void listenersSeeEveryMutation() throws DiagramException {
        List<DiagramChange> changes = new ArrayList<>();
        graph.addChangeListener(changes::add);
        graph.insertLink(new Link("link_1", LinkKind.CONSUMPTION, "object_1", "process_1"));
        graph.replaceNode(graph.getNode("object_1").withLabel("Novel"));
        graph.removeLink("link_1");

        assertEquals(3, changes.size());
        assertEquals(DiagramChange.Type.LINK_ADDED, changes.get(0).getType());
        assertEquals(DiagramChange.Type.NODE_CHANGED, changes.get(1).getType());
        assertEquals("link_1", changes.get(2).getElementId());
    }

    @Test
    void replaceCannotChangeOwner() {
        assertThrows(IllegalArgumentException.class,
                () -> graph.replaceNode(graph.getNode("object_1").withOwningProcess("process_1")));
    }
}
