package org.opmsim.diagram.opl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opmsim.diagram.DiagramEditor;
import org.opmsim.diagram.graph.CommandResult;
import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.diagram.model.*;
import org.opmsim.exceptions.DiagramException;

class OplParserTest {

    private DiagramEditor editor;
    private DiagramGraph graph;

    @BeforeEach
    void setUp() {
        editor = new DiagramEditor();
        graph = editor.getGraph();
    }

    private Node byLabel(String label) {
        for (Node node : graph.nodes()) {
            if (node.getLabel().equals(label) && !node.isState()) {
                return node;
            }
        }
        return null;
    }

    private Node stateOf(Node object, String label) {
        for (Node state : graph.statesOf(object.getId())) {
            if (state.getLabel().equals(label)) {
                return state;
            }
        }
        return null;
    }

    @Test
    void proceduralSentencesCreateNodesAndLinks() throws DiagramException {
        OplImportResult result = editor.importOpl(
                "Reading consumes Book.\n"
                + "Reading yields Knowledge.\n"
                + "Reader handles Reading.\n"
                + "Reading requires Glasses and Lamp.\n");

        assertTrue(result.getIgnoredLines().isEmpty());
        Node reading = byLabel("Reading");
        Node book = byLabel("Book");
        assertEquals(NodeKind.PROCESS, reading.getKind());
        assertEquals(NodeKind.OBJECT, book.getKind());
        assertEquals(Essence.PHYSICAL, reading.getEssence());
        assertEquals(Essence.INFORMATICAL, book.getEssence());

        assertNotNull(graph.findLink(LinkKind.CONSUMPTION, book.getId(), reading.getId()));
        assertNotNull(graph.findLink(LinkKind.RESULT, reading.getId(), byLabel("Knowledge").getId()));
        assertNotNull(graph.findLink(LinkKind.AGENT, byLabel("Reader").getId(), reading.getId()));
        assertNotNull(graph.findLink(LinkKind.INSTRUMENT, byLabel("Lamp").getId(), reading.getId()));
        assertEquals(5, graph.getLinkCount());
    }

    @Test
    void definitionsApplyToLaterSentences() throws DiagramException {
        editor.importOpl("Boiling changes Water from cold to hot.\n"
                + "Water is a physical and environmental object.\n"
                + "Boiling is an informatical process.\n");

        Node water = byLabel("Water");
        assertEquals(Essence.PHYSICAL, water.getEssence());
        assertEquals(Affiliation.ENVIRONMENTAL, water.getAffiliation());
        assertEquals(Essence.INFORMATICAL, byLabel("Boiling").getEssence());

        Node cold = stateOf(water, "cold");
        Node hot = stateOf(water, "hot");
        assertNotNull(graph.findLink(LinkKind.CONSUMPTION, cold.getId(), byLabel("Boiling").getId()));
        assertNotNull(graph.findLink(LinkKind.RESULT, byLabel("Boiling").getId(), hot.getId()));
    }

    @Test
    void statesAndStructureSentences() throws DiagramException {
        editor.importOpl("Door can be open, closed or locked.\n"
                + "Lock is jammed.\n"
                + "House consists of Door, Window and Roof.\n"
                + "House is characterized by Color.\n"
                + "Vehicle generalizes Car and Truck.\n"
                + "Sedan is a Car.\n"
                + "Car has instances My Car.\n"
                + "Your Car is an instance of Car.\n"
                + "Bike and Scooter are Vehicle.\n"
                + "Garden.\n");

        Node door = byLabel("Door");
        assertEquals(3, graph.statesOf(door.getId()).size());
        assertNotNull(stateOf(byLabel("Lock"), "jammed"));

        String house = byLabel("House").getId();
        assertNotNull(graph.findLink(LinkKind.AGGREGATION, door.getId(), house));
        assertNotNull(graph.findLink(LinkKind.EXHIBITION, byLabel("Color").getId(), house));

        String vehicle = byLabel("Vehicle").getId();
        String car = byLabel("Car").getId();
        assertNotNull(graph.findLink(LinkKind.GENERALIZATION, car, vehicle));
        assertNotNull(graph.findLink(LinkKind.GENERALIZATION, byLabel("Sedan").getId(), car));
        assertNotNull(graph.findLink(LinkKind.GENERALIZATION, byLabel("Scooter").getId(), vehicle));
        assertNotNull(graph.findLink(LinkKind.INSTANTIATION, byLabel("My Car").getId(), car));
        assertNotNull(graph.findLink(LinkKind.INSTANTIATION, byLabel("Your Car").getId(), car));
        assertNotNull(byLabel("Garden"));
    }

    @Test
    void invalidAndRepeatedLinksAreSkipped() throws DiagramException {
        editor.importOpl("Reading consumes Book.");
        int links = graph.getLinkCount();

        OplImportResult result = editor.importOpl("Reading consumes Book.\n"
                + "Reading consumes Reading.\n"
                + "Is this a sentence?\n");

        assertEquals(links, graph.getLinkCount());
        assertEquals(2, result.getSkippedLinks().size());
        assertEquals(Collections.singletonList("Is this a sentence?"), result.getIgnoredLines());
    }

    @Test
    void existingNodesAreResolvedByLabel() throws DiagramException {
        String book = editor.addObject("Book", 0, 0, null);
        editor.importOpl("Reading consumes Book.");
        assertEquals(2, graph.getNodeCount());
        assertNotNull(graph.findLink(LinkKind.CONSUMPTION, book, byLabel("Reading").getId()));
    }

    @Test
    void importIsOneUndoableStep() throws DiagramException {
        editor.importOpl("Reading consumes Book.\nBook can be new or used.\nReading yields Knowledge.");
        assertFalse(graph.isEmpty());
        assertEquals(CommandResult.UNDONE, editor.undo());
        assertTrue(graph.isEmpty());
        assertEquals(CommandResult.REDONE, editor.redo());
        assertEquals(5, graph.getNodeCount());
    }

    @Test
    void newNodesLandInRequestedView() throws DiagramException {
        String parent = editor.addProcess("Studying", 0, 0, null);
        editor.importOpl("Skimming consumes Chapter.", parent);
        assertEquals(parent, byLabel("Skimming").getOwningProcessId());
        assertEquals(parent, byLabel("Chapter").getOwningProcessId());
        assertNull(byLabel("Studying").getOwningProcessId());
    }

    @Test
    void placementFollowsGrid() throws DiagramException {
        editor.importOpl("Reading consumes Book.");
        Geometry reading = byLabel("Reading").getGeometry();
        Geometry book = byLabel("Book").getGeometry();
        assertEquals(0.0, (reading.getX() + reading.getWidth() / 2) % 25);
        assertTrue(reading.getY() < book.getY());
    }

    @Test
    void definitionDetection() {
        assertTrue(OplParser.isDefinition("Car is an informatical object."));
        assertTrue(OplParser.isDefinition("Metal Bar is physical."));
        assertTrue(OplParser.isDefinition("Pump is a systemic and physical process."));
        assertFalse(OplParser.isDefinition("Door is open."));
        assertFalse(OplParser.isDefinition("Sedan is a Car."));
    }
}
