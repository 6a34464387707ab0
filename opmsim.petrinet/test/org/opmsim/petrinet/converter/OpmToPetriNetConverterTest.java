package org.opmsim.petrinet.converter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.opmsim.diagram.DiagramEditor;
import org.opmsim.diagram.model.Cardinality;
import org.opmsim.diagram.model.LinkKind;
import org.opmsim.exceptions.DiagramException;
import org.opmsim.exceptions.NotEnabledException;
import org.opmsim.exceptions.StateSpaceTooLargeException;
import org.opmsim.exceptions.UnsupportedTopologyException;
import org.opmsim.petrinet.analysis.ReachabilityAnalyzer;
import org.opmsim.petrinet.model.*;
import org.opmsim.petrinet.simulator.PetriNetSimulator;

import static org.opmsim.petrinet.converter.OpmToPetriNetConverter.placeId;
import static org.opmsim.petrinet.converter.OpmToPetriNetConverter.transitionId;

class OpmToPetriNetConverterTest {

    private final OpmToPetriNetConverter converter = new OpmToPetriNetConverter(ArcPolicy.TEST);

    private static Arc arc(PetriNet net, String place, String transition, ArcType type) {
        for (Arc arc : net.arcsOf(transition, type)) {
            if (arc.getPlaceId().equals(place)) {
                return arc;
            }
        }
        return null;
    }

    @Test
    void consumptionAndResultBecomeInputAndOutputArcs() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String book = editor.addObject("Book", 0, 0, null);
        String read = editor.addProcess("Read", 200, 0, null);
        String knowledge = editor.addObject("Knowledge", 400, 0, null);
        editor.addLink(LinkKind.CONSUMPTION, book, read);
        editor.addLink(LinkKind.RESULT, read, knowledge);

        PetriNet net = converter.convert(editor.getGraph());

        assertEquals(2, net.getPlaces().size());
        assertEquals(1, net.getTransitions().size());
        assertNotNull(arc(net, placeId(book), transitionId(read), ArcType.INPUT));
        assertNotNull(arc(net, placeId(knowledge), transitionId(read), ArcType.OUTPUT));
        assertEquals(1, net.getInitialMarking().get(placeId(book)));
        assertEquals(0, net.getInitialMarking().get(placeId(knowledge)));
        assertEquals("Read", net.getTransition(transitionId(read)).getLabel());
    }

    @Test
    void statefulObjectGetsPlacePerState() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String book = editor.addObject("Book", 0, 0, null);
        String open = editor.addState(book, "Open", null, false);
        String closed = editor.addState(book, "Closed", null, true);
        String opening = editor.addProcess("Opening", 200, 0, null);
        editor.addLink(LinkKind.CONSUMPTION, closed, opening);
        editor.addLink(LinkKind.RESULT, opening, open);

        PetriNet net = converter.convert(editor.getGraph());

        assertTrue(net.hasPlace(placeId(book)));
        assertTrue(net.hasPlace(placeId(book, open)));
        assertTrue(net.hasPlace(placeId(book, closed)));
        assertEquals(3, net.getPlaces().size());
        assertEquals(open, net.getPlace(placeId(book, open)).getStateId());

        Marking initial = net.getInitialMarking();
        assertEquals(1, initial.get(placeId(book, closed)));
        assertEquals(0, initial.get(placeId(book, open)));
        assertEquals(0, initial.get(placeId(book)));
        assertNotNull(arc(net, placeId(book, closed), transitionId(opening), ArcType.INPUT));
        assertNotNull(arc(net, placeId(book, open), transitionId(opening), ArcType.OUTPUT));
    }

    @Test
    void resultIntoStateMovesTheObject() throws DiagramException, UnsupportedTopologyException,
            NotEnabledException, StateSpaceTooLargeException {
        DiagramEditor editor = new DiagramEditor();
        String door = editor.addObject("Door", 0, 0, null);
        String open = editor.addState(door, "Open", null, true);
        String closed = editor.addState(door, "Closed", null, false);
        String key = editor.addObject("Key", 0, 200, null);
        String shutting = editor.addProcess("Shutting", 200, 0, null);
        editor.addLink(LinkKind.INSTRUMENT, key, shutting);
        editor.addLink(LinkKind.RESULT, shutting, closed);

        PetriNet net = converter.convert(editor.getGraph());
        String fromOpen = transitionId(shutting) + "_from_" + placeId(door, open);
        String fromNoState = transitionId(shutting) + "_from_" + placeId(door);
        assertNull(net.getTransition(transitionId(shutting)));
        assertEquals(Arrays.asList(fromNoState, fromOpen), ids(net.getTransitions()));
        assertEquals(shutting, net.getTransition(fromOpen).getProcessId());
        assertEquals("Shutting", net.getTransition(fromOpen).getLabel());
        assertNotNull(arc(net, placeId(door, open), fromOpen, ArcType.INPUT));
        assertNotNull(arc(net, placeId(door, closed), fromOpen, ArcType.OUTPUT));
        assertNotNull(arc(net, placeId(key), fromOpen, ArcType.TEST));
        assertNotNull(arc(net, placeId(door), fromNoState, ArcType.INPUT));

        PetriNetSimulator simulator = new PetriNetSimulator(net);
        simulator.step();
        assertEquals(0, simulator.getTokens(placeId(door, open)));
        assertEquals(1, simulator.getTokens(placeId(door, closed)));
        assertEquals(0, simulator.getTokens(placeId(door)));
        assertTrue(simulator.enabled().isEmpty());

        List<String> doorPlaces = Arrays.asList(placeId(door), placeId(door, open), placeId(door, closed));
        for (Marking marking : ReachabilityAnalyzer.analyze(net, net.getInitialMarking()).markingSet()) {
            int tokens = 0;
            for (String place : doorPlaces) {
                tokens += marking.get(place);
            }
            assertEquals(1, tokens, "Door must sit in exactly one place in " + marking);
        }
    }

    @Test
    void objectWithoutInitialStateIsCreatedByResult() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String report = editor.addObject("Report", 0, 0, null);
        editor.addState(report, "Draft", null, false);
        String fin = editor.addState(report, "Final", null, false);
        String writing = editor.addProcess("Writing", 200, 0, null);
        editor.addLink(LinkKind.RESULT, writing, fin);

        PetriNet net = converter.convert(editor.getGraph());
        assertEquals(Arrays.asList(transitionId(writing)), ids(net.getTransitions()));
        assertNotNull(arc(net, placeId(report, fin), transitionId(writing), ArcType.OUTPUT));
        assertEquals(0, net.getInitialMarking().total());
    }

    @Test
    void objectCannotBeYieldedIntoTwoStatesAtOnce() throws DiagramException {
        DiagramEditor editor = new DiagramEditor();
        String door = editor.addObject("Door", 0, 0, null);
        String open = editor.addState(door, "Open", null, true);
        String closed = editor.addState(door, "Closed", null, false);
        String slamming = editor.addProcess("Slamming", 200, 0, null);
        editor.addLink(LinkKind.RESULT, slamming, open);
        editor.addLink(LinkKind.RESULT, slamming, closed);

        UnsupportedTopologyException e = assertThrows(UnsupportedTopologyException.class,
                () -> converter.convert(editor.getGraph()));
        assertTrue(e.getMessage().contains(door));
    }

    @Test
    void enablersFollowArcPolicy() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String reader = editor.addObject("Reader", 0, 0, null);
        String lamp = editor.addObject("Lamp", 0, 100, null);
        String read = editor.addProcess("Read", 200, 0, null);
        editor.addLink(LinkKind.AGENT, reader, read);
        editor.addLink(LinkKind.INSTRUMENT, lamp, read);

        PetriNet testNet = converter.convert(editor.getGraph());
        assertEquals(2, testNet.arcsOf(transitionId(read), ArcType.TEST).size());
        assertTrue(testNet.arcsOf(transitionId(read), ArcType.INPUT).isEmpty());

        PetriNet consumeNet = new OpmToPetriNetConverter(ArcPolicy.CONSUME).convert(editor.getGraph());
        assertEquals(2, consumeNet.arcsOf(transitionId(read), ArcType.INPUT).size());
        assertTrue(consumeNet.arcsOf(transitionId(read), ArcType.TEST).isEmpty());
    }

    @Test
    void effectTakesAndGivesBack() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String engine = editor.addObject("Engine", 0, 0, null);
        String tuning = editor.addProcess("Tuning", 200, 0, null);
        editor.addLink(LinkKind.EFFECT, tuning, engine);

        PetriNet net = converter.convert(editor.getGraph());
        assertNotNull(arc(net, placeId(engine), transitionId(tuning), ArcType.INPUT));
        assertNotNull(arc(net, placeId(engine), transitionId(tuning), ArcType.OUTPUT));
    }

    @Test
    void exactCardinalityOnObjectEndSetsWeight() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String egg = editor.addObject("Egg", 0, 0, null);
        String cake = editor.addObject("Cake", 400, 0, null);
        String baking = editor.addProcess("Baking", 200, 0, null);
        editor.addLink(LinkKind.CONSUMPTION, egg, baking, Cardinality.exactly(3), Cardinality.exactly(7));
        editor.addLink(LinkKind.RESULT, baking, cake, null, Cardinality.atLeast(2));

        PetriNet net = converter.convert(editor.getGraph());
        assertEquals(3, arc(net, placeId(egg), transitionId(baking), ArcType.INPUT).getWeight());
        assertEquals(1, arc(net, placeId(cake), transitionId(baking), ArcType.OUTPUT).getWeight());
    }

    @Test
    void structuralLinksAreIgnored() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String car = editor.addObject("Car", 0, 0, null);
        String wheel = editor.addObject("Wheel", 0, 100, null);
        editor.addLink(LinkKind.AGGREGATION, wheel, car);

        PetriNet net = converter.convert(editor.getGraph());
        assertTrue(net.getArcs().isEmpty());
        assertTrue(net.getTransitions().isEmpty());
        assertEquals(2, net.getInitialMarking().total());
    }

    @Test
    void viewConversionKeepsOnlyViewContent() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        String baking = editor.addProcess("Baking", 0, 0, null);
        String dough = editor.addObject("Dough", 0, 0, baking);
        String mixing = editor.addProcess("Mixing", 100, 0, baking);
        String flour = editor.addObject("Flour", 0, 100, null);
        editor.addLink(LinkKind.RESULT, mixing, dough);
        editor.addLink(LinkKind.CONSUMPTION, flour, mixing);

        PetriNet view = converter.convert(editor.getGraph(), baking);
        assertEquals(1, view.getPlaces().size());
        assertEquals(Arrays.asList(transitionId(mixing)), ids(view.getTransitions()));
        assertEquals(1, view.getArcs().size());
        assertFalse(view.hasPlace(placeId(flour)));

        PetriNet whole = converter.convert(editor.getGraph());
        assertEquals(Arrays.asList(transitionId(baking), transitionId(mixing)), ids(whole.getTransitions()));
        assertEquals(2, whole.getArcs().size());
    }

    @Test
    void transitionsAreOrderedByProcessId() throws DiagramException, UnsupportedTopologyException {
        DiagramEditor editor = new DiagramEditor();
        for (int i = 0; i < 11; i++) {
            editor.addProcess("P" + i, i * 10, 0, null);
        }
        List<Transition> transitions = converter.convert(editor.getGraph()).getTransitions();
        assertEquals(transitionId("process_1"), transitions.get(0).getId());
        assertEquals(transitionId("process_2"), transitions.get(1).getId());
        assertEquals(transitionId("process_11"), transitions.get(10).getId());
    }

    @Test
    void unknownPolicyNameFallsBackToTest() {
        assertEquals(ArcPolicy.CONSUME, ArcPolicy.fromName("consume"));
        assertEquals(ArcPolicy.TEST, ArcPolicy.fromName("sometimes"));
    }

    private static List<String> ids(List<Transition> transitions) {
        String[] ids = new String[transitions.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = transitions.get(i).getId();
        }
        return Arrays.asList(ids);
    }
}
