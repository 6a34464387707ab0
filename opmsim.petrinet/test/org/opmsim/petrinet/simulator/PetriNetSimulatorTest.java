package org.opmsim.petrinet.simulator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opmsim.diagram.DiagramEditor;
import org.opmsim.diagram.model.LinkKind;
import org.opmsim.exceptions.DiagramException;
import org.opmsim.exceptions.NotEnabledException;
import org.opmsim.exceptions.StepLimitExceededException;
import org.opmsim.exceptions.UnsupportedTopologyException;
import org.opmsim.petrinet.converter.ArcPolicy;
import org.opmsim.petrinet.converter.OpmToPetriNetConverter;
import org.opmsim.petrinet.model.*;

import static org.opmsim.petrinet.converter.OpmToPetriNetConverter.placeId;
import static org.opmsim.petrinet.converter.OpmToPetriNetConverter.transitionId;

class PetriNetSimulatorTest {

    private PetriNet reading;

    @BeforeEach
    void setUp() {
        reading = PetriNet.builder()
                .addPlace(new Place("place_object_1", "Book", "object_1", null))
                .addPlace(new Place("place_object_2", "Knowledge", "object_2", null))
                .addTransition(new Transition("transition_process_1", "Reading", "process_1"))
                .addArc("place_object_1", "transition_process_1", ArcType.INPUT, 1)
                .addArc("place_object_2", "transition_process_1", ArcType.OUTPUT, 1)
                .setInitialTokens("place_object_1", 1)
                .build();
    }

    @Test
    void stepMovesTheTokenAndThenStops() throws NotEnabledException {
        PetriNetSimulator simulator = new PetriNetSimulator(reading);
        simulator.step();
        assertEquals(0, simulator.getTokens("place_object_1"));
        assertEquals(1, simulator.getTokens("place_object_2"));

        Marking reached = simulator.getMarking();
        assertThrows(NotEnabledException.class, simulator::step);
        assertEquals(reached, simulator.getMarking());
        assertEquals(1, simulator.getHistory().size());
    }

    @Test
    void failedFireKeepsMarkingAndHistory() {
        PetriNetSimulator simulator = new PetriNetSimulator(reading);
        simulator.setTokens("place_object_1", 0);
        Marking before = simulator.getMarking();
        assertThrows(NotEnabledException.class, () -> simulator.fire("transition_process_1"));
        assertEquals(before, simulator.getMarking());
        assertTrue(simulator.getHistory().isEmpty());
    }

    @Test
    void stepPrefersLowestIdentifier() throws NotEnabledException {
        PetriNetSimulator simulator = new PetriNetSimulator(Nets.race());
        simulator.step();
        assertEquals("transition_process_2", simulator.getHistory().get(0).getTransitionId());
    }

    @Test
    void runToFixpointFiresUntilNothingIsEnabled() throws StepLimitExceededException {
        PetriNetSimulator simulator = new PetriNetSimulator(Nets.race(), PlaceCapacity.UNBOUNDED);
        int fired = simulator.runToFixpoint();
        assertEquals(3, fired);
        assertTrue(simulator.enabled().isEmpty());
        assertEquals(0, simulator.getTokens("place_fuel"));
        assertEquals(6, simulator.getTokens("place_heat"));
        assertEquals(1, simulator.getTokens("place_match"));
    }

    @Test
    void markedOutputBlocksRepeatedProduction() throws DiagramException, UnsupportedTopologyException,
            NotEnabledException, StepLimitExceededException {
        DiagramEditor editor = new DiagramEditor();
        String tool = editor.addObject("Tool", 0, 0, null);
        String make = editor.addProcess("Make", 200, 0, null);
        String product = editor.addObject("Product", 400, 0, null);
        editor.addLink(LinkKind.INSTRUMENT, tool, make);
        editor.addLink(LinkKind.RESULT, make, product);
        PetriNet net = new OpmToPetriNetConverter(ArcPolicy.TEST).convert(editor.getGraph());

        PetriNetSimulator simulator = new PetriNetSimulator(net);
        simulator.step();
        assertEquals(1, simulator.getTokens(placeId(product)));
        assertEquals(1, simulator.getTokens(placeId(tool)));

        assertThrows(NotEnabledException.class, simulator::step);
        assertEquals(1, simulator.getTokens(placeId(product)));
        List<Transition> blocked = simulator.blocked();
        assertEquals(1, blocked.size());
        assertEquals(transitionId(make), blocked.get(0).getId());

        PetriNetSimulator fresh = new PetriNetSimulator(net);
        assertEquals(1, fresh.runToFixpoint(10));
        assertEquals(1, fresh.getTokens(placeId(product)));

        PetriNetSimulator counting = new PetriNetSimulator(net, PlaceCapacity.UNBOUNDED);
        counting.step();
        counting.step();
        assertEquals(2, counting.getTokens(placeId(product)));
    }

    @Test
    void historyIsASnapshot() throws NotEnabledException {
        PetriNetSimulator simulator = new PetriNetSimulator(reading);
        List<FiringEvent> before = simulator.getHistory();
        simulator.step();
        assertTrue(before.isEmpty());
        assertEquals(1, simulator.getHistory().size());
        assertThrows(UnsupportedOperationException.class, () -> simulator.getHistory().clear());
    }

    @Test
    void runToFixpointStopsAtTheStepLimit() {
        PetriNetSimulator simulator = new PetriNetSimulator(Nets.loop());
        StepLimitExceededException e = assertThrows(StepLimitExceededException.class,
                () -> simulator.runToFixpoint(5));
        assertEquals(5, e.getMaxSteps());
        assertEquals(5, simulator.getHistory().size());
        assertEquals(1, simulator.getMarking().total());
    }

    @Test
    void resetRestoresInitialMarking() throws NotEnabledException {
        PetriNetSimulator simulator = new PetriNetSimulator(reading);
        simulator.step();
        simulator.reset();
        assertEquals(reading.getInitialMarking(), simulator.getMarking());
        assertTrue(simulator.getHistory().isEmpty());
    }

    @Test
    void setTokensRejectsUnknownPlacesAndNegativeCounts() {
        PetriNetSimulator simulator = new PetriNetSimulator(reading);
        assertThrows(IllegalArgumentException.class, () -> simulator.setTokens("place_object_9", 1));
        assertThrows(IllegalArgumentException.class, () -> simulator.setTokens("place_object_1", -1));
        simulator.setTokens("place_object_1", 4);
        assertEquals(4, simulator.getTokens("place_object_1"));
    }

    @Test
    void capacitySplitsBlockedFromWaiting() throws NotEnabledException {
        PetriNetSimulator simulator = new PetriNetSimulator(Nets.race(), PlaceCapacity.uniform(3));
        simulator.fire("transition_process_2");

        List<Transition> blocked = simulator.blocked();
        assertEquals(1, blocked.size());
        assertEquals("transition_process_2", blocked.get(0).getId());
        assertFalse(simulator.isEnabled("transition_process_2"));
        assertTrue(simulator.isEnabled("transition_process_10"));
        assertTrue(simulator.waiting().isEmpty());

        simulator.fire("transition_process_10");
        assertEquals(2, simulator.waiting().size());
    }

    @Test
    void listenersSeeEveryFiringAndReset() throws NotEnabledException, StepLimitExceededException {
        PetriNetSimulator simulator = new PetriNetSimulator(Nets.race());
        SimulationEventLogger eventLogger = new SimulationEventLogger();
        eventLogger.setEnableLogging(false);
        simulator.addListener(eventLogger);

        simulator.fire("transition_process_10");
        simulator.runToFixpoint();
        simulator.reset();

        assertEquals(1, (int) eventLogger.getFiringCounts().get("transition_process_10"));
        assertEquals(1, (int) eventLogger.getFiringCounts().get("transition_process_2"));
        assertEquals(2, eventLogger.getEvents("TRANSITION_FIRED").size());
        assertEquals(1, eventLogger.getEvents("MARKING_CHANGE").size());
        assertTrue(eventLogger.getEventHistory().get(0).getMessage().contains("step=1"));

        simulator.removeListener(eventLogger);
        simulator.step();
        assertEquals(3, eventLogger.getEventHistory().size());

        eventLogger.clearHistory();
        assertTrue(eventLogger.getFiringCounts().isEmpty());
    }
}
