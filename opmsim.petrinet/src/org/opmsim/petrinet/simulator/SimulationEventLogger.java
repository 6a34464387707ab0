package org.opmsim.petrinet.simulator;

import java.util.*;

import org.apache.log4j.Logger;
import org.opmsim.petrinet.model.Marking;

/**
 * Records simulation events for later analysis and writes them to the log.
 * Attach one instance per simulator with {@link PetriNetSimulator#addListener}.
 */
public class SimulationEventLogger implements SimulationListener {
    private static final Logger logger = Logger.getLogger(SimulationEventLogger.class);

    private final List<SimulationEvent> eventHistory = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Integer> firingCounts = new TreeMap<>();

    private boolean enableEventStorage = true;
    private boolean enableLogging = true;

    // ========== Listener Events ==========

    @Override
    public void transitionFired(FiringEvent event) {
        String message = String.format(
            "TRANSITION_FIRED: step=%d, transitionId=%s, before=%s, after=%s",
            event.getStep(), event.getTransitionId(), event.getBefore(), event.getAfter()
        );
        log(message);
        synchronized (firingCounts) {
            firingCounts.merge(event.getTransitionId(), 1, Integer::sum);
        }
        storeEvent(new SimulationEvent("TRANSITION_FIRED", event.getTransitionId(), message));
    }

    @Override
    public void markingChanged(Marking marking, String reason) {
        String message = String.format("MARKING_CHANGE: M=%s, reason=%s", marking, reason);
        log(message);
        storeEvent(new SimulationEvent("MARKING_CHANGE", null, message));
    }

    // ========== Analysis ==========

    public List<SimulationEvent> getEventHistory() {
        synchronized (eventHistory) {
            return new ArrayList<>(eventHistory);
        }
    }

    public List<SimulationEvent> getEvents(String eventType) {
        List<SimulationEvent> matching = new ArrayList<>();
        for (SimulationEvent event : getEventHistory()) {
            if (event.getEventType().equals(eventType)) {
                matching.add(event);
            }
        }
        return matching;
    }

    /** How often each transition fired, by transition id. */
    public Map<String, Integer> getFiringCounts() {
        synchronized (firingCounts) {
            return new TreeMap<>(firingCounts);
        }
    }

    public void clearHistory() {
        eventHistory.clear();
        synchronized (firingCounts) {
            firingCounts.clear();
        }
        logger.info("Simulation event history cleared");
    }

    public void setEnableEventStorage(boolean enable) {
        this.enableEventStorage = enable;
    }

    public void setEnableLogging(boolean enable) {
        this.enableLogging = enable;
    }

    private void log(String message) {
        if (enableLogging) {
            logger.info(message);
        }
    }

    private void storeEvent(SimulationEvent event) {
        if (enableEventStorage) {
            eventHistory.add(event);
        }
    }

    // ========== Inner Classes ==========

    public static class SimulationEvent {
        private final String eventType;
        private final String transitionId;
        private final String message;
        private final long timestamp;

        public SimulationEvent(String eventType, String transitionId, String message) {
            this.eventType = eventType;
            this.transitionId = transitionId;
            this.message = message;
            this.timestamp = System.currentTimeMillis();
        }

        public String getEventType() { return eventType; }
        public String getTransitionId() { return transitionId; }
        public String getMessage() { return message; }
        public long getTimestamp() { return timestamp; }

        @Override
        public String toString() {
            return String.format("[%d] %s: %s", timestamp, eventType, message);
        }
    }
}
