package org.opmsim.petrinet.simulator;

import org.opmsim.petrinet.model.Marking;

/**
 * One firing: which transition, at which step, and the markings around it.
 */
public class FiringEvent {
    private final int step;
    private final String transitionId;
    private final Marking before;
    private final Marking after;
    private final long timestamp;

    public FiringEvent(int step, String transitionId, Marking before, Marking after) {
        this.step = step;
        this.transitionId = transitionId;
        this.before = before;
        this.after = after;
        this.timestamp = System.currentTimeMillis();
    }

    public int getStep() { return step; }
    public String getTransitionId() { return transitionId; }
    public Marking getBefore() { return before; }
    public Marking getAfter() { return after; }
    public long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("#%d %s: %s -> %s", step, transitionId, before, after);
    }
}
