package org.opmsim.petrinet.analysis;

import java.util.*;

import org.opmsim.petrinet.model.Marking;

/**
 * Markings reachable from an initial marking, with the firings between them.
 * Markings are numbered in discovery order; index 0 is the initial marking.
 */
public class ReachabilityGraph {
    private final List<Marking> markings;
    private final Map<Marking, Integer> index;
    private final List<Edge> edges;

    ReachabilityGraph(List<Marking> markings, List<Edge> edges) {
        this.markings = Collections.unmodifiableList(new ArrayList<>(markings));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.index = new HashMap<>();
        for (int i = 0; i < markings.size(); i++) {
            index.put(markings.get(i), i);
        }
    }

    public Marking getInitialMarking() {
        return markings.get(0);
    }

    public List<Marking> getMarkings() {
        return markings;
    }

    public Set<Marking> markingSet() {
        return new HashSet<>(markings);
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public boolean contains(Marking marking) {
        return index.containsKey(marking);
    }

    /** Discovery index of the marking, or -1. */
    public int indexOf(Marking marking) {
        Integer i = index.get(marking);
        return i == null ? -1 : i;
    }

    public int size() {
        return markings.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<Edge> edgesFrom(Marking marking) {
        List<Edge> outgoing = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getFrom().equals(marking)) {
                outgoing.add(edge);
            }
        }
        return outgoing;
    }

    /** Reachable markings in which no transition is enabled. */
    public List<Marking> getDeadlocks() {
        Set<Marking> withSuccessor = new HashSet<>();
        for (Edge edge : edges) {
            withSuccessor.add(edge.getFrom());
        }
        List<Marking> dead = new ArrayList<>();
        for (Marking marking : markings) {
            if (!withSuccessor.contains(marking)) {
                dead.add(marking);
            }
        }
        return dead;
    }

    public boolean isDeadlockFree() {
        return getDeadlocks().isEmpty();
    }

    /** Highest token count each place reaches; places that never hold a token are absent. */
    public Map<String, Integer> getPlaceBounds() {
        Map<String, Integer> bounds = new TreeMap<>();
        for (Marking marking : markings) {
            for (Map.Entry<String, Integer> entry : marking.asMap().entrySet()) {
                bounds.merge(entry.getKey(), entry.getValue(), Math::max);
            }
        }
        return bounds;
    }

    @Override
    public String toString() {
        return "ReachabilityGraph[" + markings.size() + " markings, " + edges.size() + " edges]";
    }

    /**
     * Firing of one transition from one marking to another.
     */
    public static final class Edge {
        private final Marking from;
        private final String transitionId;
        private final Marking to;

        public Edge(Marking from, String transitionId, Marking to) {
            this.from = from;
            this.transitionId = transitionId;
            this.to = to;
        }

        public Marking getFrom() { return from; }
        public String getTransitionId() { return transitionId; }
        public Marking getTo() { return to; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Edge)) return false;
            Edge other = (Edge) o;
            return from.equals(other.from) && transitionId.equals(other.transitionId) && to.equals(other.to);
        }

        @Override
        public int hashCode() {
            return Objects.hash(from, transitionId, to);
        }

        @Override
        public String toString() {
            return from + " --" + transitionId + "--> " + to;
        }
    }
}
